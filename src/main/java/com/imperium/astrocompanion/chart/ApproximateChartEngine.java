package com.imperium.astrocompanion.chart;

import com.imperium.astrocompanion.model.domain.BirthFacts;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.PlanetPosition;
import com.imperium.astrocompanion.model.domain.ZodiacSign;

/**
 * 未配置远程星盘服务时的本地实现：只推算太阳星座及其元素、守护星，其余落点未知。
 */
public class ApproximateChartEngine implements ChartEngine {

    @Override
    public ChartFacts computeChart(BirthFacts birth, Language language) {
        if (birth == null || birth.getBirthDate() == null) {
            throw new ChartEngineException("birthDate is required");
        }
        ZodiacSign sun = ZodiacSigns.approximateSunSign(birth.getBirthDate());
        boolean ru = language != null && language.isRussian();
        return ChartFacts.builder()
                .sun(new PlanetPosition(sun.displayName(), ru
                        ? "Солнце в знаке " + sun.displayName()
                        : "Sun in " + sun.displayName()))
                .dominantElement(sun.element())
                .rulingPlanet(sun.rulingPlanet())
                .summary(ru
                        ? "Приблизительная карта: известен только знак Солнца."
                        : "Approximate chart: only the Sun sign is known.")
                .build();
    }
}
