package com.imperium.astrocompanion.chart;

import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.ZodiacSign;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Optional;

/**
 * 按出生日期近似推算太阳星座（每年 1~2 天误差，不考虑出生时刻与时区）。
 * 边界：Pisces 为 2 月 19 日 ~ 3 月 20 日。
 */
public final class ZodiacSigns {

    /** 每个星座的起始日，顺序与 {@link ZodiacSign} 一致 */
    private static final MonthDay[] STARTS = {
            MonthDay.of(3, 21),  // Aries
            MonthDay.of(4, 20),  // Taurus
            MonthDay.of(5, 21),  // Gemini
            MonthDay.of(6, 21),  // Cancer
            MonthDay.of(7, 23),  // Leo
            MonthDay.of(8, 23),  // Virgo
            MonthDay.of(9, 23),  // Libra
            MonthDay.of(10, 23), // Scorpio
            MonthDay.of(11, 22), // Sagittarius
            MonthDay.of(12, 22), // Capricorn
            MonthDay.of(1, 20),  // Aquarius
            MonthDay.of(2, 19)   // Pisces
    };

    private ZodiacSigns() {
    }

    public static ZodiacSign approximateSunSign(LocalDate birthDate) {
        MonthDay day = MonthDay.from(birthDate);
        ZodiacSign[] signs = ZodiacSign.values();
        for (int i = 0; i < signs.length; i++) {
            MonthDay start = STARTS[i];
            MonthDay nextStart = STARTS[(i + 1) % signs.length];
            if (contains(start, nextStart, day)) {
                return signs[i];
            }
        }
        throw new IllegalStateException("No sign covers " + day);
    }

    /**
     * 用户的太阳星座分组：星盘给出可识别的太阳星座时以星盘为准，否则按出生日期近似。
     */
    public static ZodiacSign resolve(ChartFacts chart, LocalDate birthDate) {
        if (chart != null && chart.getSun() != null) {
            Optional<ZodiacSign> fromChart = ZodiacSign.parse(chart.getSun().getSign());
            if (fromChart.isPresent()) {
                return fromChart.get();
            }
        }
        return approximateSunSign(birthDate);
    }

    /** [start, end) 区间，允许跨年 */
    private static boolean contains(MonthDay start, MonthDay end, MonthDay day) {
        if (start.isBefore(end)) {
            return !day.isBefore(start) && day.isBefore(end);
        }
        return !day.isBefore(start) || day.isBefore(end);
    }
}
