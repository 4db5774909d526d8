package com.imperium.astrocompanion.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.astrocompanion.chart.ApproximateChartEngine;
import com.imperium.astrocompanion.chart.ZodiacSigns;
import com.imperium.astrocompanion.model.domain.BirthFacts;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.oracle.ForecastParser;
import com.imperium.astrocompanion.policy.CategoryPolicyTable;
import com.imperium.astrocompanion.policy.FreshnessPolicyEvaluator;
import com.imperium.astrocompanion.policy.ReferenceDayCalculator;
import com.imperium.astrocompanion.policy.RegenerationAllowance;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.concurrent.Executor;

public final class Fixtures {

    public static final ZoneId MOSCOW = ZoneId.of("Europe/Moscow");

    /** 任务在调用线程上同步执行，便于断言后台持久化 */
    public static final Executor SAME_THREAD = Runnable::run;

    private Fixtures() {
    }

    public static ReferenceDayCalculator referenceDays() {
        return new ReferenceDayCalculator(MOSCOW, Duration.ofMinutes(1));
    }

    public static FreshnessPolicyEvaluator evaluator() {
        return new FreshnessPolicyEvaluator(
                CategoryPolicyTable.defaults(new RegenerationAllowance(1, Duration.ofDays(1), 50)),
                referenceDays());
    }

    public static ForecastParser forecastParser() {
        return new ForecastParser(new ObjectMapper());
    }

    /**
     * 已完成星盘计算、尚无内容包的档案。
     */
    public static Profile profile(String userId, String name, String birthDate) {
        LocalDate date = LocalDate.parse(birthDate);
        ChartFacts chart = new ApproximateChartEngine().computeChart(BirthFacts.builder()
                .name(name)
                .birthDate(date)
                .build(), Language.EN);
        return Profile.builder()
                .id(userId)
                .name(name)
                .birthDate(date)
                .birthTime("12:00")
                .birthPlace("Moscow")
                .language(Language.EN)
                .chart(chart)
                .sunSign(ZodiacSigns.resolve(chart, date))
                .build();
    }
}
