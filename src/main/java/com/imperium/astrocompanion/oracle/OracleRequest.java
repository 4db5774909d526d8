package com.imperium.astrocompanion.oracle;

import com.imperium.astrocompanion.model.domain.BirthFacts;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.ContentCategory;
import com.imperium.astrocompanion.model.domain.DeepDiveTopic;
import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.PartnerFacts;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * 一次 Oracle 调用的输入。topic 仅 DEEP_DIVE 使用，partner 仅 SYNASTRY_* 使用，
 * referenceDate 用于按日期生成的类型（每日、每周、每月运势与 TRANSIT_FORECAST）。
 */
@Value
@Builder
public class OracleRequest {

    OracleKind kind;

    BirthFacts user;

    ChartFacts chart;

    DeepDiveTopic topic;

    PartnerFacts partner;

    LocalDate referenceDate;

    Language language;

    /**
     * 按内容类别构造请求；deep_dive_* 带上主题。
     */
    public static OracleRequest forCategory(ContentCategory category, BirthFacts user, ChartFacts chart,
                                            Language language, LocalDate referenceDate) {
        OracleKind kind = switch (category) {
            case NATAL_INTRO -> OracleKind.NATAL_INTRO;
            case THREE_KEYS -> OracleKind.THREE_KEYS;
            case DAILY_HOROSCOPE -> OracleKind.DAILY_HOROSCOPE;
            case WEEKLY_HOROSCOPE -> OracleKind.WEEKLY_HOROSCOPE;
            case MONTHLY_HOROSCOPE -> OracleKind.MONTHLY_HOROSCOPE;
            case TRANSIT_FORECAST -> OracleKind.TRANSIT_FORECAST;
            default -> OracleKind.DEEP_DIVE;
        };
        return OracleRequest.builder()
                .kind(kind)
                .user(user)
                .chart(chart)
                .topic(category.topic().orElse(null))
                .referenceDate(referenceDate)
                .language(language)
                .build();
    }
}
