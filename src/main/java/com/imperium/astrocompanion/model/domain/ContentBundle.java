package com.imperium.astrocompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个用户的全部生成内容。缺失的类别表现为字段不存在，而不是空字符串占位。
 * deepDive 以 {@link DeepDiveTopic#key()} 为键，partnerMemos 以 {@link PartnerKey#value()} 为键。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentBundle {

    private String introText;

    /** 能量、爱情、事业三个关键词解读 */
    private String threeKeys;

    private DailyForecast dailyForecast;

    private String weeklyHoroscope;

    private String monthlyHoroscope;

    private Map<String, String> deepDive = new LinkedHashMap<>();

    private Map<String, PartnerMemos> partnerMemos = new LinkedHashMap<>();

    private String transitForecast;

    public void setDeepDive(Map<String, String> deepDive) {
        this.deepDive = deepDive != null ? new LinkedHashMap<>(deepDive) : new LinkedHashMap<>();
    }

    public void setPartnerMemos(Map<String, PartnerMemos> partnerMemos) {
        this.partnerMemos = partnerMemos != null ? new LinkedHashMap<>(partnerMemos) : new LinkedHashMap<>();
    }

    public String deepDiveOf(DeepDiveTopic topic) {
        return deepDive.get(topic.key());
    }

    public void putDeepDive(DeepDiveTopic topic, String text) {
        deepDive.put(topic.key(), text);
    }

    public PartnerMemos memosOf(PartnerKey key) {
        return partnerMemos.get(key.value());
    }

    public PartnerMemos partnerMemosFor(PartnerKey key, String partnerName, String partnerDate) {
        return partnerMemos.computeIfAbsent(key.value(), k -> new PartnerMemos(partnerName, partnerDate));
    }

    /**
     * 单类别文本内容（daily_horoscope 返回 content 字段），不存在时返回 null。
     */
    public String textOf(ContentCategory category) {
        return switch (category) {
            case NATAL_INTRO -> introText;
            case THREE_KEYS -> threeKeys;
            case WEEKLY_HOROSCOPE -> weeklyHoroscope;
            case MONTHLY_HOROSCOPE -> monthlyHoroscope;
            case DAILY_HOROSCOPE -> dailyForecast != null ? dailyForecast.getContent() : null;
            case TRANSIT_FORECAST -> transitForecast;
            default -> category.topic().map(this::deepDiveOf).orElse(null);
        };
    }

    /**
     * 覆盖单个文本类别，其余字段保持不变。
     */
    public void overwrite(ContentCategory category, String text) {
        switch (category) {
            case NATAL_INTRO -> introText = text;
            case THREE_KEYS -> threeKeys = text;
            case WEEKLY_HOROSCOPE -> weeklyHoroscope = text;
            case MONTHLY_HOROSCOPE -> monthlyHoroscope = text;
            case TRANSIT_FORECAST -> transitForecast = text;
            case DAILY_HOROSCOPE -> throw new IllegalArgumentException("daily_horoscope is not a text category");
            default -> putDeepDive(category.topic().orElseThrow(), text);
        }
    }
}
