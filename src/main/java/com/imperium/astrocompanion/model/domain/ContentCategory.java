package com.imperium.astrocompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * 生成内容的类别。刷新策略不在这里定义，统一由 CategoryPolicyTable 决定。
 */
public enum ContentCategory {

    NATAL_INTRO("natal_intro", null),
    THREE_KEYS("three_keys", null),
    DAILY_HOROSCOPE("daily_horoscope", null),
    WEEKLY_HOROSCOPE("weekly_horoscope", null),
    MONTHLY_HOROSCOPE("monthly_horoscope", null),
    DEEP_DIVE_PERSONALITY("deep_dive_personality", DeepDiveTopic.PERSONALITY),
    DEEP_DIVE_LOVE("deep_dive_love", DeepDiveTopic.LOVE),
    DEEP_DIVE_CAREER("deep_dive_career", DeepDiveTopic.CAREER),
    DEEP_DIVE_WEAKNESS("deep_dive_weakness", DeepDiveTopic.WEAKNESS),
    DEEP_DIVE_KARMA("deep_dive_karma", DeepDiveTopic.KARMA),
    TRANSIT_FORECAST("transit_forecast", null);

    private final String key;
    private final DeepDiveTopic topic;

    ContentCategory(String key, DeepDiveTopic topic) {
        this.key = key;
        this.topic = topic;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /** 仅 deep_dive_* 类别有主题 */
    public Optional<DeepDiveTopic> topic() {
        return Optional.ofNullable(topic);
    }

    public static ContentCategory deepDive(DeepDiveTopic topic) {
        for (ContentCategory c : values()) {
            if (c.topic == topic) {
                return c;
            }
        }
        throw new IllegalArgumentException("No category for topic " + topic);
    }

    @JsonCreator
    public static ContentCategory fromKey(String key) {
        if (key != null) {
            for (ContentCategory c : values()) {
                if (c.key.equalsIgnoreCase(key.trim())) {
                    return c;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported content type: " + key);
    }
}
