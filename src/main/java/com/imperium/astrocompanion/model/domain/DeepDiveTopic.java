package com.imperium.astrocompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Deep Dive 分析主题。
 */
public enum DeepDiveTopic {

    PERSONALITY("personality", "Personality", "Личность"),
    LOVE("love", "Love", "Любовь"),
    CAREER("career", "Career", "Карьера"),
    WEAKNESS("weakness", "Weakness", "Слабости"),
    KARMA("karma", "Karma", "Карма");

    private final String key;
    private final String titleEn;
    private final String titleRu;

    DeepDiveTopic(String key, String titleEn, String titleRu) {
        this.key = key;
        this.titleEn = titleEn;
        this.titleRu = titleRu;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String title(Language language) {
        return language != null && language.isRussian() ? titleRu : titleEn;
    }

    @JsonCreator
    public static DeepDiveTopic fromKey(String key) {
        for (DeepDiveTopic t : values()) {
            if (t.key.equalsIgnoreCase(key)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown deep dive topic: " + key);
    }
}
