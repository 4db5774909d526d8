package com.imperium.astrocompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 内容语言，对应 languageTag（ru | en）。
 */
public enum Language {

    RU("ru"),
    EN("en");

    private final String tag;

    Language(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public boolean isRussian() {
        return this == RU;
    }

    /**
     * 按 tag 解析，未知或空值回退为 EN。
     */
    @JsonCreator
    public static Language fromTag(String tag) {
        if (tag == null) {
            return EN;
        }
        for (Language l : values()) {
            if (l.tag.equalsIgnoreCase(tag.trim())) {
                return l;
            }
        }
        return EN;
    }
}
