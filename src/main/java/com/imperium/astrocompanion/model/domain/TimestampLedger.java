package com.imperium.astrocompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * 每个类别最后一次生成的时间（epoch 毫秒）。同一类别的时间戳只增不减。
 */
public class TimestampLedger {

    private final Map<String, Long> stamps;

    public TimestampLedger() {
        this.stamps = new LinkedHashMap<>();
    }

    @JsonCreator
    public TimestampLedger(Map<String, Long> stamps) {
        this.stamps = stamps != null ? new LinkedHashMap<>(stamps) : new LinkedHashMap<>();
    }

    public OptionalLong get(ContentCategory category) {
        Long value = stamps.get(category.key());
        return value != null ? OptionalLong.of(value) : OptionalLong.empty();
    }

    /**
     * 记录生成时间；早于已有记录的时间会被忽略。
     */
    public void record(ContentCategory category, long epochMillis) {
        stamps.merge(category.key(), epochMillis, Math::max);
    }

    public boolean contains(ContentCategory category) {
        return stamps.containsKey(category.key());
    }

    @JsonValue
    public Map<String, Long> asMap() {
        return Collections.unmodifiableMap(stamps);
    }
}
