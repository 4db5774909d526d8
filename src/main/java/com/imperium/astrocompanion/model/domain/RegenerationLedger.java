package com.imperium.astrocompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按类别记录的重新生成用量。免费额度按滚动窗口计算：窗口过期后 freeUsed 归零。
 */
public class RegenerationLedger {

    private final Map<String, RegenerationUsage> usage;

    public RegenerationLedger() {
        this.usage = new LinkedHashMap<>();
    }

    @JsonCreator
    public RegenerationLedger(Map<String, RegenerationUsage> usage) {
        this.usage = usage != null ? new LinkedHashMap<>(usage) : new LinkedHashMap<>();
    }

    /**
     * 当前窗口内已使用的免费次数。
     */
    public int freeUsedInWindow(ContentCategory category, long now, Duration window) {
        RegenerationUsage u = usage.get(category.key());
        if (u == null || u.getWindowStart() == null) {
            return 0;
        }
        if (now - u.getWindowStart() >= window.toMillis()) {
            return 0;
        }
        return u.getFreeUsed();
    }

    public void recordFree(ContentCategory category, long now, Duration window) {
        RegenerationUsage u = usage.computeIfAbsent(category.key(), k -> new RegenerationUsage());
        if (u.getWindowStart() == null || now - u.getWindowStart() >= window.toMillis()) {
            u.setWindowStart(now);
            u.setFreeUsed(0);
        }
        u.setFreeUsed(u.getFreeUsed() + 1);
        u.setLastRegenAt(now);
    }

    public void recordPaid(ContentCategory category, long now) {
        RegenerationUsage u = usage.computeIfAbsent(category.key(), k -> new RegenerationUsage());
        u.setPaidCount(u.getPaidCount() + 1);
        u.setLastRegenAt(now);
    }

    public RegenerationUsage get(ContentCategory category) {
        return usage.get(category.key());
    }

    @JsonValue
    public Map<String, RegenerationUsage> asMap() {
        return Collections.unmodifiableMap(usage);
    }
}
