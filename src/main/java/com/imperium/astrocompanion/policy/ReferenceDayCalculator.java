package com.imperium.astrocompanion.policy;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * 参考日计算：在固定参考时区下取日历日期，午夜后有一小段宽限期，宽限期内仍算作前一天。
 * <p>
 * 例如参考时区 Europe/Moscow、宽限 1 分钟时，00:00:30 MSK 仍属于前一天，00:01 起才切换。
 */
public class ReferenceDayCalculator {

    private final ZoneId zone;
    private final Duration grace;

    public ReferenceDayCalculator(ZoneId zone, Duration grace) {
        this.zone = zone;
        this.grace = grace != null ? grace : Duration.ZERO;
    }

    public LocalDate referenceDay(Instant instant) {
        return instant.atZone(zone).minus(grace).toLocalDate();
    }

    public LocalDate referenceDay(long epochMillis) {
        return referenceDay(Instant.ofEpochMilli(epochMillis));
    }

    public ZoneId zone() {
        return zone;
    }
}
