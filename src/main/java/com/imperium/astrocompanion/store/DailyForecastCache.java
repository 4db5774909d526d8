package com.imperium.astrocompanion.store;

import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.model.domain.ZodiacSign;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 跨用户共享的每日运势缓存，按 (星座, 参考日) 分组。
 * <p>
 * 一致性约定：最终一致，容忍重复写入。两个同星座用户同时首次访问时可能都未命中、
 * 都调用 Oracle、都写入；后写入者覆盖先写入者。实现不得为此加锁。
 */
public interface DailyForecastCache {

    Optional<DailyForecast> get(ZodiacSign sign, LocalDate referenceDate);

    /**
     * 插入或覆盖。
     */
    void put(ZodiacSign sign, LocalDate referenceDate, DailyForecast forecast);
}
