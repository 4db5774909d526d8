package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.model.domain.Profile;

/**
 * 每日运势：按（太阳星座, 参考日）在所有用户间共享。
 */
public interface DailyHoroscopeService {

    /**
     * 依次尝试：用户内容包中今天的运势 → 共享缓存 → 调用 Oracle 并写入共享缓存。
     * 后两种情况会更新用户内容包与时间戳，并在后台持久化。
     * <p>
     * Oracle 失败属于被动刷新失败：返回上一次的运势，没有时返回兜底运势（不缓存、不记时间戳）。
     */
    DailyForecast getOrGenerate(Profile profile, ChartFacts chart);
}
