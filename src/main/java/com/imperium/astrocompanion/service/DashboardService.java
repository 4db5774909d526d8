package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.model.domain.Profile;

/**
 * 仪表盘访问：保证首次生成先于每日刷新完成。
 */
public interface DashboardService {

    /**
     * 读取档案；已有内容包时顺带刷新到期的每周、每月运势。
     *
     * @throws ProfileNotFoundException 用户不存在
     */
    Profile profile(String userId);

    /**
     * 档案没有内容包时先在前台执行首次生成，否则走共享每日运势缓存。
     *
     * @throws ProfileNotFoundException 用户不存在
     */
    DailyForecast dailyForecast(String userId);
}
