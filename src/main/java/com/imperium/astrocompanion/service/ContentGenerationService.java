package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.ContentBundle;
import com.imperium.astrocompanion.model.domain.Profile;

/**
 * 首次生成与按计划刷新：natal_intro、three_keys、每日/每周/每月运势、5 个 deep_dive。
 */
public interface ContentGenerationService {

    /**
     * 并发调用 Oracle 生成各类别内容。单个类别失败时使用本地化兜底文本，不影响其它类别；
     * 已有内容且策略判定未到期的类别保持不变。
     * <p>
     * 结果写回 profile（bundle 与时间戳）并持久化；持久化失败只记日志，仍返回内存中的内容包。
     *
     * @param profile 用户档案，会被原地修改
     * @param chart   Chart Engine 结果，可为 null（提示词中省略星盘信息）
     * @return 聚合后的内容包，不会为 null
     */
    ContentBundle generateAll(Profile profile, ChartFacts chart);

    /**
     * 刷新到期的周期类别（每周、每月运势）。失败的类别保留原内容、不记时间戳，下次访问重试。
     * 有内容更新时持久化，失败只记日志。profile 尚无内容包时不做任何事。
     *
     * @return 实际刷新的类别数
     */
    int refreshScheduled(Profile profile, ChartFacts chart);
}
