package com.imperium.astrocompanion.policy;

/**
 * 刷新策略类型。
 */
public enum CategoryKind {

    /** 只生成一次；之后只能通过重新生成入口刷新 */
    ONE_TIME,

    /** 每个参考日刷新一次，在下一次访问时惰性判断 */
    DAILY_SCHEDULED,

    /** 距上次生成满一个固定周期（周 / 月）后刷新，同样在访问时惰性判断 */
    PERIODIC,

    /** 自动路径永远不生成，只能通过付费/重新生成入口获得 */
    PAID_ONLY
}
