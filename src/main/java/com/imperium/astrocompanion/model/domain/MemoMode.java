package com.imperium.astrocompanion.model.domain;

/**
 * 合盘备忘录模式：BRIEF 与 FULL 是同一 partnerKey 下互相独立的两个缓存槽。
 */
public enum MemoMode {
    BRIEF,
    FULL
}
