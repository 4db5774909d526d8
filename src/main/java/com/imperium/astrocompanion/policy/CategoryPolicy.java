package com.imperium.astrocompanion.policy;

import java.time.Duration;

/**
 * 单个类别的策略。allowance 为 null 表示该类别不允许重新生成；period 仅 PERIODIC 类别有值。
 */
public record CategoryPolicy(CategoryKind kind, RegenerationAllowance allowance, Duration period) {

    public CategoryPolicy {
        if (kind == CategoryKind.PERIODIC && (period == null || period.isZero() || period.isNegative())) {
            throw new IllegalArgumentException("Periodic category requires a positive period");
        }
        if (kind != CategoryKind.PERIODIC && period != null) {
            throw new IllegalArgumentException("Only periodic categories have a period");
        }
    }

    public CategoryPolicy(CategoryKind kind, RegenerationAllowance allowance) {
        this(kind, allowance, null);
    }

    public boolean regenerable() {
        return allowance != null;
    }
}
