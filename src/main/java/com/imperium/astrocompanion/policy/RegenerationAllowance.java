package com.imperium.astrocompanion.policy;

import java.time.Duration;

/**
 * 重新生成的免费额度与价格：每个滚动 window 内 freeQuota 次免费，超出后按 price（星）付费。
 */
public record RegenerationAllowance(int freeQuota, Duration window, int price) {

    public RegenerationAllowance {
        if (freeQuota < 0) {
            throw new IllegalArgumentException("freeQuota must be >= 0");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (price < 0) {
            throw new IllegalArgumentException("price must be >= 0");
        }
    }
}
