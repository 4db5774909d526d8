package com.imperium.astrocompanion.model.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 重新生成的结果：成功时带新内容与实际扣费，被拒绝时带原因与标价。
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RegenerationResult {

    private final ContentCategory category;

    private final String content;

    private final DeniedReason deniedReason;

    /** 标价（星），RATE_LIMITED / PAYMENT_DECLINED 时供前端展示 */
    private final int price;

    /** 本次实际扣费，免费重新生成为 0 */
    private final int charged;

    public static RegenerationResult regenerated(ContentCategory category, String content, int charged) {
        return new RegenerationResult(category, content, null, charged, charged);
    }

    public static RegenerationResult denied(ContentCategory category, DeniedReason reason, int price) {
        return new RegenerationResult(category, null, reason, price, 0);
    }

    public boolean isRegenerated() {
        return deniedReason == null;
    }
}
