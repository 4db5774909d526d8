package com.imperium.astrocompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 重新生成被拒绝的原因。属于正常业务结果，不是错误。
 */
public enum DeniedReason {

    /** 非会员，前端应展示升级入口 */
    NOT_PREMIUM,

    /** 当前窗口免费次数已用完，且用户未同意付费 */
    RATE_LIMITED,

    /** 用户同意付费但扣款被拒（余额不足） */
    PAYMENT_DECLINED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
