package com.imperium.astrocompanion.billing;

/**
 * 付费入口，只被重新生成流程调用。金额单位为星星（Telegram Stars）。
 */
public interface BillingGateway {

    ChargeResult charge(String userId, int amount);

    /**
     * 退回一次已成功的扣款（付费后生成失败时调用）。
     */
    void refund(String userId, int amount);
}
