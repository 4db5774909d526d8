package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.ContentCategory;
import com.imperium.astrocompanion.model.domain.RegenerationResult;

/**
 * 重新生成入口：ONE_TIME 与 PAID_ONLY 类别在首次生成后只能通过这里改变。
 */
public interface RegenerationService {

    /**
     * 非会员直接拒绝；会员在当前窗口内有免费额度时免费执行，否则需 acceptPaid 并扣款成功。
     * 扣款后 Oracle 失败会退款并抛出 {@link com.imperium.astrocompanion.oracle.ContentOracleException}。
     *
     * @param userId     用户 ID
     * @param category   要重新生成的类别，不能是 daily_horoscope
     * @param acceptPaid 免费额度用完时是否同意按标价付费
     * @return 成功结果或拒绝原因，拒绝不是异常
     */
    RegenerationResult attemptRegenerate(String userId, ContentCategory category, boolean acceptPaid);
}
