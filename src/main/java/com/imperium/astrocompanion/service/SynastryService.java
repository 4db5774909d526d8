package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.MemoMode;
import com.imperium.astrocompanion.model.domain.PartnerFacts;
import com.imperium.astrocompanion.model.domain.PartnerMemo;
import com.imperium.astrocompanion.model.domain.Profile;

/**
 * 合盘解读缓存。同一 partnerKey 下 BRIEF 与 FULL 是两个独立槽位。
 */
public interface SynastryService {

    /**
     * 命中则直接返回缓存，零外部调用；未命中调用对应模式的 Oracle 并写入缓存。
     *
     * @throws InvalidInputException     合盘对象信息不合法（在任何外部调用前）
     * @throws ContentNotReadyException  用户尚未完成首次生成
     */
    PartnerMemo getOrGenerate(Profile profile, PartnerFacts partner, MemoMode mode);

    /**
     * 按 userId 加载档案后执行 {@link #getOrGenerate(Profile, PartnerFacts, MemoMode)}。
     *
     * @throws ProfileNotFoundException 用户不存在
     */
    PartnerMemo getOrGenerate(String userId, PartnerFacts partner, MemoMode mode);
}
