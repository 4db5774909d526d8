package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.Profile;

public interface OnboardingService {

    /**
     * 首次设置：校验出生信息 → 计算星盘（仅一次）→ 创建档案 → 前台执行首次生成。
     * <p>
     * 档案创建时的持久化失败会以 {@link com.imperium.astrocompanion.store.ProfilePersistenceException}
     * 抛出，用户此时没有任何可用内容，必须重试。
     *
     * @return 含星盘与内容包的档案
     */
    Profile onboard(String userId, String name, String birthDate, String birthTime, String birthPlace,
                    Language language);
}
