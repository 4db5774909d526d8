package com.imperium.astrocompanion.store;

import com.imperium.astrocompanion.model.domain.Profile;

import java.util.Optional;

/**
 * 用户档案持久化契约。put 整体覆盖（last write wins），不做并发控制。
 */
public interface ProfileStore {

    Optional<Profile> get(String userId);

    /**
     * @throws ProfilePersistenceException 写入失败
     */
    void put(Profile profile);
}
