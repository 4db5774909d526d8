package com.imperium.astrocompanion.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.astrocompanion.mapper.UserProfileMapper;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.ContentBundle;
import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.model.domain.RegenerationLedger;
import com.imperium.astrocompanion.model.domain.TimestampLedger;
import com.imperium.astrocompanion.model.domain.ZodiacSign;
import com.imperium.astrocompanion.model.entity.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * user_profiles 表上的 {@link ProfileStore} 实现。
 */
@Component
public class MybatisProfileStore implements ProfileStore {

    private static final Logger log = LoggerFactory.getLogger(MybatisProfileStore.class);

    private final UserProfileMapper userProfileMapper;
    private final ObjectMapper objectMapper;

    public MybatisProfileStore(UserProfileMapper userProfileMapper, ObjectMapper objectMapper) {
        this.userProfileMapper = userProfileMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Profile> get(String userId) {
        UserProfile row;
        try {
            row = userProfileMapper.selectById(userId);
        } catch (Exception e) {
            throw new ProfilePersistenceException("Failed to load profile " + userId, e);
        }
        if (row == null) {
            return Optional.empty();
        }
        return Optional.of(toProfile(row));
    }

    @Override
    public void put(Profile profile) {
        if (profile.getId() == null || profile.getId().isBlank()) {
            throw new ProfilePersistenceException("User ID is required for saving");
        }
        LocalDateTime now = LocalDateTime.now();
        try {
            UserProfile row = toRow(profile);
            row.setUpdatedAt(now);
            // stars_balance 只通过 deductStars / addStars 修改，避免覆盖并发扣款
            row.setStarsBalance(null);
            if (userProfileMapper.updateById(row) == 0) {
                row.setCreatedAt(now);
                row.setStarsBalance(profile.getStarsBalance());
                userProfileMapper.insert(row);
            }
            log.debug("Profile {} saved", profile.getId());
        } catch (JsonProcessingException e) {
            throw new ProfilePersistenceException("Failed to serialize profile " + profile.getId(), e);
        } catch (Exception e) {
            throw new ProfilePersistenceException("Failed to save profile " + profile.getId(), e);
        }
    }

    private UserProfile toRow(Profile profile) throws JsonProcessingException {
        UserProfile row = new UserProfile();
        row.setId(profile.getId());
        row.setName(profile.getName());
        row.setBirthDate(profile.getBirthDate());
        row.setBirthTime(profile.getBirthTime());
        row.setBirthPlace(profile.getBirthPlace());
        row.setLanguage(profile.getLanguage() != null ? profile.getLanguage().tag() : Language.EN.tag());
        row.setPremium(profile.isPremium());
        row.setSunSign(profile.getSunSign() != null ? profile.getSunSign().name() : null);
        row.setChartJson(profile.getChart() != null ? objectMapper.writeValueAsString(profile.getChart()) : null);
        row.setContentJson(profile.getBundle() != null ? objectMapper.writeValueAsString(profile.getBundle()) : null);
        row.setTimestampsJson(objectMapper.writeValueAsString(profile.getTimestamps()));
        row.setRegenerationsJson(objectMapper.writeValueAsString(profile.getRegenerations()));
        return row;
    }

    private Profile toProfile(UserProfile row) {
        return Profile.builder()
                .id(row.getId())
                .name(row.getName())
                .birthDate(row.getBirthDate())
                .birthTime(row.getBirthTime())
                .birthPlace(row.getBirthPlace())
                .language(Language.fromTag(row.getLanguage()))
                .premium(Boolean.TRUE.equals(row.getPremium()))
                .sunSign(ZodiacSign.parse(row.getSunSign()).orElse(null))
                .starsBalance(row.getStarsBalance() != null ? row.getStarsBalance() : 0)
                .chart(read(row.getChartJson(), ChartFacts.class, row.getId()))
                .bundle(read(row.getContentJson(), ContentBundle.class, row.getId()))
                .timestamps(orDefault(read(row.getTimestampsJson(), TimestampLedger.class, row.getId()),
                        new TimestampLedger()))
                .regenerations(orDefault(read(row.getRegenerationsJson(), RegenerationLedger.class, row.getId()),
                        new RegenerationLedger()))
                .build();
    }

    private <T> T read(String json, Class<T> type, String userId) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ProfilePersistenceException("Corrupted " + type.getSimpleName() + " for profile " + userId, e);
        }
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
