package com.imperium.astrocompanion.service.impl;

import com.imperium.astrocompanion.chart.ChartEngine;
import com.imperium.astrocompanion.chart.ZodiacSigns;
import com.imperium.astrocompanion.model.domain.BirthFacts;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.service.BirthFactsValidator;
import com.imperium.astrocompanion.service.ContentGenerationService;
import com.imperium.astrocompanion.service.InvalidInputException;
import com.imperium.astrocompanion.service.OnboardingService;
import com.imperium.astrocompanion.store.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class OnboardingServiceImpl implements OnboardingService {

    private static final Logger log = LoggerFactory.getLogger(OnboardingServiceImpl.class);

    private final BirthFactsValidator validator;
    private final ChartEngine chartEngine;
    private final ProfileStore profileStore;
    private final ContentGenerationService contentGenerationService;

    public OnboardingServiceImpl(BirthFactsValidator validator,
                                 ChartEngine chartEngine,
                                 ProfileStore profileStore,
                                 ContentGenerationService contentGenerationService) {
        this.validator = validator;
        this.chartEngine = chartEngine;
        this.profileStore = profileStore;
        this.contentGenerationService = contentGenerationService;
    }

    @Override
    public Profile onboard(String userId, String name, String birthDate, String birthTime, String birthPlace,
                           Language language) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidInputException("userId", "User ID is required");
        }
        BirthFacts birth = validator.validateBirthFacts(name, birthDate, birthTime, birthPlace);
        Language lang = language != null ? language : Language.EN;

        Optional<Profile> existing = profileStore.get(userId);
        Profile profile = existing.orElseGet(() -> Profile.builder().id(userId).build());

        // 星盘只算一次：出生信息未变时沿用已存的星盘
        ChartFacts chart = profile.getChart();
        if (chart == null || !birth.equals(profile.birthFacts())) {
            chart = chartEngine.computeChart(birth, lang);
            log.info("Chart computed for user {}", userId);
        } else {
            log.info("Reusing stored chart for user {}", userId);
        }

        profile.setName(birth.getName());
        profile.setBirthDate(birth.getBirthDate());
        profile.setBirthTime(birth.getBirthTime());
        profile.setBirthPlace(birth.getBirthPlace());
        profile.setLanguage(lang);
        profile.setChart(chart);
        profile.setSunSign(ZodiacSigns.resolve(chart, birth.getBirthDate()));

        // 关键路径：失败直接抛出
        profileStore.put(profile);
        log.info("Profile {} saved, sun sign {}", userId, profile.getSunSign());

        if (!profile.hasBundle()) {
            contentGenerationService.generateAll(profile, chart);
        }
        return profile;
    }
}
