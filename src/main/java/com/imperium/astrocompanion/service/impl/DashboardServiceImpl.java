package com.imperium.astrocompanion.service.impl;

import com.imperium.astrocompanion.model.domain.ContentBundle;
import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.service.ContentGenerationService;
import com.imperium.astrocompanion.service.DailyHoroscopeService;
import com.imperium.astrocompanion.service.DashboardService;
import com.imperium.astrocompanion.service.ProfileNotFoundException;
import com.imperium.astrocompanion.store.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DashboardServiceImpl implements DashboardService {

    private static final Logger log = LoggerFactory.getLogger(DashboardServiceImpl.class);

    private final ProfileStore profileStore;
    private final ContentGenerationService contentGenerationService;
    private final DailyHoroscopeService dailyHoroscopeService;

    public DashboardServiceImpl(ProfileStore profileStore,
                                ContentGenerationService contentGenerationService,
                                DailyHoroscopeService dailyHoroscopeService) {
        this.profileStore = profileStore;
        this.contentGenerationService = contentGenerationService;
        this.dailyHoroscopeService = dailyHoroscopeService;
    }

    @Override
    public Profile profile(String userId) {
        Profile profile = load(userId);
        if (profile.hasBundle()) {
            contentGenerationService.refreshScheduled(profile, profile.getChart());
        }
        return profile;
    }

    @Override
    public DailyForecast dailyForecast(String userId) {
        Profile profile = load(userId);
        if (!profile.hasBundle()) {
            log.info("User {} has no content bundle, running initial generation", userId);
            ContentBundle bundle = contentGenerationService.generateAll(profile, profile.getChart());
            return bundle.getDailyForecast();
        }
        return dailyHoroscopeService.getOrGenerate(profile, profile.getChart());
    }

    private Profile load(String userId) {
        return profileStore.get(userId).orElseThrow(() -> new ProfileNotFoundException(userId));
    }
}
