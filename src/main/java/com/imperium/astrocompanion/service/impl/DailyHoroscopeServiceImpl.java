package com.imperium.astrocompanion.service.impl;

import com.imperium.astrocompanion.chart.ZodiacSigns;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.ContentBundle;
import com.imperium.astrocompanion.model.domain.ContentCategory;
import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.model.domain.ZodiacSign;
import com.imperium.astrocompanion.oracle.ContentOracle;
import com.imperium.astrocompanion.oracle.ContentOracleException;
import com.imperium.astrocompanion.oracle.FallbackContent;
import com.imperium.astrocompanion.oracle.ForecastParser;
import com.imperium.astrocompanion.oracle.OracleKind;
import com.imperium.astrocompanion.oracle.OracleRequest;
import com.imperium.astrocompanion.policy.FreshnessPolicyEvaluator;
import com.imperium.astrocompanion.service.DailyHoroscopeService;
import com.imperium.astrocompanion.store.DailyForecastCache;
import com.imperium.astrocompanion.store.ProfilePersistenceException;
import com.imperium.astrocompanion.store.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Service
public class DailyHoroscopeServiceImpl implements DailyHoroscopeService {

    private static final Logger log = LoggerFactory.getLogger(DailyHoroscopeServiceImpl.class);

    private final ContentOracle contentOracle;
    private final ProfileStore profileStore;
    private final DailyForecastCache dailyForecastCache;
    private final FreshnessPolicyEvaluator evaluator;
    private final ForecastParser forecastParser;
    private final Executor executor;
    private final Clock clock;

    public DailyHoroscopeServiceImpl(ContentOracle contentOracle,
                                     ProfileStore profileStore,
                                     DailyForecastCache dailyForecastCache,
                                     FreshnessPolicyEvaluator evaluator,
                                     ForecastParser forecastParser,
                                     @Qualifier("generationExecutor") Executor executor,
                                     Clock clock) {
        this.contentOracle = contentOracle;
        this.profileStore = profileStore;
        this.dailyForecastCache = dailyForecastCache;
        this.evaluator = evaluator;
        this.forecastParser = forecastParser;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public DailyForecast getOrGenerate(Profile profile, ChartFacts chart) {
        Instant now = clock.instant();
        LocalDate today = evaluator.referenceDays().referenceDay(now);
        Language language = profile.getLanguage() != null ? profile.getLanguage() : Language.EN;
        DailyForecast current = profile.hasBundle() ? profile.getBundle().getDailyForecast() : null;

        // 1. 用户自己的今日运势
        if (current != null && today.equals(current.getDate()) && current.hasContent()
                && !evaluator.isDue(ContentCategory.DAILY_HOROSCOPE,
                profile.getTimestamps().get(ContentCategory.DAILY_HOROSCOPE), now)) {
            return current;
        }

        ZodiacSign sign = profile.getSunSign() != null
                ? profile.getSunSign()
                : ZodiacSigns.resolve(chart, profile.getBirthDate());

        // 2. 同星座其他用户今天已生成
        Optional<DailyForecast> shared = readShared(sign, today);
        if (shared.isPresent() && shared.get().hasContent()) {
            log.debug("Shared forecast hit for {} {}, user {}", sign, today, profile.getId());
            DailyForecast forecast = shared.get().toBuilder().build();
            attach(profile, forecast, now);
            return forecast;
        }

        // 3. 未命中：调用 Oracle
        String raw;
        try {
            raw = contentOracle.generate(OracleRequest.builder()
                    .kind(OracleKind.DAILY_HOROSCOPE)
                    .user(profile.birthFacts())
                    .chart(chart)
                    .referenceDate(today)
                    .language(language)
                    .build());
        } catch (ContentOracleException e) {
            log.warn("Daily forecast refresh failed for user {} ({} {}): {}", profile.getId(), sign, today,
                    e.getMessage());
            if (current != null && current.hasContent()) {
                return current;
            }
            return FallbackContent.dailyForecast(today, language);
        }

        DailyForecast forecast = forecastParser.parse(raw, today);
        try {
            dailyForecastCache.put(sign, today, forecast);
        } catch (RuntimeException e) {
            log.warn("Failed to write shared forecast for {} {}: {}", sign, today, e.getMessage());
        }
        log.info("Generated daily forecast for {} {} (user {})", sign, today, profile.getId());
        attach(profile, forecast, now);
        return forecast;
    }

    private Optional<DailyForecast> readShared(ZodiacSign sign, LocalDate today) {
        try {
            return dailyForecastCache.get(sign, today);
        } catch (RuntimeException e) {
            log.warn("Shared forecast lookup failed for {} {}: {}", sign, today, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 写入用户内容包并记时间戳，随后后台持久化；线程池拒绝时在当前线程保存。
     */
    private void attach(Profile profile, DailyForecast forecast, Instant now) {
        ContentBundle bundle = profile.hasBundle() ? profile.getBundle() : new ContentBundle();
        bundle.setDailyForecast(forecast);
        profile.setBundle(bundle);
        profile.getTimestamps().record(ContentCategory.DAILY_HOROSCOPE, now.toEpochMilli());
        try {
            executor.execute(() -> saveQuietly(profile));
        } catch (RejectedExecutionException e) {
            log.warn("Generation executor rejected background save for user {}, saving inline", profile.getId());
            saveQuietly(profile);
        }
    }

    private void saveQuietly(Profile profile) {
        try {
            profileStore.put(profile);
        } catch (ProfilePersistenceException e) {
            log.warn("Background save of daily forecast failed for user {}: {}", profile.getId(), e.getMessage());
        }
    }
}
