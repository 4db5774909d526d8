package com.imperium.astrocompanion.service.impl;

import com.imperium.astrocompanion.chart.ZodiacSigns;
import com.imperium.astrocompanion.model.domain.BirthFacts;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.ContentBundle;
import com.imperium.astrocompanion.model.domain.ContentCategory;
import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.model.domain.ZodiacSign;
import com.imperium.astrocompanion.oracle.ContentOracle;
import com.imperium.astrocompanion.oracle.FallbackContent;
import com.imperium.astrocompanion.oracle.ForecastParser;
import com.imperium.astrocompanion.oracle.OracleRequest;
import com.imperium.astrocompanion.policy.FreshnessPolicyEvaluator;
import com.imperium.astrocompanion.service.ContentGenerationService;
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
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

@Service
public class ContentGenerationServiceImpl implements ContentGenerationService {

    private static final Logger log = LoggerFactory.getLogger(ContentGenerationServiceImpl.class);

    private final ContentOracle contentOracle;
    private final ProfileStore profileStore;
    private final DailyForecastCache dailyForecastCache;
    private final FreshnessPolicyEvaluator evaluator;
    private final ForecastParser forecastParser;
    private final Executor executor;
    private final Clock clock;

    public ContentGenerationServiceImpl(ContentOracle contentOracle,
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
    public ContentBundle generateAll(Profile profile, ChartFacts chart) {
        Instant now = clock.instant();
        LocalDate today = evaluator.referenceDays().referenceDay(now);
        Language language = languageOf(profile);
        BirthFacts user = profile.birthFacts();
        ContentBundle bundle = profile.hasBundle() ? profile.getBundle() : new ContentBundle();
        AtomicInteger fallbacks = new AtomicInteger();

        CompletableFuture<DailyForecast> daily = null;
        Map<ContentCategory, CompletableFuture<String>> texts = new EnumMap<>(ContentCategory.class);
        for (ContentCategory category : ContentCategory.values()) {
            if (!evaluator.policyTable().generatedOnSetup(category)
                    || !needsGeneration(profile, bundle, category, now)) {
                continue;
            }
            if (category == ContentCategory.DAILY_HOROSCOPE) {
                ZodiacSign sign = profile.getSunSign() != null
                        ? profile.getSunSign()
                        : ZodiacSigns.resolve(chart, profile.getBirthDate());
                daily = submit(category,
                        () -> dailyForecast(sign, user, chart, language, today),
                        () -> FallbackContent.dailyForecast(today, language),
                        fallbacks);
            } else {
                texts.put(category, submit(category,
                        () -> contentOracle.generate(OracleRequest.forCategory(category, user, chart, language, today)),
                        () -> FallbackContent.text(category, user.getName(), language),
                        fallbacks));
            }
        }

        // 失败已在 submit 中替换为兜底内容，join 不会抛出
        long stampedAt = now.toEpochMilli();
        if (daily != null) {
            bundle.setDailyForecast(daily.join());
            profile.getTimestamps().record(ContentCategory.DAILY_HOROSCOPE, stampedAt);
        }
        texts.forEach((category, future) -> {
            bundle.overwrite(category, future.join());
            profile.getTimestamps().record(category, stampedAt);
        });

        int generated = (daily != null ? 1 : 0) + texts.size();
        log.info("Generated {} categories for user {} ({} fallbacks)", generated, profile.getId(), fallbacks.get());

        profile.setBundle(bundle);
        save(profile);
        return bundle;
    }

    @Override
    public int refreshScheduled(Profile profile, ChartFacts chart) {
        if (!profile.hasBundle()) {
            return 0;
        }
        Instant now = clock.instant();
        LocalDate today = evaluator.referenceDays().referenceDay(now);
        Language language = languageOf(profile);
        BirthFacts user = profile.birthFacts();
        ContentBundle bundle = profile.getBundle();
        AtomicInteger failures = new AtomicInteger();

        Map<ContentCategory, CompletableFuture<String>> refreshes = new EnumMap<>(ContentCategory.class);
        for (ContentCategory category : evaluator.policyTable().periodicCategories()) {
            if (needsGeneration(profile, bundle, category, now)) {
                // 失败时返回 null：保留旧内容，不记时间戳
                refreshes.put(category, submit(category,
                        () -> contentOracle.generate(OracleRequest.forCategory(category, user, chart, language, today)),
                        () -> null,
                        failures));
            }
        }
        if (refreshes.isEmpty()) {
            return 0;
        }

        int refreshed = 0;
        for (Map.Entry<ContentCategory, CompletableFuture<String>> entry : refreshes.entrySet()) {
            String text = entry.getValue().join();
            if (text == null) {
                continue;
            }
            bundle.overwrite(entry.getKey(), text);
            profile.getTimestamps().record(entry.getKey(), now.toEpochMilli());
            refreshed++;
        }
        log.info("Refreshed {} scheduled categories for user {} ({} failed)", refreshed, profile.getId(),
                failures.get());
        if (refreshed > 0) {
            save(profile);
        }
        return refreshed;
    }

    private void save(Profile profile) {
        try {
            profileStore.put(profile);
        } catch (ProfilePersistenceException e) {
            log.error("Failed to persist generated content for user {}, returning in-memory content",
                    profile.getId(), e);
        }
    }

    private static Language languageOf(Profile profile) {
        return profile.getLanguage() != null ? profile.getLanguage() : Language.EN;
    }

    /**
     * 内容缺失，或策略判定到期时需要生成。内容缺失时忽略时间戳（例如内容包丢失但时间戳仍在）。
     */
    private boolean needsGeneration(Profile profile, ContentBundle bundle, ContentCategory category, Instant now) {
        boolean missing = category == ContentCategory.DAILY_HOROSCOPE
                ? bundle.getDailyForecast() == null || !bundle.getDailyForecast().hasContent()
                : bundle.textOf(category) == null;
        return missing || evaluator.isDue(category, profile.getTimestamps().get(category), now);
    }

    /**
     * 先查共享缓存，命中则不调用 Oracle；生成成功后写回共享缓存。
     */
    private DailyForecast dailyForecast(ZodiacSign sign, BirthFacts user, ChartFacts chart,
                                        Language language, LocalDate today) {
        Optional<DailyForecast> shared = readShared(sign, today);
        if (shared.isPresent()) {
            log.debug("Daily forecast for {} {} served from shared cache", sign, today);
            return shared.get().toBuilder().build();
        }
        String raw = contentOracle.generate(
                OracleRequest.forCategory(ContentCategory.DAILY_HOROSCOPE, user, chart, language, today));
        DailyForecast forecast = forecastParser.parse(raw, today);
        try {
            dailyForecastCache.put(sign, today, forecast);
        } catch (RuntimeException e) {
            log.warn("Failed to write shared forecast for {} {}: {}", sign, today, e.getMessage());
        }
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
     * 在生成线程池上执行；线程池拒绝任务时改在调用线程执行。失败时返回 fallback 的结果并计数。
     */
    private <T> CompletableFuture<T> submit(ContentCategory category, Supplier<T> call, Supplier<T> fallback,
                                            AtomicInteger fallbacks) {
        Function<Throwable, T> recover = ex -> {
            fallbacks.incrementAndGet();
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            log.warn("Generation of {} failed, using fallback: {}", category.key(), cause.getMessage());
            return fallback.get();
        };
        try {
            return CompletableFuture.supplyAsync(call, executor).exceptionally(recover);
        } catch (RejectedExecutionException e) {
            log.warn("Generation executor rejected {}, running on caller thread: {}", category.key(), e.getMessage());
            try {
                return CompletableFuture.completedFuture(call.get());
            } catch (RuntimeException inlineFailure) {
                return CompletableFuture.completedFuture(recover.apply(inlineFailure));
            }
        }
    }
}
