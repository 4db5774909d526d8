package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.ContentBundle;
import com.imperium.astrocompanion.model.domain.ContentCategory;
import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.model.domain.ZodiacSign;
import com.imperium.astrocompanion.oracle.FallbackContent;
import com.imperium.astrocompanion.oracle.OracleKind;
import com.imperium.astrocompanion.service.impl.DailyHoroscopeServiceImpl;
import com.imperium.astrocompanion.support.CountingContentOracle;
import com.imperium.astrocompanion.support.Fixtures;
import com.imperium.astrocompanion.support.InMemoryDailyForecastCache;
import com.imperium.astrocompanion.support.InMemoryProfileStore;
import com.imperium.astrocompanion.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class DailyHoroscopeServiceTest {

    private static final LocalDate JUNE_1 = LocalDate.of(2024, 6, 1);

    private CountingContentOracle oracle;
    private InMemoryProfileStore store;
    private InMemoryDailyForecastCache sharedCache;
    private MutableClock clock;
    private DailyHoroscopeServiceImpl service;

    @BeforeEach
    void setUp() {
        oracle = new CountingContentOracle();
        store = new InMemoryProfileStore();
        sharedCache = new InMemoryDailyForecastCache();
        clock = MutableClock.at("2024-06-01T09:00:00Z");
        service = new DailyHoroscopeServiceImpl(oracle, store, sharedCache, Fixtures.evaluator(),
                Fixtures.forecastParser(), Fixtures.SAME_THREAD, clock);
    }

    private static Profile withEmptyBundle(String userId, String name, String birthDate) {
        Profile profile = Fixtures.profile(userId, name, birthDate);
        profile.setBundle(new ContentBundle());
        return profile;
    }

    @Test
    void atMostOneOracleCallPerUserPerDay() {
        Profile profile = withEmptyBundle("u1", "Anna", "1989-03-06");

        DailyForecast first = service.getOrGenerate(profile, profile.getChart());
        clock.advance(Duration.ofHours(6));
        DailyForecast second = service.getOrGenerate(profile, profile.getChart());

        assertEquals(1, oracle.calls());
        assertSame(first, second);
        assertEquals(JUNE_1, first.getDate());
        assertEquals(1, sharedCache.putCount());
        assertEquals(1, store.putCount());
        assertEquals(Instant.parse("2024-06-01T09:00:00Z").toEpochMilli(),
                profile.getTimestamps().get(ContentCategory.DAILY_HOROSCOPE).getAsLong());
    }

    @Test
    void sameSignUsersShareOneForecast() {
        // 两位 Leo 用户，共享缓存初始为空
        Profile first = withEmptyBundle("u1", "Leon", "1990-08-01");
        Profile second = withEmptyBundle("u2", "Lena", "1985-07-30");
        assertEquals(ZodiacSign.LEO, first.getSunSign());
        assertEquals(ZodiacSign.LEO, second.getSunSign());

        DailyForecast a = service.getOrGenerate(first, first.getChart());
        DailyForecast b = service.getOrGenerate(second, second.getChart());

        assertEquals(1, oracle.calls(OracleKind.DAILY_HOROSCOPE));
        assertEquals(a.getContent(), b.getContent());
        assertTrue(second.getTimestamps().contains(ContentCategory.DAILY_HOROSCOPE));
        assertEquals(b, second.getBundle().getDailyForecast());
    }

    @Test
    void differentSignsDoNotShare() {
        Profile leo = withEmptyBundle("u1", "Leon", "1990-08-01");
        Profile pisces = withEmptyBundle("u2", "Anna", "1989-03-06");

        service.getOrGenerate(leo, leo.getChart());
        service.getOrGenerate(pisces, pisces.getChart());

        assertEquals(2, oracle.calls());
        assertEquals(2, sharedCache.size());
    }

    @Test
    void nextReferenceDayRefreshes() {
        Profile profile = withEmptyBundle("u1", "Anna", "1989-03-06");
        service.getOrGenerate(profile, profile.getChart());

        clock.set(Instant.parse("2024-06-01T21:01:00Z")); // 00:01 MSK 6 月 2 日
        DailyForecast next = service.getOrGenerate(profile, profile.getChart());

        assertEquals(2, oracle.calls());
        assertEquals(LocalDate.of(2024, 6, 2), next.getDate());
    }

    @Test
    void refreshFailureKeepsLastGoodForecast() {
        Profile profile = withEmptyBundle("u1", "Anna", "1989-03-06");
        DailyForecast yesterday = DailyForecast.builder().date(JUNE_1.minusDays(1)).content("Yesterday").build();
        profile.getBundle().setDailyForecast(yesterday);
        long stamp = Instant.parse("2024-05-31T09:00:00Z").toEpochMilli();
        profile.getTimestamps().record(ContentCategory.DAILY_HOROSCOPE, stamp);
        oracle.failAll();

        DailyForecast result = service.getOrGenerate(profile, profile.getChart());

        assertSame(yesterday, result);
        assertEquals(stamp, profile.getTimestamps().get(ContentCategory.DAILY_HOROSCOPE).getAsLong());
        assertEquals(0, sharedCache.putCount());
        assertEquals(0, store.putCount());
    }

    @Test
    void refreshFailureWithoutHistoryReturnsUncachedFallback() {
        Profile profile = withEmptyBundle("u1", "Anna", "1989-03-06");
        oracle.failAll();

        DailyForecast result = service.getOrGenerate(profile, profile.getChart());

        assertEquals(FallbackContent.dailyForecast(JUNE_1, Language.EN).getContent(), result.getContent());
        assertFalse(profile.getTimestamps().contains(ContentCategory.DAILY_HOROSCOPE));
        assertNull(profile.getBundle().getDailyForecast());
        assertEquals(0, sharedCache.size());

        // Oracle 恢复后下一次访问会重新尝试
        oracle.recover();
        service.getOrGenerate(profile, profile.getChart());
        assertEquals(2, oracle.calls());
    }

    @Test
    void backgroundSaveFailureDoesNotAffectCaller() {
        store.failPuts(true);
        Profile profile = withEmptyBundle("u1", "Anna", "1989-03-06");

        DailyForecast result = assertDoesNotThrow(() -> service.getOrGenerate(profile, profile.getChart()));

        assertTrue(result.hasContent());
    }

    @Test
    void saturatedExecutorSavesOnCallerThread() {
        DailyHoroscopeServiceImpl saturated = new DailyHoroscopeServiceImpl(oracle, store, sharedCache,
                Fixtures.evaluator(), Fixtures.forecastParser(), task -> {
                    throw new RejectedExecutionException("queue full");
                }, clock);
        Profile profile = withEmptyBundle("u1", "Anna", "1989-03-06");

        DailyForecast forecast = assertDoesNotThrow(() -> saturated.getOrGenerate(profile, profile.getChart()));

        assertEquals("Bright", forecast.getMood());
        assertEquals(JUNE_1, forecast.getDate());
        assertEquals(1, sharedCache.putCount());
        assertEquals(1, store.putCount());
        assertSame(forecast, profile.getBundle().getDailyForecast());
    }

    @Test
    void saturatedExecutorOnSharedHitStillReturnsForecast() {
        sharedCache.put(ZodiacSign.PISCES, JUNE_1, DailyForecast.builder().date(JUNE_1).content("Shared").build());
        DailyHoroscopeServiceImpl saturated = new DailyHoroscopeServiceImpl(oracle, store, sharedCache,
                Fixtures.evaluator(), Fixtures.forecastParser(), task -> {
                    throw new RejectedExecutionException("queue full");
                }, clock);
        Profile profile = withEmptyBundle("u1", "Anna", "1989-03-06");

        DailyForecast forecast = assertDoesNotThrow(() -> saturated.getOrGenerate(profile, profile.getChart()));

        assertEquals("Shared", forecast.getContent());
        assertEquals(0, oracle.calls());
        assertEquals(1, store.putCount());
    }
}
