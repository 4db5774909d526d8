package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.ContentBundle;
import com.imperium.astrocompanion.model.domain.ContentCategory;
import com.imperium.astrocompanion.model.domain.DeepDiveTopic;
import com.imperium.astrocompanion.model.domain.DeniedReason;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.model.domain.RegenerationResult;
import com.imperium.astrocompanion.oracle.ContentOracleException;
import com.imperium.astrocompanion.oracle.OracleKind;
import com.imperium.astrocompanion.policy.CategoryPolicyTable;
import com.imperium.astrocompanion.policy.FreshnessPolicyEvaluator;
import com.imperium.astrocompanion.policy.RegenerationAllowance;
import com.imperium.astrocompanion.service.impl.RegenerationServiceImpl;
import com.imperium.astrocompanion.support.CountingContentOracle;
import com.imperium.astrocompanion.support.FakeBillingGateway;
import com.imperium.astrocompanion.support.Fixtures;
import com.imperium.astrocompanion.support.InMemoryProfileStore;
import com.imperium.astrocompanion.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RegenerationServiceTest {

    private CountingContentOracle oracle;
    private InMemoryProfileStore store;
    private FakeBillingGateway billing;
    private MutableClock clock;
    private RegenerationServiceImpl service;

    @BeforeEach
    void setUp() {
        oracle = new CountingContentOracle();
        store = new InMemoryProfileStore();
        billing = new FakeBillingGateway();
        clock = MutableClock.at("2024-06-01T09:00:00Z");
        service = new RegenerationServiceImpl(oracle, store, billing, Fixtures.evaluator(), clock);
    }

    private Profile onboarded(String userId, boolean premium) {
        Profile profile = Fixtures.profile(userId, "Anna", "1989-03-06");
        profile.setPremium(premium);
        ContentBundle bundle = new ContentBundle();
        bundle.setIntroText("original intro");
        bundle.putDeepDive(DeepDiveTopic.LOVE, "original love");
        profile.setBundle(bundle);
        profile.getTimestamps().record(ContentCategory.NATAL_INTRO, 1L);
        store.with(profile);
        return profile;
    }

    @Test
    void nonPremiumNeverReachesOracle() {
        onboarded("u1", false);
        billing.balance("u1", 1000);

        for (ContentCategory category : ContentCategory.values()) {
            if (!Fixtures.evaluator().policyTable().policyOf(category).regenerable()) {
                continue;
            }
            RegenerationResult result = service.attemptRegenerate("u1", category, true);
            assertFalse(result.isRegenerated());
            assertEquals(DeniedReason.NOT_PREMIUM, result.getDeniedReason());
        }
        assertEquals(0, oracle.calls());
        assertEquals(0, billing.chargeCount());
    }

    @Test
    void firstRegenerationInWindowIsFree() {
        Profile profile = onboarded("u1", true);

        RegenerationResult result = service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, false);

        assertTrue(result.isRegenerated());
        assertEquals(0, result.getCharged());
        assertThat(result.getContent()).startsWith("NATAL_INTRO#");
        assertEquals(result.getContent(), profile.getBundle().getIntroText());
        assertEquals("original love", profile.getBundle().deepDiveOf(DeepDiveTopic.LOVE));
        assertEquals(1, profile.getRegenerations().get(ContentCategory.NATAL_INTRO).getFreeUsed());
        assertEquals(Instant.parse("2024-06-01T09:00:00Z").toEpochMilli(),
                profile.getTimestamps().get(ContentCategory.NATAL_INTRO).getAsLong());
        assertEquals(1, store.putCount());
    }

    @Test
    void exhaustedQuotaIsRateLimitedWithPrice() {
        onboarded("u1", true);
        service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, false);

        RegenerationResult result = service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, false);

        assertEquals(DeniedReason.RATE_LIMITED, result.getDeniedReason());
        assertEquals(50, result.getPrice());
        assertEquals(1, oracle.calls());
    }

    @Test
    void quotaIsPerCategory() {
        onboarded("u1", true);
        service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, false);

        RegenerationResult love = service.attemptRegenerate("u1", ContentCategory.DEEP_DIVE_LOVE, false);

        assertTrue(love.isRegenerated());
        assertEquals(1, oracle.calls(OracleKind.DEEP_DIVE));
        assertEquals(DeepDiveTopic.LOVE, oracle.requests().get(1).getTopic());
    }

    @Test
    void acceptingThePriceChargesAndProceeds() {
        Profile profile = onboarded("u1", true);
        billing.balance("u1", 120);
        service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, false);

        RegenerationResult paid = service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, true);

        assertTrue(paid.isRegenerated());
        assertEquals(50, paid.getCharged());
        assertEquals(70, billing.balanceOf("u1"));
        assertEquals(1, profile.getRegenerations().get(ContentCategory.NATAL_INTRO).getPaidCount());
        assertEquals(1, profile.getRegenerations().get(ContentCategory.NATAL_INTRO).getFreeUsed());
    }

    @Test
    void declinedPaymentDoesNotCallOracle() {
        onboarded("u1", true);
        billing.balance("u1", 10);
        service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, false);

        RegenerationResult result = service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, true);

        assertEquals(DeniedReason.PAYMENT_DECLINED, result.getDeniedReason());
        assertEquals(1, oracle.calls());
        assertEquals(10, billing.balanceOf("u1"));
    }

    @Test
    void oracleFailureAfterChargeIsRefunded() {
        Profile profile = onboarded("u1", true);
        billing.balance("u1", 50);
        service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, false);
        String before = profile.getBundle().getIntroText();
        oracle.failAll();

        assertThrows(ContentOracleException.class,
                () -> service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, true));

        assertEquals(50, billing.refundedTotal());
        assertEquals(50, billing.balanceOf("u1"));
        assertEquals(before, profile.getBundle().getIntroText());
        assertEquals(0, profile.getRegenerations().get(ContentCategory.NATAL_INTRO).getPaidCount());
    }

    @Test
    void freeCreditReturnsAfterWindow() {
        onboarded("u1", true);
        service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, false);

        clock.advance(Duration.ofDays(1));
        RegenerationResult result = service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, false);

        assertTrue(result.isRegenerated());
        assertEquals(0, result.getCharged());
    }

    @Test
    void configuredWeeklyAllowanceIsHonoured() {
        RegenerationAllowance threePerWeek = new RegenerationAllowance(3, Duration.ofDays(7), 30);
        FreshnessPolicyEvaluator evaluator = new FreshnessPolicyEvaluator(
                CategoryPolicyTable.defaults(new RegenerationAllowance(1, Duration.ofDays(1), 50))
                        .withAllowance(ContentCategory.DEEP_DIVE_LOVE, threePerWeek),
                Fixtures.referenceDays());
        RegenerationServiceImpl weekly = new RegenerationServiceImpl(oracle, store, billing, evaluator, clock);
        onboarded("u1", true);

        for (int i = 0; i < 3; i++) {
            assertTrue(weekly.attemptRegenerate("u1", ContentCategory.DEEP_DIVE_LOVE, false).isRegenerated());
            clock.advance(Duration.ofDays(1));
        }
        RegenerationResult fourth = weekly.attemptRegenerate("u1", ContentCategory.DEEP_DIVE_LOVE, false);

        assertEquals(DeniedReason.RATE_LIMITED, fourth.getDeniedReason());
        assertEquals(30, fourth.getPrice());
    }

    @Test
    void transitForecastOnlyThroughRegeneration() {
        Profile profile = onboarded("u1", true);

        RegenerationResult result = service.attemptRegenerate("u1", ContentCategory.TRANSIT_FORECAST, false);

        assertTrue(result.isRegenerated());
        assertEquals(result.getContent(), profile.getBundle().getTransitForecast());
        assertEquals(1, oracle.calls(OracleKind.TRANSIT_FORECAST));
        assertNotNull(oracle.requests().get(0).getReferenceDate());
    }

    @Test
    void scheduledCategoriesCannotBeRegenerated() {
        onboarded("u1", true);

        for (ContentCategory category : new ContentCategory[]{ContentCategory.DAILY_HOROSCOPE,
                ContentCategory.WEEKLY_HOROSCOPE, ContentCategory.MONTHLY_HOROSCOPE}) {
            InvalidInputException e = assertThrows(InvalidInputException.class,
                    () -> service.attemptRegenerate("u1", category, true));
            assertEquals("category", e.getField());
        }
        assertEquals(0, oracle.calls());
    }

    @Test
    void threeKeysAreRegeneratedInPlace() {
        Profile profile = onboarded("u1", true);
        profile.getBundle().setThreeKeys("original keys");

        RegenerationResult result = service.attemptRegenerate("u1", ContentCategory.THREE_KEYS, false);

        assertTrue(result.isRegenerated());
        assertThat(profile.getBundle().getThreeKeys()).startsWith("THREE_KEYS#");
        assertEquals("original love", profile.getBundle().deepDiveOf(DeepDiveTopic.LOVE));
        assertTrue(profile.getTimestamps().contains(ContentCategory.THREE_KEYS));
    }

    @Test
    void unknownUserIsNotFound() {
        assertThrows(ProfileNotFoundException.class,
                () -> service.attemptRegenerate("ghost", ContentCategory.NATAL_INTRO, false));
    }

    @Test
    void persistenceFailureStillReturnsNewContent() {
        onboarded("u1", true);
        store.failPuts(true);

        RegenerationResult result = service.attemptRegenerate("u1", ContentCategory.NATAL_INTRO, false);

        assertTrue(result.isRegenerated());
    }
}
