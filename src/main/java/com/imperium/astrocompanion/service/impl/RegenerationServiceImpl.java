package com.imperium.astrocompanion.service.impl;

import com.imperium.astrocompanion.billing.BillingGateway;
import com.imperium.astrocompanion.billing.ChargeResult;
import com.imperium.astrocompanion.model.domain.ContentCategory;
import com.imperium.astrocompanion.model.domain.DeniedReason;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.model.domain.RegenerationResult;
import com.imperium.astrocompanion.oracle.ContentOracle;
import com.imperium.astrocompanion.oracle.ContentOracleException;
import com.imperium.astrocompanion.oracle.OracleRequest;
import com.imperium.astrocompanion.policy.CategoryPolicy;
import com.imperium.astrocompanion.policy.FreshnessPolicyEvaluator;
import com.imperium.astrocompanion.policy.RegenerationAllowance;
import com.imperium.astrocompanion.service.ContentNotReadyException;
import com.imperium.astrocompanion.service.InvalidInputException;
import com.imperium.astrocompanion.service.ProfileNotFoundException;
import com.imperium.astrocompanion.service.RegenerationService;
import com.imperium.astrocompanion.store.ProfilePersistenceException;
import com.imperium.astrocompanion.store.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
public class RegenerationServiceImpl implements RegenerationService {

    private static final Logger log = LoggerFactory.getLogger(RegenerationServiceImpl.class);

    private final ContentOracle contentOracle;
    private final ProfileStore profileStore;
    private final BillingGateway billingGateway;
    private final FreshnessPolicyEvaluator evaluator;
    private final Clock clock;

    public RegenerationServiceImpl(ContentOracle contentOracle,
                                   ProfileStore profileStore,
                                   BillingGateway billingGateway,
                                   FreshnessPolicyEvaluator evaluator,
                                   Clock clock) {
        this.contentOracle = contentOracle;
        this.profileStore = profileStore;
        this.billingGateway = billingGateway;
        this.evaluator = evaluator;
        this.clock = clock;
    }

    @Override
    public RegenerationResult attemptRegenerate(String userId, ContentCategory category, boolean acceptPaid) {
        if (category == null) {
            throw new InvalidInputException("category", "Category is required");
        }
        CategoryPolicy policy = evaluator.policyTable().policyOf(category);
        if (!policy.regenerable()) {
            throw new InvalidInputException("category",
                    category.key() + " refreshes on a schedule and cannot be regenerated");
        }
        Profile profile = profileStore.get(userId).orElseThrow(() -> new ProfileNotFoundException(userId));
        RegenerationAllowance allowance = policy.allowance();

        if (!profile.isPremium()) {
            log.info("Regeneration of {} denied for user {}: not premium", category.key(), userId);
            return RegenerationResult.denied(category, DeniedReason.NOT_PREMIUM, allowance.price());
        }
        if (!profile.hasBundle()) {
            throw new ContentNotReadyException(userId);
        }

        Instant now = clock.instant();
        long nowMs = now.toEpochMilli();
        boolean free = profile.getRegenerations().freeUsedInWindow(category, nowMs, allowance.window())
                < allowance.freeQuota();
        int charged = 0;
        if (!free) {
            if (!acceptPaid) {
                log.info("Regeneration of {} rate limited for user {}", category.key(), userId);
                return RegenerationResult.denied(category, DeniedReason.RATE_LIMITED, allowance.price());
            }
            if (billingGateway.charge(userId, allowance.price()) == ChargeResult.DENIED) {
                return RegenerationResult.denied(category, DeniedReason.PAYMENT_DECLINED, allowance.price());
            }
            charged = allowance.price();
        }

        String text;
        try {
            text = contentOracle.generate(request(profile, category, now));
        } catch (ContentOracleException e) {
            if (charged > 0) {
                refund(userId, charged, e);
            }
            throw e;
        }

        profile.getBundle().overwrite(category, text);
        if (free) {
            profile.getRegenerations().recordFree(category, nowMs, allowance.window());
        } else {
            profile.getRegenerations().recordPaid(category, nowMs);
        }
        profile.getTimestamps().record(category, nowMs);
        try {
            profileStore.put(profile);
        } catch (ProfilePersistenceException e) {
            log.warn("Failed to persist regenerated {} for user {}: {}", category.key(), userId, e.getMessage());
        }
        log.info("Regenerated {} for user {} ({})", category.key(), userId, free ? "free" : "paid " + charged);
        return RegenerationResult.regenerated(category, text, charged);
    }

    private void refund(String userId, int amount, ContentOracleException cause) {
        try {
            billingGateway.refund(userId, amount);
        } catch (RuntimeException refundFailure) {
            log.error("Refund of {} stars to user {} failed after oracle error", amount, userId, refundFailure);
            cause.addSuppressed(refundFailure);
        }
    }

    private OracleRequest request(Profile profile, ContentCategory category, Instant now) {
        return OracleRequest.forCategory(category, profile.birthFacts(), profile.getChart(), profile.getLanguage(),
                evaluator.referenceDays().referenceDay(now));
    }
}
