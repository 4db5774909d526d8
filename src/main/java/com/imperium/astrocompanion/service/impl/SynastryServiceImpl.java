package com.imperium.astrocompanion.service.impl;

import com.imperium.astrocompanion.model.domain.MemoMode;
import com.imperium.astrocompanion.model.domain.PartnerFacts;
import com.imperium.astrocompanion.model.domain.PartnerKey;
import com.imperium.astrocompanion.model.domain.PartnerMemo;
import com.imperium.astrocompanion.model.domain.PartnerMemos;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.oracle.ContentOracle;
import com.imperium.astrocompanion.oracle.OracleKind;
import com.imperium.astrocompanion.oracle.OracleRequest;
import com.imperium.astrocompanion.service.BirthFactsValidator;
import com.imperium.astrocompanion.service.ContentNotReadyException;
import com.imperium.astrocompanion.service.ProfileNotFoundException;
import com.imperium.astrocompanion.service.SynastryService;
import com.imperium.astrocompanion.store.ProfilePersistenceException;
import com.imperium.astrocompanion.store.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class SynastryServiceImpl implements SynastryService {

    private static final Logger log = LoggerFactory.getLogger(SynastryServiceImpl.class);

    private final ContentOracle contentOracle;
    private final ProfileStore profileStore;
    private final BirthFactsValidator validator;
    private final Clock clock;

    public SynastryServiceImpl(ContentOracle contentOracle,
                               ProfileStore profileStore,
                               BirthFactsValidator validator,
                               Clock clock) {
        this.contentOracle = contentOracle;
        this.profileStore = profileStore;
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public PartnerMemo getOrGenerate(String userId, PartnerFacts partner, MemoMode mode) {
        validator.validatePartner(partner);
        Profile profile = profileStore.get(userId).orElseThrow(() -> new ProfileNotFoundException(userId));
        return getOrGenerate(profile, partner, mode);
    }

    @Override
    public PartnerMemo getOrGenerate(Profile profile, PartnerFacts partner, MemoMode mode) {
        validator.validatePartner(partner);
        if (!profile.hasBundle()) {
            throw new ContentNotReadyException(profile.getId());
        }
        MemoMode effectiveMode = mode != null ? mode : MemoMode.BRIEF;
        PartnerKey key = partner.key();

        PartnerMemos existing = profile.getBundle().memosOf(key);
        if (existing != null && existing.get(effectiveMode) != null) {
            log.debug("Synastry {} hit for user {} partner {}", effectiveMode, profile.getId(), key);
            return existing.get(effectiveMode);
        }

        // 失败直接抛出，由调用方提示重试
        String text = contentOracle.generate(OracleRequest.builder()
                .kind(effectiveMode == MemoMode.FULL ? OracleKind.SYNASTRY_FULL : OracleKind.SYNASTRY_BRIEF)
                .user(profile.birthFacts())
                .chart(profile.getChart())
                .partner(partner)
                .language(profile.getLanguage())
                .build());

        PartnerMemo memo = new PartnerMemo(text, clock.millis());
        profile.getBundle()
                .partnerMemosFor(key, partner.getName().trim(), partner.getBirthDate().trim())
                .put(effectiveMode, memo);
        try {
            profileStore.put(profile);
        } catch (ProfilePersistenceException e) {
            log.warn("Failed to persist synastry memo for user {} partner {}: {}", profile.getId(), key,
                    e.getMessage());
        }
        log.info("Generated synastry {} for user {} partner {}", effectiveMode, profile.getId(), key);
        return memo;
    }
}
