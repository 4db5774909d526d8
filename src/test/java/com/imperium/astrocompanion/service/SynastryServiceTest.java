package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.ContentBundle;
import com.imperium.astrocompanion.model.domain.MemoMode;
import com.imperium.astrocompanion.model.domain.PartnerFacts;
import com.imperium.astrocompanion.model.domain.PartnerKey;
import com.imperium.astrocompanion.model.domain.PartnerMemo;
import com.imperium.astrocompanion.model.domain.PartnerMemos;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.oracle.ContentOracleException;
import com.imperium.astrocompanion.oracle.OracleKind;
import com.imperium.astrocompanion.service.impl.SynastryServiceImpl;
import com.imperium.astrocompanion.support.CountingContentOracle;
import com.imperium.astrocompanion.support.Fixtures;
import com.imperium.astrocompanion.support.InMemoryProfileStore;
import com.imperium.astrocompanion.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SynastryServiceTest {

    private CountingContentOracle oracle;
    private InMemoryProfileStore store;
    private SynastryServiceImpl service;
    private Profile profile;

    @BeforeEach
    void setUp() {
        oracle = new CountingContentOracle();
        store = new InMemoryProfileStore();
        MutableClock clock = MutableClock.at("2024-06-01T09:00:00Z");
        service = new SynastryServiceImpl(oracle, store, new BirthFactsValidator(clock), clock);
        profile = Fixtures.profile("u1", "Anna", "1989-03-06");
        profile.setBundle(new ContentBundle());
        store.with(profile);
    }

    private static PartnerFacts jane(String name) {
        return PartnerFacts.builder().name(name).birthDate("1992-08-20").relationshipType("romantic").build();
    }

    @Test
    void briefAndFullAreIndependentSlots() {
        PartnerMemo brief = service.getOrGenerate(profile, jane("Jane"), MemoMode.BRIEF);
        PartnerMemo full = service.getOrGenerate(profile, jane("Jane"), MemoMode.FULL);

        assertEquals(2, oracle.calls());
        assertEquals(1, oracle.calls(OracleKind.SYNASTRY_BRIEF));
        assertEquals(1, oracle.calls(OracleKind.SYNASTRY_FULL));
        assertNotEquals(brief.getText(), full.getText());

        assertSame(brief, service.getOrGenerate(profile, jane("Jane"), MemoMode.BRIEF));
        assertSame(full, service.getOrGenerate(profile, jane("Jane"), MemoMode.FULL));
        assertEquals(2, oracle.calls());
    }

    @Test
    void partnerKeyIgnoresCaseAndWhitespace() {
        service.getOrGenerate(profile, jane(" Jane "), MemoMode.BRIEF);
        service.getOrGenerate(profile, jane("JANE"), MemoMode.BRIEF);

        assertEquals(1, oracle.calls());
        PartnerMemos memos = profile.getBundle().memosOf(PartnerKey.of("jane", "1992-08-20"));
        assertNotNull(memos.getBrief());
        assertNull(memos.getFull());
        assertEquals("Jane", memos.getPartnerName());
    }

    @Test
    void memoIsPersistedWithGenerationTime() {
        PartnerMemo memo = service.getOrGenerate("u1", jane("Jane"), MemoMode.BRIEF);

        assertEquals(1, store.putCount());
        assertEquals(Instant.parse("2024-06-01T09:00:00Z").toEpochMilli(), memo.getGeneratedAt());
    }

    @Test
    void invalidPartnerRejectedBeforeAnyCall() {
        PartnerFacts bad = PartnerFacts.builder().name("J").birthDate("1992-08-20").build();

        assertThrows(InvalidInputException.class, () -> service.getOrGenerate(profile, bad, MemoMode.BRIEF));
        assertThrows(InvalidInputException.class, () -> service.getOrGenerate("u1",
                PartnerFacts.builder().name("Jane").birthDate("20.08.1992").build(), MemoMode.FULL));
        assertEquals(0, oracle.calls());
        assertEquals(0, store.putCount());
    }

    @Test
    void oracleFailureIsSurfacedAndNothingCached() {
        oracle.failAll();

        assertThrows(ContentOracleException.class, () -> service.getOrGenerate(profile, jane("Jane"), MemoMode.FULL));
        assertNull(profile.getBundle().memosOf(PartnerKey.of("Jane", "1992-08-20")));

        oracle.recover();
        assertNotNull(service.getOrGenerate(profile, jane("Jane"), MemoMode.FULL));
    }

    @Test
    void persistenceFailureIsAbsorbed() {
        store.failPuts(true);

        PartnerMemo memo = assertDoesNotThrow(() -> service.getOrGenerate(profile, jane("Jane"), MemoMode.BRIEF));

        assertNotNull(memo.getText());
    }

    @Test
    void requiresInitialGeneration() {
        Profile fresh = Fixtures.profile("u2", "Boris", "1980-01-01");

        assertThrows(ContentNotReadyException.class, () -> service.getOrGenerate(fresh, jane("Jane"), MemoMode.BRIEF));
        assertThrows(ProfileNotFoundException.class, () -> service.getOrGenerate("nobody", jane("Jane"), MemoMode.BRIEF));
        assertEquals(0, oracle.calls());
    }
}
