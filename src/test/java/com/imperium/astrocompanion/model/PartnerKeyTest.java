package com.imperium.astrocompanion.model;

import com.imperium.astrocompanion.model.domain.PartnerFacts;
import com.imperium.astrocompanion.model.domain.PartnerKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PartnerKeyTest {

    @Test
    void caseAndWhitespaceInsensitive() {
        assertEquals(PartnerKey.of(" Jane ", "1992-08-20"), PartnerKey.of("jane", "1992-08-20"));
        assertEquals(PartnerKey.of("JANE", "1992-08-20").hashCode(), PartnerKey.of("jane", "1992-08-20").hashCode());
    }

    @Test
    void valueIsNameUnderscoreDate() {
        assertEquals("jane_1992-08-20", PartnerKey.of(" Jane ", "1992-08-20").value());
    }

    @Test
    void differentDatesAreDifferentPartners() {
        assertNotEquals(PartnerKey.of("Jane", "1992-08-20"), PartnerKey.of("Jane", "1992-08-21"));
    }

    @Test
    void partnerFactsDeriveTheSameKey() {
        PartnerFacts partner = PartnerFacts.builder().name("Jane ").birthDate("1992-08-20").build();
        assertEquals(PartnerKey.of("jane", "1992-08-20"), partner.key());
    }
}
