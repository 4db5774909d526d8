package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.BirthFacts;
import com.imperium.astrocompanion.model.domain.PartnerFacts;
import com.imperium.astrocompanion.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class BirthFactsValidatorTest {

    private final BirthFactsValidator validator = new BirthFactsValidator(MutableClock.at("2024-06-01T12:00:00Z"));

    @Test
    void acceptsAndTrimsValidFacts() {
        BirthFacts facts = validator.validateBirthFacts("  Anna  ", "1989-03-06", "14:30", " Moscow ");
        assertEquals("Anna", facts.getName());
        assertEquals(LocalDate.of(1989, 3, 6), facts.getBirthDate());
        assertEquals("14:30", facts.getBirthTime());
        assertEquals("Moscow", facts.getBirthPlace());
    }

    @Test
    void acceptsCyrillicHyphenAndApostrophe() {
        assertDoesNotThrow(() -> validator.validateBirthFacts("Анна-Мария", "1990-01-01", "00:00", "Казань"));
        assertDoesNotThrow(() -> validator.validateBirthFacts("O'Brien", "1990-01-01", "23:59", "Dublin"));
    }

    @Test
    void rejectsBadNames() {
        assertEquals("name", assertThrows(InvalidInputException.class,
                () -> validator.validateBirthFacts("A", "1990-01-01", "12:00", "Moscow")).getField());
        assertThrows(InvalidInputException.class,
                () -> validator.validateBirthFacts("Anna2", "1990-01-01", "12:00", "Moscow"));
        assertThrows(InvalidInputException.class,
                () -> validator.validateBirthFacts("   ", "1990-01-01", "12:00", "Moscow"));
    }

    @Test
    void rejectsDatesOutsideRangeOrFormat() {
        assertThrows(InvalidInputException.class,
                () -> validator.validateBirthFacts("Anna", "1899-12-31", "12:00", "Moscow"));
        assertThrows(InvalidInputException.class,
                () -> validator.validateBirthFacts("Anna", "2024-06-02", "12:00", "Moscow"));
        assertThrows(InvalidInputException.class,
                () -> validator.validateBirthFacts("Anna", "06.03.1989", "12:00", "Moscow"));
        assertThrows(InvalidInputException.class,
                () -> validator.validateBirthFacts("Anna", "2023-02-30", "12:00", "Moscow"));
        assertDoesNotThrow(() -> validator.validateBirthFacts("Anna", "2024-06-01", "12:00", "Moscow"));
    }

    @Test
    void rejectsBadTimeAndPlace() {
        assertEquals("birthTime", assertThrows(InvalidInputException.class,
                () -> validator.validateBirthFacts("Anna", "1990-01-01", "24:00", "Moscow")).getField());
        assertThrows(InvalidInputException.class,
                () -> validator.validateBirthFacts("Anna", "1990-01-01", null, "Moscow"));
        assertEquals("birthPlace", assertThrows(InvalidInputException.class,
                () -> validator.validateBirthFacts("Anna", "1990-01-01", "12:00", "M")).getField());
    }

    @Test
    void partnerTimeAndPlaceAreOptional() {
        assertDoesNotThrow(() -> validator.validatePartner(
                PartnerFacts.builder().name("Jane").birthDate("1992-08-20").build()));
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> validator.validatePartner(
                PartnerFacts.builder().name("Jane").birthDate("1992-08-20").birthTime("7pm").build()));
        assertEquals("partnerTime", ex.getField());
        assertThrows(InvalidInputException.class, () -> validator.validatePartner(null));
    }
}
