package com.imperium.astrocompanion.oracle;

import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ForecastParserTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 1);

    private final ForecastParser parser = Fixtures.forecastParser();

    @Test
    void parsesStructuredForecast() {
        DailyForecast forecast = parser.parse(
                "{\"mood\":\"Calm\",\"color\":\"Green\",\"number\":3,\"content\":\"A quiet day.\","
                        + "\"moonImpact\":\"Moon in Cancer\",\"transitFocus\":\"Venus\"}", DAY);
        assertEquals(DAY, forecast.getDate());
        assertEquals("Calm", forecast.getMood());
        assertEquals("Green", forecast.getColor());
        assertEquals(3, forecast.getNumber());
        assertEquals("A quiet day.", forecast.getContent());
        assertEquals("Moon in Cancer", forecast.getMoonImpact());
        assertEquals("Venus", forecast.getTransitFocus());
    }

    @Test
    void stripsMarkdownFence() {
        DailyForecast forecast = parser.parse("```json\n{\"content\":\"Fenced.\"}\n```", DAY);
        assertEquals("Fenced.", forecast.getContent());
    }

    @Test
    void plainTextBecomesContent() {
        DailyForecast forecast = parser.parse("  Just some prose.  ", DAY);
        assertEquals("Just some prose.", forecast.getContent());
        assertNull(forecast.getMood());
        assertEquals(DAY, forecast.getDate());
    }

    @Test
    void nonNumericNumberIsDropped() {
        DailyForecast forecast = parser.parse("{\"content\":\"x\",\"number\":\"seven\"}", DAY);
        assertNull(forecast.getNumber());
        assertTrue(forecast.hasContent());
    }
}
