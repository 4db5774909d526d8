package com.imperium.astrocompanion.model.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * 十二星座，按黄道顺序。element / rulingPlanet 为固定对应关系。
 */
public enum ZodiacSign {

    ARIES("Aries", "Fire", "Mars"),
    TAURUS("Taurus", "Earth", "Venus"),
    GEMINI("Gemini", "Air", "Mercury"),
    CANCER("Cancer", "Water", "Moon"),
    LEO("Leo", "Fire", "Sun"),
    VIRGO("Virgo", "Earth", "Mercury"),
    LIBRA("Libra", "Air", "Venus"),
    SCORPIO("Scorpio", "Water", "Pluto"),
    SAGITTARIUS("Sagittarius", "Fire", "Jupiter"),
    CAPRICORN("Capricorn", "Earth", "Saturn"),
    AQUARIUS("Aquarius", "Air", "Uranus"),
    PISCES("Pisces", "Water", "Neptune");

    private final String displayName;
    private final String element;
    private final String rulingPlanet;

    ZodiacSign(String displayName, String element, String rulingPlanet) {
        this.displayName = displayName;
        this.element = element;
        this.rulingPlanet = rulingPlanet;
    }

    public String displayName() {
        return displayName;
    }

    public String element() {
        return element;
    }

    public String rulingPlanet() {
        return rulingPlanet;
    }

    /**
     * 宽松解析星座名（忽略大小写与首尾空白），无法识别时返回 empty。
     */
    public static Optional<ZodiacSign> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ZodiacSign sign : values()) {
            if (sign.name().equals(normalized)) {
                return Optional.of(sign);
            }
        }
        return Optional.empty();
    }
}
