package com.imperium.astrocompanion.oracle;

/**
 * Content Oracle 的生成类型，每种对应一套提示词。
 */
public enum OracleKind {
    NATAL_INTRO,
    THREE_KEYS,
    DAILY_HOROSCOPE,
    WEEKLY_HOROSCOPE,
    MONTHLY_HOROSCOPE,
    DEEP_DIVE,
    SYNASTRY_BRIEF,
    SYNASTRY_FULL,
    TRANSIT_FORECAST
}
