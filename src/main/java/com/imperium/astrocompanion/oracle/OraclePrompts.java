package com.imperium.astrocompanion.oracle;

import com.imperium.astrocompanion.model.domain.BirthFacts;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.PartnerFacts;
import com.imperium.astrocompanion.model.domain.PlanetPosition;

import java.time.format.TextStyle;
import java.util.Locale;

/**
 * 各类生成请求的提示词模板。
 */
public final class OraclePrompts {

    public static final String SYSTEM_PROMPT =
            "You are Astra, a warm and insightful astrologer. You write personal, concrete texts based on the " +
            "natal chart facts you are given. Never invent placements that are not listed. Avoid medical, legal " +
            "or financial advice.";

    private OraclePrompts() {
    }

    public static String userPrompt(OracleRequest request) {
        String body = switch (request.getKind()) {
            case NATAL_INTRO -> "Write an introduction to this person's natal chart: a general portrait of the " +
                    "personality in 3-4 paragraphs.\n" + describe(request.getUser(), request.getChart());
            case DAILY_HOROSCOPE -> "Write the horoscope for " + request.getReferenceDate() + ".\n" +
                    describe(request.getUser(), request.getChart()) +
                    "\nReply with a single JSON object only, no markdown. Structure: {\"mood\":\"one word\", " +
                    "\"color\":\"color of the day\", \"number\":lucky number, \"content\":\"2-3 paragraphs\", " +
                    "\"moonImpact\":\"one sentence\", \"transitFocus\":\"one sentence\"}.";
            case THREE_KEYS -> "Write three short keys to this natal chart, each with a title and one paragraph: " +
                    "1) the person's core energy, 2) their love style, 3) their career path.\n" +
                    describe(request.getUser(), request.getChart());
            case WEEKLY_HOROSCOPE -> "Write the horoscope for the week starting " + request.getReferenceDate() +
                    ": the theme of the week, one piece of advice, then a short note on love and on career.\n" +
                    describe(request.getUser(), request.getChart());
            case MONTHLY_HOROSCOPE -> "Write the horoscope for the month of " + monthOf(request) +
                    ": the theme of the month, the main focus, then 2-3 paragraphs of forecast.\n" +
                    describe(request.getUser(), request.getChart());
            case DEEP_DIVE -> "Write a deep analysis on the topic \"" + request.getTopic().title(request.getLanguage()) +
                    "\" for this natal chart, 4-6 paragraphs.\n" + describe(request.getUser(), request.getChart());
            case SYNASTRY_BRIEF -> "Write a short compatibility note (one paragraph) between these two people.\n" +
                    describe(request.getUser(), request.getChart()) + "\n" + describePartner(request.getPartner());
            case SYNASTRY_FULL -> "Write a full compatibility analysis between these two people: strengths, " +
                    "tensions, communication, long-term outlook.\n" +
                    describe(request.getUser(), request.getChart()) + "\n" + describePartner(request.getPartner());
            case TRANSIT_FORECAST -> "Describe how the current planetary transits around " + request.getReferenceDate() +
                    " affect this natal chart over the next weeks.\n" + describe(request.getUser(), request.getChart());
        };
        return withLanguage(body, request.getLanguage());
    }

    private static String monthOf(OracleRequest request) {
        if (request.getReferenceDate() == null) {
            return "the coming month";
        }
        Locale locale = request.getLanguage() != null && request.getLanguage().isRussian()
                ? Locale.forLanguageTag("ru")
                : Locale.ENGLISH;
        return request.getReferenceDate().getMonth().getDisplayName(TextStyle.FULL_STANDALONE, locale)
                + " " + request.getReferenceDate().getYear();
    }

    static String withLanguage(String prompt, Language language) {
        if (language != null && language.isRussian()) {
            return prompt + "\n\nОтвечай только на русском языке.";
        }
        return prompt + "\n\nAnswer in English only.";
    }

    private static String describe(BirthFacts user, ChartFacts chart) {
        StringBuilder sb = new StringBuilder();
        if (user != null) {
            sb.append("Name: ").append(user.getName()).append('\n');
            sb.append("Born: ").append(user.getBirthDate());
            if (user.getBirthTime() != null) {
                sb.append(' ').append(user.getBirthTime());
            }
            if (user.getBirthPlace() != null) {
                sb.append(", ").append(user.getBirthPlace());
            }
            sb.append('\n');
        }
        if (chart != null) {
            appendPlacement(sb, "Sun", chart.getSun());
            appendPlacement(sb, "Moon", chart.getMoon());
            appendPlacement(sb, "Rising", chart.getRising());
            appendPlacement(sb, "Mercury", chart.getMercury());
            appendPlacement(sb, "Venus", chart.getVenus());
            appendPlacement(sb, "Mars", chart.getMars());
            if (chart.getDominantElement() != null) {
                sb.append("Dominant element: ").append(chart.getDominantElement()).append('\n');
            }
            if (chart.getRulingPlanet() != null) {
                sb.append("Ruling planet: ").append(chart.getRulingPlanet()).append('\n');
            }
        }
        return sb.toString();
    }

    private static void appendPlacement(StringBuilder sb, String planet, PlanetPosition position) {
        if (position != null && position.getSign() != null) {
            sb.append(planet).append(" in ").append(position.getSign()).append('\n');
        }
    }

    private static String describePartner(PartnerFacts partner) {
        if (partner == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder("Partner: ").append(partner.getName())
                .append(", born ").append(partner.getBirthDate());
        if (partner.getBirthTime() != null) {
            sb.append(' ').append(partner.getBirthTime());
        }
        if (partner.getBirthPlace() != null) {
            sb.append(", ").append(partner.getBirthPlace());
        }
        if (partner.getRelationshipType() != null) {
            sb.append("\nRelationship: ").append(partner.getRelationshipType());
        }
        return sb.toString();
    }
}
