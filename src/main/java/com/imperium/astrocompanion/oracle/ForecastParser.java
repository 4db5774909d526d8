package com.imperium.astrocompanion.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.astrocompanion.model.domain.DailyForecast;

import java.time.LocalDate;

/**
 * 把 Oracle 返回的每日运势 JSON 转成 {@link DailyForecast}。
 * 返回值不是合法 JSON 时，整段文本作为 content。
 */
public class ForecastParser {

    private final ObjectMapper objectMapper;

    public ForecastParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DailyForecast parse(String raw, LocalDate referenceDate) {
        String json = stripFence(raw);
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root != null && root.isObject() && root.hasNonNull("content")) {
                return DailyForecast.builder()
                        .date(referenceDate)
                        .mood(text(root, "mood"))
                        .color(text(root, "color"))
                        .number(root.hasNonNull("number") && root.get("number").canConvertToInt()
                                ? root.get("number").asInt() : null)
                        .content(root.get("content").asText())
                        .moonImpact(text(root, "moonImpact"))
                        .transitFocus(text(root, "transitFocus"))
                        .build();
            }
        } catch (Exception ignored) {
            // 非 JSON，按纯文本处理
        }
        return DailyForecast.builder()
                .date(referenceDate)
                .content(raw.trim())
                .build();
    }

    private static String stripFence(String content) {
        String json = content.trim();
        if (json.startsWith("```")) {
            int start = json.indexOf('{');
            int end = json.lastIndexOf('}') + 1;
            if (start >= 0 && end > start) {
                json = json.substring(start, end);
            }
        }
        return json;
    }

    private static String text(JsonNode root, String field) {
        return root.hasNonNull(field) ? root.get(field).asText() : null;
    }
}
