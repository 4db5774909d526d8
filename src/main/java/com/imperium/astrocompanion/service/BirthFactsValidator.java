package com.imperium.astrocompanion.service;

import com.imperium.astrocompanion.model.domain.BirthFacts;
import com.imperium.astrocompanion.model.domain.PartnerFacts;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * 出生信息校验，用户本人与合盘对象共用同一套规则：
 * 姓名 2~100 个字母（拉丁或西里尔）、空格、连字符、撇号；日期 yyyy-MM-dd，1900-01-01 至今天；
 * 时间 HH:mm；地点 2~200 字符。
 */
@Component
public class BirthFactsValidator {

    static final LocalDate MIN_BIRTH_DATE = LocalDate.of(1900, 1, 1);

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Zа-яА-ЯёЁ\\s\\-']+$");
    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");
    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private final Clock clock;

    public BirthFactsValidator(Clock clock) {
        this.clock = clock;
    }

    /**
     * 校验用户本人的出生信息（时间、地点必填），返回规范化后的 {@link BirthFacts}。
     */
    public BirthFacts validateBirthFacts(String name, String birthDate, String birthTime, String birthPlace) {
        String cleanName = requireName("name", name);
        LocalDate date = requireDate("birthDate", birthDate);
        String time = requireTime("birthTime", birthTime, true);
        String place = requirePlace("birthPlace", birthPlace, true);
        return BirthFacts.builder()
                .name(cleanName)
                .birthDate(date)
                .birthTime(time)
                .birthPlace(place)
                .build();
    }

    /**
     * 校验合盘对象，时间与地点可选。
     */
    public void validatePartner(PartnerFacts partner) {
        if (partner == null) {
            throw new InvalidInputException("partner", "Partner data is required");
        }
        requireName("partnerName", partner.getName());
        requireDate("partnerDate", partner.getBirthDate());
        requireTime("partnerTime", partner.getBirthTime(), false);
        requirePlace("partnerPlace", partner.getBirthPlace(), false);
    }

    private String requireName(String field, String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException(field, "Name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() < 2 || trimmed.length() > 100) {
            throw new InvalidInputException(field, "Name must be 2-100 characters");
        }
        if (!NAME_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidInputException(field, "Name contains invalid characters");
        }
        return trimmed;
    }

    private LocalDate requireDate(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field, "Birth date is required");
        }
        String trimmed = value.trim();
        if (!DATE_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidInputException(field, "Invalid date format (expected YYYY-MM-DD)");
        }
        LocalDate date;
        try {
            date = LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new InvalidInputException(field, "Invalid date: " + trimmed);
        }
        if (date.isBefore(MIN_BIRTH_DATE) || date.isAfter(LocalDate.now(clock))) {
            throw new InvalidInputException(field, "Date must be between 1900-01-01 and today");
        }
        return date;
    }

    private String requireTime(String field, String value, boolean required) {
        if (value == null || value.isBlank()) {
            if (required) {
                throw new InvalidInputException(field, "Birth time is required");
            }
            return null;
        }
        String trimmed = value.trim();
        if (!TIME_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidInputException(field, "Invalid time format (expected HH:MM)");
        }
        return trimmed;
    }

    private String requirePlace(String field, String value, boolean required) {
        if (value == null || value.isBlank()) {
            if (required) {
                throw new InvalidInputException(field, "Birth place is required");
            }
            return null;
        }
        String trimmed = value.trim();
        if ((required && trimmed.length() < 2) || trimmed.length() > 200) {
            throw new InvalidInputException(field, "Place must be 2-200 characters");
        }
        return trimmed;
    }
}
