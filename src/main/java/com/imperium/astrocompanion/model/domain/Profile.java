package com.imperium.astrocompanion.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 用户档案：出生信息 + 星盘 + 内容包 + 两本账（生成时间、重新生成用量）。
 * bundle 为 null 表示尚未完成首次生成。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Profile {

    private String id;

    private String name;

    private LocalDate birthDate;

    private String birthTime;

    private String birthPlace;

    @Builder.Default
    private Language language = Language.EN;

    private boolean premium;

    private ZodiacSign sunSign;

    private ChartFacts chart;

    private ContentBundle bundle;

    @Builder.Default
    private TimestampLedger timestamps = new TimestampLedger();

    @Builder.Default
    private RegenerationLedger regenerations = new RegenerationLedger();

    private int starsBalance;

    public BirthFacts birthFacts() {
        return BirthFacts.builder()
                .name(name)
                .birthDate(birthDate)
                .birthTime(birthTime)
                .birthPlace(birthPlace)
                .build();
    }

    public boolean hasBundle() {
        return bundle != null;
    }
}
