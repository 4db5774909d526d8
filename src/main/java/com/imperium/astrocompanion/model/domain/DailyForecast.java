package com.imperium.astrocompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 每日运势。date 为生成时的参考日（reference day）。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DailyForecast {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;

    private String mood;

    private String color;

    private Integer number;

    private String content;

    private String moonImpact;

    private String transitFocus;

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }
}
