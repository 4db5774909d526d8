package com.imperium.astrocompanion.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * "换个说法"请求：POST /users/{userId}/regenerations。
 */
@Data
public class RegenerationRequest {

    /** 类别 key，如 natal_intro、deep_dive_love、transit_forecast */
    @NotBlank(message = "category is required")
    private String category;

    /** 免费额度用完时是否同意付费 */
    private boolean acceptPaid;
}
