package com.imperium.astrocompanion.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * 合盘请求：POST /users/{userId}/synastry。
 */
@Data
public class SynastryRequest {

    @NotBlank(message = "partnerName is required")
    private String partnerName;

    /** YYYY-MM-DD */
    @NotBlank(message = "partnerDate is required")
    private String partnerDate;

    /** HH:MM（可选） */
    private String partnerTime;

    private String partnerPlace;

    /** romantic | friendship | business 等（可选） */
    private String relationshipType;

    /** brief | full（可选，默认 brief） */
    @Pattern(regexp = "^(brief|full)?$", message = "mode must be one of: brief, full")
    private String mode;
}
