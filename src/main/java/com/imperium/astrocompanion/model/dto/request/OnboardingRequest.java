package com.imperium.astrocompanion.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 首次设置请求：POST /users/{userId}/onboarding。日期范围等业务规则由服务层再次校验。
 */
@Data
public class OnboardingRequest {

    @NotBlank(message = "name is required")
    @Size(min = 2, max = 100, message = "name length must be 2~100")
    private String name;

    /** YYYY-MM-DD */
    @NotBlank(message = "birthDate is required")
    @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "birthDate must be YYYY-MM-DD")
    private String birthDate;

    /** HH:MM */
    @NotBlank(message = "birthTime is required")
    @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$", message = "birthTime must be HH:MM")
    private String birthTime;

    @NotBlank(message = "birthPlace is required")
    @Size(min = 2, max = 200, message = "birthPlace length must be 2~200")
    private String birthPlace;

    /** ru | en（可选，默认 en） */
    @Pattern(regexp = "^(ru|en)?$", message = "language must be one of: ru, en")
    private String language;
}
