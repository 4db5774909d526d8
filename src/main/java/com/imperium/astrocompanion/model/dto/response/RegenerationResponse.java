package com.imperium.astrocompanion.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.imperium.astrocompanion.model.domain.RegenerationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 重新生成结果。status 为 regenerated 或 denied；denied 时 reason 为
 * not_premium | rate_limited | payment_declined，price 为标价。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegenerationResponse {

    private String status;

    private String category;

    private String content;

    private String reason;

    private Integer price;

    private Integer charged;

    public static RegenerationResponse from(RegenerationResult result) {
        if (result.isRegenerated()) {
            return RegenerationResponse.builder()
                    .status("regenerated")
                    .category(result.getCategory().key())
                    .content(result.getContent())
                    .charged(result.getCharged())
                    .build();
        }
        return RegenerationResponse.builder()
                .status("denied")
                .category(result.getCategory().key())
                .reason(result.getDeniedReason().code())
                .price(result.getPrice())
                .build();
    }
}
