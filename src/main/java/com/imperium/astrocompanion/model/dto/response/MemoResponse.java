package com.imperium.astrocompanion.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoResponse {

    private String partnerKey;

    /** brief | full */
    private String mode;

    private String text;

    private long generatedAt;
}
