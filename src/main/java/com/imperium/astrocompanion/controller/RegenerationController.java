package com.imperium.astrocompanion.controller;

import com.imperium.astrocompanion.model.domain.ContentCategory;
import com.imperium.astrocompanion.model.domain.RegenerationResult;
import com.imperium.astrocompanion.model.dto.request.RegenerationRequest;
import com.imperium.astrocompanion.model.dto.response.RegenerationResponse;
import com.imperium.astrocompanion.policy.RateLimitPolicy;
import com.imperium.astrocompanion.service.RegenerationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * "换个说法"。被拒绝（非会员 / 额度用完 / 扣款失败）返回 200 + status=denied，不是错误。
 */
@RestController
@RequestMapping("/api/v0/users/{userId}/regenerations")
@Tag(name = "Regeneration", description = "付费或限次重新生成单个类别")
public class RegenerationController {

    private final RegenerationService regenerationService;
    private final RateLimitPolicy rateLimitPolicy;

    public RegenerationController(RegenerationService regenerationService, RateLimitPolicy rateLimitPolicy) {
        this.regenerationService = regenerationService;
        this.rateLimitPolicy = rateLimitPolicy;
    }

    @PostMapping
    @Operation(summary = "重新生成", description = "会员每个窗口有免费次数，之后需 acceptPaid=true 按标价付费")
    public ResponseEntity<?> regenerate(
            @Parameter(description = "用户 ID", required = true) @PathVariable String userId,
            @Valid @RequestBody RegenerationRequest body,
            HttpServletRequest request) {
        if (!rateLimitPolicy.allow(userId)) {
            return ApiErrors.rateLimited(request);
        }
        ContentCategory category;
        try {
            category = ContentCategory.fromKey(body.getCategory().trim());
        } catch (IllegalArgumentException e) {
            return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument", e.getMessage(),
                    "field", "category", request);
        }
        RegenerationResult result = regenerationService.attemptRegenerate(userId, category, body.isAcceptPaid());
        return ResponseEntity.ok(RegenerationResponse.from(result));
    }
}
