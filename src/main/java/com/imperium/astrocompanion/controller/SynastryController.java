package com.imperium.astrocompanion.controller;

import com.imperium.astrocompanion.model.domain.MemoMode;
import com.imperium.astrocompanion.model.domain.PartnerFacts;
import com.imperium.astrocompanion.model.domain.PartnerMemo;
import com.imperium.astrocompanion.model.dto.request.SynastryRequest;
import com.imperium.astrocompanion.model.dto.response.MemoResponse;
import com.imperium.astrocompanion.policy.RateLimitPolicy;
import com.imperium.astrocompanion.service.SynastryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequestMapping("/api/v0/users/{userId}/synastry")
@Tag(name = "Synastry", description = "合盘解读（brief / full 分别缓存）")
public class SynastryController {

    private final SynastryService synastryService;
    private final RateLimitPolicy rateLimitPolicy;

    public SynastryController(SynastryService synastryService, RateLimitPolicy rateLimitPolicy) {
        this.synastryService = synastryService;
        this.rateLimitPolicy = rateLimitPolicy;
    }

    @PostMapping
    @Operation(summary = "合盘解读", description = "同一对象同一模式只生成一次，之后直接返回缓存")
    public ResponseEntity<?> memo(
            @Parameter(description = "用户 ID", required = true) @PathVariable String userId,
            @Valid @RequestBody SynastryRequest body,
            HttpServletRequest request) {
        if (!rateLimitPolicy.allow(userId)) {
            return ApiErrors.rateLimited(request);
        }
        MemoMode mode = "full".equalsIgnoreCase(body.getMode()) ? MemoMode.FULL : MemoMode.BRIEF;
        PartnerFacts partner = PartnerFacts.builder()
                .name(body.getPartnerName())
                .birthDate(body.getPartnerDate())
                .birthTime(body.getPartnerTime())
                .birthPlace(body.getPartnerPlace())
                .relationshipType(body.getRelationshipType())
                .build();
        PartnerMemo memo = synastryService.getOrGenerate(userId, partner, mode);
        return ResponseEntity.ok(MemoResponse.builder()
                .partnerKey(partner.key().value())
                .mode(mode.name().toLowerCase(Locale.ROOT))
                .text(memo.getText())
                .generatedAt(memo.getGeneratedAt())
                .build());
    }
}
