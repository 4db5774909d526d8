package com.imperium.astrocompanion.controller;

import com.imperium.astrocompanion.model.domain.Language;
import com.imperium.astrocompanion.model.domain.Profile;
import com.imperium.astrocompanion.model.dto.request.OnboardingRequest;
import com.imperium.astrocompanion.model.dto.response.ProfileResponse;
import com.imperium.astrocompanion.policy.RateLimitPolicy;
import com.imperium.astrocompanion.service.DashboardService;
import com.imperium.astrocompanion.service.OnboardingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 用户档案：首次设置与读取。
 */
@RestController
@RequestMapping("/api/v0/users/{userId}")
@Tag(name = "Profile", description = "首次设置与档案读取")
public class ProfileController {

    private final OnboardingService onboardingService;
    private final DashboardService dashboardService;
    private final RateLimitPolicy rateLimitPolicy;

    public ProfileController(OnboardingService onboardingService,
                             DashboardService dashboardService,
                             RateLimitPolicy rateLimitPolicy) {
        this.onboardingService = onboardingService;
        this.dashboardService = dashboardService;
        this.rateLimitPolicy = rateLimitPolicy;
    }

    /**
     * 计算星盘并同步完成首次内容生成，耗时较长（多次 Oracle 调用）。
     */
    @PostMapping("/onboarding")
    @Operation(summary = "首次设置", description = "校验出生信息、计算星盘、创建档案并生成全部初始内容")
    public ResponseEntity<?> onboard(
            @Parameter(description = "用户 ID", required = true) @PathVariable String userId,
            @Valid @RequestBody OnboardingRequest body,
            HttpServletRequest request) {
        if (!rateLimitPolicy.allow(userId)) {
            return ApiErrors.rateLimited(request);
        }
        Profile profile = onboardingService.onboard(userId, body.getName(), body.getBirthDate(),
                body.getBirthTime(), body.getBirthPlace(), Language.fromTag(body.getLanguage()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ProfileResponse.from(profile));
    }

    @GetMapping("/profile")
    @Operation(summary = "读取档案", description = "返回出生信息、星盘、内容包与各类别生成时间；到期的每周、每月运势会先刷新")
    public ResponseEntity<?> profile(
            @Parameter(description = "用户 ID", required = true) @PathVariable String userId,
            HttpServletRequest request) {
        if (!rateLimitPolicy.allow(userId)) {
            return ApiErrors.rateLimited(request);
        }
        return ResponseEntity.ok(ProfileResponse.from(dashboardService.profile(userId)));
    }
}
