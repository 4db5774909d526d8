package com.imperium.astrocompanion.controller;

import com.imperium.astrocompanion.policy.RateLimitPolicy;
import com.imperium.astrocompanion.service.DashboardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v0/users/{userId}/horoscope")
@Tag(name = "Horoscope", description = "每日运势")
public class HoroscopeController {

    private final DashboardService dashboardService;
    private final RateLimitPolicy rateLimitPolicy;

    public HoroscopeController(DashboardService dashboardService, RateLimitPolicy rateLimitPolicy) {
        this.dashboardService = dashboardService;
        this.rateLimitPolicy = rateLimitPolicy;
    }

    @GetMapping("/daily")
    @Operation(summary = "今日运势", description = "同一星座同一参考日共享一份运势；每天首次访问时惰性刷新")
    public ResponseEntity<?> daily(
            @Parameter(description = "用户 ID", required = true) @PathVariable String userId,
            HttpServletRequest request) {
        if (!rateLimitPolicy.allow(userId)) {
            return ApiErrors.rateLimited(request);
        }
        return ResponseEntity.ok(dashboardService.dailyForecast(userId));
    }
}
