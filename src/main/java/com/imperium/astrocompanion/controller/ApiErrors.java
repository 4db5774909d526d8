package com.imperium.astrocompanion.controller;

import com.imperium.astrocompanion.config.RequestIdSupport;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * 统一错误结构：{"error": {"code", "message", "requestId", "details"?}}。
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static ResponseEntity<Map<String, Object>> error(
            HttpStatus status, String code, String message, String detailsKey, Object detailsValue,
            HttpServletRequest request) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", RequestIdSupport.resolve(request));
        if (detailsKey != null && detailsValue != null) {
            err.put("details", Map.of(detailsKey, detailsValue));
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }

    static ResponseEntity<Map<String, Object>> rateLimited(HttpServletRequest request) {
        return error(HttpStatus.TOO_MANY_REQUESTS, "rate_limited",
                "Too many requests, please try again later", null, null, request);
    }
}
