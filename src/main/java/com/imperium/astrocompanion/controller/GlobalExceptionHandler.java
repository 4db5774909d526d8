package com.imperium.astrocompanion.controller;

import com.imperium.astrocompanion.chart.ChartEngineException;
import com.imperium.astrocompanion.oracle.ContentOracleException;
import com.imperium.astrocompanion.service.ContentNotReadyException;
import com.imperium.astrocompanion.service.InvalidInputException;
import com.imperium.astrocompanion.service.ProfileNotFoundException;
import com.imperium.astrocompanion.store.ProfilePersistenceException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * 全局异常映射：@Valid 失败与服务层异常统一返回 error 结构。
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex,
                                                                HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getDefaultMessage())
                .orElse("Validation failed");
        String field = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField())
                .orElse(null);
        return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument", message, "field", field, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex,
                                                                HttpServletRequest request) {
        return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument", "Malformed request body",
                null, null, request);
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidInput(InvalidInputException ex,
                                                                  HttpServletRequest request) {
        return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument", ex.getMessage(),
                "field", ex.getField(), request);
    }

    @ExceptionHandler(ProfileNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ProfileNotFoundException ex,
                                                              HttpServletRequest request) {
        return ApiErrors.error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(),
                "userId", ex.getUserId(), request);
    }

    @ExceptionHandler(ContentNotReadyException.class)
    public ResponseEntity<Map<String, Object>> handleNotReady(ContentNotReadyException ex,
                                                              HttpServletRequest request) {
        return ApiErrors.error(HttpStatus.CONFLICT, "onboarding_required", ex.getMessage(), null, null, request);
    }

    @ExceptionHandler(ContentOracleException.class)
    public ResponseEntity<Map<String, Object>> handleOracle(ContentOracleException ex, HttpServletRequest request) {
        log.warn("Oracle failure ({}): {}", ex.getKind(), ex.getMessage());
        return ApiErrors.error(HttpStatus.BAD_GATEWAY, "oracle_error",
                "Content generation failed, please try again", null, null, request);
    }

    @ExceptionHandler(ChartEngineException.class)
    public ResponseEntity<Map<String, Object>> handleChart(ChartEngineException ex, HttpServletRequest request) {
        log.warn("Chart engine failure: {}", ex.getMessage());
        return ApiErrors.error(HttpStatus.BAD_GATEWAY, "chart_engine_error",
                "Chart calculation failed, please try again", null, null, request);
    }

    @ExceptionHandler(ProfilePersistenceException.class)
    public ResponseEntity<Map<String, Object>> handlePersistence(ProfilePersistenceException ex,
                                                                 HttpServletRequest request) {
        log.error("Profile persistence failure", ex);
        return ApiErrors.error(HttpStatus.SERVICE_UNAVAILABLE, "persistence_error",
                "Could not save your profile, please try again", null, null, request);
    }
}
