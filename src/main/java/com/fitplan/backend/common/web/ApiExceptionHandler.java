package com.fitplan.backend.common.web;

import com.fitplan.backend.progress.chart.ChartRenderException;
import com.fitplan.backend.sheet.render.SheetRenderException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 統一錯誤格式 { code, message, requestId }：
 * - 400：參數 / 格式錯誤、IllegalArgument
 * - 404：找不到 workout / exercise
 * - 500：render 失敗、其他未預期錯誤
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // ===== 400 Bad Request =====

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", msg, req);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleMethodValidation(HandlerMethodValidationException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", ex.getMessage(), req);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), req);
    }

    /** message 當 code 用，例如 EXERCISE_NOT_IN_WORKOUT */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, codeOf(ex, "BAD_REQUEST"), ex.getMessage(), req);
    }

    // ===== 404 Not Found =====

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> handleNoSuch(NoSuchElementException ex, HttpServletRequest req) {
        return build(HttpStatus.NOT_FOUND, codeOf(ex, "NOT_FOUND"), ex.getMessage(), req);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException ex, HttpServletRequest req) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), req);
    }

    // ===== 500 =====

    @ExceptionHandler(SheetRenderException.class)
    public ResponseEntity<Map<String, Object>> handleRender(SheetRenderException ex, HttpServletRequest req) {
        log.warn("sheet render failed: {}", ex.toString());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "SHEET_RENDER_FAILED", ex.getMessage(), req);
    }

    @ExceptionHandler(ChartRenderException.class)
    public ResponseEntity<Map<String, Object>> handleChart(ChartRenderException ex, HttpServletRequest req) {
        log.warn("chart render failed: {}", ex.toString());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, codeOf(ex, "CHART_RENDER_FAILED"), ex.getMessage(), req);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex, HttpServletRequest req) {
        log.warn("illegal state: {}", ex.toString());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, codeOf(ex, "ILLEGAL_STATE"), ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage(), req);
    }

    /** "CATALOG_LOAD_FAILED: data/x.yaml" → "CATALOG_LOAD_FAILED" */
    private static String codeOf(Exception ex, String fallback) {
        String m = ex.getMessage();
        if (m == null || m.isBlank()) return fallback;
        String head = m.trim().split("[:\\s]", 2)[0];
        return head.matches("[A-Z][A-Z0-9_]*") ? head : fallback;
    }

    private static ResponseEntity<Map<String, Object>> build(HttpStatus status, String code, String message,
                                                              HttpServletRequest req) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        String rid = RequestIdFilter.current(req);
        if (rid != null) m.put("requestId", rid);
        return ResponseEntity.status(status).body(m);
    }
}
