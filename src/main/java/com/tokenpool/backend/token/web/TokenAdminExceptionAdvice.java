package com.tokenpool.backend.token.web;

import com.tokenpool.backend.common.web.RequestIdFilter;
import com.tokenpool.backend.token.controller.TokenAdminController;
import com.tokenpool.backend.token.dto.TokenAdminErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * admin API 錯誤格式：{errorCode, code, message, requestId}
 * - IllegalArgumentException 的 message 就是 error code
 */
@Slf4j
@RestControllerAdvice(assignableTypes = TokenAdminController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TokenAdminExceptionAdvice {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<TokenAdminErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        HttpStatus status = "TOKEN_NOT_FOUND".equals(code) ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(err(code, e.getMessage(), req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<TokenAdminErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        String msg = e.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : e.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + e.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return ResponseEntity.badRequest().body(err("VALIDATION_FAILED", msg, req));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<TokenAdminErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(err("BAD_REQUEST", "request body is not valid JSON", req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<TokenAdminErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("token admin unexpected error rid={}", RequestIdFilter.getOrCreate(req), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(err("INTERNAL_ERROR", null, req));
    }

    private static TokenAdminErrorResponse err(String code, String message, HttpServletRequest req) {
        return new TokenAdminErrorResponse(code, message, RequestIdFilter.getOrCreate(req));
    }

    private static String norm(String s, String fallback) {
        return (s == null || s.isBlank()) ? fallback : s.trim();
    }
}
