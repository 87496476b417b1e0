package com.imperium.mindjournal.controller;

import com.imperium.mindjournal.ai.orchestrator.ChatProcessingException;
import com.imperium.mindjournal.ai.orchestrator.ChatValidationException;
import com.imperium.mindjournal.ai.orchestrator.ConversationNotFoundException;
import com.imperium.mindjournal.auth.InvalidCredentialsException;
import com.imperium.mindjournal.config.RequestIdSupport;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理，统一返回 {"error": {code, message, requestId, details?}}。
 * 内部错误只写日志，不透出给调用方。
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String MSG_PROCESSING_FAILED = "Failed to process your message. Please try again.";
    static final String MSG_BACKEND_UNAVAILABLE = "The assistant is temporarily unavailable. Please try again.";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getDefaultMessage())
                .orElse("Validation failed");
        String field = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField())
                .orElse(null);
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", message, field);
    }

    @ExceptionHandler(ChatValidationException.class)
    public ResponseEntity<Map<String, Object>> handleChatValidation(ChatValidationException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", "Request body is missing or malformed", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", "Invalid value for " + ex.getName(), ex.getName());
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidCredentials(InvalidCredentialsException ex) {
        return error(HttpStatus.UNAUTHORIZED, "invalid_credentials", ex.getMessage(), null);
    }

    @ExceptionHandler(ConversationNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ConversationNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", "Conversation not found", null);
    }

    @ExceptionHandler(ChatProcessingException.class)
    public ResponseEntity<Map<String, Object>> handleChatProcessing(ChatProcessingException ex) {
        // 原因已由编排层记录
        if (ex.getReason() == ChatProcessingException.Reason.BACKEND_UNAVAILABLE) {
            return error(HttpStatus.SERVICE_UNAVAILABLE, "backend_unavailable", MSG_BACKEND_UNAVAILABLE, null);
        }
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "processing_failed", MSG_PROCESSING_FAILED, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // 404 路由、405 方法不支持等框架异常保留原状态码
            HttpStatusCode status = framework.getStatusCode();
            String code = status.value() == HttpStatus.NOT_FOUND.value() ? "not_found" : "invalid_argument";
            return error(status, code, ex.getMessage(), null);
        }
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "processing_failed", MSG_PROCESSING_FAILED, null);
    }

    private static ResponseEntity<Map<String, Object>> error(
            HttpStatusCode status, String code, String message, String field) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", resolveRequestId());
        if (field != null) {
            err.put("details", Map.of("field", field));
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }

    private static String resolveRequestId() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return RequestIdSupport.newRequestId();
        }
        HttpServletRequest request = attributes.getRequest();
        return RequestIdSupport.resolve(request);
    }
}
