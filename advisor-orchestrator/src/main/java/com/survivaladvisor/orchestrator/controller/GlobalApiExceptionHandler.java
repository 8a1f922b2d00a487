package com.survivaladvisor.orchestrator.controller;

import com.survivaladvisor.common.exception.AdvisorException;
import com.survivaladvisor.common.exception.UnknownVocabularyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to HTTP responses. Unknown vocabulary is a caller error (400);
 * anything else that escapes a handler is a 500 with a generic message.
 */
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalApiExceptionHandler.class);

    private static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(UnknownVocabularyException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownVocabulary(UnknownVocabularyException ex,
                                                                       ServerWebExchange exchange) {
        log.warn("HTTP_ERROR path={} method={} errorType={} vocabulary={} value={}",
                 resolvePath(exchange), resolveMethod(exchange), ex.getClass().getSimpleName(),
                 ex.getVocabulary(), ex.getValue());
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, ex.getMessage());
        body.put("vocabulary", ex.getVocabulary());
        body.put("value", ex.getValue());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, ServerWebExchange exchange) {
        log.warn("HTTP_ERROR path={} method={} errorType={} errorMessage={}",
                 resolvePath(exchange), resolveMethod(exchange), ex.getClass().getSimpleName(),
                 truncate(ex.getMessage()));
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, truncate(ex.getMessage())));
    }

    @ExceptionHandler(AdvisorException.class)
    public ResponseEntity<Map<String, Object>> handleAdvisorException(AdvisorException ex,
                                                                      ServerWebExchange exchange) {
        log.error("HTTP_ERROR path={} method={} component={} errorMessage={}",
                  resolvePath(exchange), resolveMethod(exchange), ex.getComponent(), truncate(ex.getMessage()), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Advisor error in " + ex.getComponent()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, ServerWebExchange exchange) {
        log.error("HTTP_ERROR path={} method={} errorType={} errorMessage={}",
                  resolvePath(exchange), resolveMethod(exchange), ex.getClass().getSimpleName(),
                  truncate(ex.getMessage()), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error"));
    }

    private static Map<String, Object> body(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message != null ? message : status.getReasonPhrase());
        return body;
    }

    private static String resolvePath(ServerWebExchange exchange) {
        return exchange == null ? "-" : exchange.getRequest().getPath().value();
    }

    private static String resolveMethod(ServerWebExchange exchange) {
        return exchange == null ? "-" : String.valueOf(exchange.getRequest().getMethod());
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH);
    }
}
