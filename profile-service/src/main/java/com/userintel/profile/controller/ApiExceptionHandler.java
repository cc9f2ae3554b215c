package com.userintel.profile.controller;

import com.userintel.common.insight.InsightTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InsightTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleTransition(InsightTransitionException ex) {
        log.warn("Rejected insight transition. id={} from={} to={}", ex.getInsightId(), ex.getFrom(), ex.getTo());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
            "error", "invalid_transition",
            "insightId", String.valueOf(ex.getInsightId()),
            "from", String.valueOf(ex.getFrom()),
            "to", String.valueOf(ex.getTo())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request. error={}", ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
            "error", "bad_request",
            "details", String.valueOf(ex.getMessage())));
    }
}
