package com.example.jejutrip.config;

import com.example.jejutrip.exception.ExternalServiceException;
import com.example.jejutrip.exception.ItineraryGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalAdvice {

    private static final Logger log = LoggerFactory.getLogger(GlobalAdvice.class);

    @ExceptionHandler(ItineraryGenerationException.class)
    public ResponseEntity<Map<String, Object>> onGeneration(ItineraryGenerationException e) {
        log.error("itinerary generation failed: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getClass().getSimpleName());
        body.put("message", e.getMessage());
        body.put("day", e.getDayNumber());
        body.put("dependency", e.getDependency());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    // 카탈로그/외부 API 장애는 요청 오류가 아니라 502
    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<Map<String, Object>> onExternal(ExternalServiceException e) {
        log.error("external dependency {} failed: {}", e.getDependency(), e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getClass().getSimpleName());
        body.put("message", e.getMessage());
        body.put("dependency", e.getDependency());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> onAny(Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getClass().getSimpleName());
        body.put("message", String.valueOf(e.getMessage()));
        return ResponseEntity.badRequest().body(body);
    }
}
