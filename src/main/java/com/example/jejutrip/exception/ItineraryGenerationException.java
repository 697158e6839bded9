package com.example.jejutrip.exception;

import lombok.Getter;

/**
 * 호출자에게 전달되는 단일 집계 오류. 라우트 연결 단계 실패는 dayNumber 가 null.
 */
@Getter
public class ItineraryGenerationException extends RuntimeException {

    private final Integer dayNumber;
    private final ExternalDependency dependency;

    public ItineraryGenerationException(Integer dayNumber, ExternalDependency dependency,
                                        String message, Throwable cause) {
        super(message, cause);
        this.dayNumber = dayNumber;
        this.dependency = dependency;
    }
}
