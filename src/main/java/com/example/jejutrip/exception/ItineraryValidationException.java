package com.example.jejutrip.exception;

/** 일정 생성 전에 거부되는 요청 오류 */
public class ItineraryValidationException extends IllegalArgumentException {

    public ItineraryValidationException(String message) {
        super(message);
    }
}
