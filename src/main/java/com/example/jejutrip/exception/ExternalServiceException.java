package com.example.jejutrip.exception;

import lombok.Getter;

@Getter
public class ExternalServiceException extends RuntimeException {

    private final ExternalDependency dependency;

    public ExternalServiceException(ExternalDependency dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public ExternalServiceException(ExternalDependency dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }
}
