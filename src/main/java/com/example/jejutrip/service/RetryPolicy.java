package com.example.jejutrip.service;

import com.example.jejutrip.exception.ExternalDependency;
import com.example.jejutrip.exception.ExternalServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * 외부 호출 재시도. IOException(타임아웃 포함)만 재시도하고, 소진되면 ExternalServiceException.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long backoffMillis;

    public RetryPolicy(int maxAttempts, long backoffMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMillis = Math.max(0, backoffMillis);
    }

    public static RetryPolicy once() {
        return new RetryPolicy(1, 0);
    }

    @FunctionalInterface
    public interface IoCall<T> {
        T call() throws IOException;
    }

    public <T> T execute(ExternalDependency dependency, IoCall<T> call) {
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (IOException e) {
                last = e;
                log.warn("[{}] attempt {}/{} failed: {}", dependency, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts && backoffMillis > 0) {
                    try {
                        Thread.sleep(backoffMillis * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new ExternalServiceException(dependency, "interrupted while retrying", ie);
                    }
                }
            }
        }
        throw new ExternalServiceException(dependency,
                dependency + " failed after " + maxAttempts + " attempt(s): " + last.getMessage(), last);
    }
}
