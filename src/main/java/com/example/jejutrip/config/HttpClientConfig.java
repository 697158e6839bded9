package com.example.jejutrip.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/** 외부 서비스별 HTTP 클라이언트 (각자 타임아웃) */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient openAiHttpClient(@Value("${openai.timeout-seconds:60}") long timeoutSeconds) {
        return new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(timeoutSeconds))
                .connectTimeout(Duration.ofSeconds(20))
                .readTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    @Bean
    public OkHttpClient googleMapsHttpClient(@Value("${google.maps.timeout-seconds:10}") long timeoutSeconds) {
        return new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(timeoutSeconds))
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
