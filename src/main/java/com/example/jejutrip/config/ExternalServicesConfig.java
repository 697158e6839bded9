package com.example.jejutrip.config;

import com.example.jejutrip.service.GoogleDirectionsClient;
import com.example.jejutrip.service.GoogleDistanceMatrixClient;
import com.example.jejutrip.service.GptClient;
import com.example.jejutrip.service.GptRelevanceScorer;
import com.example.jejutrip.service.RelevanceScorer;
import com.example.jejutrip.service.RetryPolicy;
import com.example.jejutrip.service.RouteOracle;
import com.example.jejutrip.service.StraightLineTravelOracle;
import com.example.jejutrip.service.TagOverlapRelevanceScorer;
import com.example.jejutrip.service.TravelTimeOracle;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 외부 협력 서비스 선택. API 키가 비어 있으면 오프라인 근사 구현을 쓴다.
 */
@Configuration
public class ExternalServicesConfig {

    private static final Logger log = LoggerFactory.getLogger(ExternalServicesConfig.class);

    @Bean
    public RelevanceScorer relevanceScorer(@Qualifier("openAiHttpClient") OkHttpClient http,
                                           @Value("${openai.api.key:${OPENAI_API_KEY:}}") String apiKey,
                                           @Value("${openai.base-url:https://api.openai.com/v1}") String baseUrl,
                                           @Value("${openai.model:gpt-4o-mini}") String model,
                                           @Value("${openai.max-attempts:2}") int maxAttempts,
                                           @Value("${openai.backoff-millis:500}") long backoffMillis) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("openai.api.key is not set → tag overlap relevance scoring");
            return new TagOverlapRelevanceScorer();
        }
        return new GptRelevanceScorer(new GptClient(http, baseUrl, apiKey, model),
                new RetryPolicy(maxAttempts, backoffMillis));
    }

    @Bean
    public TravelTimeOracle travelTimeOracle(@Qualifier("googleMapsHttpClient") OkHttpClient http,
                                             @Value("${google.maps.api.key:${GOOGLE_MAPS_API_KEY:}}") String apiKey,
                                             @Value("${google.maps.base-url:https://maps.googleapis.com/maps/api}") String baseUrl,
                                             @Value("${google.maps.max-attempts:3}") int maxAttempts,
                                             @Value("${google.maps.backoff-millis:300}") long backoffMillis,
                                             PlannerSettings settings) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("google.maps.api.key is not set → straight-line travel time estimates");
            // 인터페이스 하나로만 노출해야 RouteOracle 주입이 모호해지지 않는다
            return new StraightLineTravelOracle()::estimateTravelTime;
        }
        return new GoogleDistanceMatrixClient(http, baseUrl, apiKey, settings.getZoneId(),
                new RetryPolicy(maxAttempts, backoffMillis));
    }

    @Bean
    public RouteOracle routeOracle(@Qualifier("googleMapsHttpClient") OkHttpClient http,
                                   @Value("${google.maps.api.key:${GOOGLE_MAPS_API_KEY:}}") String apiKey,
                                   @Value("${google.maps.base-url:https://maps.googleapis.com/maps/api}") String baseUrl,
                                   @Value("${google.maps.max-attempts:3}") int maxAttempts,
                                   @Value("${google.maps.backoff-millis:300}") long backoffMillis) {
        if (apiKey == null || apiKey.isBlank()) {
            return new StraightLineTravelOracle()::stitchRoute;
        }
        return new GoogleDirectionsClient(http, baseUrl, apiKey, new RetryPolicy(maxAttempts, backoffMillis));
    }
}
