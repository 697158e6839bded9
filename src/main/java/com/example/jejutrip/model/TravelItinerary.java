package com.example.jejutrip.model;

import com.example.jejutrip.controller.dto.ItineraryRequest;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
public class TravelItinerary {

    private final ItineraryRequest request;
    private final List<DayPlan> plans;
    private final List<RouteSegment> routes;
    private final Summary summary;
    @Builder.Default
    private final List<String> warnings = List.of();
    private final Instant generatedAt;

    public record Summary(
            int totalDays,
            int totalSpots,
            int totalTravelTimeMinutes,
            List<String> coverageRegions
    ) {
    }
}
