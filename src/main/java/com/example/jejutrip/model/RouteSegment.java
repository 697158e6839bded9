package com.example.jejutrip.model;

import java.util.List;

public record RouteSegment(
        SpotLocation origin,
        SpotLocation destination,
        int durationMinutes,
        double distanceKm,
        List<RouteStep> steps,
        String polyline
) {
    public record RouteStep(String instruction, int distanceMeters, int durationSeconds) {
    }
}
