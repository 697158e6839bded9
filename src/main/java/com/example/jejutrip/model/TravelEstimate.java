package com.example.jejutrip.model;

/** 거리 행렬 한 칸: 출발지 → 목적지 소요 시간(분) / 거리(km) */
public record TravelEstimate(int durationMinutes, double distanceKm) {

    public static final int UNREACHABLE_MINUTES = 9999;

    public static TravelEstimate unreachable() {
        return new TravelEstimate(UNREACHABLE_MINUTES, UNREACHABLE_MINUTES);
    }
}
