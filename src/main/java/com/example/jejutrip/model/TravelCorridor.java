package com.example.jejutrip.model;

/** 출발지-목적지 중심선과 반경으로 정의되는 하루 이동 코리도 */
public record TravelCorridor(
        SpotLocation startPoint,
        SpotLocation endPoint,
        double radiusKm,
        CenterLine centerLine
) {
    public record CenterLine(double lat1, double lng1, double lat2, double lng2) {
    }
}
