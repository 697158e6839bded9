package com.example.jejutrip.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpotLocation(
        String name,
        Double latitude,
        Double longitude,
        String address,
        String placeId
) {
    public static SpotLocation of(String name, double latitude, double longitude) {
        return new SpotLocation(name, latitude, longitude, null, null);
    }

    /** 좌표 누락(null) 은 무효. JSON 에서 빠진 좌표가 0.0 으로 채워지지 않도록 박싱 타입 사용 */
    public boolean hasValidCoordinates() {
        if (latitude == null || longitude == null) return false;
        return Double.isFinite(latitude) && Double.isFinite(longitude)
                && Math.abs(latitude) <= 90 && Math.abs(longitude) <= 180;
    }
}
