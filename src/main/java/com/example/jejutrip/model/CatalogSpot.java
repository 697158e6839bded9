package com.example.jejutrip.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CatalogSpot {

    private String placeId;
    private String name;
    private List<String> categories = new ArrayList<>();
    private String region;
    private String address;
    private Double lat;
    private Double lng;
    private Integer averageDurationMinutes;
    private String operatingHours;
    private boolean closed;            // 폐업/휴업 표시
    private List<String> tags = new ArrayList<>();
    private List<String> interestTags = new ArrayList<>();
    private Boolean rainyDayFriendly;
    private Boolean hiddenGem;

    public boolean hasCoordinates() {
        if (lat == null || lng == null) return false;
        if (!Double.isFinite(lat) || !Double.isFinite(lng)) return false;
        if (lat == 0.0 && lng == 0.0) return false;              // (0,0) 초기값 배제
        return Math.abs(lat) <= 90 && Math.abs(lng) <= 180;
    }

    public String primaryCategory() {
        return (categories == null || categories.isEmpty()) ? null : categories.get(0);
    }

    public SpotLocation toLocation() {
        return new SpotLocation(name, lat, lng, address, placeId);
    }
}
