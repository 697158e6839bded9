package com.example.jejutrip.controller.dto;

import com.example.jejutrip.model.BudgetTier;
import com.example.jejutrip.model.FailurePolicy;
import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.model.TravelPace;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
public class ItineraryRequest {
    private LocalDate startDate;
    private LocalDate endDate;
    private Double dailyTravelHours;       // 하루 여행 시간 (예: 8시간)

    private SpotLocation startPoint;       // 첫날 시작점 (제주공항 등)
    private SpotLocation endPoint;         // 마지막날 도착점
    private List<AccommodationByDate> accommodations = new ArrayList<>();

    private List<String> interests = new ArrayList<>();
    private List<String> companions = new ArrayList<>();
    private TravelPace pace;
    private BudgetTier budget;

    private List<FixedSpot> fixedSpots = new ArrayList<>();   // 필수 방문지

    private boolean preferRainyDay;
    private boolean preferHiddenGems;
    private boolean avoidCrowds;

    private Double corridorRadiusKm;       // 생략 시 설정값
    private FailurePolicy failurePolicy;   // 생략 시 설정값

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AccommodationByDate {
        private LocalDate date;
        private SpotLocation location;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FixedSpot {
        private String placeId;
        private String name;
    }
}
