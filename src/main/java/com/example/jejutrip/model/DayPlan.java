package com.example.jejutrip.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;

@Getter
@Builder(toBuilder = true)
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DayPlan {

    private final LocalDate date;
    private final int dayNumber;
    private final SpotLocation startLocation;
    private final SpotLocation endLocation;
    @Builder.Default
    private final List<ItinerarySpot> spots = List.of();
    private final int totalTravelTimeMinutes;
    private final int totalActivityTimeMinutes;
    private final TravelCorridor corridor;
    private final String note;
    private final String warning;

    public boolean isEmpty() {
        return spots.isEmpty();
    }
}
