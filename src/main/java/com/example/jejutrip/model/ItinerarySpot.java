package com.example.jejutrip.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalTime;

public record ItinerarySpot(
        CatalogSpot spot,
        @JsonFormat(pattern = "HH:mm") LocalTime arrivalTime,
        @JsonFormat(pattern = "HH:mm") LocalTime departureTime,
        int stayMinutes,
        int travelMinutesFromPrevious,
        Integer travelMinutesToNext
) {
}
