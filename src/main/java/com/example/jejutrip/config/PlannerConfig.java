package com.example.jejutrip.config;

import com.example.jejutrip.model.FailurePolicy;
import com.example.jejutrip.service.TimeSlotTable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.LocalTime;
import java.time.ZoneId;

@Configuration
public class PlannerConfig {

    @Bean
    public PlannerSettings plannerSettings(
            @Value("${planner.corridor-radius-km:12}") double corridorRadiusKm,
            @Value("${planner.max-travel-minutes-per-hop:40}") int maxTravelMinutesPerHop,
            @Value("${planner.min-direction-score:20}") double minDirectionScore,
            @Value("${planner.weight.relevance:0.30}") double relevanceWeight,
            @Value("${planner.weight.direction:0.25}") double directionWeight,
            @Value("${planner.weight.travel-efficiency:0.15}") double travelEfficiencyWeight,
            @Value("${planner.weight.time-category:0.20}") double timeCategoryWeight,
            @Value("${planner.open-bonus:10}") double openBonus,
            @Value("${planner.mandatory-bonus:50}") double mandatoryBonus,
            @Value("${planner.default-stay-minutes:60}") int defaultStayMinutes,
            @Value("${planner.day-start-time:09:00}") String dayStartTime,
            @Value("${planner.max-trip-days:30}") int maxTripDays,
            @Value("${planner.failure-policy:ABORT}") FailurePolicy failurePolicy,
            @Value("${planner.zone-id:Asia/Seoul}") String zoneId) {
        return PlannerSettings.builder()
                .corridorRadiusKm(corridorRadiusKm)
                .maxTravelMinutesPerHop(maxTravelMinutesPerHop)
                .minDirectionScore(minDirectionScore)
                .relevanceWeight(relevanceWeight)
                .directionWeight(directionWeight)
                .travelEfficiencyWeight(travelEfficiencyWeight)
                .timeCategoryWeight(timeCategoryWeight)
                .openBonus(openBonus)
                .mandatoryBonus(mandatoryBonus)
                .defaultStayMinutes(defaultStayMinutes)
                .dayStartTime(LocalTime.parse(dayStartTime))
                .maxTripDays(maxTripDays)
                .failurePolicy(failurePolicy)
                .zoneId(ZoneId.of(zoneId))
                .build();
    }

    @Bean
    public TimeSlotTable timeSlotTable() {
        return TimeSlotTable.jejuDefaults();
    }
}
