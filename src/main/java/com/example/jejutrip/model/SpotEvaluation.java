package com.example.jejutrip.model;

public record SpotEvaluation(
        CandidateSpot candidate,
        int travelTimeMinutes,
        double directionScore,
        double preferenceScore,
        double travelEfficiency,
        int timeCategoryScore,
        boolean isOpenNow,
        boolean isMandatory,
        double totalScore
) {
}
