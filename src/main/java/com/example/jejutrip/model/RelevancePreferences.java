package com.example.jejutrip.model;

import java.util.List;

/** 관련성 스코어러에 그대로 전달되는 사용자 선호 */
public record RelevancePreferences(
        List<String> interests,
        List<String> companions,
        TravelPace pace,
        BudgetTier budget,
        boolean preferRainyDay,
        boolean preferHiddenGems,
        boolean avoidCrowds,
        List<String> fixedSpotNames
) {
}
