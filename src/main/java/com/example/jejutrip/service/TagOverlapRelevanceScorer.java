package com.example.jejutrip.service;

import com.example.jejutrip.model.CatalogSpot;
import com.example.jejutrip.model.RelevancePreferences;
import com.example.jejutrip.model.RelevanceScore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * API 키가 없을 때 쓰는 오프라인 채점: 관심사 태그 겹침 기반.
 */
public class TagOverlapRelevanceScorer implements RelevanceScorer {

    private static final int BASE = 50;
    private static final int PER_MATCH = 10;

    @Override
    public List<RelevanceScore> scoreRelevance(List<CatalogSpot> candidates, RelevancePreferences preferences) {
        List<String> interests = preferences.interests() == null ? List.of() : preferences.interests();
        List<String> fixed = preferences.fixedSpotNames() == null ? List.of() : preferences.fixedSpotNames();

        List<RelevanceScore> out = new ArrayList<>();
        for (CatalogSpot s : candidates) {
            if (fixed.contains(s.getName())) {
                out.add(new RelevanceScore(s.getPlaceId(), 100, "fixed spot"));
                continue;
            }
            List<String> labels = Stream.of(s.getCategories(), s.getTags(), s.getInterestTags())
                    .filter(Objects::nonNull)
                    .flatMap(List::stream)
                    .filter(Objects::nonNull)
                    .toList();
            long matches = interests.stream()
                    .filter(Objects::nonNull)
                    .filter(i -> labels.stream().anyMatch(l -> l.contains(i)))
                    .count();
            int score = BASE + (int) matches * PER_MATCH;
            if (preferences.preferRainyDay() && Boolean.TRUE.equals(s.getRainyDayFriendly())) score += PER_MATCH;
            if (preferences.preferHiddenGems() && Boolean.TRUE.equals(s.getHiddenGem())) score += PER_MATCH;
            score = Math.max(0, Math.min(100, score));
            out.add(new RelevanceScore(s.getPlaceId(), score, matches + " interest match(es)"));
        }
        return out;
    }
}
