package com.example.jejutrip.service;

import com.example.jejutrip.model.CatalogSpot;
import com.example.jejutrip.model.RelevancePreferences;
import com.example.jejutrip.model.RelevanceScore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.jejutrip.service.SpotFixtures.spot;
import static org.assertj.core.api.Assertions.assertThat;

class TagOverlapRelevanceScorerTest {

    private final TagOverlapRelevanceScorer scorer = new TagOverlapRelevanceScorer();

    @Test
    void countsInterestMatchesAcrossLabels() {
        // Given
        CatalogSpot oreum = spot("oreum", 33.4, 126.7, "오름");
        oreum.setTags(List.of("일출", "자연경관"));
        oreum.setRainyDayFriendly(false);
        CatalogSpot museum = spot("museum", 33.3, 126.4, "박물관");
        museum.setRainyDayFriendly(true);
        RelevancePreferences prefs = new RelevancePreferences(List.of("자연", "오름", "카페"), List.of(),
                null, null, true, false, false, List.of("산방산"));

        // When
        List<RelevanceScore> scores = scorer.scoreRelevance(List.of(oreum, museum), prefs);

        // Then: 오름 = 50 + 2 매칭, 박물관 = 50 + 비 오는 날
        assertThat(scores).extracting(RelevanceScore::score).containsExactly(70.0, 60.0);
    }

    @Test
    void fixedSpotNameScoresFull() {
        CatalogSpot sanbang = spot("s", 33.24, 126.31, "관광지");
        sanbang.setName("산방산");
        RelevancePreferences prefs = new RelevancePreferences(List.of(), List.of(), null, null,
                false, false, false, List.of("산방산"));

        assertThat(scorer.scoreRelevance(List.of(sanbang), prefs))
                .singleElement()
                .extracting(RelevanceScore::score)
                .isEqualTo(100.0);
    }

    @Test
    void scoreIsCappedAtHundred() {
        CatalogSpot gem = spot("g", 33.4, 126.5, "카페", "디저트", "오션뷰", "포토존", "브런치");
        gem.setHiddenGem(true);
        RelevancePreferences prefs = new RelevancePreferences(List.of("카페", "디저트", "오션뷰", "포토존", "브런치"),
                List.of(), null, null, false, true, false, List.of());

        assertThat(scorer.scoreRelevance(List.of(gem), prefs).get(0).score()).isEqualTo(100.0);
    }
}
