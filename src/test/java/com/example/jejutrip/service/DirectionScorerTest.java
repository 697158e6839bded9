package com.example.jejutrip.service;

import com.example.jejutrip.model.SpotLocation;
import org.junit.jupiter.api.Test;

import static com.example.jejutrip.service.SpotFixtures.JEJU_AIRPORT;
import static com.example.jejutrip.service.SpotFixtures.SEOGWIPO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DirectionScorerTest {

    private final DirectionScorer scorer = new DirectionScorer();

    @Test
    void movingAwayFromDestinationScoresZero() {
        // 공항 북서쪽 바다 방향
        SpotLocation away = SpotLocation.of("away", 33.56, 126.40);

        assertThat(scorer.directionScore(JEJU_AIRPORT, away, SEOGWIPO)).isEqualTo(0.0);
    }

    @Test
    void candidateAtDestinationScoresFull() {
        assertThat(scorer.directionScore(JEJU_AIRPORT, SEOGWIPO, SEOGWIPO)).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void midpointOnDirectLine() {
        SpotLocation mid = SpotLocation.of("mid", (33.5066 + 33.2541) / 2, (126.4931 + 126.5601) / 2);

        // 효율 ~100, 진척률 ~50 → 0.7*100 + 0.3*50
        assertThat(scorer.directionScore(JEJU_AIRPORT, mid, SEOGWIPO)).isCloseTo(85.0, within(0.5));
    }

    @Test
    void detourLowersScore() {
        SpotLocation onLine = SpotLocation.of("mid", (33.5066 + 33.2541) / 2, (126.4931 + 126.5601) / 2);
        SpotLocation offLine = SpotLocation.of("east", 33.38, 126.70);

        double straight = scorer.directionScore(JEJU_AIRPORT, onLine, SEOGWIPO);
        double detour = scorer.directionScore(JEJU_AIRPORT, offLine, SEOGWIPO);

        assertThat(detour).isLessThan(straight);
        assertThat(detour).isBetween(0.0, 100.0);
    }

    @Test
    void alreadyAtDestination() {
        assertThat(scorer.directionScore(SEOGWIPO, SEOGWIPO, SEOGWIPO)).isCloseTo(70.0, within(1e-9));
        assertThat(scorer.directionScore(SEOGWIPO, JEJU_AIRPORT, SEOGWIPO)).isEqualTo(0.0);
    }
}
