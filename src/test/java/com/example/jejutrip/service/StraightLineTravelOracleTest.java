package com.example.jejutrip.service;

import com.example.jejutrip.model.RouteSegment;
import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.model.TravelEstimate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.jejutrip.service.SpotFixtures.JEJU_AIRPORT;
import static com.example.jejutrip.service.SpotFixtures.SEOGWIPO;
import static org.assertj.core.api.Assertions.assertThat;

class StraightLineTravelOracleTest {

    private final StraightLineTravelOracle oracle = new StraightLineTravelOracle();

    @Test
    void estimatesAirportToSeogwipo() {
        // 약 28.8km × 1.3 ÷ 40km/h
        List<TravelEstimate> estimates = oracle.estimateTravelTime(JEJU_AIRPORT, List.of(SEOGWIPO, JEJU_AIRPORT), null);

        assertThat(estimates).hasSize(2);
        assertThat(estimates.get(0).durationMinutes()).isBetween(54, 59);
        assertThat(estimates.get(0).distanceKm()).isBetween(36.0, 39.0);
        assertThat(estimates.get(1).durationMinutes()).isEqualTo(1);
    }

    @Test
    void stitchesConsecutiveSegments() {
        SpotLocation mid = SpotLocation.of("mid", 33.38, 126.52);

        List<RouteSegment> route = oracle.stitchRoute(List.of(JEJU_AIRPORT, mid, SEOGWIPO));

        assertThat(route).hasSize(2);
        assertThat(route.get(0).origin()).isEqualTo(JEJU_AIRPORT);
        assertThat(route.get(1).destination()).isEqualTo(SEOGWIPO);
        assertThat(route).allSatisfy(seg -> assertThat(seg.steps()).isEmpty());
        assertThat(oracle.stitchRoute(List.of(JEJU_AIRPORT))).isEmpty();
    }
}
