package com.example.jejutrip.service;

import com.example.jejutrip.model.RouteSegment;
import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.model.TravelEstimate;
import com.example.jejutrip.util.HaversineUtil;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 지도 API 키가 없을 때의 근사치: 직선거리 × 도로 우회계수, 평균 속도로 환산.
 */
public class StraightLineTravelOracle implements TravelTimeOracle, RouteOracle {

    private static final double ROAD_FACTOR = 1.3;
    private static final double AVERAGE_KMH = 40.0;

    @Override
    public List<TravelEstimate> estimateTravelTime(SpotLocation origin, List<SpotLocation> destinations,
                                                   LocalDateTime departureTime) {
        List<TravelEstimate> out = new ArrayList<>(destinations.size());
        for (SpotLocation d : destinations) {
            double km = roadKm(origin, d);
            out.add(new TravelEstimate(minutes(km), round2(km)));
        }
        return out;
    }

    @Override
    public List<RouteSegment> stitchRoute(List<SpotLocation> waypoints) {
        if (waypoints == null || waypoints.size() < 2) return List.of();
        List<RouteSegment> out = new ArrayList<>();
        for (int i = 0; i + 1 < waypoints.size(); i++) {
            SpotLocation a = waypoints.get(i);
            SpotLocation b = waypoints.get(i + 1);
            double km = roadKm(a, b);
            out.add(new RouteSegment(a, b, minutes(km), round2(km), List.of(), null));
        }
        return out;
    }

    private static double roadKm(SpotLocation a, SpotLocation b) {
        return HaversineUtil.distanceKm(a.latitude(), a.longitude(), b.latitude(), b.longitude()) * ROAD_FACTOR;
    }

    private static int minutes(double km) {
        return Math.max(1, (int) Math.ceil(km / AVERAGE_KMH * 60.0));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
