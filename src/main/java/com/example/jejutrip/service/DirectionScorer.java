package com.example.jejutrip.service;

import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.util.HaversineUtil;
import org.springframework.stereotype.Service;

/**
 * 현재 위치 → 후보 이동이 최종 목적지 방향으로 얼마나 효율적인지 0~100 으로 평가.
 * 목적지에서 멀어지는 후보는 무조건 0.
 */
@Service
public class DirectionScorer {

    public double directionScore(SpotLocation current, SpotLocation candidate, SpotLocation destination) {
        double direct = dist(current, destination);
        double toSpot = dist(current, candidate);
        double spotToDest = dist(candidate, destination);

        double progress = direct - spotToDest;               // 전진 거리
        double detour = toSpot + spotToDest - direct;        // 우회 거리

        if (progress < 0) {
            return 0.0;
        }

        double efficiency;
        double progressRatio;
        if (direct > 0) {
            efficiency = detour <= 0 ? 100.0 : Math.max(0.0, 100.0 - detour / direct * 100.0);
            progressRatio = progress / direct * 100.0;
        } else {
            // 현재 위치 = 목적지 이고 후보도 같은 지점
            efficiency = 100.0;
            progressRatio = 0.0;
        }
        return Math.min(100.0, efficiency * 0.7 + progressRatio * 0.3);
    }

    private static double dist(SpotLocation a, SpotLocation b) {
        return HaversineUtil.distanceKm(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }
}
