package com.example.jejutrip.util;

/**
 * 위경도 거리 계산 유틸.
 * 선분 투영은 (lat,lng) 평면 근사이며 지역 단위 여행 거리에서만 사용한다.
 */
public final class HaversineUtil {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private HaversineUtil() {
    }

    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * 점 P에서 선분 AB까지의 최단 거리(km).
     * 투영 비율 t는 [0,1]로 잘라서 선분 밖으로 연장하지 않는다.
     */
    public static double pointToSegmentKm(double pLat, double pLng,
                                          double aLat, double aLng,
                                          double bLat, double bLng) {
        double abLat = bLat - aLat;
        double abLng = bLng - aLng;
        double apLat = pLat - aLat;
        double apLng = pLng - aLng;

        double abAb = abLat * abLat + abLng * abLng;
        double t = 0.0;
        if (abAb > 0) {
            double apAb = apLat * abLat + apLng * abLng;
            t = Math.max(0.0, Math.min(1.0, apAb / abAb));
        }

        double closestLat = aLat + t * abLat;
        double closestLng = aLng + t * abLng;
        return distanceKm(pLat, pLng, closestLat, closestLng);
    }
}
