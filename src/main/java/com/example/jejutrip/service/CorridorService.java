package com.example.jejutrip.service;

import com.example.jejutrip.exception.ItineraryValidationException;
import com.example.jejutrip.model.CandidateSpot;
import com.example.jejutrip.model.CatalogSpot;
import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.model.TravelCorridor;
import com.example.jejutrip.util.HaversineUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class CorridorService {

    private static final Logger log = LoggerFactory.getLogger(CorridorService.class);

    /** 시작점과 목적지를 잇는 직선 중심의 코리도 생성. 출발=도착이면 점 주변 원형 코리도. */
    public TravelCorridor buildCorridor(SpotLocation start, SpotLocation end, double radiusKm) {
        if (!(radiusKm > 0) || !Double.isFinite(radiusKm)) {
            throw new ItineraryValidationException("corridor radius must be positive: " + radiusKm);
        }
        return new TravelCorridor(start, end, radiusKm, new TravelCorridor.CenterLine(
                start.latitude(), start.longitude(), end.latitude(), end.longitude()));
    }

    public double distanceFromCenterLineKm(double lat, double lng, TravelCorridor corridor) {
        TravelCorridor.CenterLine line = corridor.centerLine();
        return HaversineUtil.pointToSegmentKm(lat, lng, line.lat1(), line.lng1(), line.lat2(), line.lng2());
    }

    public boolean isInCorridor(double lat, double lng, TravelCorridor corridor) {
        return distanceFromCenterLineKm(lat, lng, corridor) <= corridor.radiusKm();
    }

    /**
     * 좌표가 있는 스팟만 중심선에 투영해서 반경 이내 후보로 만든다.
     * 관련성 점수는 0으로 시작한다. 결과 순서는 보장하지 않는다.
     */
    public List<CandidateSpot> filterByCorridor(List<CatalogSpot> spots, TravelCorridor corridor) {
        if (spots == null || spots.isEmpty()) return List.of();

        List<CandidateSpot> out = new ArrayList<>();
        int missing = 0;
        for (int i = 0; i < spots.size(); i++) {
            CatalogSpot spot = spots.get(i);
            if (spot == null || !spot.hasCoordinates()) {
                missing++;
                continue;
            }
            double d = distanceFromCenterLineKm(spot.getLat(), spot.getLng(), corridor);
            if (d <= corridor.radiusKm()) {
                out.add(new CandidateSpot(spot, i, d, true));
            }
        }
        if (missing > 0) {
            log.warn("[corridor] {} spot(s) skipped: no usable coordinates", missing);
        }
        return out;
    }
}
