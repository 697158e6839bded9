package com.example.jejutrip.model;

import lombok.Getter;
import lombok.ToString;

/**
 * 코리도 내부 후보. 관련성 점수는 외부 스코어러가 한 번만 채운다.
 */
@Getter
@ToString
public class CandidateSpot {

    private final CatalogSpot spot;
    private final int catalogOrder;
    private final double distanceFromCorridorKm;
    private final boolean inCorridor;
    private double relevanceScore;
    private boolean scored;

    public CandidateSpot(CatalogSpot spot, int catalogOrder, double distanceFromCorridorKm, boolean inCorridor) {
        this.spot = spot;
        this.catalogOrder = catalogOrder;
        this.distanceFromCorridorKm = distanceFromCorridorKm;
        this.inCorridor = inCorridor;
    }

    public void assignRelevance(double score) {
        if (scored) {
            throw new IllegalStateException("relevance already assigned for " + spot.getPlaceId());
        }
        this.relevanceScore = Math.max(0, Math.min(100, score));
        this.scored = true;
    }

    public String getPlaceId() {
        return spot.getPlaceId();
    }

    public SpotLocation location() {
        return spot.toLocation();
    }
}
