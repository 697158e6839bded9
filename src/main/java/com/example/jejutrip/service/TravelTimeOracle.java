package com.example.jejutrip.service;

import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.model.TravelEstimate;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 한 출발지에서 여러 목적지까지의 이동 시간. 결과는 destinations 와 같은 순서/개수.
 */
public interface TravelTimeOracle {

    List<TravelEstimate> estimateTravelTime(SpotLocation origin, List<SpotLocation> destinations,
                                            LocalDateTime departureTime);
}
