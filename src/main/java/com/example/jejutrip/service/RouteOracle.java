package com.example.jejutrip.service;

import com.example.jejutrip.model.RouteSegment;
import com.example.jejutrip.model.SpotLocation;

import java.util.List;

public interface RouteOracle {

    /** 연속된 경유지 쌍마다 하나의 구간. 경유지가 2개 미만이면 빈 목록. */
    List<RouteSegment> stitchRoute(List<SpotLocation> waypoints);
}
