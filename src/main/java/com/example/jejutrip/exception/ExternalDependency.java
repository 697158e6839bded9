package com.example.jejutrip.exception;

public enum ExternalDependency {
    RELEVANCE_SCORER,
    TRAVEL_TIME_ORACLE,
    ROUTE_ORACLE,
    SPOT_CATALOG
}
