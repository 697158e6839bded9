package com.example.jejutrip.model;

public record RelevanceScore(String placeId, double score, String reasoning) {
}
