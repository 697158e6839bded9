package com.example.jejutrip.model;

public enum TravelPace { SLOW, MODERATE, FAST }
