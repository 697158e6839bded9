package com.example.jejutrip.model;

public enum BudgetTier { LOW, MEDIUM, HIGH }
