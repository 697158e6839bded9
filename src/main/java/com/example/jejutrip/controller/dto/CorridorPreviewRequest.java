package com.example.jejutrip.controller.dto;

import com.example.jejutrip.model.SpotLocation;
import lombok.Data;

@Data
public class CorridorPreviewRequest {
    private SpotLocation start;
    private SpotLocation end;
    private Double radiusKm;
}
