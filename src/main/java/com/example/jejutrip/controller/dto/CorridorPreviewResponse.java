package com.example.jejutrip.controller.dto;

import com.example.jejutrip.model.TravelCorridor;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@AllArgsConstructor
@NoArgsConstructor
public class CorridorPreviewResponse {

    private TravelCorridor corridor;
    private int count;
    private List<Item> items;

    @Getter
    @Setter
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Item {
        private String id;              // place_id
        private String name;
        private String category;
        private double lat;
        private double lng;
        private double distanceFromCorridorKm;
    }
}
