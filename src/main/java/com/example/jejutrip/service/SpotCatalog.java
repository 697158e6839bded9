package com.example.jejutrip.service;

import com.example.jejutrip.model.CatalogSpot;

import java.util.List;

public interface SpotCatalog {

    List<CatalogSpot> listSpotsWithCoordinates();
}
