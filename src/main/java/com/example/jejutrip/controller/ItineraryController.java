package com.example.jejutrip.controller;

import com.example.jejutrip.controller.dto.CorridorPreviewRequest;
import com.example.jejutrip.controller.dto.CorridorPreviewResponse;
import com.example.jejutrip.controller.dto.ItineraryRequest;
import com.example.jejutrip.model.CandidateSpot;
import com.example.jejutrip.model.TravelCorridor;
import com.example.jejutrip.model.TravelItinerary;
import com.example.jejutrip.service.ItineraryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ItineraryController {

    private final ItineraryService itineraryService;

    @PostMapping("/itinerary")
    public TravelItinerary generate(@RequestBody ItineraryRequest req) {
        return itineraryService.generateItinerary(req);
    }

    /** 코리도 미리보기: 두 지점 사이 반경 안의 카탈로그 스팟 */
    @PostMapping("/itinerary/corridor")
    public CorridorPreviewResponse corridor(@RequestBody CorridorPreviewRequest req) {
        TravelCorridor corridor = itineraryService.buildCorridor(req.getStart(), req.getEnd(), req.getRadiusKm());
        List<CandidateSpot> candidates = itineraryService.previewCorridor(corridor);

        List<CorridorPreviewResponse.Item> items = new ArrayList<>(candidates.size());
        for (CandidateSpot c : candidates) {
            items.add(new CorridorPreviewResponse.Item(
                    c.getPlaceId(),
                    c.getSpot().getName(),
                    c.getSpot().primaryCategory(),
                    c.getSpot().getLat(),
                    c.getSpot().getLng(),
                    Math.round(c.getDistanceFromCorridorKm() * 100.0) / 100.0
            ));
        }
        return new CorridorPreviewResponse(corridor, items.size(), items);
    }
}
