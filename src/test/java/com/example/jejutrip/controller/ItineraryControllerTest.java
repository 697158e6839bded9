package com.example.jejutrip.controller;

import com.example.jejutrip.controller.dto.ItineraryRequest;
import com.example.jejutrip.exception.ExternalDependency;
import com.example.jejutrip.exception.ExternalServiceException;
import com.example.jejutrip.exception.ItineraryGenerationException;
import com.example.jejutrip.exception.ItineraryValidationException;
import com.example.jejutrip.model.CandidateSpot;
import com.example.jejutrip.model.CatalogSpot;
import com.example.jejutrip.model.DayPlan;
import com.example.jejutrip.model.FailurePolicy;
import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.model.TravelCorridor;
import com.example.jejutrip.model.TravelItinerary;
import com.example.jejutrip.model.TravelPace;
import com.example.jejutrip.service.ItineraryService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ItineraryController.class)
class ItineraryControllerTest {

    private static final String REQUEST = """
            {
              "startDate": "2026-05-01",
              "endDate": "2026-05-02",
              "dailyTravelHours": 8,
              "startPoint": {"name": "제주국제공항", "latitude": 33.5066, "longitude": 126.4931},
              "endPoint": {"name": "서귀포", "latitude": 33.2541, "longitude": 126.5601},
              "interests": ["자연", "카페"],
              "pace": "moderate",
              "failurePolicy": "best_effort"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ItineraryService itineraryService;

    @Test
    void generatesItinerary() throws Exception {
        // Given
        DayPlan day = DayPlan.builder()
                .date(LocalDate.of(2026, 5, 1))
                .dayNumber(1)
                .note("no candidate in corridor")
                .build();
        TravelItinerary itinerary = TravelItinerary.builder()
                .plans(List.of(day))
                .routes(List.of())
                .summary(new TravelItinerary.Summary(1, 0, 0, List.of()))
                .generatedAt(Instant.parse("2026-04-30T00:00:00Z"))
                .build();
        when(itineraryService.generateItinerary(any(ItineraryRequest.class))).thenReturn(itinerary);

        // When / Then
        mockMvc.perform(post("/api/itinerary").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.totalDays").value(1))
                .andExpect(jsonPath("$.plans[0].date").value("2026-05-01"))
                .andExpect(jsonPath("$.plans[0].note").value("no candidate in corridor"));

        ArgumentCaptor<ItineraryRequest> captor = ArgumentCaptor.forClass(ItineraryRequest.class);
        verify(itineraryService).generateItinerary(captor.capture());
        ItineraryRequest sent = captor.getValue();
        assertThat(sent.getStartPoint().latitude()).isEqualTo(33.5066);
        assertThat(sent.getInterests()).containsExactly("자연", "카페");
        assertThat(sent.getPace()).isEqualTo(TravelPace.MODERATE);
        assertThat(sent.getFailurePolicy()).isEqualTo(FailurePolicy.BEST_EFFORT);
    }

    @Test
    void invalidRequestIsBadRequest() throws Exception {
        when(itineraryService.generateItinerary(any(ItineraryRequest.class)))
                .thenThrow(new ItineraryValidationException("dailyTravelHours must be positive"));

        mockMvc.perform(post("/api/itinerary").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ItineraryValidationException"))
                .andExpect(jsonPath("$.message").value("dailyTravelHours must be positive"));
    }

    @Test
    void upstreamFailureIsBadGateway() throws Exception {
        when(itineraryService.generateItinerary(any(ItineraryRequest.class)))
                .thenThrow(new ItineraryGenerationException(2, ExternalDependency.TRAVEL_TIME_ORACLE,
                        "day 2 failed", null));

        mockMvc.perform(post("/api/itinerary").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.day").value(2))
                .andExpect(jsonPath("$.dependency").value("TRAVEL_TIME_ORACLE"));
    }

    @Test
    void previewsCorridor() throws Exception {
        // Given
        SpotLocation start = new SpotLocation("제주국제공항", 33.5066, 126.4931, null, null);
        SpotLocation end = new SpotLocation("서귀포", 33.2541, 126.5601, null, null);
        TravelCorridor corridor = new TravelCorridor(start, end, 12,
                new TravelCorridor.CenterLine(33.5066, 126.4931, 33.2541, 126.5601));
        CatalogSpot spot = new CatalogSpot();
        spot.setPlaceId("JJ-001");
        spot.setName("한라산 관음사");
        spot.setCategories(List.of("자연"));
        spot.setLat(33.42);
        spot.setLng(126.55);
        when(itineraryService.buildCorridor(eq(start), eq(end), isNull())).thenReturn(corridor);
        when(itineraryService.previewCorridor(corridor))
                .thenReturn(List.of(new CandidateSpot(spot, 0, 3.456, true)));

        // When / Then
        mockMvc.perform(post("/api/itinerary/corridor").contentType(MediaType.APPLICATION_JSON).content("""
                        {
                          "start": {"name": "제주국제공항", "latitude": 33.5066, "longitude": 126.4931},
                          "end": {"name": "서귀포", "latitude": 33.2541, "longitude": 126.5601}
                        }
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.corridor.radiusKm").value(12.0))
                .andExpect(jsonPath("$.items[0].id").value("JJ-001"))
                .andExpect(jsonPath("$.items[0].category").value("자연"))
                .andExpect(jsonPath("$.items[0].distanceFromCorridorKm").value(3.46));
    }

    @Test
    void catalogOutageOnPreviewIsBadGateway() throws Exception {
        // Given
        SpotLocation start = new SpotLocation("제주국제공항", 33.5066, 126.4931, null, null);
        SpotLocation end = new SpotLocation("서귀포", 33.2541, 126.5601, null, null);
        TravelCorridor corridor = new TravelCorridor(start, end, 12,
                new TravelCorridor.CenterLine(33.5066, 126.4931, 33.2541, 126.5601));
        when(itineraryService.buildCorridor(eq(start), eq(end), isNull())).thenReturn(corridor);
        when(itineraryService.previewCorridor(corridor))
                .thenThrow(new ExternalServiceException(ExternalDependency.SPOT_CATALOG, "db down"));

        // When / Then
        mockMvc.perform(post("/api/itinerary/corridor").contentType(MediaType.APPLICATION_JSON).content("""
                        {
                          "start": {"name": "제주국제공항", "latitude": 33.5066, "longitude": 126.4931},
                          "end": {"name": "서귀포", "latitude": 33.2541, "longitude": 126.5601}
                        }
                        """))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("ExternalServiceException"))
                .andExpect(jsonPath("$.dependency").value("SPOT_CATALOG"));
    }
}
