package com.example.jejutrip.service;

import com.example.jejutrip.config.PlannerSettings;
import com.example.jejutrip.exception.DayPlanningException;
import com.example.jejutrip.exception.ExternalServiceException;
import com.example.jejutrip.model.CandidateSpot;
import com.example.jejutrip.model.CatalogSpot;
import com.example.jejutrip.model.DayPlan;
import com.example.jejutrip.model.ItinerarySpot;
import com.example.jejutrip.model.RelevancePreferences;
import com.example.jejutrip.model.RelevanceScore;
import com.example.jejutrip.model.SpotEvaluation;
import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.model.TravelCorridor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 하루 일정 채우기. 남은 후보 중 최고점 스팟을 골라 시계/위치를 전진시키는 탐욕 루프.
 */
@Service
public class DayPlanner {

    private static final Logger log = LoggerFactory.getLogger(DayPlanner.class);

    static final String NOTE_NO_CANDIDATES = "no candidate in corridor";
    static final String NOTE_NO_FEASIBLE = "no feasible candidate";
    static final String NOTE_BUDGET_EXHAUSTED = "daily budget exhausted";

    private final CorridorService corridorService;
    private final RelevanceScorer relevanceScorer;
    private final SpotEvaluator spotEvaluator;
    private final PlannerSettings settings;

    public DayPlanner(CorridorService corridorService,
                      RelevanceScorer relevanceScorer,
                      SpotEvaluator spotEvaluator,
                      PlannerSettings settings) {
        this.corridorService = corridorService;
        this.relevanceScorer = relevanceScorer;
        this.spotEvaluator = spotEvaluator;
        this.settings = settings;
    }

    public record DayRequest(
            int dayNumber,
            LocalDate date,
            SpotLocation start,
            SpotLocation end,
            TravelCorridor corridor,
            List<CatalogSpot> catalog,
            Set<String> excludedIds,
            Set<String> mandatoryIds,
            RelevancePreferences preferences,
            int dailyBudgetMinutes
    ) {
    }

    private enum Phase { PLANNING, DONE }

    private record Stop(CatalogSpot spot, LocalDateTime arrival, LocalDateTime departure,
                        int stayMinutes, int travelIn) {
    }

    /** 하루 단위 루프 상태. planDay 호출마다 새로 만든다. */
    private static final class DayState {
        Phase phase = Phase.PLANNING;
        SpotLocation currentLocation;
        LocalDateTime currentTime;
        String lastVisitedCategory;
        int travelMinutes;
        int activityMinutes;
        String note;
        final List<Stop> stops = new ArrayList<>();

        int usedMinutes() {
            return travelMinutes + activityMinutes;
        }
    }

    public DayPlan planDay(DayRequest day) {
        Map<String, CandidateSpot> remaining = collectCandidates(day);
        log.info("[day {}] corridor {} → {} (r={}km): {} candidate(s)", day.dayNumber(),
                day.start().name(), day.end().name(), day.corridor().radiusKm(), remaining.size());

        if (remaining.isEmpty()) {
            return emptyDay(day, NOTE_NO_CANDIDATES);
        }

        try {
            assignRelevance(remaining, day.preferences());
        } catch (ExternalServiceException e) {
            log.error("[day {}] relevance scoring failed: {}", day.dayNumber(), e.getMessage());
            throw new DayPlanningException(day.dayNumber(), day.date(), e);
        }

        DayState state = new DayState();
        state.currentLocation = day.start();
        state.currentTime = LocalDateTime.of(day.date(), settings.getDayStartTime());

        while (state.phase == Phase.PLANNING) {
            try {
                step(day, state, remaining);
            } catch (ExternalServiceException e) {
                log.error("[day {}] travel time lookup failed: {}", day.dayNumber(), e.getMessage());
                throw new DayPlanningException(day.dayNumber(), day.date(), e);
            }
        }
        return finish(day, state);
    }

    private void step(DayRequest day, DayState state, Map<String, CandidateSpot> remaining) {
        List<SpotEvaluation> ranked = spotEvaluator.evaluate(remaining.values(), state.currentLocation,
                day.end(), state.currentTime, state.lastVisitedCategory, day.mandatoryIds());
        if (ranked.isEmpty()) {
            state.phase = Phase.DONE;
            state.note = state.stops.isEmpty() ? NOTE_NO_FEASIBLE : null;
            return;
        }

        SpotEvaluation best = ranked.get(0);
        CatalogSpot spot = best.candidate().getSpot();
        int travel = best.travelTimeMinutes();
        int stay = stayMinutes(spot);

        // 추가 전에 예산 확인 (long 으로 합산해서 오버플로 방지)
        if ((long) state.usedMinutes() + travel + stay > day.dailyBudgetMinutes()) {
            state.phase = Phase.DONE;
            state.note = NOTE_BUDGET_EXHAUSTED;
            return;
        }

        LocalDateTime arrival = state.currentTime.plusMinutes(travel);
        LocalDateTime departure = arrival.plusMinutes(stay);
        state.stops.add(new Stop(spot, arrival, departure, stay, travel));
        log.info("  [day {}] {}. {} (arrive {}, stay {}min, score {})", day.dayNumber(), state.stops.size(),
                spot.getName(), arrival.toLocalTime(), stay, String.format("%.1f", best.totalScore()));

        state.currentLocation = spot.toLocation();
        state.currentTime = departure;
        state.travelMinutes += travel;
        state.activityMinutes += stay;
        if (spot.primaryCategory() != null) {
            state.lastVisitedCategory = spot.primaryCategory();
        }
        remaining.remove(spot.getPlaceId());
    }

    private Map<String, CandidateSpot> collectCandidates(DayRequest day) {
        List<CandidateSpot> inCorridor = corridorService.filterByCorridor(day.catalog(), day.corridor());
        Map<String, CandidateSpot> byId = new LinkedHashMap<>();
        for (CandidateSpot c : inCorridor) {
            String id = c.getPlaceId();
            if (id == null || day.excludedIds().contains(id)) continue;
            if (byId.putIfAbsent(id, c) != null) {
                log.warn("[day {}] duplicate catalog id {} ignored", day.dayNumber(), id);
            }
        }
        return byId;
    }

    private void assignRelevance(Map<String, CandidateSpot> remaining, RelevancePreferences preferences) {
        List<CatalogSpot> spots = remaining.values().stream().map(CandidateSpot::getSpot).toList();
        List<RelevanceScore> scores = relevanceScorer.scoreRelevance(spots, preferences);

        Map<String, Double> byId = new HashMap<>();
        if (scores != null) {
            for (RelevanceScore s : scores) {
                if (s != null && s.placeId() != null && Double.isFinite(s.score())) {
                    byId.putIfAbsent(s.placeId(), s.score());
                }
            }
        }
        int omitted = 0;
        for (CandidateSpot c : remaining.values()) {
            Double score = byId.get(c.getPlaceId());
            if (score == null) omitted++;
            c.assignRelevance(score == null ? 0.0 : score);
        }
        if (omitted > 0) {
            log.warn("relevance scorer omitted {} candidate(s); scored as 0", omitted);
        }
    }

    private int stayMinutes(CatalogSpot spot) {
        Integer d = spot.getAverageDurationMinutes();
        return (d == null || d <= 0) ? settings.getDefaultStayMinutes() : d;
    }

    private DayPlan finish(DayRequest day, DayState state) {
        List<ItinerarySpot> spots = new ArrayList<>();
        for (int i = 0; i < state.stops.size(); i++) {
            Stop s = state.stops.get(i);
            Integer toNext = (i + 1 < state.stops.size()) ? state.stops.get(i + 1).travelIn() : null;
            spots.add(new ItinerarySpot(s.spot(), s.arrival().toLocalTime(), s.departure().toLocalTime(),
                    s.stayMinutes(), s.travelIn(), toNext));
        }
        log.info("[day {}] done: {} spot(s), travel {}min, activity {}min{}", day.dayNumber(), spots.size(),
                state.travelMinutes, state.activityMinutes, state.note == null ? "" : " (" + state.note + ")");

        return DayPlan.builder()
                .date(day.date())
                .dayNumber(day.dayNumber())
                .startLocation(day.start())
                .endLocation(day.end())
                .spots(List.copyOf(spots))
                .totalTravelTimeMinutes(state.travelMinutes)
                .totalActivityTimeMinutes(state.activityMinutes)
                .corridor(day.corridor())
                .note(state.note)
                .build();
    }

    private DayPlan emptyDay(DayRequest day, String note) {
        return DayPlan.builder()
                .date(day.date())
                .dayNumber(day.dayNumber())
                .startLocation(day.start())
                .endLocation(day.end())
                .corridor(day.corridor())
                .note(note)
                .build();
    }
}
