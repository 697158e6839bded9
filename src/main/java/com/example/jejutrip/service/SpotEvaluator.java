package com.example.jejutrip.service;

import com.example.jejutrip.config.PlannerSettings;
import com.example.jejutrip.exception.ExternalDependency;
import com.example.jejutrip.exception.ExternalServiceException;
import com.example.jejutrip.model.CandidateSpot;
import com.example.jejutrip.model.CatalogSpot;
import com.example.jejutrip.model.SpotEvaluation;
import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.model.TravelEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * 남은 후보 전체를 현재 위치/시간 기준으로 평가하고 총점 내림차순으로 돌려준다.
 */
@Service
public class SpotEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SpotEvaluator.class);

    static final Comparator<SpotEvaluation> RANKING =
            Comparator.comparingDouble(SpotEvaluation::totalScore).reversed()
                    .thenComparingInt(e -> e.candidate().getCatalogOrder());

    private final TravelTimeOracle travelTimeOracle;
    private final DirectionScorer directionScorer;
    private final TimeSlotTable timeSlotTable;
    private final PlannerSettings settings;

    public SpotEvaluator(TravelTimeOracle travelTimeOracle,
                         DirectionScorer directionScorer,
                         TimeSlotTable timeSlotTable,
                         PlannerSettings settings) {
        this.travelTimeOracle = travelTimeOracle;
        this.directionScorer = directionScorer;
        this.timeSlotTable = timeSlotTable;
        this.settings = settings;
    }

    public List<SpotEvaluation> evaluate(Collection<CandidateSpot> remaining,
                                         SpotLocation currentLocation,
                                         SpotLocation finalDestination,
                                         LocalDateTime currentTime,
                                         String lastVisitedCategory,
                                         Set<String> mandatoryIds) {
        if (remaining.isEmpty()) return List.of();

        List<CandidateSpot> candidates = new ArrayList<>(remaining);
        List<SpotLocation> destinations = candidates.stream().map(CandidateSpot::location).toList();

        // 라운드당 한 번, 남은 후보 전체를 묶어서 조회
        List<TravelEstimate> estimates =
                travelTimeOracle.estimateTravelTime(currentLocation, destinations, currentTime);
        if (estimates == null || estimates.size() != candidates.size()) {
            throw new ExternalServiceException(ExternalDependency.TRAVEL_TIME_ORACLE,
                    "expected " + candidates.size() + " travel estimates, got "
                            + (estimates == null ? "null" : estimates.size()));
        }

        int ceiling = settings.getMaxTravelMinutesPerHop();
        List<SpotEvaluation> evaluations = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            CandidateSpot candidate = candidates.get(i);
            int travelTime = estimates.get(i).durationMinutes();

            double direction = directionScorer.directionScore(currentLocation, destinations.get(i), finalDestination);
            if (direction < settings.getMinDirectionScore()) {
                continue;                                   // 역방향
            }
            if (travelTime > ceiling) {
                continue;
            }

            CatalogSpot spot = candidate.getSpot();
            boolean open = isOpenAt(spot, currentTime);
            boolean mandatory = mandatoryIds.contains(candidate.getPlaceId());
            double travelEfficiency = Math.max(0.0, 100.0 - (double) travelTime / ceiling * 100.0);
            int timeCategory = timeSlotTable.scoreTimeCategory(spot, currentTime, lastVisitedCategory);

            double total = candidate.getRelevanceScore() * settings.getRelevanceWeight()
                    + direction * settings.getDirectionWeight()
                    + travelEfficiency * settings.getTravelEfficiencyWeight()
                    + timeCategory * settings.getTimeCategoryWeight()
                    + (open ? settings.getOpenBonus() : 0.0);
            if (mandatory) {
                total += settings.getMandatoryBonus();
            }
            if (!Double.isFinite(total)) {
                log.warn("[evaluate] non-finite score for {}, treated as 0", spot.getPlaceId());
                total = 0.0;
            }

            log.debug("  {}: total={} (relevance={}, direction={}, timeSlot={}, travel={}min)",
                    spot.getName(), String.format("%.1f", total), candidate.getRelevanceScore(),
                    String.format("%.1f", direction), timeCategory, travelTime);

            evaluations.add(new SpotEvaluation(candidate, travelTime, direction, candidate.getRelevanceScore(),
                    travelEfficiency, timeCategory, open, mandatory, total));
        }

        evaluations.sort(RANKING);
        return evaluations;
    }

    /** 영업시간 문자열은 해석하지 않는다. 폐업/휴업 표시가 없으면 영업 중. */
    boolean isOpenAt(CatalogSpot spot, LocalDateTime time) {
        return !spot.isClosed();
    }
}
