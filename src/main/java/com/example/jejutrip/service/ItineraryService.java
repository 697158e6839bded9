package com.example.jejutrip.service;

import com.example.jejutrip.config.PlannerSettings;
import com.example.jejutrip.controller.dto.ItineraryRequest;
import com.example.jejutrip.exception.DayPlanningException;
import com.example.jejutrip.exception.ExternalDependency;
import com.example.jejutrip.exception.ExternalServiceException;
import com.example.jejutrip.exception.ItineraryGenerationException;
import com.example.jejutrip.exception.ItineraryValidationException;
import com.example.jejutrip.model.CandidateSpot;
import com.example.jejutrip.model.CatalogSpot;
import com.example.jejutrip.model.DayPlan;
import com.example.jejutrip.model.FailurePolicy;
import com.example.jejutrip.model.ItinerarySpot;
import com.example.jejutrip.model.RelevancePreferences;
import com.example.jejutrip.model.RouteSegment;
import com.example.jejutrip.model.SpotLocation;
import com.example.jejutrip.model.TravelCorridor;
import com.example.jejutrip.model.TravelItinerary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 여행 일정 생성: 날짜별 코리도 → 하루 일정 → 전체 경로 연결.
 * 날짜는 순서대로만 계획한다 (다음 날 출발지 = 전날 도착지).
 */
@Service
public class ItineraryService {

    private static final Logger log = LoggerFactory.getLogger(ItineraryService.class);

    private final SpotCatalog spotCatalog;
    private final CorridorService corridorService;
    private final DayPlanner dayPlanner;
    private final RouteOracle routeOracle;
    private final PlannerSettings settings;

    public ItineraryService(SpotCatalog spotCatalog,
                            CorridorService corridorService,
                            DayPlanner dayPlanner,
                            RouteOracle routeOracle,
                            PlannerSettings settings) {
        this.spotCatalog = spotCatalog;
        this.corridorService = corridorService;
        this.dayPlanner = dayPlanner;
        this.routeOracle = routeOracle;
        this.settings = settings;
    }

    /** 카탈로그 DB 에서 좌표 있는 스팟 전체를 읽어서 일정 생성 */
    public TravelItinerary generateItinerary(ItineraryRequest request) {
        validate(request);
        List<CatalogSpot> catalog;
        try {
            catalog = spotCatalog.listSpotsWithCoordinates();
        } catch (ExternalServiceException e) {
            throw new ItineraryGenerationException(null, e.getDependency(),
                    "catalog read failed: " + e.getMessage(), e);
        }
        return generateItinerary(request, catalog);
    }

    public TravelItinerary generateItinerary(ItineraryRequest request, List<CatalogSpot> catalog) {
        validate(request);
        final double radiusKm = request.getCorridorRadiusKm() != null
                ? request.getCorridorRadiusKm() : settings.getCorridorRadiusKm();
        final FailurePolicy policy = request.getFailurePolicy() != null
                ? request.getFailurePolicy() : settings.getFailurePolicy();
        final int totalDays = (int) ChronoUnit.DAYS.between(request.getStartDate(), request.getEndDate()) + 1;
        final int dailyBudget = (int) Math.floor(request.getDailyTravelHours() * 60);
        final List<CatalogSpot> spots = catalog == null ? List.of() : catalog;

        log.info("itinerary start: {} ~ {} ({} day(s)), {} catalog spot(s), policy={}",
                request.getStartDate(), request.getEndDate(), totalDays, spots.size(), policy);

        Set<String> mandatoryIds = new HashSet<>();
        List<String> fixedNames = new ArrayList<>();
        for (ItineraryRequest.FixedSpot f : nvl(request.getFixedSpots())) {
            if (f == null) continue;
            if (f.getPlaceId() != null) mandatoryIds.add(f.getPlaceId());
            if (f.getName() != null) fixedNames.add(f.getName());
        }
        RelevancePreferences preferences = new RelevancePreferences(
                nvl(request.getInterests()), nvl(request.getCompanions()),
                request.getPace(), request.getBudget(),
                request.isPreferRainyDay(), request.isPreferHiddenGems(), request.isAvoidCrowds(),
                fixedNames);

        List<DayPlan> plans = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        SpotLocation dayStart = request.getStartPoint();

        for (int i = 0; i < totalDays; i++) {
            LocalDate date = request.getStartDate().plusDays(i);
            int dayNumber = i + 1;
            SpotLocation dayEnd = (i == totalDays - 1)
                    ? request.getEndPoint()
                    : accommodationFor(request, date, i);

            TravelCorridor corridor = corridorService.buildCorridor(dayStart, dayEnd, radiusKm);
            DayPlan plan;
            try {
                plan = dayPlanner.planDay(new DayPlanner.DayRequest(dayNumber, date, dayStart, dayEnd, corridor,
                        spots, Set.copyOf(visited), Set.copyOf(mandatoryIds), preferences, dailyBudget));
            } catch (DayPlanningException e) {
                if (policy == FailurePolicy.ABORT) {
                    throw new ItineraryGenerationException(dayNumber, e.getDependency(), e.getMessage(), e);
                }
                String warning = "day " + dayNumber + " left empty: " + e.getDependency() + " failed ("
                        + e.getCause().getMessage() + ")";
                log.warn("[best-effort] {}", warning);
                warnings.add(warning);
                plan = DayPlan.builder()
                        .date(date)
                        .dayNumber(dayNumber)
                        .startLocation(dayStart)
                        .endLocation(dayEnd)
                        .corridor(corridor)
                        .note("planning failed")
                        .warning(warning)
                        .build();
            }

            for (ItinerarySpot s : plan.getSpots()) {
                visited.add(s.spot().getPlaceId());
            }
            plans.add(plan);
            dayStart = dayEnd;
        }

        List<RouteSegment> routes = stitch(plans, policy, warnings);

        TravelItinerary itinerary = TravelItinerary.builder()
                .request(request)
                .plans(List.copyOf(plans))
                .routes(routes)
                .summary(summarize(plans))
                .warnings(List.copyOf(warnings))
                .generatedAt(Instant.now())
                .build();
        log.info("itinerary done: {} day(s), {} spot(s), {} warning(s)", itinerary.getSummary().totalDays(),
                itinerary.getSummary().totalSpots(), warnings.size());
        return itinerary;
    }

    /** 두 지점 사이 코리도와 그 안의 카탈로그 후보 (중심선 거리순) */
    public List<CandidateSpot> previewCorridor(TravelCorridor corridor) {
        List<CandidateSpot> candidates = new ArrayList<>(
                corridorService.filterByCorridor(spotCatalog.listSpotsWithCoordinates(), corridor));
        candidates.sort(Comparator.comparingDouble(CandidateSpot::getDistanceFromCorridorKm));
        return candidates;
    }

    public TravelCorridor buildCorridor(SpotLocation start, SpotLocation end, Double radiusKm) {
        requireLocation(start, "start");
        requireLocation(end, "end");
        return corridorService.buildCorridor(start, end,
                radiusKm == null ? settings.getCorridorRadiusKm() : radiusKm);
    }

    /* ================================== 내부 헬퍼 ================================== */

    void validate(ItineraryRequest req) {
        if (req == null) throw new ItineraryValidationException("request is required");
        if (req.getStartDate() == null || req.getEndDate() == null) {
            throw new ItineraryValidationException("startDate/endDate are required");
        }
        if (req.getEndDate().isBefore(req.getStartDate())) {
            throw new ItineraryValidationException("endDate " + req.getEndDate()
                    + " is before startDate " + req.getStartDate());
        }
        long days = ChronoUnit.DAYS.between(req.getStartDate(), req.getEndDate()) + 1;
        if (days > settings.getMaxTripDays()) {
            throw new ItineraryValidationException("trip of " + days + " days exceeds "
                    + settings.getMaxTripDays());
        }
        if (req.getDailyTravelHours() == null || !(req.getDailyTravelHours() > 0)
                || !Double.isFinite(req.getDailyTravelHours())) {
            throw new ItineraryValidationException("dailyTravelHours must be positive");
        }
        // 하루 일정이 자정을 넘기면 안 됨 (도착/출발 시각은 LocalTime)
        int minutesUntilMidnight = 24 * 60 - settings.getDayStartTime().toSecondOfDay() / 60;
        if (Math.floor(req.getDailyTravelHours() * 60) > minutesUntilMidnight) {
            throw new ItineraryValidationException("dailyTravelHours " + req.getDailyTravelHours()
                    + " runs past midnight from day start " + settings.getDayStartTime());
        }
        requireLocation(req.getStartPoint(), "startPoint");
        requireLocation(req.getEndPoint(), "endPoint");
        for (ItineraryRequest.AccommodationByDate a : nvl(req.getAccommodations())) {
            if (a != null && a.getLocation() != null && !a.getLocation().hasValidCoordinates()) {
                throw new ItineraryValidationException("accommodation on " + a.getDate()
                        + " has invalid coordinates");
            }
        }
        if (req.getCorridorRadiusKm() != null
                && (!(req.getCorridorRadiusKm() > 0) || !Double.isFinite(req.getCorridorRadiusKm()))) {
            throw new ItineraryValidationException("corridorRadiusKm must be positive");
        }
    }

    private static void requireLocation(SpotLocation location, String field) {
        if (location == null || !location.hasValidCoordinates()) {
            throw new ItineraryValidationException(field + " coordinates are required");
        }
    }

    /** 해당 날짜 숙소 → 같은 순번 숙소 → 여행 도착점 순으로 결정 */
    private SpotLocation accommodationFor(ItineraryRequest req, LocalDate date, int index) {
        List<ItineraryRequest.AccommodationByDate> stays = nvl(req.getAccommodations());
        for (ItineraryRequest.AccommodationByDate a : stays) {
            if (a != null && date.equals(a.getDate()) && a.getLocation() != null) {
                return a.getLocation();
            }
        }
        if (index < stays.size()) {
            ItineraryRequest.AccommodationByDate a = stays.get(index);
            if (a != null && a.getDate() == null && a.getLocation() != null) {
                return a.getLocation();
            }
        }
        return req.getEndPoint();
    }

    private List<RouteSegment> stitch(List<DayPlan> plans, FailurePolicy policy, List<String> warnings) {
        List<SpotLocation> waypoints = new ArrayList<>();
        for (DayPlan plan : plans) {
            waypoints.add(plan.getStartLocation());
            for (ItinerarySpot s : plan.getSpots()) {
                waypoints.add(s.spot().toLocation());
            }
        }
        waypoints.add(plans.get(plans.size() - 1).getEndLocation());

        try {
            List<RouteSegment> routes = routeOracle.stitchRoute(waypoints);
            return routes == null ? List.of() : List.copyOf(routes);
        } catch (ExternalServiceException e) {
            if (policy == FailurePolicy.ABORT) {
                throw new ItineraryGenerationException(null, ExternalDependency.ROUTE_ORACLE,
                        "route stitching failed: " + e.getMessage(), e);
            }
            String warning = "route stitching skipped: " + e.getMessage();
            log.warn("[best-effort] {}", warning);
            warnings.add(warning);
            return List.of();
        }
    }

    private static TravelItinerary.Summary summarize(List<DayPlan> plans) {
        int spots = plans.stream().mapToInt(p -> p.getSpots().size()).sum();
        int travel = plans.stream().mapToInt(DayPlan::getTotalTravelTimeMinutes).sum();
        Set<String> regions = new LinkedHashSet<>();
        plans.stream()
                .flatMap(p -> p.getSpots().stream())
                .map(s -> s.spot().getRegion())
                .filter(Objects::nonNull)
                .filter(r -> !r.isBlank())
                .forEach(regions::add);
        return new TravelItinerary.Summary(plans.size(), spots, travel, List.copyOf(regions));
    }

    private static <T> List<T> nvl(List<T> list) {
        return list == null ? List.of() : list;
    }
}
