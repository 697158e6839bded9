package com.example.jejutrip.config;

import com.example.jejutrip.model.FailurePolicy;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * 일정 생성 가중치/상수. 테스트에서는 builder 로 결정적 값을 주입한다.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class PlannerSettings {

    @Builder.Default private final double corridorRadiusKm = 12.0;
    @Builder.Default private final int maxTravelMinutesPerHop = 40;
    @Builder.Default private final double minDirectionScore = 20.0;

    @Builder.Default private final double relevanceWeight = 0.30;
    @Builder.Default private final double directionWeight = 0.25;
    @Builder.Default private final double travelEfficiencyWeight = 0.15;
    @Builder.Default private final double timeCategoryWeight = 0.20;
    @Builder.Default private final double openBonus = 10.0;
    @Builder.Default private final double mandatoryBonus = 50.0;

    @Builder.Default private final int defaultStayMinutes = 60;
    @Builder.Default private final LocalTime dayStartTime = LocalTime.of(9, 0);
    @Builder.Default private final int maxTripDays = 30;
    @Builder.Default private final FailurePolicy failurePolicy = FailurePolicy.ABORT;
    @Builder.Default private final ZoneId zoneId = ZoneId.of("Asia/Seoul");

    public static PlannerSettings defaults() {
        return PlannerSettings.builder().build();
    }
}
