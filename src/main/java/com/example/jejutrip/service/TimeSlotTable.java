package com.example.jejutrip.service;

import com.example.jejutrip.model.CatalogSpot;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 시간대별 선호/회피 카테고리 표와 연속 방문 보너스.
 * 슬롯은 [startHour, endHour) 반열린 구간이며 서로 겹치지 않는다. 빈 구간은 중립 점수.
 */
@Getter
@Builder
public class TimeSlotTable {

    public static final int MAX_SCORE = 30;

    private final List<TimeSlotPreference> slots;
    @Builder.Default private final List<SequenceBonus> sequenceBonuses = List.of();
    @Builder.Default private final int neutralScore = 15;
    @Builder.Default private final int baseScore = 10;
    @Builder.Default private final int preferredScore = 30;
    @Builder.Default private final int avoidPenalty = 20;
    @Builder.Default private final int repetitionPenalty = 10;

    public record TimeSlotPreference(
            int startHour,
            int endHour,
            Set<String> preferredCategories,
            Set<String> avoidCategories,
            String label
    ) {
        public TimeSlotPreference {
            if (startHour >= endHour) {
                throw new IllegalArgumentException("empty slot " + label + ": " + startHour + "-" + endHour);
            }
        }

        boolean covers(int hour) {
            return hour >= startHour && hour < endHour;
        }
    }

    /** 직전 카테고리 → 다음 카테고리 조합이 특정 시간대에 나오면 가산점 */
    public record SequenceBonus(
            Set<String> previousCategories,
            int startHour,
            int endHour,
            Set<String> nextCategories,
            int bonus
    ) {
    }

    public static TimeSlotTable jejuDefaults() {
        return TimeSlotTable.builder()
                .slots(List.of(
                        new TimeSlotPreference(9, 11,
                                Set.of("관광지", "자연", "오름", "포토존", "박물관"),
                                Set.of("맛집", "카페"), "오전 - 관광/자연 활동"),
                        new TimeSlotPreference(11, 13,
                                Set.of("맛집", "식당"),
                                Set.of("카페"), "점심시간 - 식사"),
                        new TimeSlotPreference(13, 15,
                                Set.of("카페", "디저트"),
                                Set.of("맛집", "식당"), "식후 - 카페/디저트"),
                        new TimeSlotPreference(15, 17,
                                Set.of("관광지", "포토존", "쇼핑", "자연"),
                                Set.of("맛집"), "오후 - 관광/쇼핑"),
                        new TimeSlotPreference(17, 19,
                                Set.of("일몰명소", "포토존", "해변", "카페"),
                                Set.of(), "일몰시간 - 경치 감상"),
                        new TimeSlotPreference(19, 21,
                                Set.of("맛집", "식당"),
                                Set.of("카페", "관광지"), "저녁시간 - 저녁식사"),
                        new TimeSlotPreference(21, 23,
                                Set.of("야경", "술집", "바"),
                                Set.of("관광지", "오름"), "저녁 늦은시간 - 야경/바")))
                .sequenceBonuses(List.of(
                        new SequenceBonus(Set.of("맛집", "식당"), 13, 15, Set.of("카페", "디저트"), 15)))
                .build();
    }

    public Optional<TimeSlotPreference> slotAt(LocalDateTime time) {
        int hour = time.getHour();
        return slots.stream().filter(s -> s.covers(hour)).findFirst();
    }

    /**
     * 시간대 적합도 0~30.
     *
     * @param lastVisitedCategory 직전 방문지의 대표 카테고리, 첫 방문이면 null
     */
    public int scoreTimeCategory(CatalogSpot spot, LocalDateTime currentTime, String lastVisitedCategory) {
        Optional<TimeSlotPreference> slot = slotAt(currentTime);
        List<String> categories = spot.getCategories();
        if (slot.isEmpty() || categories == null || categories.isEmpty()) {
            return neutralScore;
        }
        TimeSlotPreference pref = slot.get();

        int score = matchesAny(categories, pref.preferredCategories()) ? preferredScore : baseScore;
        if (matchesAny(categories, pref.avoidCategories())) {
            score -= avoidPenalty;
        }
        // 같은 카테고리 연속 방지 (맛집 -> 맛집, 카페 -> 카페)
        if (lastVisitedCategory != null && categories.contains(lastVisitedCategory)) {
            score -= repetitionPenalty;
        }
        if (lastVisitedCategory != null) {
            int hour = currentTime.getHour();
            for (SequenceBonus b : sequenceBonuses) {
                if (hour >= b.startHour() && hour < b.endHour()
                        && containsAny(lastVisitedCategory, b.previousCategories())
                        && matchesAny(categories, b.nextCategories())) {
                    score += b.bonus();
                }
            }
        }
        return Math.max(0, Math.min(MAX_SCORE, score));
    }

    private static boolean matchesAny(List<String> categories, Set<String> keywords) {
        if (keywords == null || keywords.isEmpty()) return false;
        for (String c : categories) {
            if (c != null && containsAny(c, keywords)) return true;
        }
        return false;
    }

    private static boolean containsAny(String category, Set<String> keywords) {
        for (String k : keywords) {
            if (category.contains(k)) return true;
        }
        return false;
    }
}
