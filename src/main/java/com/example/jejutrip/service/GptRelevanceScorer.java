package com.example.jejutrip.service;

import com.example.jejutrip.exception.ExternalDependency;
import com.example.jejutrip.exception.ExternalServiceException;
import com.example.jejutrip.model.CatalogSpot;
import com.example.jejutrip.model.RelevancePreferences;
import com.example.jejutrip.model.RelevanceScore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GPT 로 후보 스팟의 사용자 선호 적합도를 0~100 으로 채점.
 */
public class GptRelevanceScorer implements RelevanceScorer {

    private static final Logger log = LoggerFactory.getLogger(GptRelevanceScorer.class);

    private final GptClient gptClient;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper om = new ObjectMapper();

    public GptRelevanceScorer(GptClient gptClient, RetryPolicy retryPolicy) {
        this.gptClient = gptClient;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public List<RelevanceScore> scoreRelevance(List<CatalogSpot> candidates, RelevancePreferences preferences) {
        if (candidates.isEmpty()) return List.of();

        String prompt = buildPrompt(toJson(candidates.stream().map(this::toPayload).toList()),
                toJson(preferencePayload(preferences)));
        String raw = retryPolicy.execute(ExternalDependency.RELEVANCE_SCORER, () -> gptClient.completeJson(prompt));
        List<RelevanceScore> scores = parseScores(raw);
        log.info("[gpt] scored {}/{} candidate(s)", scores.size(), candidates.size());
        return scores;
    }

    String buildPrompt(String candidatesJson, String preferencesJson) {
        String template = """
    당신은 제주 여행 큐레이터입니다. 사용자 선호를 보고 각 후보 스팟의 적합도를 0~100 점으로 평가하세요.
    **반드시 유효한 JSON만** 출력하세요. 설명 금지.

    제약:
    - 입력 후보의 place_id 만 사용하세요(새 id 금지).
    - 모든 후보에 점수를 매기세요.
    - 필수 방문지(fixed_spots)와 이름이 같은 후보는 높은 점수를 주세요.
    - prefer_rainy_day / prefer_hidden_gems / avoid_crowds 가 true 이면 해당 속성을 반영하세요.
    - 동선/거리는 고려하지 마세요(별도로 계산합니다).

    후보목록(candidates): %s
    사용자선호(preferences): %s

    출력 JSON 스키마:
    { "scores": [ { "place_id": "string", "score": 0, "reasoning": "이유(최대60자)" } ] }
    """;
        return String.format(template, candidatesJson, preferencesJson);
    }

    List<RelevanceScore> parseScores(String json) {
        try {
            JsonNode arr = om.readTree(json).path("scores");
            if (!arr.isArray()) {
                throw new ExternalServiceException(ExternalDependency.RELEVANCE_SCORER,
                        "relevance reply has no scores array");
            }
            List<RelevanceScore> out = new ArrayList<>();
            for (JsonNode it : arr) {
                String id = it.path("place_id").asText(null);
                if (id == null || !it.path("score").isNumber()) continue;
                double score = Math.max(0, Math.min(100, it.path("score").asDouble()));
                out.add(new RelevanceScore(id, score, it.path("reasoning").asText("")));
            }
            return out;
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException(ExternalDependency.RELEVANCE_SCORER,
                    "relevance reply is not JSON: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> toPayload(CatalogSpot s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("place_id", s.getPlaceId());
        m.put("place_name", nvl(s.getName()));
        m.put("categories", s.getCategories() == null ? List.of() : s.getCategories());
        m.put("region", nvl(s.getRegion()));
        m.put("tags", s.getTags() == null ? List.of() : s.getTags());
        m.put("interest_tags", s.getInterestTags() == null ? List.of() : s.getInterestTags());
        if (s.getRainyDayFriendly() != null) m.put("rainy_day_friendly", s.getRainyDayFriendly());
        if (s.getHiddenGem() != null) m.put("is_hidden_gem", s.getHiddenGem());
        return m;
    }

    private Map<String, Object> preferencePayload(RelevancePreferences p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("interests", p.interests());
        m.put("companions", p.companions());
        if (p.pace() != null) m.put("pace", p.pace().name().toLowerCase());
        if (p.budget() != null) m.put("budget", p.budget().name().toLowerCase());
        m.put("prefer_rainy_day", p.preferRainyDay());
        m.put("prefer_hidden_gems", p.preferHiddenGems());
        m.put("avoid_crowds", p.avoidCrowds());
        m.put("fixed_spots", p.fixedSpotNames());
        return m;
    }

    private String toJson(Object v) {
        try {
            return om.writeValueAsString(v);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize prompt payload", e);
        }
    }

    private static String nvl(String s) {
        return s == null ? "" : s;
    }
}
