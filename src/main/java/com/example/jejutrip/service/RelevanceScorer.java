package com.example.jejutrip.service;

import com.example.jejutrip.model.CatalogSpot;
import com.example.jejutrip.model.RelevancePreferences;
import com.example.jejutrip.model.RelevanceScore;

import java.util.List;

/**
 * 후보 스팟의 사용자 선호 관련성(0~100) 평가. 하루에 한 번, 코리도 내 후보 전체를 묶어서 호출한다.
 * 실패 시 {@link com.example.jejutrip.exception.ExternalServiceException}.
 */
public interface RelevanceScorer {

    List<RelevanceScore> scoreRelevance(List<CatalogSpot> candidates, RelevancePreferences preferences);
}
