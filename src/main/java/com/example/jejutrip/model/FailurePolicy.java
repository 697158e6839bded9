package com.example.jejutrip.model;

/** 외부 서비스 실패 시 처리 방식 */
public enum FailurePolicy {
    /** 전체 일정 생성을 중단한다 */
    ABORT,
    /** 실패한 날을 빈 일정 + 경고로 대체하고 계속 진행한다 */
    BEST_EFFORT
}
