package com.goormthonuniv.stagescore.dto;

/** 점수의 출처(provenance). EXPLICIT 가 가장 신뢰도가 높다. */
public enum ScoreSource {
    EXPLICIT,   // 평론가가 직접 남긴 별점/등급/숫자
    INFERRED,   // 키워드 휴리스틱 추정치
    ENSEMBLE    // 자동 채점기(oracle) 앙상블 + 보정
}
