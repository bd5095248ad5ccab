package com.goormthonuniv.stagescore.dto;

/**
 * 앙상블 채점 결과.
 * secondary/tiebreaker/disagreement 는 해당 호출이 실패했거나 수행되지 않았으면 null.
 */
public record EnsembleResult(
        int primaryScore,
        Integer secondaryScore,
        Integer tiebreakerScore,
        int finalScore,
        Confidence confidence,
        Integer disagreement,
        boolean flagForReview,
        boolean primaryFromFallback
) {}
