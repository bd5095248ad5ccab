package com.goormthonuniv.stagescore.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 공연 단위 집계. 항상 현재 리뷰 전체로부터 통째로 다시 계산된다.
 * confidence 가 PENDING 이면 weightedScore 는 null (부분 평균을 노출하지 않음).
 */
public record ShowAggregate(
        String showId,
        Double weightedScore,
        int reviewCount,
        Map<Integer, TierStats> tiers,
        Map<Bucket, Integer> bucketCounts,
        Integer percentPositive,
        AggregateConfidence confidence,
        Instant computedAt
) {
    public ShowAggregate {
        // 출력 순서 고정: tier 오름차순, 버킷 선언 순
        tiers = tiers == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(tiers));
        bucketCounts = bucketCounts == null || bucketCounts.isEmpty() ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(bucketCounts));
    }

    @JsonIgnore
    public boolean isPending() {
        return confidence == AggregateConfidence.PENDING;
    }

    public Integer displayScore() {
        return weightedScore == null ? null : (int) Math.round(weightedScore);
    }
}
