package com.goormthonuniv.stagescore.aggregate;

/** 집계 신뢰도 임계값 */
public record AggregationPolicy(
        int minReviews,          // 미만이면 pending
        int highReviews,
        int highTier1,
        int mediumReviews,
        int mediumTier1
) {
    public static AggregationPolicy defaults() {
        return new AggregationPolicy(5, 15, 3, 6, 1);
    }
}
