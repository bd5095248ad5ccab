package com.goormthonuniv.stagescore.aggregate;

import com.goormthonuniv.stagescore.dto.*;
import com.goormthonuniv.stagescore.outlet.OutletResolver;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 공연 단위 가중 평균: Σ(score × tierWeight) / Σ tierWeight.
 * 리뷰 수가 minReviews 미만이면 점수 없이 pending.
 */
public class ShowAggregator {

    private final OutletResolver outlets;
    private final AggregationPolicy policy;
    private final Clock clock;

    public ShowAggregator(OutletResolver outlets, AggregationPolicy policy, Clock clock) {
        this.outlets = outlets;
        this.policy = policy;
        this.clock = clock;
    }

    public ShowAggregate aggregate(String showId, List<NormalizedReview> reviews) {
        Map<Integer, TierStats> tiers = new TreeMap<>();
        for (int t = 1; t <= 3; t++) tiers.put(t, TierStats.EMPTY);
        Map<Bucket, Integer> buckets = new EnumMap<>(Bucket.class);
        for (Bucket b : Bucket.values()) buckets.put(b, 0);

        for (NormalizedReview r : reviews) {
            int tier = outlets.tierOf(r.outletId());
            tiers.merge(tier, TierStats.EMPTY.add(r.assignedScore()),
                    (a, b) -> new TierStats(a.count() + b.count(), a.scoreSum() + b.scoreSum()));
            buckets.merge(Bucket.of(r.assignedScore()), 1, Integer::sum);
        }

        int count = reviews.size();
        int tier1 = tiers.get(1).count();
        Integer percentPositive = count == 0 ? null
                : (int) Math.round(100.0 * (buckets.get(Bucket.RAVE) + buckets.get(Bucket.POSITIVE)) / count);

        AggregateConfidence confidence = confidence(count, tier1);
        Double score = confidence == AggregateConfidence.PENDING ? null : round2(weightedMean(reviews));

        return new ShowAggregate(showId, score, count, tiers, buckets, percentPositive, confidence, clock.instant());
    }

    /** tier 가중 평균 (리뷰가 없으면 NaN) */
    public double weightedMean(List<NormalizedReview> reviews) {
        double num = 0, den = 0;
        for (NormalizedReview r : reviews) {
            double w = outlets.tierWeight(r.outletId());
            num += r.assignedScore() * w;
            den += w;
        }
        return den == 0 ? Double.NaN : num / den;
    }

    AggregateConfidence confidence(int count, int tier1) {
        if (count < policy.minReviews()) return AggregateConfidence.PENDING;
        if (count >= policy.highReviews() && tier1 >= policy.highTier1()) return AggregateConfidence.HIGH;
        if (count >= policy.mediumReviews() && tier1 >= policy.mediumTier1()) return AggregateConfidence.MEDIUM;
        return AggregateConfidence.LOW;
    }

    private static double round2(double v) {
        return Math.round(v * 100) / 100.0;
    }
}
