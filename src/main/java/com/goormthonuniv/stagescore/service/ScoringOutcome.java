package com.goormthonuniv.stagescore.service;

import com.goormthonuniv.stagescore.dto.NormalizedReview;
import com.goormthonuniv.stagescore.dto.RejectedReview;

/** 리뷰 한 건 채점 결과: 정규화 성공 또는 거절 둘 중 하나 */
public record ScoringOutcome(NormalizedReview review, RejectedReview rejection) {

    public static ScoringOutcome scored(NormalizedReview review) {
        return new ScoringOutcome(review, null);
    }

    public static ScoringOutcome rejected(RejectedReview rejection) {
        return new ScoringOutcome(null, rejection);
    }

    public boolean isScored() {
        return review != null;
    }
}
