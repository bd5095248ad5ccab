package com.goormthonuniv.stagescore.dedupe;

import com.goormthonuniv.stagescore.dto.NormalizedReview;

import java.util.List;

/** 기존 저장분 + 새 배치 병합 결과 */
public record MergeOutcome(
        List<NormalizedReview> reviews,
        int added,
        int updated,
        int unchanged,
        int duplicatesRemoved,     // 새 배치 내부 중복
        List<DuplicateConflict> conflicts
) {
    public MergeOutcome {
        reviews = List.copyOf(reviews);
        conflicts = List.copyOf(conflicts);
    }
}
