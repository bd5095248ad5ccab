package com.goormthonuniv.stagescore.dedupe;

import com.goormthonuniv.stagescore.dto.NormalizedReview;

import java.util.List;

public record DedupeResult(
        List<NormalizedReview> reviews,
        int duplicatesRemoved,
        List<DuplicateConflict> conflicts
) {
    public DedupeResult {
        reviews = List.copyOf(reviews);
        conflicts = List.copyOf(conflicts);
    }
}
