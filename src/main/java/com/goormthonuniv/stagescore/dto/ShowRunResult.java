package com.goormthonuniv.stagescore.dto;

import java.util.List;

public record ShowRunResult(
        String showId,
        int received,
        int scored,
        List<RejectedReview> rejected,
        int added,
        int updated,
        int unchanged,
        int duplicatesRemoved,
        ShowAggregate aggregate,
        int auditEntries,
        boolean persisted,
        String error            // 공연 단위 처리 실패 시 사유 (성공이면 null)
) {
    public ShowRunResult {
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public static ShowRunResult failed(String showId, int received, String error) {
        return new ShowRunResult(showId, received, 0, List.of(), 0, 0, 0, 0, null, 0, false, error);
    }
}
