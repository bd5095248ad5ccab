package com.goormthonuniv.stagescore.dto;

import java.time.Instant;
import java.util.List;

public record BatchReport(
        String jobId,
        BatchStatus status,
        Instant startedAt,
        Instant finishedAt,
        List<ShowRunResult> shows
) {
    public BatchReport {
        shows = shows == null ? List.of() : List.copyOf(shows);
    }
}
