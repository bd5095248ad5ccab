package com.goormthonuniv.stagescore.dedupe;

/** 병합된 중복끼리 점수가 달랐던 기록. 버려진 값은 감사 로그/리포트에만 남는다 */
public record DuplicateConflict(
        String showId,
        String outletId,
        String criticName,
        MatchType matchType,
        int keptScore,
        int discardedScore,
        String keptUrl,
        String discardedUrl
) {}
