package com.goormthonuniv.stagescore.store;

import com.goormthonuniv.stagescore.dto.AuditReport;
import com.goormthonuniv.stagescore.dto.NormalizedReview;
import com.goormthonuniv.stagescore.dto.ShowAggregate;

import java.util.List;

/** 한 공연의 리뷰 + 집계 + 감사 리포트. 저장소는 이 단위로 통째 교체한다 */
public record ShowSnapshot(
        String showId,
        List<NormalizedReview> reviews,
        ShowAggregate aggregate,
        AuditReport audit
) {
    public ShowSnapshot {
        reviews = reviews == null ? List.of() : List.copyOf(reviews);
    }
}
