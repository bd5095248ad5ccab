package com.goormthonuniv.stagescore.verify;

import com.goormthonuniv.stagescore.dto.AuditReport;
import com.goormthonuniv.stagescore.dto.NormalizedReview;

import java.util.List;

/** 감사 플래그가 다시 계산된 리뷰 목록 + 감사 리포트 */
public record ValidationResult(List<NormalizedReview> reviews, AuditReport report) {

    public ValidationResult {
        reviews = List.copyOf(reviews);
    }
}
