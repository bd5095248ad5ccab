package com.goormthonuniv.stagescore.dto;

/**
 * 리뷰에 붙는 권고(advisory) 플래그. 어떤 플래그도 저장/집계를 막지 않는다.
 * audit=true 인 항목은 Validator 가 매 배치마다 다시 계산한다.
 */
public enum ReviewFlag {
    // ----- 채점 단계에서 붙는 플래그 -----
    UNRESOLVED_OUTLET(AuditCategory.PROBLEMATIC_SOURCE, false),
    HIGH_ORACLE_DISAGREEMENT(AuditCategory.HIGH_LLM_DISAGREEMENT, false),
    ORACLE_FALLBACK(AuditCategory.HIGH_LLM_DISAGREEMENT, false),
    INSUFFICIENT_CALIBRATION(AuditCategory.MISSING_CONTEXT, false),
    INFERRED_SCORE(AuditCategory.AMBIGUOUS_SCORE, false),
    RATING_HINT_MISMATCH(AuditCategory.CONVERSION_EDGE_CASE, false),
    CONVERSION_EDGE_CASE(AuditCategory.CONVERSION_EDGE_CASE, false),

    // ----- Validator(감사) 플래그 -----
    BUCKET_MISMATCH(AuditCategory.CONVERSION_EDGE_CASE, true),
    THUMB_MISMATCH(AuditCategory.CONVERSION_EDGE_CASE, true),
    SENTIMENT_CONTRADICTION(AuditCategory.AMBIGUOUS_SCORE, true),
    OUTSIDE_PUBLICATION_WINDOW(AuditCategory.PROBLEMATIC_SOURCE, true),
    NEAR_DUPLICATE_CRITIC(AuditCategory.PROBLEMATIC_SOURCE, true),
    MISSING_PROVENANCE(AuditCategory.MISSING_CONTEXT, true),
    UNIFORM_BUCKETS(AuditCategory.PROBLEMATIC_SOURCE, true),
    DUPLICATE_CONFLICT(AuditCategory.AMBIGUOUS_SCORE, true);

    private final AuditCategory category;
    private final boolean audit;

    ReviewFlag(AuditCategory category, boolean audit) {
        this.category = category;
        this.audit = audit;
    }

    public AuditCategory category() { return category; }

    public boolean isAudit() { return audit; }
}
