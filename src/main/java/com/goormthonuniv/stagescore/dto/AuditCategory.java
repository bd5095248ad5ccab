package com.goormthonuniv.stagescore.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/** 사람 검수 워크플로에 넘기는 고정 분류 체계. */
public enum AuditCategory {
    PROBLEMATIC_SOURCE("problematic_source"),
    HIGH_LLM_DISAGREEMENT("high_llm_disagreement"),
    CONVERSION_EDGE_CASE("conversion_edge_case"),
    AMBIGUOUS_SCORE("ambiguous_score"),
    MISSING_CONTEXT("missing_context");

    private final String wire;

    AuditCategory(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
