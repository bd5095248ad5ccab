package com.goormthonuniv.stagescore.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AggregateConfidence {
    HIGH, MEDIUM, LOW, PENDING;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
