package com.goormthonuniv.stagescore.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Confidence {
    HIGH, MEDIUM, LOW;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Confidence cap(Confidence ceiling) {
        return this.ordinal() < ceiling.ordinal() ? ceiling : this;
    }
}
