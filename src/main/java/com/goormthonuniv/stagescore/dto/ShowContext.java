package com.goormthonuniv.stagescore.dto;

import jakarta.validation.constraints.NotBlank;

import java.time.LocalDate;

public record ShowContext(
        @NotBlank String showId,
        String title,
        LocalDate openingDate   // 선택: 게재일 창(window) 검사에 사용
) {
    public static ShowContext of(String showId) {
        return new ShowContext(showId, null, null);
    }
}
