package com.goormthonuniv.stagescore.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

public record ShowBatchRequest(
        @NotBlank String showId,
        String title,
        LocalDate openingDate,
        @NotNull List<@Valid RawReview> reviews
) {
    public ShowContext context() {
        return new ShowContext(showId, title, openingDate);
    }
}
