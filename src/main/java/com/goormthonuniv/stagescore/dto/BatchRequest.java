package com.goormthonuniv.stagescore.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BatchRequest(
        @NotEmpty List<@Valid ShowBatchRequest> shows
) {}
