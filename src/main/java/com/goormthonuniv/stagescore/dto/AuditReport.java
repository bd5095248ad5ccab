package com.goormthonuniv.stagescore.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record AuditReport(
        String showId,
        List<AuditEntry> entries,
        Instant generatedAt
) {
    public AuditReport {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public Map<AuditCategory, List<AuditEntry>> byCategory() {
        return entries.stream().collect(Collectors.groupingBy(
                AuditEntry::category, () -> new EnumMap<>(AuditCategory.class), Collectors.toList()));
    }

    @JsonIgnore
    public boolean isClean() {
        return entries.isEmpty();
    }
}
