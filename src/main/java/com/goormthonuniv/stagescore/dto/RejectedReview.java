package com.goormthonuniv.stagescore.dto;

public record RejectedReview(
        String outletName,
        String criticName,
        String originalRating,
        String reason
) {
    public static RejectedReview of(RawReview raw, String reason) {
        return new RejectedReview(raw.outletName(), raw.criticName(), raw.originalRating(), reason);
    }
}
