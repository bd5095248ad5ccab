package com.goormthonuniv.stagescore.dto;

public record AuditEntry(
        String showId,
        String outletId,     // 공연 단위 플래그면 null
        String criticName,
        String url,
        ReviewFlag flag,
        AuditCategory category,
        String detail
) {
    public static AuditEntry forReview(NormalizedReview r, ReviewFlag flag, String detail) {
        return new AuditEntry(r.showId(), r.outletId(), r.criticName(), r.url(), flag, flag.category(), detail);
    }

    public static AuditEntry forShow(String showId, ReviewFlag flag, String detail) {
        return new AuditEntry(showId, null, null, null, flag, flag.category(), detail);
    }
}
