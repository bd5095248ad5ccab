package com.goormthonuniv.stagescore.dto;

import jakarta.validation.constraints.NotBlank;

public record RawReview(
        @NotBlank String source,      // "bww" | "dtli" | "show-score" | "outlet" ...
        @NotBlank String outletName,  // 원문 표기 그대로 (예: "NY Times", "nytimes.com")
        String url,
        String criticName,
        String publishDate,           // ISO(yyyy-MM-dd) 우선, 그 외 포맷은 관대하게 파싱
        String originalRating,        // "4/5", "B+", "Rave", "★★★½" ...
        String ratingType,            // 선택: "stars" | "letter" | "numeric" | "bucket" | "thumb"
        Integer maxScale,             // 선택: 별점/숫자 만점
        String excerpt,               // 발췌/본문 일부
        String designation            // 선택: Critics_Pick 등
) {
    public boolean hasRating() {
        return originalRating != null && !originalRating.isBlank();
    }

    public boolean hasExcerpt() {
        return excerpt != null && !excerpt.isBlank();
    }
}
