package com.goormthonuniv.stagescore.outlet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** 평점 표기 방식. 매체 카탈로그의 기대 포맷이자 RawReview 의 rating-type 힌트 */
public enum RatingFormat {
    STARS("stars"),
    LETTER("letter"),
    NUMERIC("numeric"),
    TEXT_BUCKET("text_bucket"),
    THUMB("thumb");

    private final String wire;

    RatingFormat(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static RatingFormat fromWire(String value) {
        return fromHint(value).orElseThrow(() -> new IllegalArgumentException("unknown rating format: " + value));
    }

    /** 자유 형식 힌트("star", "letter_grade", "bucket", "thumbs" ...)를 관대하게 해석 */
    public static Optional<RatingFormat> fromHint(String hint) {
        if (hint == null || hint.isBlank()) return Optional.empty();
        String h = hint.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return Optional.ofNullable(HINTS.get(h));
    }

    private static final Map<String, RatingFormat> HINTS = Map.ofEntries(
            Map.entry("stars", STARS), Map.entry("star", STARS),
            Map.entry("letter", LETTER), Map.entry("letter_grade", LETTER), Map.entry("grade", LETTER),
            Map.entry("numeric", NUMERIC), Map.entry("number", NUMERIC), Map.entry("score", NUMERIC),
            Map.entry("percent", NUMERIC),
            Map.entry("text_bucket", TEXT_BUCKET), Map.entry("bucket", TEXT_BUCKET),
            Map.entry("text", TEXT_BUCKET), Map.entry("sentiment", TEXT_BUCKET),
            Map.entry("thumb", THUMB), Map.entry("thumbs", THUMB)
    );
}
