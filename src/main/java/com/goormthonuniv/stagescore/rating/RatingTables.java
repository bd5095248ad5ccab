package com.goormthonuniv.stagescore.rating;

import java.util.Map;
import java.util.Set;

/** 평점 환산 고정 테이블 (불변) */
public final class RatingTables {

    private RatingTables() {}

    // ===== 학점 (단조 감소) =====
    public static final Map<String, Integer> LETTER_GRADES = Map.ofEntries(
            Map.entry("A+", 98), Map.entry("A", 95), Map.entry("A-", 92),
            Map.entry("B+", 88), Map.entry("B", 85), Map.entry("B-", 82),
            Map.entry("C+", 78), Map.entry("C", 75), Map.entry("C-", 72),
            Map.entry("D+", 68), Map.entry("D", 65), Map.entry("D-", 62),
            Map.entry("F", 50)
    );

    // ===== 텍스트 버킷 → 중앙값 =====
    public static final Map<String, Integer> TEXT_BUCKETS = Map.ofEntries(
            // 호평
            Map.entry("rave", 92), Map.entry("ecstatic", 95), Map.entry("masterpiece", 97),
            Map.entry("excellent", 90), Map.entry("outstanding", 90), Map.entry("brilliant", 92),
            // 긍정
            Map.entry("positive", 80), Map.entry("favorable", 78), Map.entry("good", 76),
            Map.entry("enjoyable", 75), Map.entry("recommended", 77), Map.entry("solid", 74),
            // 혼합
            Map.entry("mixed-positive", 68), Map.entry("mixed positive", 68), Map.entry("mostly positive", 70),
            Map.entry("generally favorable", 69), Map.entry("mixed", 60), Map.entry("middling", 58),
            Map.entry("uneven", 55), Map.entry("so-so", 55), Map.entry("mixed-negative", 48),
            Map.entry("mixed negative", 48), Map.entry("mostly negative", 45), Map.entry("lukewarm", 52),
            // 혹평
            Map.entry("negative", 38), Map.entry("unfavorable", 35), Map.entry("disappointing", 40),
            Map.entry("poor", 35), Map.entry("pan", 25), Map.entry("terrible", 20),
            Map.entry("awful", 18), Map.entry("disastrous", 15)
    );

    // ===== 엄지 =====
    public static final int THUMB_UP = 78;
    public static final int THUMB_FLAT = 58;
    public static final int THUMB_DOWN = 35;

    public static final Map<String, Integer> THUMBS = Map.ofEntries(
            Map.entry("up", THUMB_UP), Map.entry("thumbs up", THUMB_UP), Map.entry("thumb up", THUMB_UP),
            Map.entry("yes", THUMB_UP), Map.entry("recommend", THUMB_UP), Map.entry("👍", THUMB_UP),
            Map.entry("flat", THUMB_FLAT), Map.entry("sideways", THUMB_FLAT), Map.entry("thumbs sideways", THUMB_FLAT),
            Map.entry("maybe", THUMB_FLAT), Map.entry("meh", THUMB_FLAT),
            Map.entry("down", THUMB_DOWN), Map.entry("thumbs down", THUMB_DOWN), Map.entry("thumb down", THUMB_DOWN),
            Map.entry("no", THUMB_DOWN), Map.entry("skip", THUMB_DOWN), Map.entry("👎", THUMB_DOWN)
    );

    /** 변환 결과가 경계에 걸려 사람이 다시 볼 만한 원문 평점 */
    public static final Set<String> CONVERSION_EDGE_CASES = Set.of("B+", "B-", "A-", "C+", "3.5", "2.5");
}
