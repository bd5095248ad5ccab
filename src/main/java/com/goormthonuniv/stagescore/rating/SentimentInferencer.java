package com.goormthonuniv.stagescore.rating;

import com.goormthonuniv.stagescore.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 본문 키워드 기반 점수 추정 (근사치).
 * 단어 경계 기준으로 각 키워드의 등장 여부만 센다 (등장 횟수 무관).
 */
@Component
public class SentimentInferencer {

    static final int MIN_TEXT_LENGTH = 10;

    // ===== 키워드 =====
    private static final List<String> STRONG_POSITIVE = List.of(
            "masterpiece", "extraordinary", "triumphant", "must-see");
    private static final List<String> POSITIVE = List.of(
            "brilliant", "stunning", "magnificent", "wonderful", "excellent", "superb", "terrific",
            "delightful", "enchanting", "captivating", "riveting", "electrifying", "soaring",
            "dazzling", "star-making", "unmissable", "essential");
    private static final List<String> STRONG_NEGATIVE = List.of(
            "terrible", "awful", "disaster", "avoid", "skip");
    private static final List<String> NEGATIVE = List.of(
            "disappointing", "tedious", "boring", "dull", "flat", "lifeless", "uninspired",
            "mediocre", "weak", "forgettable", "tired", "stale", "misguided", "problematic",
            "awkward", "clunky", "overlong");
    private static final List<String> MIXED = List.of(
            "uneven", "inconsistent", "mixed", "some", "however", "but", "despite",
            "although", "while", "moments", "occasionally");

    private static final double STRONG = 2.0;
    private static final double NORMAL = 1.0;
    private static final double MIXED_WEIGHT = 0.5;

    /** 점수 추정. 텍스트가 짧거나 키워드가 하나도 없으면 empty */
    public Optional<ParsedRating> infer(String text) {
        SentimentSignal s = signal(text);
        if (s.isEmpty()) return Optional.empty();
        return Optional.of(ParsedRating.inferred(score(s)));
    }

    public SentimentSignal signal(String text) {
        if (text == null || text.strip().length() < MIN_TEXT_LENGTH) return SentimentSignal.NONE;
        double pos = STRONG * hits(text, STRONG_POSITIVE) + NORMAL * hits(text, POSITIVE);
        double neg = STRONG * hits(text, STRONG_NEGATIVE) + NORMAL * hits(text, NEGATIVE);
        double mixed = MIXED_WEIGHT * hits(text, MIXED);
        return new SentimentSignal(pos, neg, mixed);
    }

    static int score(SentimentSignal s) {
        if (s.stronglyPositive()) return s.positive() > 3 ? 88 : 78;
        if (s.stronglyNegative()) return s.negative() > 3 ? 35 : 45;
        if (s.mixed() > s.positive() && s.mixed() > s.negative()) return 60;
        return (int) Math.round(50 + 30 * (s.positiveRatio() - s.negativeRatio()));
    }

    private static int hits(String text, List<String> words) {
        int n = 0;
        for (String w : words) {
            if (TextUtils.containsWord(text, w)) n++;
        }
        return n;
    }
}
