package com.goormthonuniv.stagescore.rating;

import com.goormthonuniv.stagescore.dto.ReviewFlag;
import com.goormthonuniv.stagescore.dto.ScoreSource;
import com.goormthonuniv.stagescore.outlet.RatingFormat;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** 0~100 으로 환산된 점수 + 어떤 경로로 얻었는지 */
public record ParsedRating(
        int score,
        RatingFormat format,      // 추론 점수면 null
        ScoreSource source,
        Set<ReviewFlag> flags
) {
    public ParsedRating {
        score = clamp(score);
        flags = flags == null || flags.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public static ParsedRating explicit(int score, RatingFormat format) {
        return new ParsedRating(score, format, ScoreSource.EXPLICIT, Set.of());
    }

    public static ParsedRating inferred(int score) {
        return new ParsedRating(score, null, ScoreSource.INFERRED, EnumSet.of(ReviewFlag.INFERRED_SCORE));
    }

    public ParsedRating withFlag(ReviewFlag flag) {
        EnumSet<ReviewFlag> next = flags.isEmpty() ? EnumSet.noneOf(ReviewFlag.class) : EnumSet.copyOf(flags);
        next.add(flag);
        return new ParsedRating(score, format, source, next);
    }

    static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }
}
