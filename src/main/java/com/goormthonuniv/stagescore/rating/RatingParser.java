package com.goormthonuniv.stagescore.rating;

import com.goormthonuniv.stagescore.dto.RawReview;
import com.goormthonuniv.stagescore.dto.ReviewFlag;
import com.goormthonuniv.stagescore.outlet.OutletConfig;
import com.goormthonuniv.stagescore.outlet.RatingFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 명시 평점 → 0~100.
 * 별점 → 학점 → 숫자 → 텍스트 버킷 → 엄지 순서로 시도하고 처음 성공한 결과를 EXPLICIT 으로 돌려준다.
 * 명시 평점이 없거나 해석 불가면 empty (추론/앙상블 경로는 호출 측 결정).
 */
@Slf4j
@Component
public class RatingParser {

    private final List<RatingStrategy> strategies;

    public RatingParser(List<RatingStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public static RatingParser withDefaults() {
        return new RatingParser(List.of(
                new StarRatingStrategy(),
                new LetterGradeStrategy(),
                new NumericRatingStrategy(),
                new TextBucketStrategy(),
                new ThumbRatingStrategy()
        ));
    }

    /** 리뷰 + (선택) 매체 설정으로 해석. 힌트/매체 포맷 불일치, 경계 변환 케이스는 플래그로 남긴다 */
    public Optional<ParsedRating> parse(RawReview raw, OutletConfig outlet) {
        if (!raw.hasRating()) return Optional.empty();
        Integer maxScale = raw.maxScale() != null ? raw.maxScale() : (outlet != null ? outlet.maxScale() : null);

        Optional<ParsedRating> parsed = parse(raw.originalRating(), maxScale);
        if (parsed.isEmpty()) {
            log.debug("[StageScore] no rating strategy matched rating=\"{}\" outlet={}", raw.originalRating(), raw.outletName());
            return parsed;
        }
        ParsedRating result = parsed.get();

        Optional<RatingFormat> expected = RatingFormat.fromHint(raw.ratingType());
        if (expected.isEmpty() && outlet != null) expected = Optional.ofNullable(outlet.ratingFormat());
        if (expected.isPresent() && !compatible(expected.get(), result.format())) {
            result = result.withFlag(ReviewFlag.RATING_HINT_MISMATCH);
        }
        if (isConversionEdgeCase(raw.originalRating())) {
            result = result.withFlag(ReviewFlag.CONVERSION_EDGE_CASE);
        }
        return Optional.of(result);
    }

    /** 문자열만으로 해석 */
    public Optional<ParsedRating> parse(String rating, Integer maxScale) {
        if (rating == null || rating.isBlank()) return Optional.empty();
        String trimmed = rating.trim();
        for (RatingStrategy strategy : strategies) {
            OptionalInt score = strategy.parse(trimmed, maxScale);
            if (score.isPresent()) {
                return Optional.of(ParsedRating.explicit(score.getAsInt(), strategy.format()));
            }
        }
        return Optional.empty();
    }

    public static boolean isConversionEdgeCase(String rating) {
        return rating != null && RatingTables.CONVERSION_EDGE_CASES.contains(rating.trim().toUpperCase(Locale.ROOT));
    }

    // 별점/숫자는 같은 계열(눈금 척도)로 본다
    private static boolean compatible(RatingFormat expected, RatingFormat actual) {
        if (expected == actual) return true;
        return isScale(expected) && isScale(actual);
    }

    private static boolean isScale(RatingFormat f) {
        return f == RatingFormat.STARS || f == RatingFormat.NUMERIC;
    }
}
