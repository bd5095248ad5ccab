package com.goormthonuniv.stagescore.rating;

import com.goormthonuniv.stagescore.outlet.RatingFormat;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 별점: "4/5", "3.5 out of 5", "4 stars", "★★★☆☆", "★★★½".
 * 분모가 10 을 넘는 "k/n" 은 NumericRatingStrategy 몫.
 */
@Component
@Order(1)
public class StarRatingStrategy implements RatingStrategy {

    static final int MAX_STAR_DENOMINATOR = 10;
    private static final int DEFAULT_STARS = 5;

    private static final String NUM = "(\\d+(?:\\.\\d+)?)";
    private static final Pattern SLASH = Pattern.compile(NUM + "\\s*/\\s*" + NUM);
    private static final Pattern OUT_OF = Pattern.compile(NUM + "\\s*out\\s+of\\s*" + NUM, Pattern.CASE_INSENSITIVE);
    private static final Pattern STARS_WORD = Pattern.compile(NUM + "\\s*-?\\s*stars?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HALF_AFTER_DIGIT = Pattern.compile("(\\d+)\\s*(?:½|\\s1/2)");
    private static final Pattern GLYPH_RUN = Pattern.compile("[★⭐☆½]+");
    private static final Pattern ASTERISKS_ONLY = Pattern.compile("^[*½☆\\s]+$");

    @Override
    public RatingFormat format() {
        return RatingFormat.STARS;
    }

    @Override
    public OptionalInt parse(String rating, Integer maxScale) {
        String s = HALF_AFTER_DIGIT.matcher(rating.replace("\uFE0F", "")).replaceAll("$1.5");

        Matcher m = SLASH.matcher(s);
        if (m.find()) return ofFraction(m.group(1), m.group(2));

        m = OUT_OF.matcher(s);
        if (m.find()) return ofFraction(m.group(1), m.group(2));

        m = STARS_WORD.matcher(s);
        if (m.find()) {
            double k = Double.parseDouble(m.group(1));
            return OptionalInt.of(normalizeStar(k, starScale(maxScale)));
        }

        return glyphs(s.trim(), maxScale);
    }

    /** k/n 별 → 0~100. k 는 [0, n] 으로 잘린다 */
    public static int normalizeStar(double k, double n) {
        if (n <= 0) throw new IllegalArgumentException("star scale must be positive: " + n);
        double clamped = Math.max(0, Math.min(n, k));
        return (int) Math.round(clamped / n * 100);
    }

    // ------------------------ 내부 유틸 ------------------------

    private static OptionalInt ofFraction(String kText, String nText) {
        double n = Double.parseDouble(nText);
        if (n <= 0 || n > MAX_STAR_DENOMINATOR) return OptionalInt.empty();
        return OptionalInt.of(normalizeStar(Double.parseDouble(kText), n));
    }

    private static OptionalInt glyphs(String s, Integer maxScale) {
        String run;
        Matcher g = GLYPH_RUN.matcher(s);
        if (g.find() && hasFilledOrHalf(g.group())) {
            run = g.group();
        } else if (ASTERISKS_ONLY.matcher(s).matches() && s.indexOf('*') >= 0) {
            run = s;
        } else {
            return OptionalInt.empty();
        }
        int filled = 0, half = 0, empty = 0;
        for (int i = 0; i < run.length(); i++) {
            char c = run.charAt(i);
            if (c == '★' || c == '⭐' || c == '*') filled++;
            else if (c == '½') half++;
            else if (c == '☆') empty++;
        }
        double k = filled + 0.5 * half;
        double n = empty > 0 ? filled + half + empty : starScale(maxScale);
        return OptionalInt.of(normalizeStar(k, n));
    }

    private static boolean hasFilledOrHalf(String run) {
        return run.indexOf('★') >= 0 || run.indexOf('⭐') >= 0 || run.indexOf('½') >= 0;
    }

    private static int starScale(Integer maxScale) {
        if (maxScale != null && maxScale > 0 && maxScale <= MAX_STAR_DENOMINATOR) return maxScale;
        return DEFAULT_STARS;
    }
}
