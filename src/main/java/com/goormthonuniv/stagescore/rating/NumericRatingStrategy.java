package com.goormthonuniv.stagescore.rating;

import com.goormthonuniv.stagescore.outlet.RatingFormat;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 숫자: "85/100", "85 out of 100", "85", "85%", "7.5". "Score:"/"Rating:" 접두어 허용.
 * 맨 숫자는 만점을 알면 그 기준, 모르면 10 초과 → 100점 만점, 10 이하 → 10점 만점.
 */
@Component
@Order(3)
public class NumericRatingStrategy implements RatingStrategy {

    private static final String NUM = "(\\d+(?:\\.\\d+)?)";
    private static final Pattern FRACTION = Pattern.compile(NUM + "\\s*(?:/|out\\s+of)\\s*" + NUM, Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE = Pattern.compile("^" + NUM + "\\s*(%)?$");
    private static final Pattern PREFIX = Pattern.compile("^(?:rating|score)\\s*[:\\-]?\\s*", Pattern.CASE_INSENSITIVE);

    @Override
    public RatingFormat format() {
        return RatingFormat.NUMERIC;
    }

    @Override
    public OptionalInt parse(String rating, Integer maxScale) {
        String s = PREFIX.matcher(rating.trim()).replaceFirst("");
        Matcher m = FRACTION.matcher(s);
        if (m.find()) {
            double k = Double.parseDouble(m.group(1));
            double n = Double.parseDouble(m.group(2));
            if (n <= 0) return OptionalInt.empty();
            return OptionalInt.of(scale(k, n));
        }
        m = BARE.matcher(s);
        if (!m.matches()) return OptionalInt.empty();

        double v = Double.parseDouble(m.group(1));
        if (m.group(2) != null) return OptionalInt.of(scale(v, 100));
        if (maxScale != null && maxScale > 0 && v <= maxScale) return OptionalInt.of(scale(v, maxScale));
        return OptionalInt.of(scale(v, v > 10 ? 100 : 10));
    }

    private static int scale(double k, double n) {
        return ParsedRating.clamp((int) Math.round(k / n * 100));
    }
}
