package com.goormthonuniv.stagescore.rating;

import com.goormthonuniv.stagescore.outlet.RatingFormat;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/** 평가 어휘 ("Rave", "Mixed-Positive", "Sentiment: Pan") → 버킷 중앙값 */
@Component
@Order(4)
public class TextBucketStrategy implements RatingStrategy {

    private static final Pattern PREFIX = Pattern.compile("^sentiment\\s*[:\\-]\\s*");

    @Override
    public RatingFormat format() {
        return RatingFormat.TEXT_BUCKET;
    }

    @Override
    public OptionalInt parse(String rating, Integer maxScale) {
        String s = PREFIX.matcher(rating.trim().toLowerCase(Locale.ROOT)).replaceFirst("");
        s = s.replaceAll("[.!]+$", "").replace('_', ' ').replaceAll("\\s+", " ").trim();
        Integer v = RatingTables.TEXT_BUCKETS.get(s);
        return v == null ? OptionalInt.empty() : OptionalInt.of(v);
    }
}
