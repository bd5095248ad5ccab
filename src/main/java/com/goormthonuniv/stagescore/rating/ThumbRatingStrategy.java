package com.goormthonuniv.stagescore.rating;

import com.goormthonuniv.stagescore.outlet.RatingFormat;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.OptionalInt;

@Component
@Order(5)
public class ThumbRatingStrategy implements RatingStrategy {

    @Override
    public RatingFormat format() {
        return RatingFormat.THUMB;
    }

    @Override
    public OptionalInt parse(String rating, Integer maxScale) {
        String s = rating.trim().toLowerCase(Locale.ROOT).replaceAll("[.!]+$", "");
        Integer v = RatingTables.THUMBS.get(s);
        if (v == null) v = RatingTables.THUMBS.get(s.replace('-', ' ').replaceAll("\\s+", " "));
        return v == null ? OptionalInt.empty() : OptionalInt.of(v);
    }
}
