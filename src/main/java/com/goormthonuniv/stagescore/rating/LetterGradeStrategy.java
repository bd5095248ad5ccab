package com.goormthonuniv.stagescore.rating;

import com.goormthonuniv.stagescore.outlet.RatingFormat;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 학점: "B+", "A minus", "Grade: B+", 범위 "B+/A-" (두 값 평균) */
@Component
@Order(2)
public class LetterGradeStrategy implements RatingStrategy {

    private static final Pattern PREFIX = Pattern.compile("^(?:grade|rating|score)\\s*[:\\-]?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLUS_WORD = Pattern.compile("\\s*\\bplus\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MINUS_WORD = Pattern.compile("\\s*\\bminus\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SINGLE = Pattern.compile("^([A-DF][+-]?)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RANGE = Pattern.compile("^([A-DF][+-]?)\\s*(?:/|to)\\s*([A-DF][+-]?)$", Pattern.CASE_INSENSITIVE);

    @Override
    public RatingFormat format() {
        return RatingFormat.LETTER;
    }

    @Override
    public OptionalInt parse(String rating, Integer maxScale) {
        String s = PREFIX.matcher(rating.trim()).replaceFirst("");
        s = s.replace('–', '-').replace('−', '-').replace('—', '-');
        s = PLUS_WORD.matcher(s).replaceAll("+");
        s = MINUS_WORD.matcher(s).replaceAll("-");
        s = s.replaceAll("[.!]+$", "").trim();

        Matcher m = SINGLE.matcher(s);
        if (m.matches()) {
            Integer v = lookup(m.group(1));
            return v == null ? OptionalInt.empty() : OptionalInt.of(v);
        }
        m = RANGE.matcher(s);
        if (m.matches()) {
            Integer a = lookup(m.group(1));
            Integer b = lookup(m.group(2));
            if (a == null || b == null) return OptionalInt.empty();
            return OptionalInt.of((int) Math.round((a + b) / 2.0));
        }
        return OptionalInt.empty();
    }

    private static Integer lookup(String grade) {
        return RatingTables.LETTER_GRADES.get(grade.toUpperCase(Locale.ROOT));
    }
}
