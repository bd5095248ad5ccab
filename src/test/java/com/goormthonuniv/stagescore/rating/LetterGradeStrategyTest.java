package com.goormthonuniv.stagescore.rating;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LetterGradeStrategyTest {

    private final LetterGradeStrategy strategy = new LetterGradeStrategy();

    @Test
    void gradesAreMonotonic() {
        List<String> order = List.of("A+", "A", "A-", "B+", "B", "B-", "C+", "C", "C-", "D+", "D", "D-", "F");
        int previous = Integer.MAX_VALUE;
        for (String grade : order) {
            int score = strategy.parse(grade, null).getAsInt();
            assertThat(score).as(grade).isLessThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void acceptsWordsAndDashVariants() {
        assertThat(strategy.parse("B plus", null)).hasValue(88);
        assertThat(strategy.parse("A–", null)).hasValue(92);
        assertThat(strategy.parse("c+.", null)).hasValue(78);
    }

    @Test
    void rejectsNonGrades() {
        assertThat(strategy.parse("E", null)).isEmpty();
        assertThat(strategy.parse("Bravo", null)).isEmpty();
        assertThat(strategy.parse("4/5", null)).isEmpty();
    }
}
