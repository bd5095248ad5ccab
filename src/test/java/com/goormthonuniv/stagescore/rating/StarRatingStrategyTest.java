package com.goormthonuniv.stagescore.rating;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StarRatingStrategyTest {

    private final StarRatingStrategy strategy = new StarRatingStrategy();

    @Test
    void normalizeStarBounds() {
        assertThat(StarRatingStrategy.normalizeStar(0, 5)).isZero();
        assertThat(StarRatingStrategy.normalizeStar(5, 5)).isEqualTo(100);
        assertThat(StarRatingStrategy.normalizeStar(3, 4)).isEqualTo(75);
        assertThat(StarRatingStrategy.normalizeStar(2.5, 5)).isEqualTo(50);
    }

    @Test
    void normalizeStarClampsNumerator() {
        assertThat(StarRatingStrategy.normalizeStar(7, 5)).isEqualTo(100);
        assertThat(StarRatingStrategy.normalizeStar(-1, 5)).isZero();
    }

    @Test
    void normalizeStarRejectsNonPositiveScale() {
        assertThatThrownBy(() -> StarRatingStrategy.normalizeStar(3, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void starsWordUsesOutletScale() {
        assertThat(strategy.parse("3 stars", 4)).hasValue(75);
        assertThat(strategy.parse("3 stars", 100)).hasValue(60);
    }

    @Test
    void asterisksCountAsStars() {
        assertThat(strategy.parse("****", null)).hasValue(80);
    }

    @Test
    void leavesLargeDenominatorsToNumeric() {
        assertThat(strategy.parse("85/100", null)).isEmpty();
    }
}
