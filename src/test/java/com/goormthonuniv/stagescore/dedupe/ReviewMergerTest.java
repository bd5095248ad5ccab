package com.goormthonuniv.stagescore.dedupe;

import com.goormthonuniv.stagescore.dto.NormalizedReview;
import com.goormthonuniv.stagescore.dto.ReviewFlag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static com.goormthonuniv.stagescore.dedupe.Reviews.review;
import static org.assertj.core.api.Assertions.assertThat;

class ReviewMergerTest {

    private final NormalizedReview withUrl = review("NYT", null, 80)
            .url("https://nytimes.com/r/1")
            .flags(Set.of(ReviewFlag.CONVERSION_EDGE_CASE))
            .build();
    private final NormalizedReview withCritic = review("NYT", "Jesse Green", 70)
            .pullQuote("A thrilling night.")
            .publishDate(LocalDate.of(2026, 3, 12))
            .flags(Set.of(ReviewFlag.INFERRED_SCORE))
            .build();

    @Test
    void winnerKeepsRequiredFieldsAndLoserFillsGaps() {
        NormalizedReview merged = ReviewMerger.merge(withUrl, withCritic);

        assertThat(merged.assignedScore()).isEqualTo(80);
        assertThat(merged.url()).isEqualTo("https://nytimes.com/r/1");
        assertThat(merged.criticName()).isEqualTo("Jesse Green");
        assertThat(merged.pullQuote()).isEqualTo("A thrilling night.");
        assertThat(merged.publishDate()).isEqualTo(LocalDate.of(2026, 3, 12));
        assertThat(merged.flags()).containsExactlyInAnyOrder(ReviewFlag.CONVERSION_EDGE_CASE, ReviewFlag.INFERRED_SCORE);
    }

    @Test
    void mergeIsCommutativeAndIdempotent() {
        NormalizedReview ab = ReviewMerger.merge(withUrl, withCritic);

        assertThat(ReviewMerger.merge(withCritic, withUrl)).isEqualTo(ab);
        assertThat(ReviewMerger.merge(ab, withCritic)).isEqualTo(ab);
        assertThat(ReviewMerger.merge(ab, withUrl)).isEqualTo(ab);
        assertThat(ReviewMerger.merge(ab, ab)).isEqualTo(ab);
    }

    @Test
    void earlierPublishDateWinsWhenPresenceTies() {
        NormalizedReview early = review("VARIETY", "Frank Rizzo", 60).publishDate(LocalDate.of(2026, 3, 1)).build();
        NormalizedReview late = review("VARIETY", "Frank Rizzo", 90).publishDate(LocalDate.of(2026, 3, 5)).build();

        assertThat(ReviewMerger.merge(late, early).assignedScore()).isEqualTo(60);
        assertThat(ReviewMerger.isWinner(early, late)).isTrue();
    }

    @Test
    void commutativeEvenWhenOnlyScoresDiffer() {
        List<NormalizedReview> pair = List.of(review("AP", "Mark Kennedy", 71).build(), review("AP", "Mark Kennedy", 64).build());

        assertThat(ReviewMerger.merge(pair.get(0), pair.get(1)))
                .isEqualTo(ReviewMerger.merge(pair.get(1), pair.get(0)));
    }
}
