package com.goormthonuniv.stagescore.dedupe;

import com.goormthonuniv.stagescore.dto.NormalizedReview;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.goormthonuniv.stagescore.dedupe.Reviews.review;
import static org.assertj.core.api.Assertions.assertThat;

class ReviewDeduplicatorTest {

    private final ReviewDeduplicator deduplicator = new ReviewDeduplicator(new DuplicateMatcher(true));

    @Test
    void sameUrlThreeTimesCollapsesToOne() {
        List<NormalizedReview> input = List.of(
                review("NYT", null, 80).url("https://www.nytimes.com/r/1").build(),
                review("NYT", "Jesse Green", 80).url("http://nytimes.com/r/1/").build(),
                review("NYTIMES", null, 80).url("https://nytimes.com/r/1?src=rss").build());

        DedupeResult r = deduplicator.deduplicate(input);

        assertThat(r.reviews()).hasSize(1);
        assertThat(r.duplicatesRemoved()).isEqualTo(2);
        assertThat(r.reviews().get(0).criticName()).isEqualTo("Jesse Green");
        assertThat(r.conflicts()).isEmpty();
    }

    @Test
    void resultDoesNotDependOnInputOrder() {
        List<NormalizedReview> input = new ArrayList<>(List.of(
                review("NYT", "Jesse Green", 80).url("https://nytimes.com/r/1").build(),
                review("NYT", null, 78).build(),
                review("VARIETY", "Frank Rizzo", 65).build(),
                review("VARIETY", "frank rizzo", 70).url("https://variety.com/r/2").build(),
                review("AP", "Mark Kennedy", 90).build()));

        DedupeResult first = deduplicator.deduplicate(input);
        Collections.reverse(input);
        DedupeResult second = deduplicator.deduplicate(input);

        assertThat(second.reviews()).isEqualTo(first.reviews());
        assertThat(first.reviews()).extracting(NormalizedReview::outletId).containsExactly("AP", "NYT", "VARIETY");
    }

    @Test
    void conflictingScoresAreRecorded() {
        DedupeResult r = deduplicator.deduplicate(List.of(
                review("VARIETY", "Frank Rizzo", 65).build(),
                review("VARIETY", "Frank Rizzo", 70).url("https://variety.com/r/2").build()));

        assertThat(r.reviews()).singleElement().satisfies(x -> assertThat(x.assignedScore()).isEqualTo(70));
        assertThat(r.conflicts()).singleElement().satisfies(c -> {
            assertThat(c.keptScore()).isEqualTo(70);
            assertThat(c.discardedScore()).isEqualTo(65);
            assertThat(c.matchType()).isEqualTo(MatchType.OUTLET_CRITIC);
        });
    }

    @Test
    void differentCriticsAtSameOutletAreBothKept() {
        DedupeResult r = deduplicator.deduplicate(List.of(
                review("NYT", "Jesse Green", 80).build(),
                review("NYT", "Laura Collins-Hughes", 60).build()));
        assertThat(r.reviews()).hasSize(2);
        assertThat(r.duplicatesRemoved()).isZero();
    }

    @Test
    void mergeWithExistingCountsAddedUpdatedUnchanged() {
        NormalizedReview stored = review("NYT", "Jesse Green", 80).build();
        NormalizedReview storedToo = review("AP", "Mark Kennedy", 75).url("https://apnews.com/r/9").build();

        MergeOutcome outcome = deduplicator.mergeWithExisting(List.of(stored, storedToo), List.of(
                review("NYT", "Jesse Green", 80).url("https://nytimes.com/r/1").build(),   // URL 보강
                review("AP", "Mark Kennedy", 75).url("https://apnews.com/r/9").build(),    // 동일
                review("WSJ", "Charles Isherwood", 55).build()));                          // 신규

        assertThat(outcome.added()).isEqualTo(1);
        assertThat(outcome.updated()).isEqualTo(1);
        assertThat(outcome.unchanged()).isEqualTo(1);
        assertThat(outcome.reviews()).hasSize(3);
        assertThat(outcome.reviews()).filteredOn(x -> "NYT".equals(x.outletId()))
                .singleElement().satisfies(x -> assertThat(x.url()).isEqualTo("https://nytimes.com/r/1"));
    }

    @Test
    void rerunningSameBatchChangesNothing() {
        List<NormalizedReview> batch = List.of(
                review("NYT", "Jesse Green", 80).url("https://nytimes.com/r/1").build(),
                review("AP", "Mark Kennedy", 75).build());

        MergeOutcome first = deduplicator.mergeWithExisting(List.of(), batch);
        MergeOutcome second = deduplicator.mergeWithExisting(first.reviews(), batch);

        assertThat(second.reviews()).isEqualTo(first.reviews());
        assertThat(second.added()).isZero();
        assertThat(second.unchanged()).isEqualTo(2);
    }
}
