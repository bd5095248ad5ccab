package com.goormthonuniv.stagescore.service;

import com.goormthonuniv.stagescore.calibration.CalibrationCorrector;
import com.goormthonuniv.stagescore.calibration.CalibrationEntry;
import com.goormthonuniv.stagescore.calibration.CalibrationOffsetTable;
import com.goormthonuniv.stagescore.calibration.CalibrationSampleCollector;
import com.goormthonuniv.stagescore.dto.*;
import com.goormthonuniv.stagescore.llm.EnsembleScorer;
import com.goormthonuniv.stagescore.rating.DesignationDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.goormthonuniv.stagescore.service.PipelineFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ReviewScoringServiceTest {

    private EnsembleScorer ensemble;
    private CalibrationSampleCollector samples;

    @BeforeEach
    void setUp() {
        ensemble = mock(EnsembleScorer.class);
        samples = new CalibrationSampleCollector(100);
    }

    @Test
    void explicitRatingAtKnownOutlet() {
        NormalizedReview r = scored(scoring(ensemble, noCalibration(), samples, false),
                rated("Guardian", "Arifa Akbar", "4/5"));

        assertThat(r.outletId()).isEqualTo("GUARDIAN");
        assertThat(r.assignedScore()).isEqualTo(80);
        assertThat(r.bucket()).isEqualTo(Bucket.POSITIVE);
        assertThat(r.thumb()).isEqualTo(Thumb.UP);
        assertThat(r.scoreSource()).isEqualTo(ScoreSource.EXPLICIT);
        assertThat(r.publishDate()).isEqualTo(LocalDate.of(2026, 3, 12));
        assertThat(r.flags()).isEmpty();
        verifyNoInteractions(ensemble);
    }

    @Test
    void unresolvedOutletIsFlaggedNotRejected() {
        NormalizedReview r = scored(scoring(ensemble, noCalibration(), samples, false),
                rated("Joe's Theatre Blog", "Joe", "B"));

        assertThat(r.outletId()).isEqualTo("JOESTH");
        assertThat(r.flags()).contains(ReviewFlag.UNRESOLVED_OUTLET);
    }

    @Test
    void keywordInferenceWhenOraclesUnavailable() {
        when(ensemble.isAvailable()).thenReturn(false);

        NormalizedReview r = scored(scoring(ensemble, noCalibration(), samples, false),
                excerptOnly("NY Times", "Jesse Green", "Critic's Pick. A brilliant,   stunning and wonderful revival."));

        assertThat(r.assignedScore()).isEqualTo(78);
        assertThat(r.scoreSource()).isEqualTo(ScoreSource.INFERRED);
        assertThat(r.flags()).contains(ReviewFlag.INFERRED_SCORE);
        assertThat(r.designation()).isEqualTo(DesignationDetector.CRITICS_PICK);
        assertThat(r.pullQuote()).isEqualTo("Critic's Pick. A brilliant, stunning and wonderful revival.");
        assertThat(r.originalRating()).isNull();
    }

    @Test
    void ensembleScoreWithoutCalibrationDataIsFlagged() {
        when(ensemble.isAvailable()).thenReturn(true);
        when(ensemble.score(anyString())).thenReturn(Optional.of(
                new EnsembleResult(80, 50, 60, 60, Confidence.LOW, 30, true, false)));

        NormalizedReview r = scored(scoring(ensemble, noCalibration(), samples, false),
                excerptOnly("NY Times", "Jesse Green", "It is a production that exists."));

        assertThat(r.assignedScore()).isEqualTo(60);
        assertThat(r.scoreSource()).isEqualTo(ScoreSource.ENSEMBLE);
        assertThat(r.flags()).containsExactlyInAnyOrder(
                ReviewFlag.INSUFFICIENT_CALIBRATION, ReviewFlag.HIGH_ORACLE_DISAGREEMENT);
    }

    @Test
    void ensembleScoreIsCalibrated() {
        when(ensemble.isAvailable()).thenReturn(true);
        when(ensemble.score(anyString())).thenReturn(Optional.of(
                new EnsembleResult(77, 75, null, 77, Confidence.MEDIUM, 2, false, true)));
        CalibrationCorrector calibration = new CalibrationCorrector(new CalibrationOffsetTable(
                List.of(new CalibrationEntry(Bucket.POSITIVE, -4.0, 50)), 10, null));

        NormalizedReview r = scored(scoring(ensemble, calibration, samples, false),
                excerptOnly("NY Times", "Jesse Green", "It is a production that exists."));

        assertThat(r.assignedScore()).isEqualTo(73);
        assertThat(r.flags()).contains(ReviewFlag.ORACLE_FALLBACK).doesNotContain(ReviewFlag.INSUFFICIENT_CALIBRATION);
    }

    @Test
    void ensembleFailureFallsBackToKeywords() {
        when(ensemble.isAvailable()).thenReturn(true);
        when(ensemble.score(anyString())).thenReturn(Optional.empty());

        NormalizedReview r = scored(scoring(ensemble, noCalibration(), samples, false),
                excerptOnly("NY Times", "Jesse Green", "A tedious, boring and dull evening."));

        assertThat(r.scoreSource()).isEqualTo(ScoreSource.INFERRED);
        assertThat(r.assignedScore()).isEqualTo(45);
    }

    @Test
    void nothingToScoreIsRejected() {
        ReviewScoringService service = scoring(ensemble, noCalibration(), samples, false);

        ScoringOutcome noSignal = service.score("show", excerptOnly("NY Times", "Jesse Green", null));
        ScoringOutcome garbage = service.score("show", rated("NY Times", "Jesse Green", "see it!!"));

        assertThat(noSignal.isScored()).isFalse();
        assertThat(noSignal.rejection().reason()).isEqualTo("no rating and no usable excerpt");
        assertThat(garbage.rejection().reason()).contains("unparseable rating");
        assertThat(garbage.rejection().outletName()).isEqualTo("NY Times");
    }

    @Test
    void explicitRatingsFeedCalibrationSamplesWhenEnabled() {
        when(ensemble.isAvailable()).thenReturn(true);
        when(ensemble.score(anyString())).thenReturn(Optional.of(
                new EnsembleResult(90, 88, null, 90, Confidence.HIGH, 2, false, false)));
        RawReview raw = new RawReview("outlet", "Guardian", null, "Arifa Akbar", null, "4/5", null, null,
                "A superb, riveting evening.", null);

        NormalizedReview r = scored(scoring(ensemble, noCalibration(), samples, true), raw);

        assertThat(r.assignedScore()).isEqualTo(80);
        assertThat(samples.snapshot()).singleElement().satisfies(s -> {
            assertThat(s.rawScore()).isEqualTo(90);
            assertThat(s.truthScore()).isEqualTo(80);
        });
    }

    @Test
    void samplingIsOffByDefault() {
        RawReview raw = new RawReview("outlet", "Guardian", null, "Arifa Akbar", null, "4/5", null, null,
                "A superb, riveting evening.", null);

        scored(scoring(ensemble, noCalibration(), samples, false), raw);

        assertThat(samples.size()).isZero();
        verify(ensemble, never()).score(anyString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2026-03-12", "2026-03-12T19:30:00Z", "March 12, 2026", "Mar 12, 2026", "3/12/2026"})
    void publishDateFormats(String text) {
        assertThat(ReviewScoringService.parseDate(text)).isEqualTo(LocalDate.of(2026, 3, 12));
    }

    @Test
    void unparseableDateIsNull() {
        assertThat(ReviewScoringService.parseDate("opening night")).isNull();
        assertThat(ReviewScoringService.parseDate(" ")).isNull();
    }

    private static NormalizedReview scored(ReviewScoringService service, RawReview raw) {
        ScoringOutcome outcome = service.score("hamlet-2026", raw);
        assertThat(outcome.isScored()).as("rejected: %s", outcome.rejection()).isTrue();
        return outcome.review();
    }
}
