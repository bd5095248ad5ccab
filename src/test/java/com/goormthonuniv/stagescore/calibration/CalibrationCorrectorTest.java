package com.goormthonuniv.stagescore.calibration;

import com.goormthonuniv.stagescore.dto.Bucket;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CalibrationCorrectorTest {

    private final CalibrationOffsetTable table = new CalibrationOffsetTable(List.of(
            new CalibrationEntry(Bucket.PAN, 3.2, 18),
            new CalibrationEntry(Bucket.MIXED, -4.5, 41),
            new CalibrationEntry(Bucket.POSITIVE, -1.8, 96),
            new CalibrationEntry(Bucket.RAVE, 1.1, 7)
    ), 10, Instant.parse("2026-09-28T03:00:00Z"));

    private final CalibrationCorrector corrector = new CalibrationCorrector(table);

    @Test
    void appliesOffsetAtBucketMidpoint() {
        CalibrationResult r = corrector.correct(77);
        assertThat(r.offset()).isEqualTo(-1.8);
        assertThat(r.correctedScore()).isEqualTo(75);
        assertThat(r.insufficientData()).isFalse();
    }

    @Test
    void knotsReturnTheirOffsetExactly() {
        assertThat(table.offsetAt(24.5)).isEqualTo(3.2);
        assertThat(table.offsetAt(59.5)).isEqualTo(-4.5);
        assertThat(table.offsetAt(77)).isEqualTo(-1.8);
        assertThat(table.offsetAt(85)).isEqualTo(0.0);
    }

    @Test
    void inertBucketPassesThroughAndFlags() {
        CalibrationResult r = corrector.correct(90);
        assertThat(r.correctedScore()).isEqualTo(90);
        assertThat(r.insufficientData()).isTrue();
    }

    @Test
    void offsetIsClampedIntoRange() {
        CalibrationCorrector strong = new CalibrationCorrector(new CalibrationOffsetTable(
                List.of(new CalibrationEntry(Bucket.PAN, -15, 50)), 10, null));
        assertThat(strong.correct(2).correctedScore()).isZero();
    }

    @Test
    void oneRawPointNeverMovesCorrectedScoreByMoreThanTwo() {
        int previous = corrector.correct(0).correctedScore();
        for (int raw = 1; raw <= 100; raw++) {
            int current = corrector.correct(raw).correctedScore();
            assertThat(Math.abs(current - previous)).as("raw %d", raw).isLessThanOrEqualTo(2);
            previous = current;
        }
    }

    @Test
    void emptyTableCorrectsNothing() {
        CalibrationCorrector none = new CalibrationCorrector(CalibrationOffsetTable.empty(10));
        for (int raw : new int[]{0, 49, 50, 84, 100}) {
            assertThat(none.correct(raw).correctedScore()).isEqualTo(raw);
            assertThat(none.correct(raw).insufficientData()).isTrue();
        }
    }

    @Test
    void replaceTableSwapsReference() {
        CalibrationOffsetTable next = CalibrationOffsetTable.empty(10);
        corrector.replaceTable(next);
        assertThat(corrector.table()).isSameAs(next);
    }

    @Test
    void overlayKeepsOldOffsetsForBucketsWithoutNewData() {
        CalibrationOffsetTable fresh = new CalibrationOffsetTable(List.of(
                new CalibrationEntry(Bucket.RAVE, 2.0, 12),
                new CalibrationEntry(Bucket.PAN, 9.0, 3)
        ), 10, Instant.parse("2026-10-01T00:00:00Z"));

        CalibrationOffsetTable merged = table.overlay(fresh);

        assertThat(merged.entries().get(Bucket.RAVE).offset()).isEqualTo(2.0);
        assertThat(merged.entries().get(Bucket.PAN).offset()).isEqualTo(3.2);
        assertThat(merged.isActive(Bucket.RAVE)).isTrue();
        assertThat(merged.derivedAt()).isEqualTo(Instant.parse("2026-10-01T00:00:00Z"));
    }
}
