package com.goormthonuniv.stagescore.calibration;

import com.goormthonuniv.stagescore.dto.Bucket;

import java.time.Clock;
import java.util.*;

/** 표본으로부터 버킷별 오프셋 = mean(정답 - 원점수), ±15 로 제한 */
public class CalibrationDeriver {

    public static final double MAX_OFFSET = 15.0;

    private final Clock clock;

    public CalibrationDeriver(Clock clock) {
        this.clock = clock;
    }

    public CalibrationOffsetTable derive(Collection<CalibrationSample> samples, int minSampleSize) {
        EnumMap<Bucket, double[]> acc = new EnumMap<>(Bucket.class); // [sum, count]
        for (CalibrationSample s : samples) {
            double[] a = acc.computeIfAbsent(Bucket.of(s.rawScore()), b -> new double[2]);
            a[0] += s.truthScore() - s.rawScore();
            a[1] += 1;
        }
        List<CalibrationEntry> entries = new ArrayList<>();
        acc.forEach((bucket, a) -> {
            double mean = a[0] / a[1];
            double offset = Math.max(-MAX_OFFSET, Math.min(MAX_OFFSET, mean));
            entries.add(new CalibrationEntry(bucket, round2(offset), (int) a[1]));
        });
        return new CalibrationOffsetTable(entries, minSampleSize, clock.instant());
    }

    private static double round2(double v) {
        return Math.round(v * 100) / 100.0;
    }
}
