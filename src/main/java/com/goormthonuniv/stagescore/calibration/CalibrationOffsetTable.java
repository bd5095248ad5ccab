package com.goormthonuniv.stagescore.calibration;

import com.goormthonuniv.stagescore.dto.Bucket;

import java.time.Instant;
import java.util.*;

/**
 * 버킷별 보정 오프셋 (불변). 표본 수가 minSampleSize 미만인 버킷은 비활성.
 *
 * 오프셋은 노트(knot) 사이 선형 보간으로 구한다.
 * 활성 버킷은 (중앙값, offset), 비활성 버킷은 (하한, 0)·(상한, 0) 을 노트로 기여하므로
 * 비활성 구간 안의 점수는 움직이지 않고 경계에서 오프셋이 연속적으로 변한다.
 */
public final class CalibrationOffsetTable {

    public static final int DEFAULT_MIN_SAMPLE_SIZE = 10;

    private final Map<Bucket, CalibrationEntry> entries;
    private final int minSampleSize;
    private final Instant derivedAt;
    private final double[] knotX;
    private final double[] knotY;

    public CalibrationOffsetTable(Collection<CalibrationEntry> entries, int minSampleSize, Instant derivedAt) {
        EnumMap<Bucket, CalibrationEntry> m = new EnumMap<>(Bucket.class);
        if (entries != null) {
            for (CalibrationEntry e : entries) m.put(e.bucket(), e);
        }
        this.entries = Collections.unmodifiableMap(m);
        this.minSampleSize = minSampleSize;
        this.derivedAt = derivedAt;

        List<double[]> knots = new ArrayList<>();
        for (Bucket b : ascending()) {
            if (isActive(b)) {
                knots.add(new double[]{b.midpoint(), this.entries.get(b).offset()});
            } else {
                knots.add(new double[]{b.min(), 0});
                knots.add(new double[]{b.max(), 0});
            }
        }
        this.knotX = new double[knots.size()];
        this.knotY = new double[knots.size()];
        for (int i = 0; i < knots.size(); i++) {
            knotX[i] = knots.get(i)[0];
            knotY[i] = knots.get(i)[1];
        }
    }

    /** 모든 버킷 비활성 (보정 없음) */
    public static CalibrationOffsetTable empty(int minSampleSize) {
        return new CalibrationOffsetTable(List.of(), minSampleSize, null);
    }

    public boolean isActive(Bucket bucket) {
        CalibrationEntry e = entries.get(bucket);
        return e != null && e.sampleSize() >= minSampleSize;
    }

    /** 원점수 위치의 보간 오프셋 */
    public double offsetAt(double raw) {
        if (raw <= knotX[0]) return knotY[0];
        int last = knotX.length - 1;
        if (raw >= knotX[last]) return knotY[last];
        for (int i = 1; i <= last; i++) {
            if (raw == knotX[i]) return knotY[i];
            if (raw < knotX[i]) {
                double x0 = knotX[i - 1], x1 = knotX[i];
                double t = (raw - x0) / (x1 - x0);
                return knotY[i - 1] + t * (knotY[i] - knotY[i - 1]);
            }
        }
        return knotY[last];
    }

    /** 이 테이블 위에 other 의 활성 버킷을 덮어쓴 새 테이블 */
    public CalibrationOffsetTable overlay(CalibrationOffsetTable other) {
        EnumMap<Bucket, CalibrationEntry> merged = new EnumMap<>(Bucket.class);
        merged.putAll(entries);
        for (Bucket b : Bucket.values()) {
            if (other.isActive(b)) merged.put(b, other.entries.get(b));
        }
        return new CalibrationOffsetTable(merged.values(), minSampleSize,
                other.derivedAt != null ? other.derivedAt : derivedAt);
    }

    public Map<Bucket, CalibrationEntry> entries() {
        return entries;
    }

    public int minSampleSize() {
        return minSampleSize;
    }

    public Instant derivedAt() {
        return derivedAt;
    }

    private static List<Bucket> ascending() {
        return List.of(Bucket.PAN, Bucket.MIXED, Bucket.POSITIVE, Bucket.RAVE);
    }
}
