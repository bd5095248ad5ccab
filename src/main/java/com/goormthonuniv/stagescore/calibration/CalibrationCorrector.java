package com.goormthonuniv.stagescore.calibration;

import com.goormthonuniv.stagescore.dto.Bucket;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 앙상블(오라클) 점수의 편향 보정.
 * 테이블은 불변 객체 참조 교체로만 갱신되므로 채점 경로는 갱신 작업을 기다리지 않는다.
 */
@Slf4j
public class CalibrationCorrector {

    private final AtomicReference<CalibrationOffsetTable> table;

    public CalibrationCorrector(CalibrationOffsetTable initial) {
        this.table = new AtomicReference<>(initial);
    }

    public CalibrationResult correct(int raw) {
        CalibrationOffsetTable t = table.get();
        if (!t.isActive(Bucket.of(raw))) {
            return new CalibrationResult(raw, raw, 0.0, true);
        }
        double offset = t.offsetAt(raw);
        int corrected = (int) Math.max(0, Math.min(100, Math.round(raw + offset)));
        return new CalibrationResult(raw, corrected, offset, false);
    }

    public CalibrationOffsetTable table() {
        return table.get();
    }

    public void replaceTable(CalibrationOffsetTable next) {
        CalibrationOffsetTable prev = table.getAndSet(next);
        log.info("[StageScore] calibration table replaced prev={} next={}", prev.entries().values(), next.entries().values());
    }
}
