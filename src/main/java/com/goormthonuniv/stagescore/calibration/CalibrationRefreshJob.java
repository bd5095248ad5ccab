package com.goormthonuniv.stagescore.calibration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/** 수집된 표본으로 보정 테이블을 주기적으로 재도출해 원자적으로 교체 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalibrationRefreshJob {

    private final CalibrationCorrector corrector;
    private final CalibrationDeriver deriver;
    private final CalibrationSampleCollector collector;

    @Value("${stagescore.calibration.min-sample-size:10}")
    private int minSampleSize = CalibrationOffsetTable.DEFAULT_MIN_SAMPLE_SIZE;

    @Scheduled(fixedDelayString = "${stagescore.calibration.refresh-interval-ms:21600000}",
            initialDelayString = "${stagescore.calibration.refresh-interval-ms:21600000}")
    public void refresh() {
        List<CalibrationSample> samples = collector.snapshot();
        if (samples.size() < minSampleSize) {
            log.debug("[StageScore] calibration refresh skipped samples={} min={}", samples.size(), minSampleSize);
            return;
        }
        CalibrationOffsetTable derived = deriver.derive(samples, minSampleSize);
        // 이번 표본이 부족한 버킷은 기존 오프셋 유지
        corrector.replaceTable(corrector.table().overlay(derived));
        log.info("[StageScore] calibration refreshed from {} samples", samples.size());
    }
}
