package com.goormthonuniv.stagescore.calibration;

import com.goormthonuniv.stagescore.dto.Bucket;

/** 원점수 버킷별 가산 오프셋과, 그 오프셋을 도출한 표본 수 */
public record CalibrationEntry(Bucket bucket, double offset, int sampleSize) {}
