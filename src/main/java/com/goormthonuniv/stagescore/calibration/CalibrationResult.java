package com.goormthonuniv.stagescore.calibration;

public record CalibrationResult(
        int rawScore,
        int correctedScore,
        double offset,
        boolean insufficientData   // 원점수 버킷이 비활성이라 그대로 통과
) {}
