package com.goormthonuniv.stagescore.calibration;

/** 같은 리뷰에 대한 (오라클 원점수, 명시 평점 기준 정답) 쌍 */
public record CalibrationSample(int rawScore, int truthScore) {}
