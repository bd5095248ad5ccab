package com.goormthonuniv.stagescore.calibration;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** 파이프라인이 모은 보정 표본. 최근 capacity 개만 유지 */
public class CalibrationSampleCollector {

    private final int capacity;
    private final Deque<CalibrationSample> samples = new ArrayDeque<>();

    public CalibrationSampleCollector(int capacity) {
        this.capacity = capacity;
    }

    public synchronized void record(CalibrationSample sample) {
        if (samples.size() == capacity) samples.removeFirst();
        samples.addLast(sample);
    }

    public synchronized List<CalibrationSample> snapshot() {
        return List.copyOf(samples);
    }

    public synchronized int size() {
        return samples.size();
    }
}
