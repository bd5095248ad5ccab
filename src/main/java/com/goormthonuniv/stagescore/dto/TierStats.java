package com.goormthonuniv.stagescore.dto;

public record TierStats(int count, int scoreSum) {

    public static final TierStats EMPTY = new TierStats(0, 0);

    public TierStats add(int score) {
        return new TierStats(count + 1, scoreSum + score);
    }

    public double average() {
        return count == 0 ? 0.0 : (double) scoreSum / count;
    }
}
