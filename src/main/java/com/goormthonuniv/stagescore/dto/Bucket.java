package com.goormthonuniv.stagescore.dto;

/**
 * 점수에서 파생되는 거친 감성 구간.
 * Rave ≥ 85, Positive ≥ 70, Mixed ≥ 50, 나머지 Pan.
 */
public enum Bucket {
    RAVE("Rave", 85, 100),
    POSITIVE("Positive", 70, 84),
    MIXED("Mixed", 50, 69),
    PAN("Pan", 0, 49);

    private final String label;
    private final int min;
    private final int max;

    Bucket(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public static Bucket of(int score) {
        if (score >= 85) return RAVE;
        if (score >= 70) return POSITIVE;
        if (score >= 50) return MIXED;
        return PAN;
    }

    public String label() { return label; }
    public int min() { return min; }
    public int max() { return max; }

    public double midpoint() {
        return (min + max) / 2.0;
    }

    public boolean isFavorable() {
        return this == RAVE || this == POSITIVE;
    }
}
