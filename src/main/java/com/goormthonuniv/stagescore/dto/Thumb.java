package com.goormthonuniv.stagescore.dto;

public enum Thumb {
    UP, FLAT, DOWN;

    public static Thumb of(int score) {
        if (score >= 70) return UP;
        if (score >= 50) return FLAT;
        return DOWN;
    }
}
