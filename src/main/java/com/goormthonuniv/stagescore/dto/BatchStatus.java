package com.goormthonuniv.stagescore.dto;

public enum BatchStatus {
    RUNNING, COMPLETED, CANCELLED, FAILED
}
