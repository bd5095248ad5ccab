package com.goormthonuniv.stagescore.llm;

public record OracleResult(
        String oracle,
        Integer value,        // 성공 시 0~100
        String error,         // 실패 사유 (성공이면 null)
        boolean retryable
) {
    public static OracleResult ok(String oracle, int value) {
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException("oracle score out of range: " + value);
        }
        return new OracleResult(oracle, value, null, false);
    }

    public static OracleResult failure(String oracle, String error, boolean retryable) {
        return new OracleResult(oracle, null, error, retryable);
    }

    public boolean isSuccess() {
        return value != null;
    }
}
