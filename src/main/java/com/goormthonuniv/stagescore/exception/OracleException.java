package com.goormthonuniv.stagescore.exception;

/**
 * 채점 오라클 호출 실패.
 * retryable=false 이면 (인증 실패, 응답 형식 오류 등) 재시도하지 않는다.
 */
public class OracleException extends RuntimeException {

    private final boolean retryable;

    public OracleException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public OracleException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
