package com.goormthonuniv.stagescore.llm;

import com.goormthonuniv.stagescore.exception.OracleException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * 오라클 1회 호출 + 재시도(백오프). 오라클마다 이름별 {@link Retry} 인스턴스를 쓴다.
 * 재시도 불가 오류는 즉시 중단, 전체 호출 수는 1 + maxRetries 로 상한.
 */
@Slf4j
public class OracleInvoker {

    private final RetryRegistry registry;

    public OracleInvoker(RetryRegistry registry) {
        this.registry = registry;
        registry.getEventPublisher().onEntryAdded(e -> e.getAddedEntry().getEventPublisher()
                .onRetry(r -> log.info("[StageScore] oracle={} retry={} in {}ms",
                        r.getName(), r.getNumberOfRetryAttempts(), r.getWaitInterval().toMillis())));
    }

    public static OracleInvoker of(int maxRetries, IntervalFunction interval) {
        return new OracleInvoker(RetryRegistry.of(retryConfig(maxRetries, interval)));
    }

    public static RetryConfig retryConfig(int maxRetries, IntervalFunction interval) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        return RetryConfig.<OracleResult>custom()
                .maxAttempts(1 + maxRetries)
                .intervalFunction(interval)
                .retryOnResult(r -> !r.isSuccess() && r.retryable())
                .build();
    }

    public OracleResult invoke(ScoringOracle oracle, String text) {
        if (!oracle.isAvailable()) {
            return OracleResult.failure(oracle.name(), "oracle unavailable", false);
        }
        Supplier<OracleResult> call = Retry.decorateSupplier(registry.retry(oracle.name()), () -> callOnce(oracle, text));
        OracleResult last = call.get();
        if (!last.isSuccess()) {
            log.warn("[StageScore] oracle={} failed error={}", oracle.name(), last.error());
        }
        return last;
    }

    private static OracleResult callOnce(ScoringOracle oracle, String text) {
        try {
            OracleResult r = oracle.score(text);
            if (r == null) return OracleResult.failure(oracle.name(), "oracle returned no result", true);
            return r;
        } catch (OracleException e) {
            return OracleResult.failure(oracle.name(), e.getMessage(), e.isRetryable());
        } catch (RuntimeException e) {
            return OracleResult.failure(oracle.name(), String.valueOf(e.getMessage()), true);
        }
    }
}
