package com.goormthonuniv.stagescore.llm;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.stagescore.dto.Confidence;
import com.goormthonuniv.stagescore.dto.EnsembleResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 독립 오라클 판단을 합쳐 점수 + 신뢰도를 만든다.
 *
 * <ul>
 *   <li>A(주)와 B(보조)를 동시에 호출, 차이 &lt; 10 이면 A 점수/high</li>
 *   <li>10~19 면 평균(반올림)/medium</li>
 *   <li>20 이상이면 A, B 완료 후 C(타이브레이커) 호출, 세 점수의 중앙값/low + 검토 플래그</li>
 * </ul>
 *
 * A 가 재시도 후에도 실패하면 B 를 한 번 더 호출해 주 점수로 삼고, 보조 B 결과와는 그대로 비교한다
 * (신뢰도 상한 medium). 주 점수를 얻지 못하면 empty. 성공 결과는 본문 기준으로 캐시한다.
 */
@Slf4j
public class EnsembleScorer {

    static final int MEDIUM_DISAGREEMENT = 10;
    static final int HIGH_DISAGREEMENT = 20;

    private final ScoringOracle primary;
    private final ScoringOracle secondary;
    private final ScoringOracle tiebreaker;
    private final OracleInvoker invoker;
    private final Executor executor;

    // ===== 캐시 =====
    private final Cache<String, EnsembleResult> cache;

    public EnsembleScorer(ScoringOracle primary,
                          ScoringOracle secondary,
                          ScoringOracle tiebreaker,
                          OracleInvoker invoker,
                          Executor executor,
                          Duration cacheTtl,
                          long cacheMaxSize) {
        this.primary = primary;
        this.secondary = secondary;
        this.tiebreaker = tiebreaker;
        this.invoker = invoker;
        this.executor = executor;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(cacheMaxSize)
                .build();
    }

    /** 주/보조 중 하나라도 호출 가능해야 앙상블 경로를 쓴다 */
    public boolean isAvailable() {
        return primary.isAvailable() || secondary.isAvailable();
    }

    public Optional<EnsembleResult> score(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        EnsembleResult cached = cache.getIfPresent(text);
        if (cached != null) return Optional.of(cached);

        Optional<EnsembleResult> result = compute(text);
        result.ifPresent(r -> cache.put(text, r));
        return result;
    }

    // ===================== 내부 =====================

    private Optional<EnsembleResult> compute(String text) {
        CompletableFuture<OracleResult> a = CompletableFuture.supplyAsync(() -> invoker.invoke(primary, text), executor);
        CompletableFuture<OracleResult> b = CompletableFuture.supplyAsync(() -> invoker.invoke(secondary, text), executor);
        OracleResult ra = await(a, primary);
        OracleResult rb = await(b, secondary);

        if (ra.isSuccess()) {
            return Optional.of(combine(ra.value(), rb, text, false));
        }
        log.warn("[StageScore] primary oracle={} failed, falling back to {}", primary.name(), secondary.name());
        OracleResult fallback = invoker.invoke(secondary, text);
        if (fallback.isSuccess()) {
            return Optional.of(combine(fallback.value(), rb, text, true));
        }
        log.warn("[StageScore] no primary score primary={} fallback={}", ra.error(), fallback.error());
        return Optional.empty();
    }

    private EnsembleResult combine(int p, OracleResult second, String text, boolean fromFallback) {
        Confidence ceiling = fromFallback ? Confidence.MEDIUM : Confidence.HIGH;

        if (!second.isSuccess()) {
            // 두 번째 의견 없음
            return new EnsembleResult(p, null, null, p, Confidence.LOW, null, true, fromFallback);
        }
        int s = second.value();
        int d = Math.abs(p - s);

        if (d < MEDIUM_DISAGREEMENT) {
            return new EnsembleResult(p, s, null, p, Confidence.HIGH.cap(ceiling), d, false, fromFallback);
        }
        if (d < HIGH_DISAGREEMENT) {
            return new EnsembleResult(p, s, null, roundedMean(p, s), Confidence.MEDIUM.cap(ceiling), d, false, fromFallback);
        }
        OracleResult c = invoker.invoke(tiebreaker, text);
        if (!c.isSuccess()) {
            return new EnsembleResult(p, s, null, roundedMean(p, s), Confidence.LOW, d, true, fromFallback);
        }
        return new EnsembleResult(p, s, c.value(), median(p, s, c.value()), Confidence.LOW, d, true, fromFallback);
    }

    private static OracleResult await(CompletableFuture<OracleResult> f, ScoringOracle oracle) {
        try {
            return f.join();
        } catch (CompletionException e) {
            return OracleResult.failure(oracle.name(), String.valueOf(e.getCause()), false);
        }
    }

    static int roundedMean(int a, int b) {
        return (int) Math.round((a + b) / 2.0);
    }

    static int median(int a, int b, int c) {
        int[] v = {a, b, c};
        Arrays.sort(v);
        return v[1];
    }
}
