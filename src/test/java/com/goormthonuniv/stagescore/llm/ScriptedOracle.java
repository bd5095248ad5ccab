package com.goormthonuniv.stagescore.llm;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** 미리 정한 응답을 순서대로 돌려주는 테스트용 오라클. 마지막 응답은 계속 반복 */
class ScriptedOracle implements ScoringOracle {

    private final String name;
    private final boolean available;
    private final Deque<Supplier<OracleResult>> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();

    ScriptedOracle(String name, boolean available) {
        this.name = name;
        this.available = available;
    }

    static ScriptedOracle scoring(String name, int value) {
        return new ScriptedOracle(name, true).thenScore(value);
    }

    static ScriptedOracle unavailable(String name) {
        return new ScriptedOracle(name, false);
    }

    ScriptedOracle thenScore(int value) {
        script.addLast(() -> OracleResult.ok(name, value));
        return this;
    }

    ScriptedOracle thenFail(boolean retryable) {
        script.addLast(() -> OracleResult.failure(name, "scripted failure", retryable));
        return this;
    }

    ScriptedOracle thenThrow(RuntimeException e) {
        script.addLast(() -> {
            throw e;
        });
        return this;
    }

    int calls() {
        return calls.get();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public synchronized OracleResult score(String reviewText) {
        calls.incrementAndGet();
        Supplier<OracleResult> next = script.size() > 1 ? script.pollFirst() : script.peekFirst();
        if (next == null) throw new IllegalStateException("no scripted response for " + name);
        return next.get();
    }
}
