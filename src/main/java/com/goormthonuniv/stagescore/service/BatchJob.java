package com.goormthonuniv.stagescore.service;

import com.goormthonuniv.stagescore.dto.BatchReport;
import com.goormthonuniv.stagescore.dto.BatchStatus;
import com.goormthonuniv.stagescore.dto.ShowRunResult;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 배치 1회 실행 상태.
 * 저장은 writeIfActive 안에서만 일어나며 cancel() 과 같은 락을 잡으므로,
 * 취소가 표시된 뒤에는 어떤 쓰기도 시작되지 않는다. (진행 중인 오라클 호출은 끝까지 간다)
 */
public class BatchJob {

    private final String id;
    private final Clock clock;
    private final Instant startedAt;
    private final Object lock = new Object();
    private final List<ShowRunResult> results = new ArrayList<>();
    private final CompletableFuture<BatchReport> done = new CompletableFuture<>();

    private boolean cancelled;
    private BatchStatus status = BatchStatus.RUNNING;
    private Instant finishedAt;

    public BatchJob(String id, Clock clock) {
        this.id = id;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public String id() {
        return id;
    }

    /** @return 이번 호출로 취소됐으면 true (이미 끝났거나 취소된 작업이면 false) */
    public boolean cancel() {
        synchronized (lock) {
            if (cancelled || status != BatchStatus.RUNNING) return false;
            cancelled = true;
            return true;
        }
    }

    public boolean isCancelled() {
        synchronized (lock) {
            return cancelled;
        }
    }

    /** 취소되지 않았을 때만 write 를 실행. 실행했으면 true */
    public boolean writeIfActive(Runnable write) {
        synchronized (lock) {
            if (cancelled) return false;
            write.run();
            return true;
        }
    }

    public void record(ShowRunResult result) {
        synchronized (lock) {
            results.add(result);
        }
    }

    /** 실행 종료. 취소된 작업은 failed 가 아니면 CANCELLED 로 마감 */
    public BatchReport finish(boolean failed) {
        BatchReport report;
        synchronized (lock) {
            if (status == BatchStatus.RUNNING) {
                status = failed ? BatchStatus.FAILED : (cancelled ? BatchStatus.CANCELLED : BatchStatus.COMPLETED);
                finishedAt = clock.instant();
            }
            report = reportLocked();
        }
        done.complete(report);
        return report;
    }

    public BatchReport report() {
        synchronized (lock) {
            return reportLocked();
        }
    }

    public CompletableFuture<BatchReport> completion() {
        return done;
    }

    private BatchReport reportLocked() {
        BatchStatus shown = status == BatchStatus.RUNNING && cancelled ? BatchStatus.CANCELLED : status;
        return new BatchReport(id, shown, startedAt, finishedAt, results);
    }
}
