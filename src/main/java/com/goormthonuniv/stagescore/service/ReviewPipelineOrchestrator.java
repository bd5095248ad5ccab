package com.goormthonuniv.stagescore.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.goormthonuniv.stagescore.aggregate.ShowAggregator;
import com.goormthonuniv.stagescore.dedupe.MergeOutcome;
import com.goormthonuniv.stagescore.dedupe.ReviewDeduplicator;
import com.goormthonuniv.stagescore.dto.*;
import com.goormthonuniv.stagescore.source.ReviewSource;
import com.goormthonuniv.stagescore.store.ReviewStore;
import com.goormthonuniv.stagescore.store.ShowSnapshot;
import com.goormthonuniv.stagescore.verify.ReviewValidator;
import com.goormthonuniv.stagescore.verify.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 배치 실행기. 공연 단위로 병렬 처리하며 공연끼리 가변 상태를 공유하지 않는다.
 * 공연 1건: 채점 → 기존 저장분과 병합 → 감사 → 집계 → (취소되지 않았으면) 스냅샷 교체.
 * 리뷰 한 건, 공연 한 건의 실패는 배치 전체를 멈추지 않는다.
 */
@Slf4j
public class ReviewPipelineOrchestrator {

    // ===== 의존성 =====
    private final List<ReviewSource> sources;
    private final ReviewScoringService scoring;
    private final ReviewDeduplicator deduplicator;
    private final ReviewValidator validator;
    private final ShowAggregator aggregator;
    private final ReviewStore store;
    private final BatchJobRegistry registry;
    private final Executor executor;
    private final Clock clock;

    // 같은 공연을 동시에 처리하는 배치끼리 병합-저장 구간 직렬화. 아무도 쥐고 있지 않은 락은 GC 대상
    private final LoadingCache<String, ReentrantLock> showLocks = Caffeine.newBuilder()
            .weakValues()
            .build(k -> new ReentrantLock());

    public ReviewPipelineOrchestrator(List<ReviewSource> sources,
                                      ReviewScoringService scoring,
                                      ReviewDeduplicator deduplicator,
                                      ReviewValidator validator,
                                      ShowAggregator aggregator,
                                      ReviewStore store,
                                      BatchJobRegistry registry,
                                      Executor executor,
                                      Clock clock) {
        this.sources = List.copyOf(sources);
        this.scoring = scoring;
        this.deduplicator = deduplicator;
        this.validator = validator;
        this.aggregator = aggregator;
        this.store = store;
        this.registry = registry;
        this.executor = executor;
        this.clock = clock;
    }

    /** 비동기 실행. 작업은 즉시 반환되고 completion() 으로 끝을 기다릴 수 있다 */
    public BatchJob submit(BatchRequest request) {
        BatchJob job = new BatchJob(UUID.randomUUID().toString(), clock);
        registry.register(job);
        Collection<ShowBatchRequest> shows = groupByShow(request.shows());
        log.info("[StageScore] batch {} started shows={}", job.id(), shows.size());

        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (ShowBatchRequest show : shows) {
            tasks.add(CompletableFuture.runAsync(
                    () -> job.record(processShow(job, show.context(), show.reviews())), executor));
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).whenComplete((v, ex) -> {
            if (ex != null) log.error("[StageScore] batch {} failed", job.id(), ex);
            BatchReport report = job.finish(ex != null);
            log.info("[StageScore] batch {} finished status={} shows={}", job.id(), report.status(), report.shows().size());
        });
        return job;
    }

    /** 동기 실행 */
    public BatchReport run(BatchRequest request) {
        return submit(request).completion().join();
    }

    public Optional<BatchJob> job(String jobId) {
        return registry.find(jobId);
    }

    public boolean cancel(String jobId) {
        BatchJob job = registry.get(jobId);
        boolean cancelled = job.cancel();
        if (cancelled) log.info("[StageScore] batch {} cancel requested", jobId);
        return cancelled;
    }

    /** 등록된 공급자에서 원시 리뷰를 모아 한 공연을 다시 처리 */
    public ShowRunResult refresh(ShowContext show) {
        List<RawReview> raws = new ArrayList<>();
        for (ReviewSource s : sources) {
            try {
                raws.addAll(s.fetch(show));
            } catch (RuntimeException e) {
                log.warn("[StageScore] source={} show={} error={}", s.name(), show.showId(), e.getMessage());
            }
        }
        BatchJob job = new BatchJob(UUID.randomUUID().toString(), clock);
        registry.register(job);
        ShowRunResult result = processShow(job, show, raws);
        job.record(result);
        job.finish(false);
        return result;
    }

    // ===================== 공연 1건 =====================

    ShowRunResult processShow(BatchJob job, ShowContext show, List<RawReview> raws) {
        String showId = show.showId();
        if (job.isCancelled()) {
            return ShowRunResult.failed(showId, raws.size(), "cancelled");
        }
        try {
            // 1) 채점
            List<NormalizedReview> scored = new ArrayList<>();
            List<RejectedReview> rejected = new ArrayList<>();
            for (RawReview raw : raws) {
                try {
                    ScoringOutcome o = scoring.score(showId, raw);
                    if (o.isScored()) scored.add(o.review());
                    else rejected.add(o.rejection());
                } catch (RuntimeException e) {
                    log.warn("[StageScore] scoring error show={} outlet={} error={}", showId, raw.outletName(), e.getMessage());
                    rejected.add(RejectedReview.of(raw, "scoring error: " + e.getMessage()));
                }
            }

            ReentrantLock lock = lockFor(showId);
            lock.lock();
            try {
                // 2) 병합
                List<NormalizedReview> existing = store.load(showId).map(ShowSnapshot::reviews).orElse(List.of());
                MergeOutcome merged = deduplicator.mergeWithExisting(existing, scored);

                // 3) 감사 → 4) 집계
                ValidationResult validated = validator.validate(show, merged.reviews(), merged.conflicts());
                ShowAggregate aggregate = aggregator.aggregate(showId, validated.reviews());
                ShowSnapshot snapshot = new ShowSnapshot(showId, validated.reviews(), aggregate, validated.report());

                // 5) 저장 (취소 확인과 같은 락 안에서)
                boolean persisted = job.writeIfActive(() -> store.replace(snapshot));
                if (!persisted) {
                    log.info("[StageScore] show={} not persisted: batch {} cancelled", showId, job.id());
                }
                log.info("[StageScore] show={} received={} scored={} rejected={} added={} updated={} score={} confidence={}",
                        showId, raws.size(), scored.size(), rejected.size(), merged.added(), merged.updated(),
                        aggregate.weightedScore(), aggregate.confidence().wire());

                return new ShowRunResult(showId, raws.size(), scored.size(), rejected,
                        merged.added(), merged.updated(), merged.unchanged(), merged.duplicatesRemoved(),
                        aggregate, validated.report().entries().size(), persisted, persisted ? null : "cancelled");
            } finally {
                lock.unlock();
            }
        } catch (RuntimeException e) {
            log.error("[StageScore] show={} failed", showId, e);
            return ShowRunResult.failed(showId, raws.size(), String.valueOf(e.getMessage()));
        }
    }

    // ===================== 내부 유틸 =====================

    /** 한 배치에 같은 공연이 여러 번 오면 리뷰를 합쳐 한 작업으로 */
    private static Collection<ShowBatchRequest> groupByShow(List<ShowBatchRequest> shows) {
        Map<String, ShowBatchRequest> byId = new LinkedHashMap<>();
        for (ShowBatchRequest s : shows) {
            byId.merge(s.showId(), s, (a, b) -> {
                List<RawReview> all = new ArrayList<>(a.reviews());
                all.addAll(b.reviews());
                return new ShowBatchRequest(a.showId(),
                        a.title() != null ? a.title() : b.title(),
                        a.openingDate() != null ? a.openingDate() : b.openingDate(),
                        all);
            });
        }
        return byId.values();
    }

    ReentrantLock lockFor(String showId) {
        return showLocks.get(showId);
    }
}
