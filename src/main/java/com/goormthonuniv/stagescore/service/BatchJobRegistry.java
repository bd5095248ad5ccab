package com.goormthonuniv.stagescore.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.stagescore.exception.NotFoundException;

import java.time.Duration;
import java.util.Optional;

/** 최근 배치 작업 보관 (만료 후 조회 불가) */
public class BatchJobRegistry {

    private final Cache<String, BatchJob> jobs;

    public BatchJobRegistry(Duration retention, long maxJobs) {
        this.jobs = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(maxJobs)
                .build();
    }

    public void register(BatchJob job) {
        jobs.put(job.id(), job);
    }

    public Optional<BatchJob> find(String jobId) {
        return Optional.ofNullable(jobs.getIfPresent(jobId));
    }

    public BatchJob get(String jobId) {
        return find(jobId).orElseThrow(() -> new NotFoundException("batch job", jobId));
    }
}
