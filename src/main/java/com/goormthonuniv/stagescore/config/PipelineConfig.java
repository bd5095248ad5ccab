package com.goormthonuniv.stagescore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.stagescore.aggregate.AggregationPolicy;
import com.goormthonuniv.stagescore.aggregate.ShowAggregator;
import com.goormthonuniv.stagescore.calibration.CalibrationCorrector;
import com.goormthonuniv.stagescore.calibration.CalibrationSampleCollector;
import com.goormthonuniv.stagescore.dedupe.DuplicateMatcher;
import com.goormthonuniv.stagescore.dedupe.ReviewDeduplicator;
import com.goormthonuniv.stagescore.llm.EnsembleScorer;
import com.goormthonuniv.stagescore.outlet.OutletResolver;
import com.goormthonuniv.stagescore.rating.DesignationDetector;
import com.goormthonuniv.stagescore.rating.RatingParser;
import com.goormthonuniv.stagescore.rating.SentimentInferencer;
import com.goormthonuniv.stagescore.service.BatchJobRegistry;
import com.goormthonuniv.stagescore.service.ReviewPipelineOrchestrator;
import com.goormthonuniv.stagescore.service.ReviewScoringService;
import com.goormthonuniv.stagescore.source.JsonDirectoryReviewSource;
import com.goormthonuniv.stagescore.source.ReviewSource;
import com.goormthonuniv.stagescore.store.InMemoryReviewStore;
import com.goormthonuniv.stagescore.store.JsonFileReviewStore;
import com.goormthonuniv.stagescore.store.ReviewStore;
import com.goormthonuniv.stagescore.verify.ReviewValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/** 병합/집계/감사/저장/배치 실행 구성 */
@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ===== 병합 =====

    @Bean
    public ReviewDeduplicator reviewDeduplicator(@Value("${stagescore.dedupe.strip-query:true}") boolean stripQuery) {
        return new ReviewDeduplicator(new DuplicateMatcher(stripQuery));
    }

    // ===== 집계 / 감사 =====

    @Bean
    public AggregationPolicy aggregationPolicy(@Value("${stagescore.aggregate.min-reviews:5}") int minReviews,
                                               @Value("${stagescore.aggregate.high.reviews:15}") int highReviews,
                                               @Value("${stagescore.aggregate.high.tier1:3}") int highTier1,
                                               @Value("${stagescore.aggregate.medium.reviews:6}") int mediumReviews,
                                               @Value("${stagescore.aggregate.medium.tier1:1}") int mediumTier1) {
        return new AggregationPolicy(minReviews, highReviews, highTier1, mediumReviews, mediumTier1);
    }

    @Bean
    public ShowAggregator showAggregator(OutletResolver outletResolver, AggregationPolicy aggregationPolicy, Clock clock) {
        return new ShowAggregator(outletResolver, aggregationPolicy, clock);
    }

    @Bean
    public ReviewValidator reviewValidator(SentimentInferencer sentimentInferencer, Clock clock) {
        return new ReviewValidator(sentimentInferencer, clock);
    }

    // ===== 저장소 / 공급자 =====

    @Bean
    public ReviewStore reviewStore(ObjectMapper objectMapper, @Value("${stagescore.store.dir:}") String dir) {
        if (dir == null || dir.isBlank()) {
            log.info("[StageScore] review store: in-memory");
            return new InMemoryReviewStore();
        }
        log.info("[StageScore] review store: json files in {}", dir);
        return new JsonFileReviewStore(Path.of(dir), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "stagescore.sources.json-dir")
    public ReviewSource jsonDirectoryReviewSource(ObjectMapper objectMapper,
                                                  @Value("${stagescore.sources.json-dir}") String dir) {
        return new JsonDirectoryReviewSource(Path.of(dir), objectMapper);
    }

    // ===== 채점 / 배치 =====

    @Bean
    public ReviewScoringService reviewScoringService(OutletResolver outletResolver,
                                                     RatingParser ratingParser,
                                                     SentimentInferencer sentimentInferencer,
                                                     DesignationDetector designationDetector,
                                                     EnsembleScorer ensembleScorer,
                                                     CalibrationCorrector calibrationCorrector,
                                                     CalibrationSampleCollector calibrationSampleCollector,
                                                     @Value("${stagescore.calibration.sample-explicit:false}") boolean sampleExplicit) {
        return new ReviewScoringService(outletResolver, ratingParser, sentimentInferencer, designationDetector,
                ensembleScorer, calibrationCorrector, calibrationSampleCollector, sampleExplicit);
    }

    @Bean
    public BatchJobRegistry batchJobRegistry(@Value("${stagescore.jobs.retention:PT24H}") Duration retention,
                                             @Value("${stagescore.jobs.max:500}") long maxJobs) {
        return new BatchJobRegistry(retention, maxJobs);
    }

    @Bean
    public ReviewPipelineOrchestrator reviewPipelineOrchestrator(ObjectProvider<ReviewSource> sources,
                                                                 ReviewScoringService reviewScoringService,
                                                                 ReviewDeduplicator reviewDeduplicator,
                                                                 ReviewValidator reviewValidator,
                                                                 ShowAggregator showAggregator,
                                                                 ReviewStore reviewStore,
                                                                 BatchJobRegistry batchJobRegistry,
                                                                 @Qualifier("pipelineExecutor") ThreadPoolTaskExecutor pipelineExecutor,
                                                                 Clock clock) {
        return new ReviewPipelineOrchestrator(sources.orderedStream().toList(), reviewScoringService,
                reviewDeduplicator, reviewValidator, showAggregator, reviewStore, batchJobRegistry,
                pipelineExecutor, clock);
    }
}
