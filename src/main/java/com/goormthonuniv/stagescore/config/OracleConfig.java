package com.goormthonuniv.stagescore.config;

import com.goormthonuniv.stagescore.llm.*;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * 채점 오라클 3종(primary/secondary/tiebreaker)과 앙상블 구성.
 * application.yml:
 * stagescore:
 *   oracles:
 *     primary:   { api-key: ..., model: gpt-4o-mini, base-url: https://api.openai.com/v1 }
 * API 키는 커밋하지 않는 properties/env.properties 에 둔다 (없으면 무시).
 */
@Slf4j
@Configuration
@PropertySource(value = "classpath:properties/env.properties", ignoreResourceNotFound = true)
public class OracleConfig {

    @Value("${stagescore.oracles.timeout:PT30S}")
    private Duration timeout;

    // ===== 오라클 =====

    @Bean
    public ScoringOracle primaryOracle(RestClient.Builder builder,
                                       @Value("${stagescore.oracles.primary.base-url:https://api.openai.com/v1}") String baseUrl,
                                       @Value("${stagescore.oracles.primary.api-key:}") String apiKey,
                                       @Value("${stagescore.oracles.primary.model:gpt-4o-mini}") String model) {
        return oracle("primary", builder, baseUrl, apiKey, model);
    }

    @Bean
    public ScoringOracle secondaryOracle(RestClient.Builder builder,
                                         @Value("${stagescore.oracles.secondary.base-url:https://api.openai.com/v1}") String baseUrl,
                                         @Value("${stagescore.oracles.secondary.api-key:}") String apiKey,
                                         @Value("${stagescore.oracles.secondary.model:gpt-4o}") String model) {
        return oracle("secondary", builder, baseUrl, apiKey, model);
    }

    @Bean
    public ScoringOracle tiebreakerOracle(RestClient.Builder builder,
                                          @Value("${stagescore.oracles.tiebreaker.base-url:https://api.openai.com/v1}") String baseUrl,
                                          @Value("${stagescore.oracles.tiebreaker.api-key:}") String apiKey,
                                          @Value("${stagescore.oracles.tiebreaker.model:gpt-4.1-mini}") String model) {
        return oracle("tiebreaker", builder, baseUrl, apiKey, model);
    }

    // ===== 재시도 / 실행기 =====

    @Bean
    public RetryRegistry oracleRetryRegistry(@Value("${stagescore.oracles.retry.initial-delay:PT1S}") Duration initialDelay,
                                             @Value("${stagescore.oracles.retry.max-retries:3}") int maxRetries) {
        return RetryRegistry.of(OracleInvoker.retryConfig(maxRetries,
                IntervalFunction.ofExponentialBackoff(initialDelay, 2.0)));
    }

    @Bean
    public OracleInvoker oracleInvoker(RetryRegistry oracleRetryRegistry) {
        return new OracleInvoker(oracleRetryRegistry);
    }

    @Bean
    public ThreadPoolTaskExecutor oracleExecutor(@Value("${stagescore.oracles.threads:8}") int threads) {
        return executor("oracle-", threads);
    }

    @Bean
    public ThreadPoolTaskExecutor pipelineExecutor(@Value("${stagescore.pipeline.threads:4}") int threads) {
        return executor("pipeline-", threads);
    }

    @Bean
    public EnsembleScorer ensembleScorer(@Qualifier("primaryOracle") ScoringOracle primary,
                                         @Qualifier("secondaryOracle") ScoringOracle secondary,
                                         @Qualifier("tiebreakerOracle") ScoringOracle tiebreaker,
                                         OracleInvoker oracleInvoker,
                                         @Qualifier("oracleExecutor") ThreadPoolTaskExecutor oracleExecutor,
                                         @Value("${stagescore.oracles.cache.ttl:PT24H}") Duration cacheTtl,
                                         @Value("${stagescore.oracles.cache.max-size:10000}") long cacheMaxSize) {
        EnsembleScorer scorer = new EnsembleScorer(primary, secondary, tiebreaker, oracleInvoker,
                oracleExecutor, cacheTtl, cacheMaxSize);
        log.info("[StageScore] ensemble scorer available={} (primary={}, secondary={}, tiebreaker={})",
                scorer.isAvailable(), primary.isAvailable(), secondary.isAvailable(), tiebreaker.isAvailable());
        return scorer;
    }

    // ===================== 내부 =====================

    private ScoringOracle oracle(String name, RestClient.Builder builder, String baseUrl, String apiKey, String model) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        RestClient rest = builder.clone().requestFactory(factory).build();
        return new OpenAiScoringOracle(name, rest, baseUrl, apiKey, model);
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int threads) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(threads);
        ex.setMaxPoolSize(threads);
        ex.setThreadNamePrefix(prefix);
        ex.setWaitForTasksToCompleteOnShutdown(true);
        return ex;
    }
}
