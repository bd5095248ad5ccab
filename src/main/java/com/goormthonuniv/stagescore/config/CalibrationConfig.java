package com.goormthonuniv.stagescore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.stagescore.calibration.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/** 보정 테이블 초기값(calibration/offsets.json) 로드 + 보정 관련 빈 */
@Slf4j
@Configuration
public class CalibrationConfig {

    /** offsets.json 형식 */
    public record OffsetsFile(Integer minSampleSize, Instant derivedAt, List<CalibrationEntry> entries) {}

    @Bean
    public CalibrationCorrector calibrationCorrector(ResourceLoader resourceLoader,
                                                     ObjectMapper objectMapper,
                                                     @Value("${stagescore.calibration.seed:classpath:calibration/offsets.json}") String location,
                                                     @Value("${stagescore.calibration.min-sample-size:10}") int minSampleSize) {
        CalibrationOffsetTable table = load(resourceLoader.getResource(location), objectMapper, minSampleSize);
        log.info("[StageScore] calibration seed location={} entries={}", location, table.entries().values());
        return new CalibrationCorrector(table);
    }

    @Bean
    public CalibrationDeriver calibrationDeriver(Clock clock) {
        return new CalibrationDeriver(clock);
    }

    @Bean
    public CalibrationSampleCollector calibrationSampleCollector(
            @Value("${stagescore.calibration.sample-capacity:5000}") int capacity) {
        return new CalibrationSampleCollector(capacity);
    }

    /** 시드가 없으면 보정 없이 시작 (모든 버킷 비활성) */
    static CalibrationOffsetTable load(Resource resource, ObjectMapper objectMapper, int minSampleSize) {
        if (!resource.exists()) {
            log.warn("[StageScore] calibration seed not found: {} (all buckets inert)", resource.getDescription());
            return CalibrationOffsetTable.empty(minSampleSize);
        }
        try (InputStream in = resource.getInputStream()) {
            OffsetsFile file = objectMapper.readValue(in, OffsetsFile.class);
            int min = file.minSampleSize() != null ? file.minSampleSize() : minSampleSize;
            return new CalibrationOffsetTable(file.entries(), min, file.derivedAt());
        } catch (IOException e) {
            throw new UncheckedIOException("calibration seed unreadable: " + resource.getDescription(), e);
        }
    }
}
