package com.goormthonuniv.stagescore.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.stagescore.exception.OutletCatalogException;
import com.goormthonuniv.stagescore.outlet.OutletConfig;
import com.goormthonuniv.stagescore.outlet.OutletResolver;
import com.goormthonuniv.stagescore.outlet.TierWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/** 매체 카탈로그(outlets.json)를 기동 시 한 번 읽는다. 없거나 비어 있으면 기동 중단 */
@Slf4j
@Configuration
public class OutletCatalogConfig {

    @Bean
    public OutletResolver outletResolver(ResourceLoader resourceLoader,
                                         ObjectMapper objectMapper,
                                         TierWeights tierWeights,
                                         @Value("${stagescore.outlets.catalog:classpath:outlets.json}") String location) {
        List<OutletConfig> outlets = load(resourceLoader.getResource(location), objectMapper, tierWeights);
        log.info("[StageScore] outlet catalog loaded location={} outlets={}", location, outlets.size());
        return new OutletResolver(outlets, tierWeights);
    }

    static List<OutletConfig> load(Resource resource, ObjectMapper objectMapper, TierWeights tierWeights) {
        if (!resource.exists()) {
            throw new OutletCatalogException("outlet catalog not found: " + resource.getDescription());
        }
        List<OutletConfig> raw;
        try (InputStream in = resource.getInputStream()) {
            raw = objectMapper.readValue(in, new TypeReference<List<OutletConfig>>() {});
        } catch (IOException e) {
            throw new OutletCatalogException("outlet catalog unreadable: " + resource.getDescription(), e);
        }
        if (raw == null || raw.isEmpty()) {
            throw new OutletCatalogException("outlet catalog is empty: " + resource.getDescription());
        }
        // JSON 에 가중치가 없으면 tier 기준으로 채움
        return raw.stream()
                .map(o -> o.tierWeight() > 0 ? o : o.withTierWeight(tierWeights.weightOf(o.tier())))
                .toList();
    }
}
