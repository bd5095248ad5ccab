package com.goormthonuniv.stagescore.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.*;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI stageScoreOpenApi(@Value("${spring.application.name:stagescore}") String appName) {
        return new OpenAPI()
                .info(new Info()
                        .title("StageScore Review Pipeline API")
                        .description("평론 리뷰 정규화, 앙상블 채점, 공연별 합의 점수 집계 (" + appName + ")")
                        .version("v0.1.0"))
                .tags(List.of(
                        new Tag().name("batches").description("배치 제출/조회/취소"),
                        new Tag().name("shows").description("공연별 집계/리뷰/감사 리포트")))
                .externalDocs(new ExternalDocumentation().description("Swagger UI").url("/swagger-ui.html"));
    }
}
