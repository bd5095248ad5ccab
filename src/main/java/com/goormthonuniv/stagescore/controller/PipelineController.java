package com.goormthonuniv.stagescore.controller;

import com.goormthonuniv.stagescore.dto.AuditReport;
import com.goormthonuniv.stagescore.dto.BatchReport;
import com.goormthonuniv.stagescore.dto.BatchRequest;
import com.goormthonuniv.stagescore.dto.NormalizedReview;
import com.goormthonuniv.stagescore.dto.ShowAggregate;
import com.goormthonuniv.stagescore.dto.ShowContext;
import com.goormthonuniv.stagescore.dto.ShowRunResult;
import com.goormthonuniv.stagescore.exception.NotFoundException;
import com.goormthonuniv.stagescore.service.BatchJob;
import com.goormthonuniv.stagescore.service.ReviewPipelineOrchestrator;
import com.goormthonuniv.stagescore.store.ReviewStore;
import com.goormthonuniv.stagescore.store.ShowSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class PipelineController {

    private final ReviewPipelineOrchestrator orchestrator;
    private final ReviewStore store;

    // ===== 배치 =====

    @Operation(tags = "batches", summary = "리뷰 배치 제출", description = "공연별 원시 리뷰 묶음을 받아 비동기로 채점/병합/집계합니다. 작업 ID 를 즉시 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "작업 접수"),
            @ApiResponse(responseCode = "400", description = "요청 형식 오류")
    })
    @PostMapping("/batches")
    public ResponseEntity<BatchReport> submit(@Valid @RequestBody BatchRequest req) {
        BatchJob job = orchestrator.submit(req);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job.report());
    }

    @Operation(tags = "batches", summary = "배치 상태 조회")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "없는 작업 (또는 보관 기간 만료)")
    })
    @GetMapping("/batches/{jobId}")
    public ResponseEntity<BatchReport> batch(@PathVariable String jobId) {
        BatchJob job = orchestrator.job(jobId).orElseThrow(() -> new NotFoundException("batch", jobId));
        return ResponseEntity.ok(job.report());
    }

    @Operation(tags = "batches", summary = "배치 취소", description = "취소 이후에는 어떤 공연도 저장되지 않습니다. 이미 끝난 작업은 그대로입니다.")
    @PostMapping("/batches/{jobId}/cancel")
    public ResponseEntity<BatchReport> cancel(@PathVariable String jobId) {
        orchestrator.cancel(jobId);
        BatchJob job = orchestrator.job(jobId).orElseThrow(() -> new NotFoundException("batch", jobId));
        return ResponseEntity.ok(job.report());
    }

    // ===== 공연 =====

    @Operation(tags = "shows", summary = "공연 재수집", description = "등록된 리뷰 공급자에서 다시 가져와 동기로 처리합니다.")
    @PostMapping("/shows/{showId}/refresh")
    public ResponseEntity<ShowRunResult> refresh(@PathVariable String showId,
                                                 @RequestParam(required = false) String title,
                                                 @RequestParam(required = false)
                                                 @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate openingDate) {
        return ResponseEntity.ok(orchestrator.refresh(new ShowContext(showId, title, openingDate)));
    }

    @Operation(tags = "shows", summary = "공연 집계 조회")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "처리된 적 없는 공연")
    })
    @GetMapping("/shows/{showId}/aggregate")
    public ResponseEntity<ShowAggregate> aggregate(@PathVariable String showId) {
        return ResponseEntity.ok(snapshot(showId).aggregate());
    }

    @Operation(tags = "shows", summary = "공연 리뷰 목록")
    @GetMapping("/shows/{showId}/reviews")
    public ResponseEntity<List<NormalizedReview>> reviews(@PathVariable String showId) {
        return ResponseEntity.ok(snapshot(showId).reviews());
    }

    @Operation(tags = "shows", summary = "공연 감사 리포트")
    @GetMapping("/shows/{showId}/audit")
    public ResponseEntity<AuditReport> audit(@PathVariable String showId) {
        return ResponseEntity.ok(snapshot(showId).audit());
    }

    private ShowSnapshot snapshot(String showId) {
        return store.load(showId).orElseThrow(() -> new NotFoundException("show", showId));
    }
}
