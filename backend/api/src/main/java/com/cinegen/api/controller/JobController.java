package com.cinegen.api.controller;

import com.cinegen.api.dto.JobDto;
import com.cinegen.api.service.JobService;
import com.cinegen.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/jobs")
@Tag(name = "Job", description = "영상 생성 작업 API")
public class JobController {

    private final JobService jobService;

    @PostMapping
    @Operation(summary = "생성 작업 제출", description = "프롬프트와 파라미터로 영상 생성 작업을 큐에 등록합니다.")
    public ApiResponse<JobDto.ResSubmit> submit(@RequestBody JobDto.ReqSubmit request) {
        log.info("[Job] Submit request - kind: {}, personas: {}", request.getKind(), request.getPersonaIds());
        JobDto.ResSubmit response = jobService.submit(request);
        return ApiResponse.success(response.getMessage(), response);
    }

    @PostMapping("/validate")
    @Operation(summary = "요청 검증", description = "작업을 등록하지 않고 프롬프트와 파라미터를 검증합니다.")
    public ApiResponse<JobDto.ResValidate> validate(@RequestBody JobDto.ReqSubmit request) {
        return ApiResponse.success(jobService.validate(request));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "작업 상태 조회", description = "진행률, 현재 단계, 결과 또는 오류를 조회합니다.")
    public ApiResponse<JobDto.ResStatus> getStatus(@PathVariable String jobId) {
        return ApiResponse.success(jobService.getStatus(jobId));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "작업 취소", description = "대기 중이거나 처리 중인 작업을 취소합니다. 이미 종료된 작업은 409.")
    public ApiResponse<JobDto.ResCancel> cancel(@PathVariable String jobId) {
        log.info("[Job] Cancel request - jobId: {}", jobId);
        return ApiResponse.success("작업이 취소되었습니다.", jobService.cancel(jobId));
    }

    @GetMapping
    @Operation(summary = "작업 목록", description = "최근 작업을 최신순으로 조회합니다.")
    public ApiResponse<List<JobDto.ResStatus>> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer limit) {
        return ApiResponse.success(jobService.list(status, limit));
    }
}
