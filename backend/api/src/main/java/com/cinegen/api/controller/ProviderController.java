package com.cinegen.api.controller;

import com.cinegen.api.dto.ProviderDto;
import com.cinegen.api.service.JobService;
import com.cinegen.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/providers")
@Tag(name = "Provider", description = "영상 생성 프로바이더 API")
public class ProviderController {

    private final JobService jobService;

    @GetMapping
    @Operation(summary = "프로바이더 목록", description = "우선순위, 사용 가능 여부, 모델 ID를 조회합니다.")
    public ApiResponse<List<ProviderDto.ResProvider>> list() {
        return ApiResponse.success(jobService.listProviders());
    }

    @GetMapping("/{name}/operations")
    @Operation(summary = "작업 핸들 조회", description = "프로바이더의 장기 실행 작업 상태를 한 번 조회합니다.")
    public ApiResponse<ProviderDto.ResOperation> pollOperation(
            @PathVariable String name,
            @RequestParam String handle) {
        log.info("[Provider] Poll operation - provider: {}, handle: {}", name, handle);
        return ApiResponse.success(jobService.pollOperation(name, handle));
    }
}
