package com.cinegen.api.controller;

import com.cinegen.api.dto.WorkerDto;
import com.cinegen.api.worker.GenerationWorker;
import com.cinegen.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/worker")
@Tag(name = "Worker", description = "생성 워커 상태 API")
public class WorkerController {

    private final GenerationWorker generationWorker;

    @GetMapping("/status")
    @Operation(summary = "워커 상태", description = "워커 ID, 실행 여부, 큐 종류와 크기를 조회합니다.")
    public ApiResponse<WorkerDto.ResStatus> status() {
        return ApiResponse.success(generationWorker.getStatus());
    }
}
