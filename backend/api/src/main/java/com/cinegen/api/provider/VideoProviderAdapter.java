package com.cinegen.api.provider;

/**
 * 원격 영상 생성 백엔드 하나를 감싸는 공통 인터페이스
 *
 * 자격 증명이 없으면 isAvailable() 이 false 이며, 이때 submit 은 호출되지 않는다.
 * 어댑터는 결과를 임의로 만들어내지 않는다.
 */
public interface VideoProviderAdapter {

    /**
     * 라우터에서 사용하는 프로바이더 이름 (예: "veo", "sora")
     */
    String getName();

    String getModelId();

    boolean isAvailable();

    /**
     * 생성 요청 제출
     * @return 즉시 완료된 결과 또는 대기 중인 Operation
     */
    ProviderOutcome submit(GenerationRequest request);

    /**
     * 대기 중인 작업 상태 조회 (1회, 대기 없음)
     */
    Operation poll(String handle);
}
