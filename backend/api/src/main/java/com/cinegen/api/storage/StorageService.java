package com.cinegen.api.storage;

/**
 * 파일 저장소 서비스 인터페이스
 * S3 또는 로컬 파일 시스템을 추상화 (생성된 영상 바이너리 보관용)
 */
public interface StorageService {

    /**
     * 파일 저장
     * @param data 파일 데이터
     * @param suggestedName 저장 경로 힌트 (예: videos/{jobId}.mp4)
     * @param contentType MIME 타입
     * @return 저장된 파일 참조 (로컬 절대 경로 또는 s3://bucket/key)
     */
    String put(byte[] data, String suggestedName, String contentType);

    /**
     * 파일 읽기
     * @param storedRef put 이 반환한 참조
     */
    byte[] get(String storedRef);
}
