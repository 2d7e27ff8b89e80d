package com.cinegen.api.storage;

import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 로컬 파일 시스템 기반 저장소 서비스
 * S3가 비활성화되어 있을 때 사용
 */
@Slf4j
public class LocalStorageService implements StorageService {

    private final Path root;

    public LocalStorageService(String rootPath) {
        this.root = Paths.get(rootPath).toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
            log.info("LocalStorageService initialized - path: {}", root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local storage directory: " + root, e);
        }
    }

    @Override
    public String put(byte[] data, String suggestedName, String contentType) {
        Path filePath = resolve(suggestedName);
        try {
            Files.createDirectories(filePath.getParent());
            Files.write(filePath, data);
            log.info("File saved locally: {} ({} bytes)", filePath, data.length);
            return filePath.toString();
        } catch (IOException e) {
            log.error("Failed to save file locally: {}", suggestedName, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "Local storage failed: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] get(String storedRef) {
        Path filePath = resolve(storedRef);
        if (!Files.exists(filePath)) {
            throw new ApiException(ErrorCode.STORAGE_FAILED, "File not found: " + storedRef);
        }
        try {
            return Files.readAllBytes(filePath);
        } catch (IOException e) {
            log.error("Failed to read local file: {}", storedRef, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "Local storage read failed: " + e.getMessage(), e);
        }
    }

    /**
     * 저장소 루트 밖으로 나가는 경로는 거부
     */
    private Path resolve(String name) {
        Path candidate = Paths.get(name);
        Path filePath = candidate.isAbsolute() ? candidate.normalize() : root.resolve(name).normalize();
        if (!filePath.startsWith(root)) {
            throw new ApiException(ErrorCode.STORAGE_FAILED, "Path escapes storage root: " + name);
        }
        return filePath;
    }
}
