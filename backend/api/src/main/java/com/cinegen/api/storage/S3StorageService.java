package com.cinegen.api.storage;

import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * AWS S3 기반 파일 저장소 서비스
 * 참조 형식: s3://{bucket}/{key}
 */
@Slf4j
public class S3StorageService implements StorageService {

    private static final String SCHEME = "s3://";

    private final S3Client s3Client;
    private final String bucket;
    private final String keyPrefix;

    public S3StorageService(S3Client s3Client, String bucket, String keyPrefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        log.info("S3StorageService initialized - bucket: {}, prefix: {}", bucket, this.keyPrefix);
    }

    @Override
    public String put(byte[] data, String suggestedName, String contentType) {
        String key = keyPrefix + suggestedName;
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType)
                    .build();

            s3Client.putObject(request, RequestBody.fromBytes(data));

            log.info("File uploaded to S3: {}/{} (size: {} bytes)", bucket, key, data.length);
            return SCHEME + bucket + "/" + key;
        } catch (S3Exception e) {
            log.error("Failed to upload file to S3: {}", key, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "S3 upload failed: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] get(String storedRef) {
        String key = toKey(storedRef);
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build();

            return s3Client.getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException e) {
            log.warn("File not found in S3: {}", key);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "File not found: " + storedRef, e);
        } catch (S3Exception e) {
            log.error("Failed to download file from S3: {}", key, e);
            throw new ApiException(ErrorCode.STORAGE_FAILED, "S3 download failed: " + e.getMessage(), e);
        }
    }

    private String toKey(String storedRef) {
        String bucketPrefix = SCHEME + bucket + "/";
        return storedRef.startsWith(bucketPrefix) ? storedRef.substring(bucketPrefix.length()) : storedRef;
    }
}
