package com.cinegen.api.config;

import com.cinegen.api.storage.LocalStorageService;
import com.cinegen.api.storage.S3StorageService;
import com.cinegen.api.storage.StorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * 파일 저장소 설정
 * - aws.s3.enabled=true  → S3StorageService
 * - 그 외                 → LocalStorageService (java.io.tmpdir/cinegen)
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(name = "aws.s3.enabled", havingValue = "true")
    public S3Client s3Client(@Value("${aws.s3.region:ap-northeast-2}") String region) {
        return S3Client.builder()
                .region(Region.of(region))
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "aws.s3.enabled", havingValue = "true")
    public StorageService s3StorageService(S3Client s3Client,
                                           @Value("${aws.s3.bucket}") String bucket,
                                           @Value("${aws.s3.key-prefix:cinegen/}") String keyPrefix) {
        return new S3StorageService(s3Client, bucket, keyPrefix);
    }

    @Bean
    @ConditionalOnProperty(name = "aws.s3.enabled", havingValue = "false", matchIfMissing = true)
    public StorageService localStorageService(
            @Value("${cinegen.storage.local-path:#{systemProperties['java.io.tmpdir']}/cinegen}") String localPath) {
        return new LocalStorageService(localPath);
    }
}
