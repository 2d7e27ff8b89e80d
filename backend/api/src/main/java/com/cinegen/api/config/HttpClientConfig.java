package com.cinegen.api.config;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP 클라이언트 공통 설정
 * - RestTemplate: 프로바이더 호출용 (연결/읽기 타임아웃)
 * - ObjectMapper: 프로바이더 응답 파싱, Redis 큐 직렬화
 */
@Configuration
public class HttpClientConfig {

    /**
     * RestTemplate Bean
     * - Connection Timeout: 기본 30초
     * - Read Timeout: 기본 5분 (인라인 base64 영상 응답은 수십 MB)
     */
    @Bean
    @Primary
    public RestTemplate restTemplate(@Value("${cinegen.http.connect-timeout-ms:30000}") int connectTimeoutMs,
                                     @Value("${cinegen.http.read-timeout-ms:300000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);

        return new RestTemplate(factory);
    }

    /**
     * ObjectMapper Bean
     * - 알 수 없는 속성 무시
     * - Java 8 날짜/시간 지원
     * - 문자열 길이 제한 100MB (bytesBase64Encoded 영상 응답)
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        StreamReadConstraints constraints = StreamReadConstraints.builder()
            .maxStringLength(100_000_000)
            .build();
        mapper.getFactory().setStreamReadConstraints(constraints);

        return mapper;
    }
}
