package com.cinegen.api.dto;

import com.cinegen.api.provider.GenerationOutput;
import com.cinegen.api.provider.Operation;
import com.cinegen.api.provider.ProviderDescriptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

public class ProviderDto {

    /**
     * 프로바이더 상태
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResProvider {
        private String name;
        private String modelId;
        private boolean available;
        private int priority;          // 1부터 시작, 작을수록 우선
        private boolean defaultProvider;

        public static ResProvider from(ProviderDescriptor descriptor) {
            return ResProvider.builder()
                    .name(descriptor.getName())
                    .modelId(descriptor.getModelId())
                    .available(descriptor.isAvailable())
                    .priority(descriptor.getPriority())
                    .defaultProvider(descriptor.isDefault())
                    .build();
        }
    }

    /**
     * 작업 핸들 직접 조회 응답
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResOperation {
        private String provider;
        private String handle;
        private String shortHandle;
        private boolean done;
        private String resultRef;
        private String mimeType;
        private String source;
        private String errorCode;
        private String error;
        private Map<String, Object> metadata;

        public static ResOperation from(String provider, Operation operation) {
            GenerationOutput output = operation.getOutput();
            return ResOperation.builder()
                    .provider(provider)
                    .handle(operation.getHandle())
                    .shortHandle(operation.getShortHandle())
                    .done(operation.isDone())
                    .resultRef(output != null ? output.getResultRef() : null)
                    .mimeType(output != null ? output.getMimeType() : null)
                    .source(output != null && output.getSource() != null ? output.getSource().name() : null)
                    .errorCode(operation.getErrorCode() != null ? operation.getErrorCode().name() : null)
                    .error(operation.getError())
                    .metadata(operation.getMetadata())
                    .build();
        }
    }
}
