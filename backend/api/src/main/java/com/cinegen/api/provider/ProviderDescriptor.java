package com.cinegen.api.provider;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ProviderDescriptor {
    private final String name;
    private final String modelId;
    private final boolean available;
    private final int priority;
    private final boolean isDefault;
}
