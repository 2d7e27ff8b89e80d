package com.cinegen.api.persona;

import com.cinegen.api.provider.ReferenceAsset;

import java.util.Collections;
import java.util.List;

/**
 * 페르소나 저장소가 연결되지 않은 배포용 기본 구현. 항상 빈 목록.
 */
public class NoOpPersonaReferenceResolver implements PersonaReferenceResolver {

    @Override
    public List<ReferenceAsset> resolveReferences(String promptText, List<String> personaIds) {
        return Collections.emptyList();
    }
}
