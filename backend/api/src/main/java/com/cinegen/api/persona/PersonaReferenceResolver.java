package com.cinegen.api.persona;

import com.cinegen.api.provider.ReferenceAsset;

import java.util.List;

/**
 * 프롬프트와 페르소나 목록으로부터 참조 자산을 찾는 외부 협력자
 */
public interface PersonaReferenceResolver {

    /**
     * @return 0개 이상의 참조 자산 (순서는 우선순위)
     */
    List<ReferenceAsset> resolveReferences(String promptText, List<String> personaIds);
}
