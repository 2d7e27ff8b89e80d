package com.cinegen.api.config;

import com.cinegen.api.persona.NoOpPersonaReferenceResolver;
import com.cinegen.api.persona.PersonaReferenceResolver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PersonaConfig {

    @Bean
    @ConditionalOnMissingBean(PersonaReferenceResolver.class)
    public PersonaReferenceResolver personaReferenceResolver() {
        return new NoOpPersonaReferenceResolver();
    }
}
