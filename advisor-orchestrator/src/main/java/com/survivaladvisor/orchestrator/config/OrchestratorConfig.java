package com.survivaladvisor.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.survivaladvisor.common.reference.ReferenceData;
import com.survivaladvisor.common.reference.ReferenceDataLoader;
import com.survivaladvisor.common.snapshot.SnapshotNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    @Value("${advisor.reference-data.base-path:reference}")
    private String referenceDataBasePath;

    @Value("${advisor.ai.cooldown-seconds:0}")
    private long aiCooldownSeconds;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    public ReferenceDataLoader referenceDataLoader(ObjectMapper objectMapper) {
        return new ReferenceDataLoader(objectMapper);
    }

    @Bean
    public ReferenceData referenceData(ReferenceDataLoader loader) {
        return loader.load(referenceDataBasePath);
    }

    @Bean
    public SnapshotNormalizer snapshotNormalizer(ObjectMapper objectMapper, ReferenceData referenceData) {
        return new SnapshotNormalizer(objectMapper, referenceData);
    }

    /** Cooldown applied to every caller-supplied last-request time. */
    @Bean
    public Duration aiCooldown() {
        return Duration.ofSeconds(Math.max(0, aiCooldownSeconds));
    }
}
