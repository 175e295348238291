package com.forensic.anomaly.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j bulkhead capping concurrent analyses per instance.
 * Limits come from {@code resilience4j.bulkhead.instances.analysisEngine}.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String ANALYSIS_ENGINE_INSTANCE = "analysisEngine";

    @Bean
    public Bulkhead analysisBulkhead(BulkheadRegistry bulkheadRegistry) {
        Bulkhead bulkhead = bulkheadRegistry.bulkhead(ANALYSIS_ENGINE_INSTANCE);

        bulkhead.getEventPublisher()
                .onCallPermitted(event -> log.debug("Analysis permitted: available={}/{}",
                        bulkhead.getMetrics().getAvailableConcurrentCalls(),
                        bulkhead.getMetrics().getMaxAllowedConcurrentCalls()))
                .onCallRejected(event -> log.warn("Analysis rejected, engine saturated: available={}/{}",
                        bulkhead.getMetrics().getAvailableConcurrentCalls(),
                        bulkhead.getMetrics().getMaxAllowedConcurrentCalls()))
                .onCallFinished(event -> log.debug("Analysis finished: duration={}ms",
                        event.getCallDuration()));

        return bulkhead;
    }
}
