package com.forensic.anomaly.config;

import com.forensic.anomaly.engine.AnomalyEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Freezes the bound {@code anomaly.*} properties into a {@link DetectionConfig} and builds the engine.
 * An invalid configuration fails here and aborts startup.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    public DetectionConfig detectionConfig(AnomalyDetectionProperties properties) {
        DetectionConfig config = DetectionConfig.from(properties);
        log.info("Detection config: roundUnit={}, threshold={}, margin={}, similarityCutoff={}, " +
                        "dateWindowDays={}, amountTolerance={}, benfordMinSample={}, parallel={}",
                config.roundNumberUnit(),
                config.thresholdAmount(),
                config.thresholdMargin(),
                config.similarityCutoff(),
                config.dateWindowDays(),
                config.amountTolerance(),
                config.benfordMinSampleSize(),
                config.parallelDetectors());
        return config;
    }

    @Bean
    public AnomalyEngine anomalyEngine(DetectionConfig detectionConfig) {
        return new AnomalyEngine(detectionConfig);
    }
}
