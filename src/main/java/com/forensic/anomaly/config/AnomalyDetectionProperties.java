package com.forensic.anomaly.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Bound view of the {@code anomaly.*} properties.
 * Only structural checks happen here; boundary semantics are enforced by {@link DetectionConfig}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyDetectionProperties {

    @Valid
    @NotNull
    private RoundNumber roundNumber = new RoundNumber();

    @Valid
    @NotNull
    private Threshold threshold = new Threshold();

    @Valid
    @NotNull
    private Fuzzy fuzzy = new Fuzzy();

    @Valid
    @NotNull
    private Benford benford = new Benford();

    @Valid
    @NotNull
    private Currency currency = new Currency();

    @Valid
    @NotNull
    private Engine engine = new Engine();

    @Data
    public static class RoundNumber {
        // Amounts that are an exact multiple of this unit are flagged
        @NotNull
        private BigDecimal unit = new BigDecimal("1000");
    }

    @Data
    public static class Threshold {
        // Approval limit; amounts just below it are flagged
        @NotNull
        private BigDecimal amount = new BigDecimal("10000");

        // Absolute margin below the limit. When unset, margin = amount * marginRatio
        private BigDecimal margin;

        private BigDecimal marginRatio = new BigDecimal("0.05");
    }

    @Data
    public static class Fuzzy {
        private double similarityCutoff = 0.85;

        // 0 = same calendar day only
        private int dateWindowDays = 0;

        // Relative: |a - b| <= tolerance * max(a, b)
        private double amountTolerance = 0.01;
    }

    @Data
    public static class Benford {
        private int minSampleSize = 30;

        // Nigrini first-digit nonconformity boundary
        private double madCutoff = 0.015;
    }

    @Data
    public static class Currency {
        @NotBlank
        private String symbol = "$";

        // Digits of the smallest currency unit
        private int scale = 2;
    }

    @Data
    public static class Engine {
        private boolean parallelDetectors = true;
    }
}
