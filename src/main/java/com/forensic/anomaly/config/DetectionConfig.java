package com.forensic.anomaly.config;

import com.forensic.anomaly.exception.InvalidConfigurationException;
import lombok.Builder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Immutable, validated detection parameters handed to the engine.
 * Construction fails with {@link InvalidConfigurationException} for any nonsensical boundary,
 * so a running engine never sees an invalid configuration.
 *
 * @param roundNumberUnit      amounts that are a multiple of this unit are round
 * @param thresholdAmount      approval limit
 * @param thresholdMargin      width of the flagged band below the limit; derived from the ratio when null
 * @param thresholdMarginRatio ratio used to derive the margin, null when the margin is absolute
 * @param similarityCutoff     minimum vendor similarity for a fuzzy duplicate, in (0, 1]
 * @param dateWindowDays       days after a transaction that still count as its neighbourhood
 * @param amountTolerance      relative amount difference allowed between fuzzy candidates, in [0, 1)
 * @param benfordMinSampleSize qualifying amounts needed before the digit test is meaningful
 * @param benfordMadCutoff     mean absolute deviation above which the distribution is flagged
 * @param currencySymbol       display symbol used in finding reasons
 * @param currencyScale        digits of the smallest currency unit
 * @param parallelDetectors    run the detectors concurrently
 */
@Builder(toBuilder = true)
public record DetectionConfig(
        BigDecimal roundNumberUnit,
        BigDecimal thresholdAmount,
        BigDecimal thresholdMargin,
        BigDecimal thresholdMarginRatio,
        double similarityCutoff,
        int dateWindowDays,
        double amountTolerance,
        int benfordMinSampleSize,
        double benfordMadCutoff,
        String currencySymbol,
        int currencyScale,
        boolean parallelDetectors
) {

    private static final int MAX_CURRENCY_SCALE = 6;

    public DetectionConfig {
        require(roundNumberUnit != null && roundNumberUnit.signum() > 0,
                "round-number.unit", "must be greater than zero");
        require(thresholdAmount != null && thresholdAmount.signum() > 0,
                "threshold.amount", "must be greater than zero");

        if (thresholdMargin == null) {
            require(thresholdMarginRatio != null, "threshold.margin-ratio",
                    "is required when threshold.margin is not set");
            require(thresholdMarginRatio.signum() >= 0 && thresholdMarginRatio.compareTo(BigDecimal.ONE) <= 0,
                    "threshold.margin-ratio", "must be between 0 and 1");
            thresholdMargin = thresholdAmount.multiply(thresholdMarginRatio);
        } else {
            thresholdMarginRatio = null;
        }
        require(thresholdMargin.signum() >= 0, "threshold.margin", "must not be negative");
        require(thresholdMargin.compareTo(thresholdAmount) <= 0,
                "threshold.margin", "must not exceed threshold.amount");

        require(similarityCutoff > 0.0 && similarityCutoff <= 1.0,
                "fuzzy.similarity-cutoff", "must be in (0, 1]");
        require(dateWindowDays >= 0, "fuzzy.date-window-days", "must not be negative");
        require(amountTolerance >= 0.0 && amountTolerance < 1.0,
                "fuzzy.amount-tolerance", "must be in [0, 1)");
        require(benfordMinSampleSize >= 1, "benford.min-sample-size", "must be at least 1");
        require(benfordMadCutoff > 0.0, "benford.mad-cutoff", "must be greater than zero");
        require(currencySymbol != null, "currency.symbol", "must be set");
        require(currencyScale >= 0 && currencyScale <= MAX_CURRENCY_SCALE,
                "currency.scale", "must be between 0 and " + MAX_CURRENCY_SCALE);
    }

    /**
     * Builder pre-populated with the documented defaults.
     */
    public static DetectionConfigBuilder defaultBuilder() {
        return DetectionConfig.builder()
                .roundNumberUnit(new BigDecimal("1000"))
                .thresholdAmount(new BigDecimal("10000"))
                .thresholdMarginRatio(new BigDecimal("0.05"))
                .similarityCutoff(0.85)
                .dateWindowDays(0)
                .amountTolerance(0.01)
                .benfordMinSampleSize(30)
                .benfordMadCutoff(0.015)
                .currencySymbol("$")
                .currencyScale(2)
                .parallelDetectors(true);
    }

    public static DetectionConfig defaults() {
        return defaultBuilder().build();
    }

    public static DetectionConfig from(AnomalyDetectionProperties properties) {
        return DetectionConfig.builder()
                .roundNumberUnit(properties.getRoundNumber().getUnit())
                .thresholdAmount(properties.getThreshold().getAmount())
                .thresholdMargin(properties.getThreshold().getMargin())
                .thresholdMarginRatio(properties.getThreshold().getMarginRatio())
                .similarityCutoff(properties.getFuzzy().getSimilarityCutoff())
                .dateWindowDays(properties.getFuzzy().getDateWindowDays())
                .amountTolerance(properties.getFuzzy().getAmountTolerance())
                .benfordMinSampleSize(properties.getBenford().getMinSampleSize())
                .benfordMadCutoff(properties.getBenford().getMadCutoff())
                .currencySymbol(properties.getCurrency().getSymbol())
                .currencyScale(properties.getCurrency().getScale())
                .parallelDetectors(properties.getEngine().isParallelDetectors())
                .build();
    }

    /**
     * Copy with a different approval limit. A ratio-derived margin follows the new limit;
     * an absolute margin is kept as is and re-validated.
     */
    public DetectionConfig withThreshold(BigDecimal threshold) {
        DetectionConfigBuilder builder = toBuilder().thresholdAmount(threshold);
        if (thresholdMarginRatio != null) {
            builder.thresholdMargin(null);
        }
        return builder.build();
    }

    /**
     * Lower bound (inclusive) of the threshold-avoidance band.
     */
    public BigDecimal thresholdFloor() {
        return thresholdAmount.subtract(thresholdMargin);
    }

    public String formatAmount(BigDecimal amount) {
        StringBuilder pattern = new StringBuilder("#,##0");
        if (currencyScale > 0) {
            pattern.append('.').append("0".repeat(currencyScale));
        }
        DecimalFormat format = new DecimalFormat(pattern.toString(), DecimalFormatSymbols.getInstance(Locale.US));
        return currencySymbol + format.format(amount.setScale(currencyScale, RoundingMode.HALF_UP));
    }

    private static void require(boolean condition, String property, String message) {
        if (!condition) {
            throw new InvalidConfigurationException("anomaly." + property, message);
        }
    }
}
