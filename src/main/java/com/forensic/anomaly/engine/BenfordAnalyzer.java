package com.forensic.anomaly.engine;

import com.forensic.anomaly.config.DetectionConfig;
import com.forensic.anomaly.domain.Finding;
import com.forensic.anomaly.domain.FindingCategory;
import com.forensic.anomaly.domain.NormalizedTransaction;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * First-digit Benford test over all positive amounts.
 * <p>
 * Emits a single summary finding: the observed vs expected digit table, the mean absolute
 * deviation (MAD) with its Nigrini conformity band, and the chi-squared statistic. Below the
 * minimum sample size the finding only states that there is not enough data.
 */
@Slf4j
public class BenfordAnalyzer {

    public static final String STATUS_INSUFFICIENT_DATA = "INSUFFICIENT_DATA";
    public static final String STATUS_CONFORMING = "CONFORMING";
    public static final String STATUS_NONCONFORMING = "NONCONFORMING";

    // chi-squared critical value, 8 degrees of freedom, alpha = 0.05
    static final double CHI_SQUARED_CRITICAL = 15.507;

    private static final double[] EXPECTED = new double[10];

    static {
        for (int d = 1; d <= 9; d++) {
            EXPECTED[d] = Math.log10(1.0 + 1.0 / d);
        }
    }

    private final DetectionConfig config;

    public BenfordAnalyzer(DetectionConfig config) {
        this.config = config;
    }

    public static double expectedFrequency(int digit) {
        return EXPECTED[digit];
    }

    /**
     * Leading significant digit of a positive amount, 1 to 9.
     */
    public static int leadingDigit(BigDecimal amount) {
        String unscaled = amount.stripTrailingZeros().unscaledValue().abs().toString();
        return unscaled.charAt(0) - '0';
    }

    public List<Finding> analyzeBenford(List<NormalizedTransaction> transactions) {
        List<List<NormalizedTransaction>> byDigit = new ArrayList<>(10);
        for (int d = 0; d <= 9; d++) {
            byDigit.add(new ArrayList<>());
        }
        int sampleSize = 0;
        for (NormalizedTransaction txn : transactions) {
            if (txn.amount().signum() > 0) {
                byDigit.get(leadingDigit(txn.amount())).add(txn);
                sampleSize++;
            }
        }

        if (sampleSize < config.benfordMinSampleSize()) {
            return List.of(insufficientData(sampleSize));
        }

        List<Map<String, Object>> table = new ArrayList<>(9);
        double absoluteDeviationSum = 0.0;
        double chiSquared = 0.0;
        int mostDeviantDigit = 1;
        double largestExcess = Double.NEGATIVE_INFINITY;

        for (int d = 1; d <= 9; d++) {
            int count = byDigit.get(d).size();
            double observed = (double) count / sampleSize;
            double expected = EXPECTED[d];
            double expectedCount = expected * sampleSize;

            absoluteDeviationSum += Math.abs(observed - expected);
            chiSquared += (count - expectedCount) * (count - expectedCount) / expectedCount;
            if (observed - expected > largestExcess) {
                largestExcess = observed - expected;
                mostDeviantDigit = d;
            }

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("digit", d);
            row.put("count", count);
            row.put("observed", round(observed));
            row.put("expected", round(expected));
            table.add(row);
        }

        double mad = absoluteDeviationSum / 9.0;
        boolean flagged = mad > config.benfordMadCutoff();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", flagged ? STATUS_NONCONFORMING : STATUS_CONFORMING);
        payload.put("sampleSize", sampleSize);
        payload.put("meanAbsoluteDeviation", round(mad));
        payload.put("madCutoff", config.benfordMadCutoff());
        payload.put("conformity", conformity(mad));
        payload.put("chiSquared", round(chiSquared));
        payload.put("chiSquaredCritical", CHI_SQUARED_CRITICAL);
        payload.put("mostDeviantDigit", mostDeviantDigit);
        payload.put("flagged", flagged);
        payload.put("digits", table);

        String reason = flagged
                ? String.format("Leading digits deviate from Benford's law (MAD %.4f above %.4f); digit %d is over-represented",
                        mad, config.benfordMadCutoff(), mostDeviantDigit)
                : String.format("Leading digits conform to Benford's law (MAD %.4f, %s)", mad, conformity(mad));

        List<NormalizedTransaction> referenced = flagged ? byDigit.get(mostDeviantDigit) : List.of();
        log.debug("Benford analysis over {} amounts: MAD={}, chi2={}", sampleSize, mad, chiSquared);
        return List.of(Finding.of(FindingCategory.BENFORD_DIGIT, referenced, reason, payload));
    }

    /**
     * Nigrini's first-digit conformity bands for the mean absolute deviation.
     */
    static String conformity(double mad) {
        if (mad <= 0.006) {
            return "CLOSE";
        }
        if (mad <= 0.012) {
            return "ACCEPTABLE";
        }
        if (mad <= 0.015) {
            return "MARGINAL";
        }
        return "NONCONFORMITY";
    }

    private Finding insufficientData(int sampleSize) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", STATUS_INSUFFICIENT_DATA);
        payload.put("sampleSize", sampleSize);
        payload.put("minimumSampleSize", config.benfordMinSampleSize());
        payload.put("flagged", false);

        String reason = String.format("Insufficient data for Benford analysis: %d positive amounts, at least %d required",
                sampleSize, config.benfordMinSampleSize());
        return Finding.of(FindingCategory.BENFORD_DIGIT, List.of(), reason, payload);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_UP).doubleValue();
    }
}
