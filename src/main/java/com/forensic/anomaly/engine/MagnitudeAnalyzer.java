package com.forensic.anomaly.engine;

import com.forensic.anomaly.config.DetectionConfig;
import com.forensic.anomaly.domain.Finding;
import com.forensic.anomaly.domain.FindingCategory;
import com.forensic.anomaly.domain.NormalizedTransaction;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies amounts against the round-number and threshold-avoidance rules.
 * The two rules are independent: one row may be flagged by both.
 */
public class MagnitudeAnalyzer {

    private final DetectionConfig config;

    public MagnitudeAnalyzer(DetectionConfig config) {
        this.config = config;
    }

    /**
     * Non-zero amounts that are an exact multiple of the round-number unit.
     */
    public List<Finding> findRoundNumbers(List<NormalizedTransaction> transactions) {
        BigDecimal unit = config.roundNumberUnit();
        List<Finding> findings = new ArrayList<>();
        for (NormalizedTransaction txn : transactions) {
            BigDecimal amount = txn.amount();
            if (amount.signum() == 0 || amount.remainder(unit).signum() != 0) {
                continue;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("unit", unit);
            payload.put("multiple", amount.divideToIntegralValue(unit).toBigInteger());

            String reason = String.format("Amount %s is an exact multiple of %s",
                    config.formatAmount(amount), config.formatAmount(unit));
            findings.add(Finding.of(FindingCategory.ROUND_NUMBER, List.of(txn), reason, payload));
        }
        return findings;
    }

    /**
     * Amounts in {@code [threshold - margin, threshold)}. The threshold itself is not flagged.
     */
    public List<Finding> findThresholdFlags(List<NormalizedTransaction> transactions) {
        BigDecimal threshold = config.thresholdAmount();
        BigDecimal floor = config.thresholdFloor();
        List<Finding> findings = new ArrayList<>();
        for (NormalizedTransaction txn : transactions) {
            BigDecimal amount = txn.amount();
            if (amount.compareTo(floor) < 0 || amount.compareTo(threshold) >= 0) {
                continue;
            }
            BigDecimal delta = threshold.subtract(amount);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("threshold", threshold);
            payload.put("margin", config.thresholdMargin());
            payload.put("deltaToThreshold", delta);

            String reason = String.format("Amount %s is %s below the approval threshold of %s",
                    config.formatAmount(amount), config.formatAmount(delta), config.formatAmount(threshold));
            findings.add(Finding.of(FindingCategory.THRESHOLD_FLAG, List.of(txn), reason, payload));
        }
        return findings;
    }
}
