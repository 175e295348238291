package com.forensic.anomaly.engine;

import com.forensic.anomaly.config.DetectionConfig;
import com.forensic.anomaly.domain.Finding;
import com.forensic.anomaly.domain.FindingCategory;
import com.forensic.anomaly.domain.NormalizedTransaction;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds duplicate payments: rows sharing amount (at currency precision), date and case-folded vendor.
 * <p>
 * Rows are grouped by that key in a single pass and each group of two or more yields one
 * finding referencing all its members. Rows without a vendor never form a group.
 */
@Slf4j
public class DuplicatePaymentDetector {

    private final DetectionConfig config;

    public DuplicatePaymentDetector(DetectionConfig config) {
        this.config = config;
    }

    public List<Finding> findDuplicates(List<NormalizedTransaction> transactions) {
        // insertion order = order of first occurrence, which keeps output sorted by first index
        Map<PaymentKey, List<NormalizedTransaction>> groups = new LinkedHashMap<>();
        for (NormalizedTransaction txn : transactions) {
            if (!txn.hasVendor()) {
                continue;
            }
            groups.computeIfAbsent(keyOf(txn), k -> new ArrayList<>()).add(txn);
        }

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<PaymentKey, List<NormalizedTransaction>> group : groups.entrySet()) {
            List<NormalizedTransaction> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            PaymentKey key = group.getKey();
            NormalizedTransaction first = members.get(0);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("groupSize", members.size());
            payload.put("amount", key.amount());
            payload.put("date", key.date().toString());
            payload.put("vendor", first.vendor());

            String reason = String.format("%d payments of %s to %s on %s",
                    members.size(), config.formatAmount(key.amount()), first.vendor(), key.date());
            findings.add(Finding.of(FindingCategory.DUPLICATE, members, reason, payload));
        }

        log.debug("Duplicate detector found {} groups", findings.size());
        return findings;
    }

    /**
     * Rows flagged by the given duplicate findings (sum of group sizes).
     */
    public static int flaggedRows(List<Finding> duplicateFindings) {
        return duplicateFindings.stream().mapToInt(f -> f.sourceIndices().size()).sum();
    }

    private PaymentKey keyOf(NormalizedTransaction txn) {
        BigDecimal amount = txn.amount().setScale(config.currencyScale(), RoundingMode.HALF_UP);
        return new PaymentKey(amount, txn.date(), txn.vendorKey());
    }

    // BigDecimal equality is scale sensitive; amounts are rescaled before they get here
    private record PaymentKey(BigDecimal amount, LocalDate date, String vendorKey) {}
}
