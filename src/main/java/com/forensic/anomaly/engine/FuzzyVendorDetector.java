package com.forensic.anomaly.engine;

import com.forensic.anomaly.config.DetectionConfig;
import com.forensic.anomaly.domain.Finding;
import com.forensic.anomaly.domain.FindingCategory;
import com.forensic.anomaly.domain.NormalizedTransaction;
import com.forensic.anomaly.util.VendorSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Finds near-duplicate vendor names on payments that are otherwise alike.
 * <p>
 * Only pairs inside the same date window and amount tolerance are compared. Transactions are
 * bucketed by date; for each anchor date the bucket and the following {@code dateWindowDays}
 * buckets are swept in amount order, so each transaction is only compared with its few
 * neighbours instead of the whole ledger. A pair is reported when the case-folded vendors
 * differ and their similarity reaches the configured cutoff.
 * <p>
 * Output is sorted by descending similarity, then by source indices, so it does not depend
 * on input order.
 */
@Slf4j
public class FuzzyVendorDetector {

    private static final Comparator<Finding> BY_SIMILARITY_THEN_INDEX =
            Comparator.<Finding>comparingDouble(f -> -((Number) f.payload().get("similarity")).doubleValue())
                    .thenComparingInt(f -> f.sourceIndices().get(0))
                    .thenComparingInt(f -> f.sourceIndices().get(1));

    private final DetectionConfig config;

    public FuzzyVendorDetector(DetectionConfig config) {
        this.config = config;
    }

    public List<Finding> findFuzzyDuplicates(List<NormalizedTransaction> transactions) {
        TreeMap<LocalDate, List<NormalizedTransaction>> byDate = new TreeMap<>();
        for (NormalizedTransaction txn : transactions) {
            if (txn.hasVendor()) {
                byDate.computeIfAbsent(txn.date(), d -> new ArrayList<>()).add(txn);
            }
        }

        List<Finding> findings = new ArrayList<>();
        int comparisons = 0;
        for (LocalDate anchor : byDate.keySet()) {
            List<NormalizedTransaction> window = new ArrayList<>();
            byDate.subMap(anchor, true, anchor.plusDays(config.dateWindowDays()), true)
                    .values()
                    .forEach(window::addAll);
            window.sort(Comparator.comparing(NormalizedTransaction::amount)
                    .thenComparingInt(NormalizedTransaction::sourceIndex));

            for (int i = 0; i < window.size(); i++) {
                NormalizedTransaction lower = window.get(i);
                for (int j = i + 1; j < window.size(); j++) {
                    NormalizedTransaction upper = window.get(j);
                    if (!withinTolerance(lower.amount(), upper.amount())) {
                        break;
                    }
                    // a pair belongs to the window anchored at its earlier date
                    if (!anchor.equals(earlierDate(lower, upper))) {
                        continue;
                    }
                    comparisons++;
                    compare(lower, upper).ifPresent(findings::add);
                }
            }
        }

        findings.sort(BY_SIMILARITY_THEN_INDEX);
        log.debug("Fuzzy vendor detector compared {} candidate pairs, found {}", comparisons, findings.size());
        return findings;
    }

    private Optional<Finding> compare(NormalizedTransaction a, NormalizedTransaction b) {
        if (a.vendorKey().equals(b.vendorKey())) {
            return Optional.empty();
        }
        double similarity = VendorSimilarity.score(a.vendorKey(), b.vendorKey());
        if (similarity < config.similarityCutoff()) {
            return Optional.empty();
        }

        NormalizedTransaction first = a.sourceIndex() < b.sourceIndex() ? a : b;
        NormalizedTransaction second = first == a ? b : a;
        double rounded = BigDecimal.valueOf(similarity).setScale(4, RoundingMode.HALF_UP).doubleValue();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("similarity", rounded);
        payload.put("vendorA", first.vendor());
        payload.put("vendorB", second.vendor());
        payload.put("amountDifference", first.amount().subtract(second.amount()).abs());
        payload.put("daysApart", Math.abs(first.date().toEpochDay() - second.date().toEpochDay()));

        String reason = String.format("Vendor names '%s' and '%s' are %.0f%% similar on payments of %s and %s",
                first.vendor(), second.vendor(), rounded * 100,
                config.formatAmount(first.amount()), config.formatAmount(second.amount()));
        return Optional.of(Finding.of(FindingCategory.FUZZY_DUPLICATE, List.of(first, second), reason, payload));
    }

    // |a - b| <= tolerance * max(a, b); callers pass a <= b
    private boolean withinTolerance(BigDecimal lower, BigDecimal upper) {
        BigDecimal allowed = upper.multiply(BigDecimal.valueOf(config.amountTolerance()));
        return upper.subtract(lower).compareTo(allowed) <= 0;
    }

    private static LocalDate earlierDate(NormalizedTransaction a, NormalizedTransaction b) {
        return a.date().isBefore(b.date()) ? a.date() : b.date();
    }
}
