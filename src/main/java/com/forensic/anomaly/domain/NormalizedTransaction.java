package com.forensic.anomaly.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Canonical form of one raw transaction row.
 * Produced only by the record normalizer; every detector works on this shape.
 *
 * @param sourceIndex   position of the row in the original input
 * @param transactionId caller supplied id, or a positional fallback
 * @param amount        absolute amount, finite and non-negative
 * @param date          calendar date of the transaction
 * @param vendor        trimmed vendor name as supplied (empty when missing)
 * @param vendorKey     case-folded vendor used for comparison
 * @param attributes    every field of the raw row that was not consumed
 */
public record NormalizedTransaction(
        int sourceIndex,
        String transactionId,
        BigDecimal amount,
        LocalDate date,
        String vendor,
        String vendorKey,
        Map<String, Object> attributes
) {

    public boolean hasVendor() {
        return !vendorKey.isEmpty();
    }
}
