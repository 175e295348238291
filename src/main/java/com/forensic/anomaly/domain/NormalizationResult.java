package com.forensic.anomaly.domain;

import java.util.List;

/**
 * Output of the record normalizer: usable transactions plus one diagnostic per skipped row.
 */
public record NormalizationResult(
        List<NormalizedTransaction> transactions,
        List<RowParseError> errors
) {

    public NormalizationResult {
        transactions = List.copyOf(transactions);
        errors = List.copyOf(errors);
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }
}
