package com.forensic.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Fixed-shape count card of an analysis. Key names are part of the external contract.
 * {@code duplicates} counts flagged rows, not duplicate groups.
 */
@Schema(description = "Counts per anomaly category")
public record AnalysisSummary(

    @Schema(description = "Number of rows submitted, including rows that failed to parse", example = "5")
    @JsonProperty("total_transactions")
    int totalTransactions,

    @Schema(description = "Rows that belong to a duplicate payment group", example = "2")
    @JsonProperty("duplicates")
    int duplicates,

    @Schema(description = "Rows dated on a weekend", example = "1")
    @JsonProperty("unusual_timing")
    int unusualTiming,

    @Schema(description = "Rows with a round amount", example = "1")
    @JsonProperty("round_numbers")
    int roundNumbers,

    @Schema(description = "Rows just below the approval threshold", example = "1")
    @JsonProperty("threshold_flags")
    int thresholdFlags
) {

    public static AnalysisSummary empty(int totalTransactions) {
        return new AnalysisSummary(totalTransactions, 0, 0, 0, 0);
    }
}
