package com.forensic.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Per-category finding lists. Every key is always present; empty categories are empty lists.
 */
@Schema(description = "Findings grouped by category")
public record AnalysisDetails(

    @JsonProperty("duplicates")
    List<Finding> duplicates,

    @JsonProperty("unusual_timing")
    List<Finding> unusualTiming,

    @JsonProperty("round_numbers")
    List<Finding> roundNumbers,

    @JsonProperty("threshold_flags")
    List<Finding> thresholdFlags,

    @JsonProperty("benford")
    List<Finding> benford,

    @JsonProperty("fuzzy_duplicates")
    List<Finding> fuzzyDuplicates
) {

    public AnalysisDetails {
        duplicates = nullToEmpty(duplicates);
        unusualTiming = nullToEmpty(unusualTiming);
        roundNumbers = nullToEmpty(roundNumbers);
        thresholdFlags = nullToEmpty(thresholdFlags);
        benford = nullToEmpty(benford);
        fuzzyDuplicates = nullToEmpty(fuzzyDuplicates);
    }

    public static AnalysisDetails empty() {
        return new AnalysisDetails(null, null, null, null, null, null);
    }

    private static List<Finding> nullToEmpty(List<Finding> findings) {
        return findings == null ? List.of() : List.copyOf(findings);
    }
}
