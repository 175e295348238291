package com.forensic.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Sole output of the anomaly engine.
 */
public record AnalysisResult(

    @JsonProperty("summary")
    AnalysisSummary summary,

    @JsonProperty("details")
    AnalysisDetails details,

    @JsonProperty("diagnostics")
    DataQualityReport diagnostics,

    @JsonProperty("recommendations")
    List<String> recommendations
) {

    public AnalysisResult {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    @JsonIgnore
    public AnalysisStatus status() {
        return diagnostics.emptyBatch() ? AnalysisStatus.EMPTY_BATCH : AnalysisStatus.COMPLETED;
    }
}
