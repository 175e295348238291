package com.forensic.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Client response for one analysed batch.
 * Carries the engine result flattened next to tracking fields, so consumers read
 * {@code summary} and {@code details} at the top level.
 */
@Schema(description = "Risk report for a batch of transactions")
public record AnalysisResponse(

    @Schema(description = "Unique identifier of this analysis",
            example = "550e8400-e29b-41d4-a716-446655440000")
    @JsonProperty("analysis_id")
    String analysisId,

    @Schema(description = "Processing status", example = "COMPLETED")
    @JsonProperty("status")
    AnalysisStatus status,

    @Schema(description = "Timestamp when the batch was processed")
    @JsonProperty("processed_at")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss.SSSXXX")
    OffsetDateTime processedAt,

    @Schema(description = "Counts per category")
    @JsonProperty("summary")
    AnalysisSummary summary,

    @Schema(description = "Findings per category")
    @JsonProperty("details")
    AnalysisDetails details,

    @Schema(description = "Data-quality diagnostics")
    @JsonProperty("diagnostics")
    DataQualityReport diagnostics,

    @Schema(description = "Suggested control actions")
    @JsonProperty("recommendations")
    List<String> recommendations,

    @Schema(description = "Error message if status is FAILED")
    @JsonProperty("error_message")
    String errorMessage
) {

    public static AnalysisResponse completed(String analysisId, OffsetDateTime processedAt, AnalysisResult result) {
        return new AnalysisResponse(
                analysisId,
                result.status(),
                processedAt,
                result.summary(),
                result.details(),
                result.diagnostics(),
                result.recommendations(),
                null
        );
    }

    public static AnalysisResponse failed(String analysisId,
                                          OffsetDateTime processedAt,
                                          int rowCount,
                                          String errorMessage) {
        return withoutResult(analysisId, AnalysisStatus.FAILED, processedAt, rowCount, errorMessage);
    }

    /**
     * Status of an archived analysis that never reached a result.
     */
    public static AnalysisResponse withoutResult(String analysisId,
                                                 AnalysisStatus status,
                                                 OffsetDateTime processedAt,
                                                 int rowCount,
                                                 String errorMessage) {
        return new AnalysisResponse(
                analysisId,
                status,
                processedAt,
                AnalysisSummary.empty(rowCount),
                AnalysisDetails.empty(),
                null,
                List.of(),
                errorMessage
        );
    }
}
