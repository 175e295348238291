package com.forensic.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * How much of the submitted batch survived normalization.
 */
@Schema(description = "Data-quality diagnostics for the submitted rows")
public record DataQualityReport(

    @Schema(description = "Rows submitted", example = "5")
    @JsonProperty("raw_rows")
    int rawRows,

    @Schema(description = "Rows usable by the detectors", example = "4")
    @JsonProperty("normalized_rows")
    int normalizedRows,

    @Schema(description = "Rows skipped because of a parse error", example = "1")
    @JsonProperty("skipped_rows")
    int skippedRows,

    @Schema(description = "True when no row survived normalization", example = "false")
    @JsonProperty("empty_batch")
    boolean emptyBatch,

    @Schema(description = "One entry per skipped row")
    @JsonProperty("row_errors")
    List<RowParseError> rowErrors,

    @Schema(description = "Free-text notes about the batch")
    @JsonProperty("notes")
    List<String> notes
) {

    public DataQualityReport {
        rowErrors = rowErrors == null ? List.of() : List.copyOf(rowErrors);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
