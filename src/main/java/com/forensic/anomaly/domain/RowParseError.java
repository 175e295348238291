package com.forensic.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Diagnostic for a row that was excluded during normalization.
 */
@Schema(description = "Row skipped because a required field could not be parsed")
public record RowParseError(

    @Schema(description = "Position of the row in the submitted array", example = "4")
    @JsonProperty("source_index")
    int sourceIndex,

    @Schema(description = "Field that failed to parse", example = "amount")
    @JsonProperty("field")
    String field,

    @Schema(description = "Raw value as received", example = "N/A")
    @JsonProperty("raw_value")
    String rawValue,

    @Schema(description = "Why the value was rejected", example = "not a decimal number")
    @JsonProperty("reason")
    String reason
) {}
