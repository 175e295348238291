package com.forensic.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One flagged anomaly. Category specific values travel in {@code payload}.
 */
@Schema(description = "Single anomaly flagged for human review")
public record Finding(

    @Schema(description = "Anomaly category", example = "duplicate")
    @JsonProperty("category")
    FindingCategory category,

    @Schema(description = "Positions of the referenced rows in the submitted array")
    @JsonProperty("source_indices")
    List<Integer> sourceIndices,

    @Schema(description = "Human-readable explanation",
            example = "2 payments of $15,000.00 to ABC Supplies on 2024-01-03")
    @JsonProperty("reason")
    String reason,

    @Schema(description = "Display view of the referenced rows")
    @JsonProperty("transactions")
    List<FlaggedTransaction> transactions,

    @Schema(description = "Category specific details such as similarity score or digit table")
    @JsonProperty("payload")
    Map<String, Object> payload
) {

    public Finding {
        sourceIndices = List.copyOf(sourceIndices);
        transactions = List.copyOf(transactions);
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Builds a finding whose references and display rows come from the given transactions.
     */
    public static Finding of(FindingCategory category,
                             List<NormalizedTransaction> rows,
                             String reason,
                             Map<String, Object> payload) {
        List<NormalizedTransaction> ordered = rows.stream()
                .sorted((a, b) -> Integer.compare(a.sourceIndex(), b.sourceIndex()))
                .toList();
        return new Finding(
                category,
                ordered.stream().map(NormalizedTransaction::sourceIndex).toList(),
                reason,
                ordered.stream().map(FlaggedTransaction::from).toList(),
                payload
        );
    }

    /**
     * Row as shown alongside a finding.
     */
    @Schema(description = "Transaction referenced by a finding")
    public record FlaggedTransaction(

        @Schema(description = "Position in the submitted array", example = "0")
        @JsonProperty("source_index")
        int sourceIndex,

        @Schema(description = "Transaction identifier", example = "TXN_1")
        @JsonProperty("transaction_id")
        String transactionId,

        @Schema(description = "Transaction date", example = "2024-01-03")
        @JsonProperty("date")
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate date,

        @Schema(description = "Absolute amount", example = "15000.00")
        @JsonProperty("amount")
        BigDecimal amount,

        @Schema(description = "Vendor as supplied", example = "ABC Supplies")
        @JsonProperty("vendor")
        String vendor,

        @Schema(description = "Remaining fields of the original row")
        @JsonProperty("attributes")
        Map<String, Object> attributes
    ) {

        static FlaggedTransaction from(NormalizedTransaction txn) {
            return new FlaggedTransaction(
                    txn.sourceIndex(),
                    txn.transactionId(),
                    txn.date(),
                    txn.amount(),
                    txn.vendor(),
                    txn.attributes()
            );
        }
    }
}
