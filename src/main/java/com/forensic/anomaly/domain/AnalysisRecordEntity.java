package com.forensic.anomaly.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Archived analysis: status and serialized result, keyed by analysis id.
 */
@Entity
@Table(name = "analysis_record", indexes = {
        @Index(name = "idx_analysis_record_status", columnList = "status"),
        @Index(name = "idx_analysis_record_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRecordEntity {

    @Id
    @Column(name = "analysis_id", length = 36, nullable = false)
    private String analysisId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private AnalysisStatus status;

    @Column(name = "row_count", nullable = false)
    private int rowCount;

    @Column(name = "threshold_amount", precision = 19, scale = 4)
    private BigDecimal thresholdAmount;

    @Lob
    @Column(name = "result_json")
    private String resultJson;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;
}
