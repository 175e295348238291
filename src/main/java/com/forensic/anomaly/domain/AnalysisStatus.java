package com.forensic.anomaly.domain;

/**
 * Lifecycle of an analysis request.
 */
public enum AnalysisStatus {

    /** Accepted and archived, detectors not finished yet. */
    PENDING,

    /** Detectors ran over at least one usable row. */
    COMPLETED,

    /** No row survived normalization; the report is empty by construction. */
    EMPTY_BATCH,

    FAILED
}
