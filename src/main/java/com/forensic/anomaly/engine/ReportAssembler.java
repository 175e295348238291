package com.forensic.anomaly.engine;

import com.forensic.anomaly.domain.AnalysisDetails;
import com.forensic.anomaly.domain.AnalysisResult;
import com.forensic.anomaly.domain.AnalysisSummary;
import com.forensic.anomaly.domain.DataQualityReport;
import com.forensic.anomaly.domain.Finding;
import com.forensic.anomaly.domain.NormalizationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the fixed-shape {@link AnalysisResult} from detector output and normalization diagnostics.
 */
public class ReportAssembler {

    static final String REVIEW_DUPLICATES = "Review duplicate payments";
    static final String INVESTIGATE_TIMING = "Investigate unusual timing transactions";
    static final String MONITOR_ROUND_NUMBERS = "Monitor round-number payments";
    static final String ENFORCE_THRESHOLDS = "Enforce thresholds and approval limits";
    static final String VERIFY_VENDOR_MASTER = "Verify vendor master data for near-duplicate vendors";
    static final String INVESTIGATE_DIGITS = "Investigate leading-digit distribution for manual entry";

    public AnalysisResult assemble(int rawCount, NormalizationResult normalization, DetectorFindings findings) {
        int normalized = normalization.transactions().size();
        int skipped = normalization.errors().size();
        boolean empty = normalization.isEmpty();

        AnalysisSummary summary = new AnalysisSummary(
                rawCount,
                DuplicatePaymentDetector.flaggedRows(findings.duplicates()),
                findings.unusualTiming().size(),
                findings.roundNumbers().size(),
                findings.thresholdFlags().size());

        AnalysisDetails details = new AnalysisDetails(
                findings.duplicates(),
                findings.unusualTiming(),
                findings.roundNumbers(),
                findings.thresholdFlags(),
                findings.benford(),
                findings.fuzzyDuplicates());

        List<String> notes = new ArrayList<>();
        if (empty) {
            notes.add(rawCount == 0
                    ? "Batch contained no rows"
                    : String.format("No usable rows after normalization: %d of %d rows skipped", skipped, rawCount));
        } else if (skipped > 0) {
            notes.add(String.format("%d of %d rows skipped during normalization", skipped, rawCount));
        }

        DataQualityReport diagnostics = new DataQualityReport(
                rawCount, normalized, skipped, empty, normalization.errors(), notes);

        return new AnalysisResult(summary, details, diagnostics, recommendations(findings));
    }

    private static List<String> recommendations(DetectorFindings findings) {
        List<String> recommendations = new ArrayList<>();
        if (!findings.duplicates().isEmpty()) {
            recommendations.add(REVIEW_DUPLICATES);
        }
        if (!findings.unusualTiming().isEmpty()) {
            recommendations.add(INVESTIGATE_TIMING);
        }
        if (!findings.roundNumbers().isEmpty()) {
            recommendations.add(MONITOR_ROUND_NUMBERS);
        }
        if (!findings.thresholdFlags().isEmpty()) {
            recommendations.add(ENFORCE_THRESHOLDS);
        }
        if (!findings.fuzzyDuplicates().isEmpty()) {
            recommendations.add(VERIFY_VENDOR_MASTER);
        }
        if (findings.benford().stream().anyMatch(ReportAssembler::isFlagged)) {
            recommendations.add(INVESTIGATE_DIGITS);
        }
        return recommendations;
    }

    private static boolean isFlagged(Finding finding) {
        return Boolean.TRUE.equals(finding.payload().get("flagged"));
    }
}
