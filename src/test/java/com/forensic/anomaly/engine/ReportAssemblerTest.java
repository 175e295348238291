package com.forensic.anomaly.engine;

import com.forensic.anomaly.domain.AnalysisResult;
import com.forensic.anomaly.domain.AnalysisStatus;
import com.forensic.anomaly.domain.Finding;
import com.forensic.anomaly.domain.FindingCategory;
import com.forensic.anomaly.domain.NormalizationResult;
import com.forensic.anomaly.domain.NormalizedTransaction;
import com.forensic.anomaly.domain.RowParseError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.forensic.anomaly.engine.TestTransactions.txn;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReportAssembler Unit Tests")
class ReportAssemblerTest {

    private ReportAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ReportAssembler();
    }

    @Test
    @DisplayName("Summary counts flagged duplicate rows and list sizes for other categories")
    void summaryCountsFollowPolicy() {
        // Given
        NormalizedTransaction a = txn(0, "2024-01-06", "10000", "Acme");
        NormalizedTransaction b = txn(1, "2024-01-06", "10000", "Acme");
        NormalizedTransaction c = txn(2, "2024-01-06", "10000", "Acme");
        Finding duplicate = Finding.of(FindingCategory.DUPLICATE, List.of(a, b, c), "3 payments", Map.of());
        Finding weekend = Finding.of(FindingCategory.UNUSUAL_TIMING, List.of(a), "Saturday", Map.of());
        DetectorFindings findings = new DetectorFindings(
                List.of(duplicate), List.of(), List.of(weekend), List.of(), List.of(), List.of());
        NormalizationResult normalization = new NormalizationResult(List.of(a, b, c), List.of());

        // When
        AnalysisResult result = assembler.assemble(3, normalization, findings);

        // Then
        assertThat(result.summary().totalTransactions()).isEqualTo(3);
        assertThat(result.summary().duplicates()).isEqualTo(3);
        assertThat(result.details().duplicates()).hasSize(1);
        assertThat(result.summary().unusualTiming()).isEqualTo(result.details().unusualTiming().size());
        assertThat(result.summary().roundNumbers()).isZero();
        assertThat(result.details().benford()).isEmpty();
        assertThat(result.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(result.recommendations()).containsExactly(
                ReportAssembler.REVIEW_DUPLICATES, ReportAssembler.INVESTIGATE_TIMING);
    }

    @Test
    @DisplayName("Diagnostics report skipped rows against the raw count")
    void diagnosticsReportSkippedRows() {
        // Given
        RowParseError error = new RowParseError(1, "amount", "N/A", "not a decimal number");
        NormalizationResult normalization = new NormalizationResult(
                List.of(txn(0, "2024-01-03", "10", "Acme")), List.of(error));

        // When
        AnalysisResult result = assembler.assemble(2, normalization, DetectorFindings.none());

        // Then
        assertThat(result.summary().totalTransactions()).isEqualTo(2);
        assertThat(result.diagnostics().rawRows()).isEqualTo(2);
        assertThat(result.diagnostics().normalizedRows()).isEqualTo(1);
        assertThat(result.diagnostics().skippedRows()).isEqualTo(1);
        assertThat(result.diagnostics().emptyBatch()).isFalse();
        assertThat(result.diagnostics().rowErrors()).containsExactly(error);
        assertThat(result.diagnostics().notes()).containsExactly("1 of 2 rows skipped during normalization");
        assertThat(result.recommendations()).isEmpty();
    }

    @Test
    @DisplayName("No usable rows produces an explicit empty-batch result")
    void emptyBatchIsExplicit() {
        // Given
        NormalizationResult normalization = new NormalizationResult(List.of(), List.of(
                new RowParseError(0, "date", "soon", "not a recognised or unambiguous date")));

        // When
        AnalysisResult result = assembler.assemble(1, normalization, DetectorFindings.none());

        // Then
        assertThat(result.status()).isEqualTo(AnalysisStatus.EMPTY_BATCH);
        assertThat(result.diagnostics().emptyBatch()).isTrue();
        assertThat(result.diagnostics().notes())
                .containsExactly("No usable rows after normalization: 1 of 1 rows skipped");
        assertThat(result.summary().totalTransactions()).isEqualTo(1);
        assertThat(result.summary().duplicates()).isZero();
    }

    @Test
    @DisplayName("Digit recommendation only when the Benford finding is flagged")
    void digitRecommendationOnlyWhenFlagged() {
        // Given
        Finding conforming = Finding.of(FindingCategory.BENFORD_DIGIT, List.of(), "conforms", Map.of("flagged", false));
        Finding flagged = Finding.of(FindingCategory.BENFORD_DIGIT, List.of(), "deviates", Map.of("flagged", true));
        NormalizationResult normalization = new NormalizationResult(
                List.of(txn(0, "2024-01-03", "10", "Acme")), List.of());

        // When
        AnalysisResult quiet = assembler.assemble(1, normalization,
                new DetectorFindings(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(conforming)));
        AnalysisResult loud = assembler.assemble(1, normalization,
                new DetectorFindings(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(flagged)));

        // Then
        assertThat(quiet.recommendations()).isEmpty();
        assertThat(loud.recommendations()).containsExactly(ReportAssembler.INVESTIGATE_DIGITS);
    }
}
