package com.forensic.anomaly.engine;

import com.forensic.anomaly.domain.NormalizationResult;
import com.forensic.anomaly.domain.NormalizedTransaction;
import com.forensic.anomaly.domain.RowParseError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.forensic.anomaly.engine.TestTransactions.row;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecordNormalizer Unit Tests")
class RecordNormalizerTest {

    private RecordNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new RecordNormalizer();
    }

    @Test
    @DisplayName("Should normalize a well-formed row")
    void shouldNormalizeWellFormedRow() {
        // Given
        Map<String, Object> raw = row("2024-01-03", "15000", "  ABC Supplies ");
        raw.put("description", "Office chairs");

        // When
        NormalizationResult result = normalizer.normalize(List.of(raw));

        // Then
        assertThat(result.errors()).isEmpty();
        NormalizedTransaction txn = result.transactions().get(0);
        assertThat(txn.sourceIndex()).isZero();
        assertThat(txn.transactionId()).isEqualTo("TXN_1");
        assertThat(txn.amount()).isEqualByComparingTo("15000");
        assertThat(txn.date()).isEqualTo(LocalDate.of(2024, 1, 3));
        assertThat(txn.vendor()).isEqualTo("ABC Supplies");
        assertThat(txn.vendorKey()).isEqualTo("abc supplies");
        assertThat(txn.attributes()).containsOnlyKeys("description");
    }

    @Test
    @DisplayName("Should keep a supplied transaction id")
    void shouldKeepSuppliedTransactionId() {
        // Given
        Map<String, Object> raw = row("2024-01-03", 100, "Acme");
        raw.put("transaction_id", "INV-0042");

        // When
        NormalizedTransaction txn = normalizer.normalize(List.of(raw)).transactions().get(0);

        // Then
        assertThat(txn.transactionId()).isEqualTo("INV-0042");
        assertThat(txn.attributes()).isEmpty();
    }

    @Test
    @DisplayName("Should resolve aliased column names")
    void shouldResolveAliasedColumns() {
        // Given
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("Posting Date", "2024-02-01");
        raw.put("Total Amt", "$2,500.00");
        raw.put("Payee Name", "Northwind");

        // When
        NormalizationResult result = normalizer.normalize(List.of(raw));

        // Then
        assertThat(result.errors()).isEmpty();
        NormalizedTransaction txn = result.transactions().get(0);
        assertThat(txn.amount()).isEqualByComparingTo("2500");
        assertThat(txn.date()).isEqualTo(LocalDate.of(2024, 2, 1));
        assertThat(txn.vendor()).isEqualTo("Northwind");
    }

    @Test
    @DisplayName("Should parse amounts of every supported shape as absolute values")
    void shouldParseAmounts() {
        assertThat(normalizer.parseAmount("$10,000.00")).contains(new BigDecimal("10000.00"));
        assertThat(normalizer.parseAmount("-250.50")).contains(new BigDecimal("250.50"));
        assertThat(normalizer.parseAmount("(1,500.00)")).contains(new BigDecimal("1500.00"));
        assertThat(normalizer.parseAmount(-42)).contains(new BigDecimal("42"));
        assertThat(normalizer.parseAmount(12.5d)).contains(new BigDecimal("12.5"));
        assertThat(normalizer.parseAmount(new BigDecimal("-0.01"))).contains(new BigDecimal("0.01"));
    }

    @Test
    @DisplayName("Should reject unparseable amounts")
    void shouldRejectUnparseableAmounts() {
        assertThat(normalizer.parseAmount("N/A")).isEmpty();
        assertThat(normalizer.parseAmount("1.2.3")).isEmpty();
        assertThat(normalizer.parseAmount(Double.NaN)).isEmpty();
        assertThat(normalizer.parseAmount(Double.POSITIVE_INFINITY)).isEmpty();
        assertThat(normalizer.parseAmount(null)).isEmpty();
        assertThat(normalizer.parseAmount(true)).isEmpty();
    }

    @Test
    @DisplayName("Should read exponent notation as its full value")
    void shouldReadExponentNotation() {
        assertThat(normalizer.parseAmount("1e3")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("1000"));
        assertThat(normalizer.parseAmount("1.5E+4")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("15000"));
        assertThat(normalizer.parseAmount("2E-2")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("0.02"));
        assertThat(normalizer.parseAmount("1e3").orElseThrow().scale()).isZero();
    }

    @Test
    @DisplayName("Should reject amounts with stray letters instead of dropping them")
    void shouldRejectAmountsWithStrayLetters() {
        assertThat(normalizer.parseAmount("12abc")).isEmpty();
        assertThat(normalizer.parseAmount("1x3")).isEmpty();
        assertThat(normalizer.parseAmount("USD 100")).isEmpty();
        assertThat(normalizer.parseAmount("e3")).isEmpty();
    }

    @Test
    @DisplayName("A row with a null column name is kept and the name is left out of the attributes")
    void nullColumnNameDoesNotBreakTheBatch() {
        // Given
        Map<String, Object> odd = new HashMap<>();
        odd.put("date", "2024-01-04");
        odd.put("amount", "200");
        odd.put("vendor", "Acme");
        odd.put(null, "stray");
        odd.put("memo", "kept");

        // When
        NormalizationResult result = normalizer.normalize(List.of(row("2024-01-03", "100", "Acme"), odd));

        // Then
        assertThat(result.errors()).isEmpty();
        assertThat(result.transactions()).hasSize(2);
        assertThat(result.transactions().get(1).attributes()).containsOnlyKeys("memo");
    }

    @Test
    @DisplayName("Aliases match whole words of the column name only")
    void aliasesMatchWholeWordsOnly() {
        // Given
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("consumer_id", "C-77");
        raw.put("invoiceDate", "2024-02-01");
        raw.put("totalAmt", "75.00");
        raw.put("supplier", "Northwind");

        // When
        NormalizationResult result = normalizer.normalize(List.of(raw));

        // Then
        assertThat(result.errors()).isEmpty();
        NormalizedTransaction txn = result.transactions().get(0);
        assertThat(txn.amount()).isEqualByComparingTo("75");
        assertThat(txn.date()).isEqualTo(LocalDate.of(2024, 2, 1));
        assertThat(txn.attributes()).containsOnlyKeys("consumer_id");
    }

    @Test
    @DisplayName("Should parse ISO dates, date-times and unambiguous slash dates")
    void shouldParseDates() {
        assertThat(normalizer.parseDate("2024-01-07")).contains(LocalDate.of(2024, 1, 7));
        assertThat(normalizer.parseDate("2024-01-07T13:45:00")).contains(LocalDate.of(2024, 1, 7));
        assertThat(normalizer.parseDate("2024-01-07 13:45")).contains(LocalDate.of(2024, 1, 7));
        assertThat(normalizer.parseDate("2024/1/7")).contains(LocalDate.of(2024, 1, 7));
        assertThat(normalizer.parseDate("25/12/2024")).contains(LocalDate.of(2024, 12, 25));
        assertThat(normalizer.parseDate("12/25/2024")).contains(LocalDate.of(2024, 12, 25));
        assertThat(normalizer.parseDate("5/5/2024")).contains(LocalDate.of(2024, 5, 5));
        assertThat(normalizer.parseDate(LocalDateTime.of(2024, 3, 1, 9, 0))).contains(LocalDate.of(2024, 3, 1));
    }

    @Test
    @DisplayName("Should reject ambiguous and invalid dates")
    void shouldRejectAmbiguousAndInvalidDates() {
        assertThat(normalizer.parseDate("03/01/2024")).isEmpty();
        assertThat(normalizer.parseDate("2024-02-30")).isEmpty();
        assertThat(normalizer.parseDate("31/31/2024")).isEmpty();
        assertThat(normalizer.parseDate("yesterday")).isEmpty();
        assertThat(normalizer.parseDate(" ")).isEmpty();
        assertThat(normalizer.parseDate(20240107)).isEmpty();
    }

    @Test
    @DisplayName("Missing vendor becomes the empty sentinel, not an error")
    void missingVendorIsNotAnError() {
        // Given
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("date", "2024-01-03");
        raw.put("amount", 100);

        // When
        NormalizationResult result = normalizer.normalize(List.of(raw));

        // Then
        assertThat(result.errors()).isEmpty();
        assertThat(result.transactions().get(0).vendor()).isEmpty();
        assertThat(result.transactions().get(0).hasVendor()).isFalse();
    }

    @Test
    @DisplayName("Bad rows are skipped with one diagnostic each and the batch continues")
    void badRowsAreSkippedWithDiagnostics() {
        // Given
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row("2024-01-03", "N/A", "Acme"));
        rows.add(row("03/01/2024", "100", "Acme"));
        rows.add(null);
        rows.add(Map.of("vendor", "Acme", "date", "2024-01-03"));
        rows.add(row("2024-01-04", "200", "Acme"));

        // When
        NormalizationResult result = normalizer.normalize(rows);

        // Then
        assertThat(result.transactions()).extracting(NormalizedTransaction::sourceIndex).containsExactly(4);
        assertThat(result.errors()).extracting(RowParseError::sourceIndex).containsExactly(0, 1, 2, 3);
        assertThat(result.errors()).extracting(RowParseError::field)
                .containsExactly("amount", "date", "row", "amount");
        assertThat(result.errors().get(0).rawValue()).isEqualTo("N/A");
        assertThat(result.errors().get(1).reason()).isEqualTo("not a recognised or unambiguous date");
        assertThat(result.errors().get(3).reason()).isEqualTo("no amount column");
    }

    @Test
    @DisplayName("Should not mutate the input rows")
    void shouldNotMutateInput() {
        // Given
        Map<String, Object> raw = row("2024-01-03", "$1,000", "Acme");
        Map<String, Object> snapshot = new LinkedHashMap<>(raw);

        // When
        normalizer.normalize(List.of(raw));

        // Then
        assertThat(raw).isEqualTo(snapshot);
    }
}
