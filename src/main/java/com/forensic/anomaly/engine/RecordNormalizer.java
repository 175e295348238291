package com.forensic.anomaly.engine;

import com.forensic.anomaly.domain.NormalizationResult;
import com.forensic.anomaly.domain.NormalizedTransaction;
import com.forensic.anomaly.domain.RowParseError;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coerces loosely-typed rows into {@link NormalizedTransaction}s.
 * <p>
 * This is the only gate between untyped input and the typed model. It never throws for row
 * content: a row whose amount or date cannot be read is skipped and reported as a
 * {@link RowParseError}. A missing vendor is not an error and becomes the empty string.
 * <p>
 * Columns are resolved by name per row. An exact {@code date}/{@code amount}/{@code vendor}
 * key wins, otherwise the first key with a word equal to one of the known aliases is used
 * ({@code "Posting Date"}, {@code "totalAmt"}).
 */
@Slf4j
public class RecordNormalizer {

    static final String FIELD_ROW = "row";
    static final String FIELD_AMOUNT = "amount";
    static final String FIELD_DATE = "date";

    private static final String TRANSACTION_ID_KEY = "transaction_id";

    private static final List<String> DATE_ALIASES = List.of("date");
    private static final List<String> AMOUNT_ALIASES = List.of("amount", "amt", "sum", "total");
    private static final List<String> VENDOR_ALIASES = List.of("vendor", "payee", "merchant", "supplier");

    private static final Pattern ACCOUNTING_NEGATIVE = Pattern.compile("^\\((.*)\\)$");
    private static final Pattern AMOUNT_NOISE = Pattern.compile("[\\p{Sc}\\s,']");
    private static final Pattern KEY_WORD_BOUNDARY = Pattern.compile("[^A-Za-z0-9]+|(?<=[a-z0-9])(?=[A-Z])");

    private static final DateTimeFormatter ISO_SLASH = strict("uuuu/M/d");
    private static final DateTimeFormatter DAY_FIRST = strict("d/M/uuuu");
    private static final DateTimeFormatter MONTH_FIRST = strict("M/d/uuuu");

    /**
     * Normalizes every row, preserving input order.
     *
     * @param rows raw rows; individual entries may be null
     * @return usable transactions plus one diagnostic per skipped row
     */
    public NormalizationResult normalize(List<Map<String, Object>> rows) {
        List<NormalizedTransaction> transactions = new ArrayList<>(rows.size());
        List<RowParseError> errors = new ArrayList<>();

        for (int index = 0; index < rows.size(); index++) {
            Map<String, Object> row = rows.get(index);
            if (row == null) {
                errors.add(new RowParseError(index, FIELD_ROW, null, "row is null"));
                continue;
            }
            normalizeRow(index, row, errors).ifPresent(transactions::add);
        }

        if (!errors.isEmpty()) {
            log.warn("Skipped {} of {} rows during normalization", errors.size(), rows.size());
        }
        return new NormalizationResult(transactions, errors);
    }

    private Optional<NormalizedTransaction> normalizeRow(int index, Map<String, Object> row, List<RowParseError> errors) {
        String dateKey = resolveKey(row, DATE_ALIASES);
        String amountKey = resolveKey(row, AMOUNT_ALIASES);
        String vendorKey = resolveKey(row, VENDOR_ALIASES);

        Object rawAmount = amountKey == null ? null : row.get(amountKey);
        Optional<BigDecimal> amount = parseAmount(rawAmount);
        if (amount.isEmpty()) {
            errors.add(new RowParseError(index, FIELD_AMOUNT, describe(rawAmount),
                    amountKey == null ? "no amount column" : "not a decimal number"));
            log.debug("Row {} skipped: unparseable amount {}", index, rawAmount);
            return Optional.empty();
        }

        Object rawDate = dateKey == null ? null : row.get(dateKey);
        Optional<LocalDate> date = parseDate(rawDate);
        if (date.isEmpty()) {
            errors.add(new RowParseError(index, FIELD_DATE, describe(rawDate),
                    dateKey == null ? "no date column" : "not a recognised or unambiguous date"));
            log.debug("Row {} skipped: unparseable date {}", index, rawDate);
            return Optional.empty();
        }

        String vendor = parseVendor(vendorKey == null ? null : row.get(vendorKey));
        Object rawId = row.get(TRANSACTION_ID_KEY);
        String transactionId = rawId == null || rawId.toString().isBlank()
                ? "TXN_" + (index + 1)
                : rawId.toString().trim();

        Map<String, Object> attributes = new LinkedHashMap<>();
        row.forEach((key, value) -> {
            if (key != null && !key.equals(dateKey) && !key.equals(amountKey) && !key.equals(vendorKey)
                    && !key.equals(TRANSACTION_ID_KEY)) {
                attributes.put(key, value);
            }
        });

        return Optional.of(new NormalizedTransaction(
                index,
                transactionId,
                amount.get(),
                date.get(),
                vendor,
                vendor.toLowerCase(Locale.ROOT),
                Collections.unmodifiableMap(attributes)
        ));
    }

    /**
     * Parses an amount into its absolute decimal value.
     * Accepts numbers, and strings carrying currency symbols, thousands separators,
     * a sign, an exponent or accounting parentheses. Any other character rejects the value.
     */
    Optional<BigDecimal> parseAmount(Object value) {
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal.abs());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                return Optional.empty();
            }
            return Optional.of(BigDecimal.valueOf(d).abs());
        }
        if (value instanceof Number number) {
            try {
                return Optional.of(new BigDecimal(number.toString()).abs());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (!(value instanceof String text)) {
            return Optional.empty();
        }

        String cleaned = text.trim();
        Matcher accounting = ACCOUNTING_NEGATIVE.matcher(cleaned);
        if (accounting.matches()) {
            cleaned = accounting.group(1);
        }
        cleaned = AMOUNT_NOISE.matcher(cleaned).replaceAll("");
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            BigDecimal parsed = new BigDecimal(cleaned).abs();
            return Optional.of(parsed.scale() < 0 ? parsed.setScale(0) : parsed);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses ISO dates, ISO date-times and slash formats. A slash date that reads as two
     * different dates (day-first vs month-first) is rejected as ambiguous.
     */
    Optional<LocalDate> parseDate(Object value) {
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (!(value instanceof String text) || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();

        if (trimmed.contains("-")) {
            String datePart = trimmed.length() > 10
                    && (trimmed.charAt(10) == 'T' || trimmed.charAt(10) == ' ')
                    ? trimmed.substring(0, 10)
                    : trimmed;
            return tryParse(datePart, DateTimeFormatter.ISO_LOCAL_DATE);
        }

        if (trimmed.indexOf('/') == 4) {
            return tryParse(trimmed, ISO_SLASH);
        }

        Optional<LocalDate> dayFirst = tryParse(trimmed, DAY_FIRST);
        Optional<LocalDate> monthFirst = tryParse(trimmed, MONTH_FIRST);
        if (dayFirst.isPresent() && monthFirst.isPresent()) {
            return dayFirst.get().equals(monthFirst.get()) ? dayFirst : Optional.empty();
        }
        return dayFirst.isPresent() ? dayFirst : monthFirst;
    }

    private String parseVendor(Object value) {
        return value == null ? "" : value.toString().trim();
    }

    private static String resolveKey(Map<String, Object> row, List<String> aliases) {
        String exact = aliases.get(0);
        if (row.containsKey(exact)) {
            return exact;
        }
        for (String key : row.keySet()) {
            if (key == null) {
                continue;
            }
            for (String word : KEY_WORD_BOUNDARY.split(key)) {
                if (aliases.contains(word.toLowerCase(Locale.ROOT))) {
                    return key;
                }
            }
        }
        return null;
    }

    private static Optional<LocalDate> tryParse(String text, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(text, formatter));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static String describe(Object value) {
        return value == null ? null : value.toString();
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }
}
