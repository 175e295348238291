package com.forensic.anomaly.engine;

import com.forensic.anomaly.config.DetectionConfig;
import com.forensic.anomaly.domain.Finding;
import com.forensic.anomaly.domain.FindingCategory;
import com.forensic.anomaly.domain.NormalizedTransaction;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Flags payments dated on a weekend. Works on calendar dates only, so no time zone applies.
 */
public class TimingAnalyzer {

    private static final Set<DayOfWeek> NON_BUSINESS_DAYS = EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

    private final DetectionConfig config;

    public TimingAnalyzer(DetectionConfig config) {
        this.config = config;
    }

    public List<Finding> findUnusualTiming(List<NormalizedTransaction> transactions) {
        List<Finding> findings = new ArrayList<>();
        for (NormalizedTransaction txn : transactions) {
            DayOfWeek day = txn.date().getDayOfWeek();
            if (!NON_BUSINESS_DAYS.contains(day)) {
                continue;
            }
            String dayName = day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("dayOfWeek", day.name());

            String reason = String.format("Payment of %s dated %s, a %s",
                    config.formatAmount(txn.amount()), txn.date(), dayName);
            findings.add(Finding.of(FindingCategory.UNUSUAL_TIMING, List.of(txn), reason, payload));
        }
        return findings;
    }
}
