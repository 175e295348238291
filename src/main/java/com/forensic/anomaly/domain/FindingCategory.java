package com.forensic.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of anomaly the engine reports. The JSON value is part of the external contract.
 */
public enum FindingCategory {

    DUPLICATE("duplicate"),
    FUZZY_DUPLICATE("fuzzy_duplicate"),
    UNUSUAL_TIMING("unusual_timing"),
    ROUND_NUMBER("round_number"),
    THRESHOLD_FLAG("threshold_flag"),
    BENFORD_DIGIT("benford_digit");

    private final String code;

    FindingCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static FindingCategory fromCode(String code) {
        return Arrays.stream(values())
                .filter(category -> category.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown finding category: " + code));
    }
}
