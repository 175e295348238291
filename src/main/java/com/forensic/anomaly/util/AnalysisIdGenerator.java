package com.forensic.anomaly.util;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Issues and checks analysis identifiers (random UUID v4, canonical lowercase form).
 * Stateless and thread-safe; a component so tests can stub the ids.
 */
@Component
public class AnalysisIdGenerator {

    /**
     * Generates a new analysis id.
     */
    public String generate() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        long msb = (random.nextLong() & 0xffffffffffff0fffL) | 0x0000000000004000L;
        long lsb = (random.nextLong() & 0x3fffffffffffffffL) | 0x8000000000000000L;
        return new UUID(msb, lsb).toString();
    }

    /**
     * Returns the canonical form of a client supplied id.
     *
     * @throws IllegalArgumentException if the value is not a UUID
     */
    public String requireValid(String analysisId) {
        if (analysisId == null || analysisId.isBlank()) {
            throw new IllegalArgumentException("Analysis id must not be blank");
        }
        try {
            return UUID.fromString(analysisId.trim()).toString();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed analysis id: " + analysisId, e);
        }
    }
}
