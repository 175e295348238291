package com.forensic.anomaly.engine;

import com.forensic.anomaly.domain.Finding;

import java.util.List;

/**
 * Raw output of the detector groups for one batch, before assembly into a report.
 */
public record DetectorFindings(
        List<Finding> duplicates,
        List<Finding> fuzzyDuplicates,
        List<Finding> unusualTiming,
        List<Finding> roundNumbers,
        List<Finding> thresholdFlags,
        List<Finding> benford
) {

    public DetectorFindings {
        duplicates = List.copyOf(duplicates);
        fuzzyDuplicates = List.copyOf(fuzzyDuplicates);
        unusualTiming = List.copyOf(unusualTiming);
        roundNumbers = List.copyOf(roundNumbers);
        thresholdFlags = List.copyOf(thresholdFlags);
        benford = List.copyOf(benford);
    }

    public static DetectorFindings none() {
        return new DetectorFindings(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
