package com.forensic.anomaly.engine;

import com.forensic.anomaly.config.DetectionConfig;
import com.forensic.anomaly.domain.AnalysisResult;
import com.forensic.anomaly.domain.Finding;
import com.forensic.anomaly.domain.NormalizationResult;
import com.forensic.anomaly.domain.NormalizedTransaction;
import com.forensic.anomaly.exception.AnalysisException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point of the anomaly engine: normalizes raw rows, runs every detector over the
 * same transaction list and assembles the report.
 * <p>
 * An engine is immutable and holds no per-batch state, so one instance can serve concurrent
 * callers. When {@code parallelDetectors} is set the detector groups run on
 * {@link Schedulers#parallel()} and are joined before assembly; the result is identical
 * to the sequential run.
 */
@Slf4j
public class AnomalyEngine {

    public static final String DETECTOR_FAILED = "DETECTOR_FAILED";

    private final DetectionConfig config;
    private final RecordNormalizer normalizer;
    private final DuplicatePaymentDetector duplicateDetector;
    private final FuzzyVendorDetector fuzzyDetector;
    private final TimingAnalyzer timingAnalyzer;
    private final MagnitudeAnalyzer magnitudeAnalyzer;
    private final BenfordAnalyzer benfordAnalyzer;
    private final ReportAssembler assembler;

    public AnomalyEngine(DetectionConfig config) {
        this.config = config;
        this.normalizer = new RecordNormalizer();
        this.duplicateDetector = new DuplicatePaymentDetector(config);
        this.fuzzyDetector = new FuzzyVendorDetector(config);
        this.timingAnalyzer = new TimingAnalyzer(config);
        this.magnitudeAnalyzer = new MagnitudeAnalyzer(config);
        this.benfordAnalyzer = new BenfordAnalyzer(config);
        this.assembler = new ReportAssembler();
    }

    public DetectionConfig config() {
        return config;
    }

    /**
     * New engine over another configuration; used for per-request overrides.
     */
    public AnomalyEngine withConfig(DetectionConfig other) {
        return new AnomalyEngine(other);
    }

    /**
     * Analyzes one batch of raw rows. A null batch is treated as an empty one.
     *
     * @param rows raw rows as decoded from JSON, in submission order
     * @return the full report; never null
     * @throws AnalysisException if a detector fails
     */
    public AnalysisResult analyze(List<Map<String, Object>> rows) {
        List<Map<String, Object>> batch = rows == null ? List.of() : rows;
        NormalizationResult normalization = normalizer.normalize(batch);

        if (normalization.isEmpty()) {
            log.warn("No usable rows in batch of {}", batch.size());
            DetectorFindings findings = new DetectorFindings(
                    List.of(), List.of(), List.of(), List.of(), List.of(),
                    benfordAnalyzer.analyzeBenford(List.of()));
            return assembler.assemble(batch.size(), normalization, findings);
        }

        List<NormalizedTransaction> transactions = normalization.transactions();
        DetectorFindings findings = config.parallelDetectors()
                ? detectInParallel(transactions)
                : detectSequentially(transactions);

        log.debug("Detectors finished over {} rows: duplicates={}, fuzzy={}, timing={}, round={}, threshold={}",
                transactions.size(),
                findings.duplicates().size(),
                findings.fuzzyDuplicates().size(),
                findings.unusualTiming().size(),
                findings.roundNumbers().size(),
                findings.thresholdFlags().size());

        return assembler.assemble(batch.size(), normalization, findings);
    }

    private DetectorFindings detectSequentially(List<NormalizedTransaction> txns) {
        List<Finding> duplicates = run("duplicate", () -> duplicateDetector.findDuplicates(txns));
        List<Finding> fuzzy = run("fuzzy", () -> fuzzyDetector.findFuzzyDuplicates(txns));
        List<Finding> timing = run("timing", () -> timingAnalyzer.findUnusualTiming(txns));
        MagnitudeFindings magnitude = run("magnitude", () -> magnitude(txns));
        List<Finding> benford = run("benford", () -> benfordAnalyzer.analyzeBenford(txns));
        return new DetectorFindings(duplicates, fuzzy, timing, magnitude.round(), magnitude.threshold(), benford);
    }

    private DetectorFindings detectInParallel(List<NormalizedTransaction> txns) {
        return Mono.zip(
                        onParallel("duplicate", () -> duplicateDetector.findDuplicates(txns)),
                        onParallel("fuzzy", () -> fuzzyDetector.findFuzzyDuplicates(txns)),
                        onParallel("timing", () -> timingAnalyzer.findUnusualTiming(txns)),
                        onParallel("magnitude", () -> magnitude(txns)),
                        onParallel("benford", () -> benfordAnalyzer.analyzeBenford(txns)))
                .map(t -> new DetectorFindings(
                        t.getT1(), t.getT2(), t.getT3(), t.getT4().round(), t.getT4().threshold(), t.getT5()))
                .block();
    }

    private MagnitudeFindings magnitude(List<NormalizedTransaction> txns) {
        return new MagnitudeFindings(
                magnitudeAnalyzer.findRoundNumbers(txns),
                magnitudeAnalyzer.findThresholdFlags(txns));
    }

    private static <T> Mono<T> onParallel(String detector, Supplier<T> work) {
        return Mono.fromCallable(() -> run(detector, work))
                .subscribeOn(Schedulers.parallel());
    }

    private static <T> T run(String detector, Supplier<T> work) {
        try {
            return work.get();
        } catch (RuntimeException e) {
            log.error("Detector '{}' failed", detector, e);
            throw new AnalysisException("Detector '" + detector + "' failed: " + e.getMessage(), DETECTOR_FAILED, e);
        }
    }

    private record MagnitudeFindings(List<Finding> round, List<Finding> threshold) {}
}
