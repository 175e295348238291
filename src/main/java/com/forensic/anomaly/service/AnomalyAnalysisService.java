package com.forensic.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forensic.anomaly.domain.AnalysisRecordEntity;
import com.forensic.anomaly.domain.AnalysisResponse;
import com.forensic.anomaly.domain.AnalysisResult;
import com.forensic.anomaly.domain.AnalysisStatus;
import com.forensic.anomaly.engine.AnomalyEngine;
import com.forensic.anomaly.exception.AnalysisException;
import com.forensic.anomaly.util.AnalysisIdGenerator;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs analyses through the engine and keeps the archive.
 * Responsibilities:
 * - Issue an analysis id per batch
 * - Apply a per-request approval threshold override
 * - Guard the engine with the analysis bulkhead
 * - Archive status and serialized result, and rebuild responses from the archive
 */
@Service
@Slf4j
public class AnomalyAnalysisService {

    static final String STORED_RESULT_UNREADABLE = "STORED_RESULT_UNREADABLE";

    private final AnomalyEngine anomalyEngine;
    private final AnalysisRecordRepository analysisRecordRepository;
    private final AnalysisIdGenerator idGenerator;
    private final ObjectMapper objectMapper;
    private final Bulkhead analysisBulkhead;

    public AnomalyAnalysisService(AnomalyEngine anomalyEngine,
                                  AnalysisRecordRepository analysisRecordRepository,
                                  AnalysisIdGenerator idGenerator,
                                  ObjectMapper objectMapper,
                                  Bulkhead analysisBulkhead) {
        this.anomalyEngine = anomalyEngine;
        this.analysisRecordRepository = analysisRecordRepository;
        this.idGenerator = idGenerator;
        this.objectMapper = objectMapper;
        this.analysisBulkhead = analysisBulkhead;
    }

    /**
     * Analyzes one batch of rows.
     *
     * @param rows              raw rows in submission order
     * @param thresholdOverride approval limit for this request only, or null for the configured one
     * @return the report; status FAILED when the engine could not finish
     * @throws com.forensic.anomaly.exception.InvalidConfigurationException if the override is not a valid limit
     * @throws BulkheadFullException if the engine is saturated
     */
    @Transactional
    public AnalysisResponse analyze(List<Map<String, Object>> rows, BigDecimal thresholdOverride) {
        AnomalyEngine engine = engineFor(thresholdOverride);
        String analysisId = idGenerator.generate();
        int rowCount = rows == null ? 0 : rows.size();
        log.info("Starting analysis {} over {} rows", analysisId, rowCount);

        persistPending(analysisId, rowCount, engine);
        try {
            AnalysisResult result = analysisBulkhead.executeSupplier(() -> engine.analyze(rows));
            return complete(analysisId, result);
        } catch (BulkheadFullException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Analysis {} failed", analysisId, ex);
            return fail(analysisId, rowCount, ex);
        }
    }

    /**
     * Analyzes several batches in parallel. Each batch gets its own id and archive record;
     * one failing batch does not affect the others. Responses keep the order of the input.
     * No more batches are in flight than the bulkhead admits.
     */
    public List<AnalysisResponse> analyzeBatch(List<List<Map<String, Object>>> batches) {
        int concurrency = Math.max(1, analysisBulkhead.getBulkheadConfig().getMaxConcurrentCalls());
        log.info("Starting batch analysis of {} batches, {} at a time", batches.size(), concurrency);

        List<AnalysisResponse> responses = Flux.fromIterable(batches)
                .map(rows -> new BatchItem(idGenerator.generate(), rows))
                .flatMapSequential(this::processBatchItem, concurrency)
                .collectList()
                .block();

        log.info("Completed batch analysis: {}/{} successful",
                responses.stream().filter(r -> r.status() != AnalysisStatus.FAILED).count(),
                responses.size());
        return responses;
    }

    /**
     * Rebuilds an archived analysis.
     *
     * @throws AnalysisException if the archived result cannot be read back
     */
    @Transactional(readOnly = true)
    public Optional<AnalysisResponse> getAnalysisById(String analysisId) {
        log.debug("Retrieving analysis record: {}", analysisId);

        return analysisRecordRepository.findById(analysisId)
                .map(entity -> {
                    if (entity.getResultJson() == null) {
                        return AnalysisResponse.withoutResult(
                                analysisId,
                                entity.getStatus(),
                                entity.getCreatedAt(),
                                entity.getRowCount(),
                                entity.getErrorMessage());
                    }
                    try {
                        AnalysisResult result = objectMapper.readValue(entity.getResultJson(), AnalysisResult.class);
                        return AnalysisResponse.completed(analysisId, entity.getCompletedAt(), result);
                    } catch (JsonProcessingException e) {
                        log.error("Error reading stored result for {}", analysisId, e);
                        throw new AnalysisException("Error retrieving analysis " + analysisId,
                                STORED_RESULT_UNREADABLE, e);
                    }
                });
    }

    private AnomalyEngine engineFor(BigDecimal thresholdOverride) {
        if (thresholdOverride == null) {
            return anomalyEngine;
        }
        log.debug("Applying threshold override {}", thresholdOverride);
        return anomalyEngine.withConfig(anomalyEngine.config().withThreshold(thresholdOverride));
    }

    private Mono<AnalysisResponse> processBatchItem(BatchItem item) {
        int rowCount = item.rows() == null ? 0 : item.rows().size();
        return Mono.fromCallable(() -> {
                    persistPending(item.analysisId(), rowCount, anomalyEngine);
                    return anomalyEngine.analyze(item.rows());
                })
                .subscribeOn(Schedulers.boundedElastic())
                .transformDeferred(BulkheadOperator.of(analysisBulkhead))
                .map(result -> complete(item.analysisId(), result))
                .onErrorResume(ex -> {
                    log.error("Batch item {} failed: {}", item.analysisId(), ex.getMessage());
                    return Mono.just(fail(item.analysisId(), rowCount, ex));
                });
    }

    private AnalysisResponse complete(String analysisId, AnalysisResult result) {
        OffsetDateTime processedAt = OffsetDateTime.now();
        AnalysisStatus status = result.status();
        AnalysisRecordEntity entity = findOrCreate(analysisId, result.summary().totalTransactions());
        entity.setStatus(status);
        entity.setResultJson(serialize(result));
        entity.setCompletedAt(processedAt);
        analysisRecordRepository.save(entity);

        log.info("Analysis {} finished with status {}: duplicates={}, unusualTiming={}, roundNumbers={}, thresholdFlags={}",
                analysisId,
                status,
                result.summary().duplicates(),
                result.summary().unusualTiming(),
                result.summary().roundNumbers(),
                result.summary().thresholdFlags());
        return AnalysisResponse.completed(analysisId, processedAt, result);
    }

    private AnalysisResponse fail(String analysisId, int rowCount, Throwable cause) {
        OffsetDateTime processedAt = OffsetDateTime.now();
        AnalysisRecordEntity entity = findOrCreate(analysisId, rowCount);
        entity.setStatus(AnalysisStatus.FAILED);
        entity.setErrorMessage(cause.getMessage());
        entity.setCompletedAt(processedAt);
        analysisRecordRepository.save(entity);
        return AnalysisResponse.failed(analysisId, processedAt, rowCount, cause.getMessage());
    }

    private void persistPending(String analysisId, int rowCount, AnomalyEngine engine) {
        AnalysisRecordEntity entity = AnalysisRecordEntity.builder()
                .analysisId(analysisId)
                .status(AnalysisStatus.PENDING)
                .rowCount(rowCount)
                .thresholdAmount(engine.config().thresholdAmount())
                .createdAt(OffsetDateTime.now())
                .build();
        analysisRecordRepository.save(entity);
        log.debug("Persisted pending analysis: {}", analysisId);
    }

    private AnalysisRecordEntity findOrCreate(String analysisId, int rowCount) {
        return analysisRecordRepository.findById(analysisId)
                .orElseGet(() -> AnalysisRecordEntity.builder()
                        .analysisId(analysisId)
                        .rowCount(rowCount)
                        .thresholdAmount(anomalyEngine.config().thresholdAmount())
                        .createdAt(OffsetDateTime.now())
                        .build());
    }

    private String serialize(AnalysisResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Error serializing analysis result", "RESULT_NOT_SERIALIZABLE", e);
        }
    }

    private record BatchItem(String analysisId, List<Map<String, Object>> rows) {}
}
