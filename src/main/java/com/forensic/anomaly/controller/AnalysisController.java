package com.forensic.anomaly.controller;

import com.forensic.anomaly.domain.AnalysisResponse;
import com.forensic.anomaly.service.AnomalyAnalysisService;
import com.forensic.anomaly.util.AnalysisIdGenerator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * REST controller for transaction anomaly analysis.
 * Rows are free-form JSON objects; column names are resolved by the engine.
 */
@RestController
@RequestMapping("/api/v1/analyze")
@Tag(name = "Analysis", description = "Transaction anomaly analysis APIs")
@Slf4j
public class AnalysisController {

    private final AnomalyAnalysisService analysisService;
    private final AnalysisIdGenerator idGenerator;

    public AnalysisController(AnomalyAnalysisService analysisService, AnalysisIdGenerator idGenerator) {
        this.analysisService = analysisService;
        this.idGenerator = idGenerator;
    }

    @PostMapping
    @Operation(
            summary = "Analyze transactions",
            description = "Screens one batch of transaction rows and returns the risk report. " +
                         "Rows that cannot be parsed are skipped and listed under diagnostics."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Batch analysed",
                    content = @Content(schema = @Schema(implementation = AnalysisResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Malformed body or invalid threshold override",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            ),
            @ApiResponse(
                    responseCode = "429",
                    description = "Too many concurrent analyses",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<AnalysisResponse> analyze(
            @Parameter(description = "Transaction rows", required = true)
            @RequestBody List<Map<String, Object>> rows,
            @Parameter(description = "Approval threshold for this request only", example = "5000")
            @RequestParam(name = "threshold", required = false) BigDecimal threshold) {

        log.info("Received analysis request with {} rows", rows.size());

        return ResponseEntity.ok(analysisService.analyze(rows, threshold));
    }

    @PostMapping("/batch")
    @Operation(
            summary = "Analyze several batches",
            description = "Analyses several independent batches in parallel. Each batch receives its own analysis id."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Batches analysed"
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Empty or malformed payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<List<AnalysisResponse>> analyzeBatch(
            @Parameter(description = "List of row batches", required = true)
            @RequestBody List<List<Map<String, Object>>> batches) {

        log.info("Received batch analysis request with {} batches", batches.size());

        if (batches.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(analysisService.analyzeBatch(batches));
    }

    @GetMapping("/{analysisId}")
    @Operation(
            summary = "Get analysis by ID",
            description = "Retrieves an archived analysis by its id"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Analysis found",
                    content = @Content(schema = @Schema(implementation = AnalysisResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Malformed analysis id"
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Analysis not found"
            )
    })
    public ResponseEntity<AnalysisResponse> getAnalysisById(
            @Parameter(description = "Analysis id", example = "550e8400-e29b-41d4-a716-446655440000")
            @PathVariable String analysisId) {

        String canonicalId = idGenerator.requireValid(analysisId);
        log.debug("Retrieving analysis: {}", canonicalId);

        return analysisService.getAnalysisById(canonicalId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Liveness check for the analysis endpoints")
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Anomaly analysis service is healthy");
    }
}
