package com.forensic.anomaly;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forensic.anomaly.domain.AnalysisStatus;
import com.forensic.anomaly.service.AnalysisRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Anomaly service end-to-end")
class AnomalyServiceIntegrationTest {

    private static final String SAMPLE = """
            [
              {"date": "2024-01-03", "amount": 15000, "vendor": "ABC Supplies", "description": "Chairs"},
              {"date": "2024-01-03", "amount": "15,000.00", "vendor": "abc supplies", "description": "Chairs again"},
              {"date": "2024-01-07", "amount": 4500, "vendor": "CloudSoft"},
              {"date": "2024-01-05", "amount": 10000, "vendor": "Consulting"},
              {"date": "2024-01-06", "amount": 9999.00, "vendor": "Consulting"},
              {"date": "03/01/2024", "amount": 120, "vendor": "Ambiguous Ltd"}
            ]
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AnalysisRecordRepository analysisRecordRepository;

    @Test
    @DisplayName("Should analyze, archive and retrieve a batch")
    void shouldAnalyzeArchiveAndRetrieve() throws Exception {
        // When
        MvcResult posted = mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SAMPLE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.summary.total_transactions").value(6))
                .andExpect(jsonPath("$.summary.duplicates").value(2))
                .andExpect(jsonPath("$.summary.unusual_timing").value(2))
                .andExpect(jsonPath("$.summary.round_numbers").value(3))
                .andExpect(jsonPath("$.summary.threshold_flags").value(1))
                .andExpect(jsonPath("$.details.duplicates[0].source_indices[0]").value(0))
                .andExpect(jsonPath("$.details.duplicates[0].source_indices[1]").value(1))
                .andExpect(jsonPath("$.details.duplicates[0].transactions[0].attributes.description").value("Chairs"))
                .andExpect(jsonPath("$.details.benford[0].payload.status").value("INSUFFICIENT_DATA"))
                .andExpect(jsonPath("$.diagnostics.skipped_rows").value(1))
                .andExpect(jsonPath("$.diagnostics.row_errors[0].source_index").value(5))
                .andReturn();

        JsonNode body = objectMapper.readTree(posted.getResponse().getContentAsString());
        String analysisId = body.get("analysis_id").asText();

        // Then
        mockMvc.perform(get("/api/v1/analyze/{analysisId}", analysisId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.analysis_id").value(analysisId))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.summary.duplicates").value(2))
                .andExpect(jsonPath("$.recommendations[0]").value("Review duplicate payments"));

        assertThat(analysisRecordRepository.findById(analysisId))
                .get()
                .satisfies(entity -> {
                    assertThat(entity.getStatus()).isEqualTo(AnalysisStatus.COMPLETED);
                    assertThat(entity.getRowCount()).isEqualTo(6);
                });
    }

    @Test
    @DisplayName("Should report an empty batch distinctly from a clean one")
    void shouldReportEmptyBatch() throws Exception {
        MvcResult posted = mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"date\": \"soon\", \"amount\": \"N/A\", \"vendor\": \"Acme\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("EMPTY_BATCH"))
                .andExpect(jsonPath("$.summary.total_transactions").value(1))
                .andExpect(jsonPath("$.diagnostics.empty_batch").value(true))
                .andExpect(jsonPath("$.details.benford[0].payload.status").value("INSUFFICIENT_DATA"))
                .andReturn();

        String analysisId = objectMapper.readTree(posted.getResponse().getContentAsString())
                .get("analysis_id").asText();
        assertThat(analysisRecordRepository.findById(analysisId))
                .get()
                .extracting(entity -> entity.getStatus())
                .isEqualTo(AnalysisStatus.EMPTY_BATCH);
    }

    @Test
    @DisplayName("Should reject a zero threshold override with 400")
    void shouldRejectZeroThreshold() throws Exception {
        mockMvc.perform(post("/api/v1/analyze")
                        .param("threshold", "0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SAMPLE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.property").value("anomaly.threshold.amount"));
    }

    @Test
    @DisplayName("Should analyze several batches with separate ids")
    void shouldAnalyzeBatches() throws Exception {
        mockMvc.perform(post("/api/v1/analyze/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + SAMPLE + ", []]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$[1].status").value("EMPTY_BATCH"));
    }

    @Test
    @DisplayName("Should return 404 for an unknown analysis")
    void shouldReturn404ForUnknownAnalysis() throws Exception {
        mockMvc.perform(get("/api/v1/analyze/{analysisId}", "00000000-0000-4000-8000-000000000000"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Actuator health is UP")
    void actuatorHealthIsUp() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
