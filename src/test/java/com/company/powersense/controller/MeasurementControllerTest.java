package com.company.powersense.controller;

import com.company.powersense.domain.Measurement;
import com.company.powersense.domain.enums.SortOrder;
import com.company.powersense.dto.response.CountResponse;
import com.company.powersense.dto.response.MeasurementResponse;
import com.company.powersense.repository.TimeSeriesQuery;
import com.company.powersense.service.MeasurementIngestionService;
import com.company.powersense.service.MeasurementQueryService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MeasurementController.class)
@AutoConfigureMockMvc(addFilters = false)
class MeasurementControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MeasurementQueryService queryService;

    @MockBean
    private MeasurementIngestionService ingestionService;

    @Test
    void measurementsAreFilteredByQueryParameters() throws Exception {
        when(queryService.findMeasurements(any())).thenReturn(List.of(MeasurementResponse.builder()
                .ts(Instant.parse("2025-01-01T00:00:00Z"))
                .source("France")
                .metric("consommation")
                .value(65000.0)
                .ukey("abc")
                .version(2)
                .insertedAt(Instant.parse("2025-01-01T00:05:00Z"))
                .build()));

        mockMvc.perform(get("/api/v1/measurements")
                        .param("start", "2025-01-01T00:00:00Z")
                        .param("end", "2025-01-02T00:00:00Z")
                        .param("metric", "consommation")
                        .param("limit", "10")
                        .param("order", "ASC"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].ukey").value("abc"))
                .andExpect(jsonPath("$[0].version").value(2))
                .andExpect(jsonPath("$[0].value").value(65000.0))
                .andExpect(jsonPath("$[0].inserted_at").value("2025-01-01T00:05:00Z"));

        ArgumentCaptor<TimeSeriesQuery> captor = ArgumentCaptor.forClass(TimeSeriesQuery.class);
        verify(queryService).findMeasurements(captor.capture());
        TimeSeriesQuery query = captor.getValue();
        assertThat(query.getStart()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
        assertThat(query.getEnd()).isEqualTo(Instant.parse("2025-01-02T00:00:00Z"));
        assertThat(query.getMetric()).isEqualTo("consommation");
        assertThat(query.getSource()).isNull();
        assertThat(query.getLimit()).isEqualTo(10);
        assertThat(query.getOrder()).isEqualTo(SortOrder.ASC);
    }

    @Test
    void unknownOrderIsRejected() throws Exception {
        mockMvc.perform(get("/api/v1/measurements").param("order", "sideways"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("order must be 'asc' or 'desc'"));

        verifyNoInteractions(queryService);
    }

    @Test
    void limitOutOfRangeIsRejected() throws Exception {
        mockMvc.perform(get("/api/v1/measurements/latest").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/measurements").param("limit", "5001"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(queryService);
    }

    @Test
    void malformedTimestampIsRejected() throws Exception {
        mockMvc.perform(get("/api/v1/measurements").param("start", "yesterday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value for parameter 'start'"));
    }

    @Test
    void latestDefaultsToDescendingHundred() throws Exception {
        when(queryService.findLatest(null, 100, SortOrder.DESC)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/measurements/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void countIsWrapped() throws Exception {
        when(queryService.count()).thenReturn(new CountResponse(42));

        mockMvc.perform(get("/api/v1/measurements/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(42));
    }

    @Test
    void storeOutageMapsToServiceUnavailable() throws Exception {
        when(queryService.count()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(get("/api/v1/measurements/count"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Measurement store unavailable"));
    }

    @Test
    void pushedRowsGoThroughVersionedIngestion() throws Exception {
        when(ingestionService.ingest(anyList())).thenReturn(1);

        mockMvc.perform(post("/api/v1/measurements/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"rows": [
                                  {"ts": "2025-01-01T01:00:00+01:00", "source": "France", "metric": "consommation",
                                   "value": 65000, "perimetre": "France", "nature": "Données temps réel"},
                                  {"ts": "2025-01-01T00:15:00Z", "source": "France", "metric": "consommation",
                                   "value": null, "perimetre": "France", "nature": "Données temps réel"}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inserted").value(1));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Measurement>> captor = ArgumentCaptor.forClass(List.class);
        verify(ingestionService).ingest(captor.capture());
        assertThat(captor.getValue()).hasSize(2);
        assertThat(captor.getValue().get(0).getTimestamp()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
        assertThat(captor.getValue().get(1).getValue().isPresent()).isFalse();
    }

    @Test
    void pushedRowWithoutMetricIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/measurements/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"rows": [{"ts": "2025-01-01T00:00:00Z", "source": "France",
                                           "perimetre": "France", "nature": "Données temps réel"}]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        verify(ingestionService, never()).ingest(anyList());
    }

    @Test
    void missingRowsIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/measurements/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.rows").value("rows is required"));
    }

    @Test
    void unreadableBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/measurements/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rows\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }
}
