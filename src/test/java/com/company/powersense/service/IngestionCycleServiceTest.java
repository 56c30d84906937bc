package com.company.powersense.service;

import com.company.powersense.config.PowerSenseProperties;
import com.company.powersense.config.RetryConfiguration;
import com.company.powersense.config.TransientErrors;
import com.company.powersense.domain.CycleResult;
import com.company.powersense.domain.Measurement;
import com.company.powersense.domain.RawRecord;
import com.company.powersense.exception.UpstreamConfigurationException;
import com.company.powersense.ingest.RecordNormalizer;
import com.company.powersense.repository.MeasurementRepository;
import com.company.powersense.upstream.HistoryArchiveReader;
import com.company.powersense.upstream.UpstreamApiClient;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.TransientDataAccessResourceException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionCycleServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-10T08:00:00Z");

    @Mock
    private UpstreamApiClient upstreamApiClient;
    @Mock
    private HistoryArchiveReader historyArchiveReader;
    @Mock
    private MeasurementIngestionService ingestionService;
    @Mock
    private MeasurementRepository measurementRepository;

    private PowerSenseProperties properties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        properties = new PowerSenseProperties();
        meterRegistry = new SimpleMeterRegistry();
    }

    private IngestionCycleService service() {
        Retry retry = Retry.of("test", RetryConfiguration.linearRetryConfig(
                3, Duration.ofMillis(1), TransientErrors::isTransientStoreError));
        return new IngestionCycleService(upstreamApiClient, historyArchiveReader,
                new RecordNormalizer(properties, meterRegistry), ingestionService, measurementRepository,
                retry, OpenTelemetry.noop().getTracer("test"), meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    @Test
    void regularPassNormalizesAndWritesRecentRecords() {
        when(measurementRepository.isEmpty()).thenReturn(false);
        when(upstreamApiClient.fetchRecent(NOW)).thenReturn(List.of(record("2025-01-10T07:45:00+00:00")));
        when(ingestionService.ingest(anyList())).thenReturn(2);

        CycleResult result = service().runCycle();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.rowsWritten()).isEqualTo(2);
        verify(historyArchiveReader, never()).download(any());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Measurement>> captor = ArgumentCaptor.forClass(List.class);
        verify(ingestionService).ingest(captor.capture());
        assertThat(captor.getValue()).extracting(Measurement::getMetric)
                .containsExactlyInAnyOrder("consommation", "prevision_j1");

        assertThat(meterRegistry.counter("powersense.ingest.rows.written").count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("powersense.ingest.last_success").gauge().value())
                .isEqualTo((double) NOW.getEpochSecond());
    }

    @Test
    void emptyStoreIsSeededFromHistoryBeforeTheRegularPass() {
        when(measurementRepository.isEmpty()).thenReturn(true);
        when(historyArchiveReader.download(LocalDate.of(2025, 1, 10)))
                .thenReturn(List.of(record("2025-01-01T00:00:00Z")));
        when(upstreamApiClient.fetchRecent(NOW)).thenReturn(List.of());
        when(ingestionService.ingest(anyList())).thenReturn(2, 0);

        CycleResult result = service().runCycle();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.rowsWritten()).isEqualTo(2);
        verify(ingestionService, times(2)).ingest(anyList());
    }

    @Test
    void historyDisabledSkipsTheEmptinessCheck() {
        properties.getHistory().setEnabled(false);
        when(upstreamApiClient.fetchRecent(NOW)).thenReturn(List.of());
        when(ingestionService.ingest(anyList())).thenReturn(0);

        assertThat(service().runCycle().isSuccess()).isTrue();
        verify(measurementRepository, never()).isEmpty();
        verify(historyArchiveReader, never()).download(any());
    }

    @Test
    void emptinessCheckIsRetriedOnTransientStoreErrors() {
        when(measurementRepository.isEmpty())
                .thenThrow(new TransientDataAccessResourceException("connection reset"))
                .thenReturn(false);
        when(upstreamApiClient.fetchRecent(NOW)).thenReturn(List.of());
        when(ingestionService.ingest(anyList())).thenReturn(0);

        assertThat(service().runCycle().isSuccess()).isTrue();
        verify(measurementRepository, times(2)).isEmpty();
    }

    @Test
    void failedPassIsReportedNotThrown() {
        when(measurementRepository.isEmpty()).thenReturn(false);
        when(upstreamApiClient.fetchRecent(NOW))
                .thenThrow(new UpstreamConfigurationException("Upstream URL is not configured"));

        CycleResult result = service().runCycle();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errors()).isEqualTo(1);
        assertThat(result.rowsWritten()).isZero();
        assertThat(meterRegistry.counter("powersense.ingest.errors").count()).isEqualTo(1.0);
        verify(ingestionService, never()).ingest(anyList());
    }

    @Test
    void bootstrapFailureFailsThePass() {
        when(measurementRepository.isEmpty()).thenReturn(true);
        when(historyArchiveReader.download(any())).thenThrow(new IllegalStateException("archive down"));

        CycleResult result = service().runCycle();

        assertThat(result.isSuccess()).isFalse();
        verify(upstreamApiClient, never()).fetchRecent(any());
    }

    private static RawRecord record(String timestamp) {
        return RawRecord.of(Map.of(
                "date_heure", timestamp,
                "perimetre", "France",
                "nature", "Données temps réel",
                "consommation", 65000,
                "prevision_j1", 64800));
    }
}
