package com.company.powersense.service;

import com.company.powersense.config.PowerSenseProperties;
import com.company.powersense.domain.CycleResult;
import com.company.powersense.domain.Measurement;
import com.company.powersense.domain.RawRecord;
import com.company.powersense.ingest.RecordNormalizer;
import com.company.powersense.repository.MeasurementRepository;
import com.company.powersense.upstream.HistoryArchiveReader;
import com.company.powersense.upstream.UpstreamApiClient;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One ingestion pass: seed an empty store from the history archive, then fetch the recent upstream
 * window, normalize it and push it through the versioned write path.
 * <p>
 * A failed pass is reported, not thrown, so the scheduler keeps triggering the next one.
 */
@Service
@Slf4j
public class IngestionCycleService {

    private final UpstreamApiClient upstreamApiClient;
    private final HistoryArchiveReader historyArchiveReader;
    private final RecordNormalizer recordNormalizer;
    private final MeasurementIngestionService ingestionService;
    private final MeasurementRepository measurementRepository;
    private final Retry storeRetry;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final boolean historyEnabled;
    private final AtomicLong lastSuccessEpochSeconds;

    public IngestionCycleService(UpstreamApiClient upstreamApiClient,
                                 HistoryArchiveReader historyArchiveReader,
                                 RecordNormalizer recordNormalizer,
                                 MeasurementIngestionService ingestionService,
                                 MeasurementRepository measurementRepository,
                                 @Qualifier("storeRetry") Retry storeRetry,
                                 Tracer tracer,
                                 MeterRegistry meterRegistry,
                                 Clock clock,
                                 PowerSenseProperties properties) {
        this.upstreamApiClient = upstreamApiClient;
        this.historyArchiveReader = historyArchiveReader;
        this.recordNormalizer = recordNormalizer;
        this.ingestionService = ingestionService;
        this.measurementRepository = measurementRepository;
        this.storeRetry = storeRetry;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.historyEnabled = properties.getHistory().isEnabled();
        this.lastSuccessEpochSeconds = meterRegistry.gauge("powersense.ingest.last_success", new AtomicLong());
    }

    public CycleResult runCycle() {
        Instant start = clock.instant();
        Span span = tracer.spanBuilder("ingest.cycle")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        int written = 0;
        try (Scope scope = span.makeCurrent()) {
            if (historyEnabled && isStoreEmpty()) {
                written += bootstrapHistory(start);
            }

            List<RawRecord> records = upstreamApiClient.fetchRecent(start);
            List<Measurement> measurements = recordNormalizer.normalizeAll(records);
            span.setAttribute("records.fetched", records.size());
            span.setAttribute("measurements.normalized", measurements.size());

            written += ingestionService.ingest(measurements);
            span.setAttribute("rows.written", written);

            Duration duration = Duration.between(start, clock.instant());
            meterRegistry.counter("powersense.ingest.rows.written").increment(written);
            lastSuccessEpochSeconds.set(clock.instant().getEpochSecond());
            recordDuration(duration);

            log.info("ingest_cycle rows={} errors=0 duration={}ms", written, duration.toMillis());
            return CycleResult.success(written, duration);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Ingestion cycle failed");

            Duration duration = Duration.between(start, clock.instant());
            meterRegistry.counter("powersense.ingest.errors").increment();
            meterRegistry.counter("powersense.ingest.rows.written").increment(written);
            recordDuration(duration);

            log.error("ingest_cycle rows={} errors=1 duration={}ms", written, duration.toMillis(), e);
            return CycleResult.failure(written, duration);
        } finally {
            span.end();
        }
    }

    private boolean isStoreEmpty() {
        return Retry.decorateSupplier(storeRetry, measurementRepository::isEmpty).get();
    }

    private int bootstrapHistory(Instant now) {
        log.info("Measurement store is empty, bootstrapping from the history archive");
        List<RawRecord> records = historyArchiveReader.download(LocalDate.ofInstant(now, ZoneOffset.UTC));
        List<Measurement> measurements = recordNormalizer.normalizeAll(records);
        int written = ingestionService.ingest(measurements);
        log.info("History bootstrap wrote {} rows from {} archive records", written, records.size());
        return written;
    }

    private void recordDuration(Duration duration) {
        meterRegistry.timer("powersense.ingest.cycle.duration").record(duration);
    }
}
