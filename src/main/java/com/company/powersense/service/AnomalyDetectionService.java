package com.company.powersense.service;

import com.company.powersense.anomaly.AnomalyScorer;
import com.company.powersense.anomaly.BaselineBuilder;
import com.company.powersense.config.PowerSenseProperties;
import com.company.powersense.domain.Anomaly;
import com.company.powersense.domain.Baseline;
import com.company.powersense.domain.CycleResult;
import com.company.powersense.domain.VersionedRow;
import com.company.powersense.ingest.BatchWriter;
import com.company.powersense.repository.MeasurementRepository;
import com.company.powersense.util.TimeUtils;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One detection pass over the configured metric.
 * <p>
 * History covers {@code [now - lookback, now)}; the evaluation boundary is
 * {@code now - evaluationWindow}. Rows before the boundary build the baseline, rows at or after it are scored.
 */
@Service
@Slf4j
public class AnomalyDetectionService {

    private final MeasurementRepository measurementRepository;
    private final BaselineBuilder baselineBuilder;
    private final AnomalyScorer anomalyScorer;
    private final BatchWriter batchWriter;
    private final Retry storeRetry;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final PowerSenseProperties.Anomaly config;
    private final AtomicInteger baselineBuckets;

    public AnomalyDetectionService(MeasurementRepository measurementRepository,
                                   BaselineBuilder baselineBuilder,
                                   AnomalyScorer anomalyScorer,
                                   BatchWriter batchWriter,
                                   @Qualifier("storeRetry") Retry storeRetry,
                                   Tracer tracer,
                                   MeterRegistry meterRegistry,
                                   Clock clock,
                                   PowerSenseProperties properties) {
        this.measurementRepository = measurementRepository;
        this.baselineBuilder = baselineBuilder;
        this.anomalyScorer = anomalyScorer;
        this.batchWriter = batchWriter;
        this.storeRetry = storeRetry;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.config = properties.getAnomaly();
        this.baselineBuckets = meterRegistry.gauge("powersense.anomaly.baseline.buckets", new AtomicInteger());
    }

    public CycleResult runCycle() {
        Instant start = clock.instant();
        Instant historyStart = start.minus(config.getLookback());
        Instant boundary = start.minus(config.getEvaluationWindow());

        Span span = tracer.spanBuilder("anomaly.cycle")
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute("metric", config.getMetric())
                .startSpan();

        int written = 0;
        try (Scope scope = span.makeCurrent()) {
            List<VersionedRow> history = fetchHistory(config.getMetric(), historyStart, start);
            Baseline baseline = baselineBuilder.build(history, boundary);
            baselineBuckets.set(baseline.size());

            List<Anomaly> anomalies = anomalyScorer.score(history, baseline, boundary, config.getZscoreThreshold());
            written = batchWriter.writeAnomalies(anomalies);

            span.setAttribute("rows.fetched", history.size());
            span.setAttribute("baseline.buckets", baseline.size());
            span.setAttribute("rows.written", written);

            Duration duration = Duration.between(start, clock.instant());
            meterRegistry.counter("powersense.anomaly.rows.written").increment(written);
            meterRegistry.timer("powersense.anomaly.cycle.duration").record(duration);

            log.info("anomaly_cycle metric={} rows={} errors=0 duration={}ms",
                    config.getMetric(), written, duration.toMillis());
            return CycleResult.success(written, duration);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Anomaly detection cycle failed");

            Duration duration = Duration.between(start, clock.instant());
            meterRegistry.counter("powersense.anomaly.errors").increment();
            meterRegistry.timer("powersense.anomaly.cycle.duration").record(duration);

            log.error("anomaly_cycle metric={} rows={} errors=1 duration={}ms",
                    config.getMetric(), written, duration.toMillis(), e);
            return CycleResult.failure(written, duration);
        } finally {
            span.end();
        }
    }

    /**
     * Latest version of each key, fetched window by window in ascending time order.
     */
    List<VersionedRow> fetchHistory(String metric, Instant start, Instant end) {
        List<VersionedRow> rows = new ArrayList<>();
        List<Instant[]> windows = TimeUtils.chunkTimeRange(start, end, config.getFetchChunk());
        for (Instant[] window : windows) {
            rows.addAll(Retry.decorateSupplier(storeRetry,
                    () -> measurementRepository.findLatestForMetric(metric, window[0], window[1])).get());
        }
        log.debug("Fetched {} {} rows in {} windows from {} to {}", rows.size(), metric, windows.size(), start, end);
        return rows;
    }
}
