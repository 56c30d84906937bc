package com.company.powersense.service;

import com.company.powersense.domain.Measurement;
import com.company.powersense.domain.VersionedRow;
import com.company.powersense.ingest.BatchWriter;
import com.company.powersense.ingest.LatestStateReconciler;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Write path shared by the scheduled cycle and the ingest endpoint: reconcile against the latest
 * stored state, then write the changed rows.
 * <p>
 * A transient store failure at any point restarts the whole batch, state read included, so a
 * partially applied write is seen as stored state by the next attempt.
 * <p>
 * Calls are serialized: versions are derived from stored state, so two reconciliations of the same
 * keys must not interleave within this process.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MeasurementIngestionService {

    private final LatestStateReconciler reconciler;
    private final BatchWriter batchWriter;
    private final CacheEvictionService cacheEvictionService;

    @Qualifier("storeRetry")
    private final Retry storeRetry;

    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * @return number of new versioned rows written
     */
    public int ingest(List<Measurement> measurements) {
        if (measurements == null || measurements.isEmpty()) {
            return 0;
        }

        int written;
        writeLock.lock();
        try {
            written = Retry.decorateSupplier(storeRetry, () -> {
                List<VersionedRow> changed = reconciler.reconcile(measurements);
                return batchWriter.writeMeasurements(changed);
            }).get();
        } finally {
            writeLock.unlock();
        }

        cacheEvictionService.onMeasurementsWritten(written);

        log.info("Ingested {} measurements: {} new versions written", measurements.size(), written);
        return written;
    }
}
