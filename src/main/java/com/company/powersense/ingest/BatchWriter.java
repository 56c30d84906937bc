package com.company.powersense.ingest;

import com.company.powersense.domain.Anomaly;
import com.company.powersense.domain.VersionedRow;
import com.company.powersense.repository.AnomalyRepository;
import com.company.powersense.repository.MeasurementRepository;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Single bulk write per call. Empty input never reaches the store.
 * <p>
 * Anomaly writes carry the store retry policy. Measurement writes are one attempt: their caller
 * retries the state read and the write together, so the attempt cap holds for the whole unit.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BatchWriter {

    private final MeasurementRepository measurementRepository;
    private final AnomalyRepository anomalyRepository;

    @Qualifier("storeRetry")
    private final Retry storeRetry;

    /**
     * @return rows written, equal to the input size on success
     */
    public int writeMeasurements(List<VersionedRow> rows) {
        return write("measurements", rows, () -> measurementRepository.insertBatch(rows));
    }

    public int writeAnomalies(List<Anomaly> anomalies) {
        return write("anomalies", anomalies,
                Retry.decorateSupplier(storeRetry, () -> anomalyRepository.insertBatch(anomalies)));
    }

    private int write(String table, List<?> rows, Supplier<Integer> insert) {
        if (rows == null || rows.isEmpty()) {
            log.debug("Nothing to write to {}", table);
            return 0;
        }

        int written = insert.get();
        log.debug("Wrote {} rows to {}", written, table);
        return written;
    }
}
