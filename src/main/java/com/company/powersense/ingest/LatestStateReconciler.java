package com.company.powersense.ingest;

import com.company.powersense.domain.LatestState;
import com.company.powersense.domain.Measurement;
import com.company.powersense.domain.VersionedRow;
import com.company.powersense.ingest.versioning.VersioningStrategy;
import com.company.powersense.repository.MeasurementRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Keeps only the measurements that change the latest known value of their identity key and
 * assigns each one its version.
 * <p>
 * The stored state is read once per call; accepted rows update an in-memory copy so that repeated
 * keys inside one batch version in arrival order. Not safe for two concurrent passes on the same keys.
 */
@Component
@Slf4j
public class LatestStateReconciler {

    private final MeasurementRepository measurementRepository;
    private final IdentityKeyBuilder identityKeyBuilder;
    private final VersioningStrategy versioningStrategy;
    private final Counter unchangedCounter;
    private final Counter versionedCounter;

    public LatestStateReconciler(MeasurementRepository measurementRepository,
                                 IdentityKeyBuilder identityKeyBuilder,
                                 VersioningStrategy versioningStrategy,
                                 MeterRegistry meterRegistry) {
        this.measurementRepository = measurementRepository;
        this.identityKeyBuilder = identityKeyBuilder;
        this.versioningStrategy = versioningStrategy;
        this.unchangedCounter = meterRegistry.counter("powersense.reconciler.unchanged");
        this.versionedCounter = meterRegistry.counter("powersense.reconciler.versioned");
    }

    /**
     * @return changed measurements with their versions, in arrival order
     */
    public List<VersionedRow> reconcile(List<Measurement> measurements) {
        if (measurements == null || measurements.isEmpty()) {
            return List.of();
        }

        List<String> keys = new ArrayList<>(measurements.size());
        Set<String> distinctKeys = new LinkedHashSet<>();
        for (Measurement measurement : measurements) {
            String key = identityKeyBuilder.build(measurement);
            keys.add(key);
            distinctKeys.add(key);
        }

        Map<String, LatestState> latest = new HashMap<>();
        if (versioningStrategy.requiresLatestState()) {
            latest.putAll(measurementRepository.findLatestState(distinctKeys));
        }

        List<VersionedRow> changed = new ArrayList<>();
        for (int i = 0; i < measurements.size(); i++) {
            Measurement measurement = measurements.get(i);
            String key = keys.get(i);

            OptionalLong version = versioningStrategy.nextVersion(
                    key, measurement.getValue(), latest.get(key));
            if (version.isEmpty()) {
                continue;
            }

            changed.add(VersionedRow.of(measurement, key, version.getAsLong()));
            latest.put(key, new LatestState(measurement.getValue(), version.getAsLong()));
        }

        int unchanged = measurements.size() - changed.size();
        unchangedCounter.increment(unchanged);
        versionedCounter.increment(changed.size());

        log.debug("Reconciled {} measurements over {} keys ({} mode): {} changed, {} unchanged",
                measurements.size(), distinctKeys.size(), versioningStrategy.mode(),
                changed.size(), unchanged);

        return changed;
    }
}
