package com.company.powersense.anomaly;

import com.company.powersense.config.PowerSenseProperties;
import com.company.powersense.domain.Baseline;
import com.company.powersense.domain.BaselineBucket;
import com.company.powersense.domain.BucketKey;
import com.company.powersense.domain.VersionedRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates history strictly before the evaluation boundary into per-(dow, hour, minute)
 * mean / sample standard deviation / count.
 */
@Component
@Slf4j
public class BaselineBuilder {

    private final int minSamples;

    public BaselineBuilder(PowerSenseProperties properties) {
        this.minSamples = properties.getAnomaly().getMinSamples();
    }

    public Baseline build(List<VersionedRow> history, Instant boundary) {
        if (history == null || history.isEmpty()) {
            return Baseline.empty();
        }

        Map<BucketKey, RunningStats> stats = new LinkedHashMap<>();
        int used = 0;
        for (VersionedRow row : history) {
            if (row.getTimestamp() == null || row.getValue() == null || !row.getValue().isPresent()) {
                continue;
            }
            if (!row.getTimestamp().isBefore(boundary)) {
                continue;
            }
            stats.computeIfAbsent(BucketKey.of(row.getTimestamp()), key -> new RunningStats())
                    .add(row.getValue().asDouble());
            used++;
        }

        List<BaselineBucket> buckets = new ArrayList<>();
        for (Map.Entry<BucketKey, RunningStats> entry : stats.entrySet()) {
            RunningStats s = entry.getValue();
            if (s.count < minSamples) {
                continue;
            }
            BucketKey key = entry.getKey();
            buckets.add(BaselineBucket.builder()
                    .dow(key.dow())
                    .hour(key.hour())
                    .minute(key.minute())
                    .mean(s.mean)
                    .std(s.std())
                    .sampleCount(s.count)
                    .build());
        }

        log.debug("Baseline from {}/{} rows before {}: {} of {} buckets kept (min samples {})",
                used, history.size(), boundary, buckets.size(), stats.size(), minSamples);
        return new Baseline(buckets, minSamples);
    }

    /**
     * Welford accumulator.
     */
    private static final class RunningStats {
        private long count;
        private double mean;
        private double m2;

        void add(double value) {
            count++;
            double delta = value - mean;
            mean += delta / count;
            m2 += delta * (value - mean);
        }

        // Sample deviation (n - 1); null when undefined or zero
        Double std() {
            if (count < 2) {
                return null;
            }
            double std = Math.sqrt(m2 / (count - 1));
            return std == 0.0 ? null : std;
        }
    }
}
