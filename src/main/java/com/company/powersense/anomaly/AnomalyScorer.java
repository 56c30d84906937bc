package com.company.powersense.anomaly;

import com.company.powersense.domain.Anomaly;
import com.company.powersense.domain.Baseline;
import com.company.powersense.domain.BaselineBucket;
import com.company.powersense.domain.BucketKey;
import com.company.powersense.domain.VersionedRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scores rows at or after the boundary against their baseline bucket. Rows without a scorable
 * bucket are left out silently.
 */
@Component
@Slf4j
public class AnomalyScorer {

    public List<Anomaly> score(List<VersionedRow> evaluation, Baseline baseline,
                               Instant boundary, double threshold) {
        if (evaluation == null || evaluation.isEmpty() || baseline.isEmpty()) {
            return List.of();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        int scored = 0;
        for (VersionedRow row : evaluation) {
            if (row.getTimestamp() == null || row.getValue() == null || !row.getValue().isPresent()) {
                continue;
            }
            if (row.getTimestamp().isBefore(boundary)) {
                continue;
            }

            BucketKey key = BucketKey.of(row.getTimestamp());
            Optional<BaselineBucket> bucket = baseline.findScorable(key);
            if (bucket.isEmpty()) {
                continue;
            }
            scored++;

            double value = row.getValue().asDouble();
            double mean = bucket.get().getMean();
            double std = bucket.get().getStd();
            double zscore = (value - mean) / std;

            if (Math.abs(zscore) >= threshold) {
                anomalies.add(Anomaly.builder()
                        .timestamp(row.getTimestamp())
                        .source(row.getSource())
                        .metric(row.getMetric())
                        .value(value)
                        .zscore(zscore)
                        .mean(mean)
                        .std(std)
                        .threshold(threshold)
                        .dow(key.dow())
                        .hour(key.hour())
                        .minute(key.minute())
                        .build());
            }
        }

        log.debug("Scored {}/{} evaluation rows, {} flagged", scored, evaluation.size(), anomalies.size());
        return anomalies;
    }
}
