package com.company.powersense.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persisted form of a measurement. Rows are append-only; the row with the highest
 * version for an identity key is the current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionedRow implements Serializable {
    private static final long serialVersionUID = 1L;

    private Instant timestamp;
    private String source;
    private String metric;

    @Builder.Default
    private MetricValue value = MetricValue.ABSENT;

    private String identityKey;
    private long version;

    // Assigned by the store on insert, null before the row is written
    private Instant insertedAt;

    public static VersionedRow of(Measurement measurement, String identityKey, long version) {
        return VersionedRow.builder()
                .timestamp(measurement.getTimestamp())
                .source(measurement.getSource())
                .metric(measurement.getMetric())
                .value(measurement.getValue())
                .identityKey(identityKey)
                .version(version)
                .build();
    }
}
