package com.company.powersense.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One observed value of one metric at one instant, as produced by normalization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Measurement {

    // Always UTC
    private Instant timestamp;

    private String source;
    private String metric;

    @Builder.Default
    private MetricValue value = MetricValue.ABSENT;

    private String perimeter;

    // Categorical qualifier, e.g. realized vs forecast. May be null.
    private String nature;
}
