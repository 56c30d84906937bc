package com.company.powersense.domain;

/**
 * Current value and version stored for one identity key.
 */
public record LatestState(MetricValue value, long version) {

    public LatestState {
        if (value == null) {
            value = MetricValue.ABSENT;
        }
    }
}
