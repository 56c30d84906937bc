package com.company.powersense.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary statistics of one (dow, hour, minute) slot over the lookback window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineBucket {
    private int dow;
    private int hour;
    private int minute;
    private double mean;

    // Null when undefined: fewer than two samples or zero variance
    private Double std;

    private long sampleCount;

    public BucketKey key() {
        return new BucketKey(dow, hour, minute);
    }

    public boolean isScorable(int minSamples) {
        return sampleCount >= minSamples && std != null && std != 0.0;
    }
}
