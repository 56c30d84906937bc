package com.company.powersense.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * A reading whose z-score against its baseline bucket reached the threshold.
 * Append-only: re-running a cycle over an overlapping window may flag the same instant again.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly implements Serializable {
    private static final long serialVersionUID = 1L;

    private Instant timestamp;
    private String source;
    private String metric;
    private double value;
    private double zscore;
    private double mean;
    private double std;
    private double threshold;
    private int dow;
    private int hour;
    private int minute;
    private Instant insertedAt;
}
