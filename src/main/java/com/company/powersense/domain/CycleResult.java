package com.company.powersense.domain;

import java.time.Duration;

/**
 * Outcome of one scheduled pass, reported to the scheduling layer.
 */
public record CycleResult(int rowsWritten, int errors, Duration duration) {

    public static CycleResult success(int rowsWritten, Duration duration) {
        return new CycleResult(rowsWritten, 0, duration);
    }

    public static CycleResult failure(int rowsWritten, Duration duration) {
        return new CycleResult(rowsWritten, 1, duration);
    }

    public boolean isSuccess() {
        return errors == 0;
    }
}
