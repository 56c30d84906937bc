package com.company.powersense.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Objects;

/**
 * Nullable numeric reading with a single canonical absent state.
 * <p>
 * Java null and {@code NaN} both collapse to {@link #ABSENT}, so equality between two
 * readings never has to special-case the different ways a missing value may arrive.
 * {@code -0.0} is stored as {@code 0.0}: the two compare equal as numbers, and {@link Double#equals} would not.
 */
public final class MetricValue implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final MetricValue ABSENT = new MetricValue(null);

    private final Double value;

    private MetricValue(Double value) {
        this.value = value;
    }

    @JsonCreator
    public static MetricValue of(Double value) {
        if (value == null || value.isNaN()) {
            return ABSENT;
        }
        return new MetricValue(value == 0.0 ? 0.0 : value);
    }

    public static MetricValue of(double value) {
        return of(Double.valueOf(value));
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * @throws IllegalStateException when the reading is absent
     */
    public double asDouble() {
        if (value == null) {
            throw new IllegalStateException("Metric value is absent");
        }
        return value;
    }

    /**
     * Boxed value for JDBC and JSON, null when absent.
     */
    @JsonValue
    public Double orNull() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricValue that)) return false;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "ABSENT" : value.toString();
    }
}
