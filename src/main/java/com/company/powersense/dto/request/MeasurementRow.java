package com.company.powersense.dto.request;

import com.company.powersense.domain.Measurement;
import com.company.powersense.domain.MetricValue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * One pushed measurement. {@code value} may be null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementRow {
    @NotNull(message = "ts is required")
    private OffsetDateTime ts;

    @NotBlank(message = "source is required")
    private String source;

    @NotBlank(message = "metric is required")
    private String metric;

    private Double value;

    @NotBlank(message = "perimetre is required")
    private String perimetre;

    @NotBlank(message = "nature is required")
    private String nature;

    public Measurement toMeasurement() {
        return Measurement.builder()
                .timestamp(ts.toInstant())
                .source(source)
                .metric(metric)
                .value(MetricValue.of(value))
                .perimeter(perimetre)
                .nature(nature)
                .build();
    }
}
