package com.company.powersense.ingest;

import com.company.powersense.config.PowerSenseProperties;
import com.company.powersense.domain.Measurement;
import com.company.powersense.domain.MetricValue;
import com.company.powersense.domain.RawRecord;
import com.company.powersense.util.TimeUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns one raw upstream record into one {@link Measurement} per numeric column.
 * <p>
 * Data-quality problems never raise: a record without a usable timestamp yields nothing, and
 * null or non-numeric columns are skipped. Both kinds of drop are counted.
 */
@Component
@Slf4j
public class RecordNormalizer {

    public static final String FIELD_PERIMETER = "perimetre";
    public static final String FIELD_NATURE = "nature";
    public static final String FIELD_DATE = "date";
    public static final String FIELD_TIME = "heure";
    public static final String FIELD_TIMESTAMP = "date_heure";

    // Metadata and pagination artifacts, never metrics
    static final Set<String> NON_METRIC_FIELDS = Set.of(
            FIELD_PERIMETER, FIELD_NATURE, FIELD_DATE, FIELD_TIME, FIELD_TIMESTAMP,
            "total_count", "results");

    private final String defaultSource;
    private final Counter noTimestampDrops;
    private final Counter zeroMetricRecords;
    private final Counter skippedFields;

    public RecordNormalizer(PowerSenseProperties properties, MeterRegistry meterRegistry) {
        this.defaultSource = properties.getIngestion().getDefaultSource();
        this.noTimestampDrops = meterRegistry.counter("powersense.normalizer.records.dropped", "reason", "timestamp");
        this.zeroMetricRecords = meterRegistry.counter("powersense.normalizer.records.dropped", "reason", "no_metrics");
        this.skippedFields = meterRegistry.counter("powersense.normalizer.fields.skipped");
    }

    public List<Measurement> normalize(RawRecord record) {
        Optional<Instant> timestamp = resolveTimestamp(record);
        if (timestamp.isEmpty()) {
            log.debug("Dropping record without usable timestamp: {}", record);
            noTimestampDrops.increment();
            return List.of();
        }

        String perimeter = record.has(FIELD_PERIMETER) ? record.getString(FIELD_PERIMETER) : defaultSource;
        String nature = record.getString(FIELD_NATURE);

        List<Measurement> measurements = new ArrayList<>();
        for (Map.Entry<String, Object> field : record.entries()) {
            if (NON_METRIC_FIELDS.contains(field.getKey())) {
                continue;
            }
            Optional<Double> numeric = toNumber(field.getValue());
            if (numeric.isEmpty()) {
                skippedFields.increment();
                continue;
            }
            measurements.add(Measurement.builder()
                    .timestamp(timestamp.get())
                    .source(perimeter)
                    .metric(field.getKey())
                    .value(MetricValue.of(numeric.get()))
                    .perimeter(perimeter)
                    .nature(nature)
                    .build());
        }

        if (measurements.isEmpty()) {
            log.debug("Record at {} carried no numeric field", timestamp.get());
            zeroMetricRecords.increment();
        }
        return measurements;
    }

    public List<Measurement> normalizeAll(List<RawRecord> records) {
        List<Measurement> measurements = new ArrayList<>();
        for (RawRecord record : records) {
            measurements.addAll(normalize(record));
        }
        return measurements;
    }

    /**
     * Combined timestamp field first, otherwise the first date-like and time-like values found.
     */
    Optional<Instant> resolveTimestamp(RawRecord record) {
        String combined = record.getString(FIELD_TIMESTAMP);
        if (combined != null && !combined.isBlank()) {
            return TimeUtils.parseTimestamp(combined);
        }

        String date = null;
        String time = null;
        for (Map.Entry<String, Object> field : record.entries()) {
            if (field.getValue() == null) {
                continue;
            }
            String text = field.getValue().toString().trim();
            if (date == null && TimeUtils.isDateLike(text)) {
                date = text;
            } else if (time == null && TimeUtils.isTimeLike(text)) {
                time = text;
            }
            if (date != null && time != null) {
                break;
            }
        }
        return TimeUtils.combineDateAndTime(date, time);
    }

    /**
     * Numbers pass through, numeric strings are parsed, everything else is not a measurement.
     * NaN counts as non-numeric.
     */
    static Optional<Double> toNumber(Object raw) {
        Double value = null;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text && !text.isBlank()) {
            try {
                value = Double.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (value == null || value.isNaN()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
