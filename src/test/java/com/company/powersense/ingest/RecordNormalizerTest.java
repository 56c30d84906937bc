package com.company.powersense.ingest;

import com.company.powersense.config.PowerSenseProperties;
import com.company.powersense.domain.Measurement;
import com.company.powersense.domain.MetricValue;
import com.company.powersense.domain.RawRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordNormalizerTest {

    private SimpleMeterRegistry meterRegistry;
    private RecordNormalizer normalizer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        normalizer = new RecordNormalizer(new PowerSenseProperties(), meterRegistry);
    }

    @Test
    void emitsOneMeasurementPerNumericField() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("perimetre", "France");
        fields.put("nature", "Données temps réel");
        fields.put("date", "2025-01-01");
        fields.put("heure", "10:15");
        fields.put("date_heure", "2025-01-01T10:15:00+00:00");
        fields.put("consommation", 65000);
        fields.put("gaz", "4200.5");
        fields.put("fioul", null);
        fields.put("taux_co2", "ND");

        List<Measurement> measurements = normalizer.normalize(RawRecord.of(fields));

        assertThat(measurements).extracting(Measurement::getMetric)
                .containsExactly("consommation", "gaz");
        assertThat(measurements).allSatisfy(m -> {
            assertThat(m.getTimestamp()).isEqualTo(Instant.parse("2025-01-01T10:15:00Z"));
            assertThat(m.getSource()).isEqualTo("France");
            assertThat(m.getPerimeter()).isEqualTo("France");
            assertThat(m.getNature()).isEqualTo("Données temps réel");
        });
        assertThat(measurements.get(0).getValue()).isEqualTo(MetricValue.of(65000.0));
        assertThat(measurements.get(1).getValue()).isEqualTo(MetricValue.of(4200.5));
        assertThat(meterRegistry.counter("powersense.normalizer.fields.skipped").count()).isEqualTo(2.0);
    }

    @Test
    void convertsOffsetTimestampToUtc() {
        RawRecord record = RawRecord.of(Map.of(
                "date_heure", "2025-01-01T11:15:00+01:00",
                "consommation", 1.0));

        assertThat(normalizer.normalize(record))
                .singleElement()
                .extracting(Measurement::getTimestamp)
                .isEqualTo(Instant.parse("2025-01-01T10:15:00Z"));
    }

    @Test
    void fallsBackToSeparateDateAndTimeValues() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("jour", "2025-02-03");
        fields.put("creneau", "08:30");
        fields.put("eolien", 12.0);

        List<Measurement> measurements = normalizer.normalize(RawRecord.of(fields));

        assertThat(measurements).singleElement().satisfies(m -> {
            assertThat(m.getTimestamp()).isEqualTo(Instant.parse("2025-02-03T08:30:00Z"));
            assertThat(m.getMetric()).isEqualTo("eolien");
        });
    }

    @Test
    void missingPerimeterUsesConfiguredDefaultSource() {
        PowerSenseProperties properties = new PowerSenseProperties();
        properties.getIngestion().setDefaultSource("Bretagne");
        RecordNormalizer custom = new RecordNormalizer(properties, meterRegistry);

        List<Measurement> measurements = custom.normalize(RawRecord.of(Map.of(
                "date_heure", "2025-01-01T10:00:00Z",
                "solaire", 3)));

        assertThat(measurements).singleElement().satisfies(m -> {
            assertThat(m.getSource()).isEqualTo("Bretagne");
            assertThat(m.getPerimeter()).isEqualTo("Bretagne");
        });
    }

    @Test
    void unparsableTimestampDropsTheRecordSilently() {
        List<Measurement> measurements = normalizer.normalize(RawRecord.of(Map.of(
                "date_heure", "yesterday at noon",
                "consommation", 1.0)));

        assertThat(measurements).isEmpty();
        assertThat(meterRegistry.counter("powersense.normalizer.records.dropped", "reason", "timestamp").count())
                .isEqualTo(1.0);
    }

    @Test
    void recordWithoutTimestampYieldsNothing() {
        assertThat(normalizer.normalize(RawRecord.of(Map.of("consommation", 1.0)))).isEmpty();
    }

    @Test
    void recordWithoutNumericFieldYieldsNothing() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("date_heure", "2025-01-01T10:00:00Z");
        fields.put("perimetre", "France");
        fields.put("commentaire", "n/a");
        fields.put("total_count", 42);

        assertThat(normalizer.normalize(RawRecord.of(fields))).isEmpty();
        assertThat(meterRegistry.counter("powersense.normalizer.records.dropped", "reason", "no_metrics").count())
                .isEqualTo(1.0);
    }

    @Test
    void normalizationIsDeterministic() {
        RawRecord record = RawRecord.of(Map.of(
                "date_heure", "2025-01-01T10:00:00Z",
                "perimetre", "France",
                "nature", "n",
                "consommation", 1.0,
                "gaz", 2.0));

        assertThat(normalizer.normalize(record)).containsExactlyInAnyOrderElementsOf(normalizer.normalize(record));
    }

    @Test
    void nanAndBooleansAreNotNumbers() {
        assertThat(RecordNormalizer.toNumber(Double.NaN)).isEmpty();
        assertThat(RecordNormalizer.toNumber("NaN")).isEmpty();
        assertThat(RecordNormalizer.toNumber(Boolean.TRUE)).isEmpty();
        assertThat(RecordNormalizer.toNumber(" 12.5 ")).contains(12.5);
        assertThat(RecordNormalizer.toNumber(7L)).contains(7.0);
    }

    @Test
    void normalizeAllConcatenatesRecords() {
        List<RawRecord> records = List.of(
                RawRecord.of(Map.of("date_heure", "2025-01-01T10:00:00Z", "a", 1)),
                RawRecord.of(Map.of("date_heure", "bad", "a", 1)),
                RawRecord.of(Map.of("date_heure", "2025-01-01T10:15:00Z", "a", 2)));

        assertThat(normalizer.normalizeAll(records)).hasSize(2);
    }
}
