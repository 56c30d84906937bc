package com.company.powersense.anomaly;

import com.company.powersense.domain.Anomaly;
import com.company.powersense.domain.Baseline;
import com.company.powersense.domain.BaselineBucket;
import com.company.powersense.domain.VersionedRow;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.company.powersense.anomaly.BaselineBuilderTest.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnomalyScorerTest {

    private static final Instant BOUNDARY = Instant.parse("2025-01-01T14:00:00Z");
    // Wednesday 14:30 UTC
    private static final Instant SLOT = Instant.parse("2025-01-01T14:30:00Z");

    private final AnomalyScorer scorer = new AnomalyScorer();

    private final Baseline baseline = new Baseline(List.of(BaselineBucket.builder()
            .dow(2).hour(14).minute(30)
            .mean(100.0).std(5.0).sampleCount(4)
            .build()), 3);

    @Test
    void flagsValueBeyondThreshold() {
        List<Anomaly> anomalies = scorer.score(List.of(row(SLOT, 130.0)), baseline, BOUNDARY, 3.0);

        assertThat(anomalies).singleElement().satisfies(a -> {
            assertThat(a.getZscore()).isCloseTo(6.0, within(1e-9));
            assertThat(a.getValue()).isEqualTo(130.0);
            assertThat(a.getMean()).isEqualTo(100.0);
            assertThat(a.getStd()).isEqualTo(5.0);
            assertThat(a.getThreshold()).isEqualTo(3.0);
            assertThat(a.getDow()).isEqualTo(2);
            assertThat(a.getHour()).isEqualTo(14);
            assertThat(a.getMinute()).isEqualTo(30);
            assertThat(a.getTimestamp()).isEqualTo(SLOT);
            assertThat(a.getMetric()).isEqualTo("consommation");
        });
    }

    @Test
    void valueWithinThresholdIsNotFlagged() {
        assertThat(scorer.score(List.of(row(SLOT, 110.0)), baseline, BOUNDARY, 3.0)).isEmpty();
    }

    @Test
    void thresholdIsInclusiveAndSymmetric() {
        List<Anomaly> anomalies = scorer.score(List.of(row(SLOT, 115.0), row(SLOT, 85.0)), baseline, BOUNDARY, 3.0);

        assertThat(anomalies).extracting(Anomaly::getZscore)
                .containsExactly(3.0, -3.0);
    }

    @Test
    void rowsBeforeBoundaryAreNeverScored() {
        Instant early = BOUNDARY.minusSeconds(1);
        Baseline earlyBaseline = new Baseline(List.of(BaselineBucket.builder()
                .dow(2).hour(13).minute(59).mean(100.0).std(5.0).sampleCount(4).build()), 3);

        assertThat(scorer.score(List.of(row(early, 500.0)), earlyBaseline, BOUNDARY, 3.0)).isEmpty();
    }

    @Test
    void rowsWithoutScorableBucketAreSkipped() {
        Baseline undefinedStd = new Baseline(List.of(BaselineBucket.builder()
                .dow(2).hour(14).minute(30).mean(100.0).std(null).sampleCount(10).build()), 3);
        Baseline thin = new Baseline(List.of(BaselineBucket.builder()
                .dow(2).hour(14).minute(30).mean(100.0).std(5.0).sampleCount(2).build()), 3);
        VersionedRow otherSlot = row(SLOT.plusSeconds(60), 500.0);

        assertThat(scorer.score(List.of(row(SLOT, 500.0)), undefinedStd, BOUNDARY, 3.0)).isEmpty();
        assertThat(scorer.score(List.of(row(SLOT, 500.0)), thin, BOUNDARY, 3.0)).isEmpty();
        assertThat(scorer.score(List.of(otherSlot), baseline, BOUNDARY, 3.0)).isEmpty();
    }

    @Test
    void emptyBaselineScoresNothing() {
        assertThat(scorer.score(List.of(row(SLOT, 500.0)), Baseline.empty(), BOUNDARY, 3.0)).isEmpty();
    }
}
