package com.company.powersense.dto.response;

import com.company.powersense.domain.Anomaly;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyResponse {
    private Instant ts;
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

    @JsonProperty("inserted_at")
    private Instant insertedAt;

    public static AnomalyResponse from(Anomaly anomaly) {
        return AnomalyResponse.builder()
                .ts(anomaly.getTimestamp())
                .source(anomaly.getSource())
                .metric(anomaly.getMetric())
                .value(anomaly.getValue())
                .zscore(anomaly.getZscore())
                .mean(anomaly.getMean())
                .std(anomaly.getStd())
                .threshold(anomaly.getThreshold())
                .dow(anomaly.getDow())
                .hour(anomaly.getHour())
                .minute(anomaly.getMinute())
                .insertedAt(anomaly.getInsertedAt())
                .build();
    }
}
