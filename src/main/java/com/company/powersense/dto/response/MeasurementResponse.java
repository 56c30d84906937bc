package com.company.powersense.dto.response;

import com.company.powersense.domain.VersionedRow;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private Instant ts;
    private String source;
    private String metric;
    private Double value;
    private String ukey;
    private long version;

    @JsonProperty("inserted_at")
    private Instant insertedAt;

    public static MeasurementResponse from(VersionedRow row) {
        return MeasurementResponse.builder()
                .ts(row.getTimestamp())
                .source(row.getSource())
                .metric(row.getMetric())
                .value(row.getValue().orNull())
                .ukey(row.getIdentityKey())
                .version(row.getVersion())
                .insertedAt(row.getInsertedAt())
                .build();
    }
}
