package com.company.powersense.repository;

import com.company.powersense.domain.enums.SortOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Filter shape shared by the measurement and anomaly history queries. Null fields do not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeSeriesQuery {
    // Inclusive bounds
    private Instant start;
    private Instant end;

    private String source;
    private String metric;

    // Measurements only
    private String identityKey;

    @Builder.Default
    private int limit = 100;

    @Builder.Default
    private SortOrder order = SortOrder.DESC;
}
