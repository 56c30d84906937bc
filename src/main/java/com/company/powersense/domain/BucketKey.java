package com.company.powersense.domain;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Seasonality slot: day-of-week (0 = Monday .. 6 = Sunday), hour and minute, all in UTC.
 */
public record BucketKey(int dow, int hour, int minute) {

    public static BucketKey of(Instant timestamp) {
        ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
        return new BucketKey(utc.getDayOfWeek().getValue() - 1, utc.getHour(), utc.getMinute());
    }
}
