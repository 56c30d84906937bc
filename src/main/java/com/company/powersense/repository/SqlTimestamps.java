package com.company.powersense.repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Calendar;
import java.util.TimeZone;

/**
 * UTC-pinned conversions between {@link Instant} and JDBC values, independent of the JVM zone.
 */
final class SqlTimestamps {

    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private SqlTimestamps() {
    }

    static void set(PreparedStatement ps, int index, Instant instant) throws SQLException {
        ps.setTimestamp(index, Timestamp.from(instant), Calendar.getInstance(UTC));
    }

    static Instant get(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column, Calendar.getInstance(UTC));
        return timestamp != null ? timestamp.toInstant() : null;
    }

    /**
     * Query bound carrying its own UTC offset, so the driver never falls back to the JVM zone.
     */
    static OffsetDateTime param(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
