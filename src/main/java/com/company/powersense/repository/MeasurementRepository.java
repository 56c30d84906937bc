package com.company.powersense.repository;

import com.company.powersense.config.PowerSenseProperties;
import com.company.powersense.domain.LatestState;
import com.company.powersense.domain.MetricValue;
import com.company.powersense.domain.VersionedRow;
import com.company.powersense.domain.enums.SortOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only access to the {@code measurements} table.
 * <p>
 * Nothing is ever updated or deleted: the current value of an identity key is the row with the
 * highest version, computed by query.
 */
@Repository
@Slf4j
public class MeasurementRepository {

    private static final String INSERT_SQL = """
            INSERT INTO measurements (ts, source, metric, value, ukey, version)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    // Tuple wrapping keeps a NULL value instead of letting argMax skip it
    private static final String LATEST_STATE_SQL = """
            SELECT ukey,
                   tupleElement(argMax(tuple(value), version), 1) AS value,
                   max(version) AS version
            FROM measurements
            WHERE ukey IN (:keys)
            GROUP BY ukey
            """;

    private static final String SELECT_RAW = """
            SELECT ts, source, metric, value, ukey, version, inserted_at
            FROM measurements
            """;

    private static final String SELECT_LATEST = """
            SELECT ts, source, metric, value, ukey, version, inserted_at
            FROM (
                SELECT ukey,
                       tupleElement(latest, 1) AS version,
                       tupleElement(latest, 2) AS inserted_at,
                       tupleElement(latest, 3) AS ts,
                       tupleElement(latest, 4) AS source,
                       tupleElement(latest, 5) AS metric,
                       tupleElement(latest, 6) AS value
                FROM (
                    SELECT ukey, max(tuple(version, inserted_at, ts, source, metric, value)) AS latest
                    FROM measurements
                    %s
                    GROUP BY ukey
                )
            )
            """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final int stateChunkSize;
    private final int insertChunkSize;

    public MeasurementRepository(JdbcTemplate jdbcTemplate,
                                 NamedParameterJdbcTemplate namedJdbcTemplate,
                                 PowerSenseProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = namedJdbcTemplate;
        this.stateChunkSize = Math.max(1, properties.getStore().getStateChunkSize());
        this.insertChunkSize = Math.max(1, properties.getStore().getInsertChunkSize());
    }

    /**
     * Latest value and version of every given key that exists, queried in bounded chunks.
     */
    public Map<String, LatestState> findLatestState(Collection<String> identityKeys) {
        if (identityKeys == null || identityKeys.isEmpty()) {
            return Map.of();
        }

        List<String> keys = new ArrayList<>(identityKeys);
        Map<String, LatestState> state = new HashMap<>();

        for (int from = 0; from < keys.size(); from += stateChunkSize) {
            List<String> chunk = keys.subList(from, Math.min(from + stateChunkSize, keys.size()));
            namedJdbcTemplate.query(LATEST_STATE_SQL,
                    new MapSqlParameterSource("keys", chunk),
                    rs -> {
                        state.put(rs.getString("ukey"),
                                new LatestState(readValue(rs), rs.getLong("version")));
                    });
        }

        log.debug("Fetched latest state for {}/{} keys in {} chunks",
                state.size(), keys.size(), (keys.size() + stateChunkSize - 1) / stateChunkSize);
        return state;
    }

    /**
     * Bulk insert; {@code inserted_at} is assigned by the store.
     *
     * @return number of rows sent
     */
    public int insertBatch(List<VersionedRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }

        jdbcTemplate.batchUpdate(INSERT_SQL, rows, insertChunkSize, (ps, row) -> {
            SqlTimestamps.set(ps, 1, row.getTimestamp());
            ps.setString(2, row.getSource());
            ps.setString(3, row.getMetric());
            ps.setObject(4, row.getValue().orNull());
            ps.setString(5, row.getIdentityKey());
            ps.setLong(6, row.getVersion());
        });

        return rows.size();
    }

    /**
     * Raw history, every version of every key.
     */
    public List<VersionedRow> findMeasurements(TimeSeriesQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", query.getLimit());
        List<String> clauses = new ArrayList<>();

        if (query.getStart() != null) {
            clauses.add("ts >= :start");
            params.addValue("start", SqlTimestamps.param(query.getStart()));
        }
        if (query.getEnd() != null) {
            clauses.add("ts <= :end");
            params.addValue("end", SqlTimestamps.param(query.getEnd()));
        }
        if (query.getSource() != null) {
            clauses.add("source = :source");
            params.addValue("source", query.getSource());
        }
        if (query.getMetric() != null) {
            clauses.add("metric = :metric");
            params.addValue("metric", query.getMetric());
        }
        if (query.getIdentityKey() != null) {
            clauses.add("ukey = :ukey");
            params.addValue("ukey", query.getIdentityKey());
        }

        String sql = SELECT_RAW + where(clauses) + " ORDER BY ts " + query.getOrder().sql() + " LIMIT :limit";
        return namedJdbcTemplate.query(sql, params, new VersionedRowMapper());
    }

    /**
     * Max-version row per identity key.
     */
    public List<VersionedRow> findLatest(String identityKey, int limit, SortOrder order) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", limit);
        List<String> clauses = new ArrayList<>();
        if (identityKey != null) {
            clauses.add("ukey = :ukey");
            params.addValue("ukey", identityKey);
        }

        String sql = SELECT_LATEST.formatted(where(clauses)) + " ORDER BY ts " + order.sql() + " LIMIT :limit";
        return namedJdbcTemplate.query(sql, params, new VersionedRowMapper());
    }

    /**
     * Latest version of every key of one metric with {@code start <= ts < end}, oldest first, unbounded.
     */
    public List<VersionedRow> findLatestForMetric(String metric, Instant start, Instant end) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("metric", metric)
                .addValue("start", SqlTimestamps.param(start))
                .addValue("end", SqlTimestamps.param(end));

        String sql = SELECT_LATEST.formatted("WHERE metric = :metric AND ts >= :start AND ts < :end")
                + " ORDER BY ts ASC";
        return namedJdbcTemplate.query(sql, params, new VersionedRowMapper());
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT count() FROM measurements", Long.class);
        return count != null ? count : 0L;
    }

    public boolean isEmpty() {
        return count() == 0;
    }

    public boolean ping() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (Exception e) {
            log.warn("Store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private static String where(List<String> clauses) {
        return clauses.isEmpty() ? "" : "WHERE " + String.join(" AND ", clauses);
    }

    private static MetricValue readValue(ResultSet rs) throws SQLException {
        double value = rs.getDouble("value");
        return rs.wasNull() ? MetricValue.ABSENT : MetricValue.of(value);
    }

    private static class VersionedRowMapper implements RowMapper<VersionedRow> {
        @Override
        public VersionedRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return VersionedRow.builder()
                    .timestamp(SqlTimestamps.get(rs, "ts"))
                    .source(rs.getString("source"))
                    .metric(rs.getString("metric"))
                    .value(readValue(rs))
                    .identityKey(rs.getString("ukey"))
                    .version(rs.getLong("version"))
                    .insertedAt(SqlTimestamps.get(rs, "inserted_at"))
                    .build();
        }
    }
}
