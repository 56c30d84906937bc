package com.company.powersense.repository;

import com.company.powersense.domain.Anomaly;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

@Repository
@RequiredArgsConstructor
@Slf4j
public class AnomalyRepository {

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    /**
     * Append anomaly rows. No deduplication against earlier cycles.
     */
    public int insertBatch(List<Anomaly> anomalies) {
        if (anomalies == null || anomalies.isEmpty()) {
            return 0;
        }

        String sql = """
            INSERT INTO anomalies (
                ts, source, metric, value, zscore, mean, std, threshold, dow, hour, minute
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, anomalies, anomalies.size(), (ps, anomaly) -> {
            SqlTimestamps.set(ps, 1, anomaly.getTimestamp());
            ps.setString(2, anomaly.getSource());
            ps.setString(3, anomaly.getMetric());
            ps.setDouble(4, anomaly.getValue());
            ps.setDouble(5, anomaly.getZscore());
            ps.setDouble(6, anomaly.getMean());
            ps.setDouble(7, anomaly.getStd());
            ps.setDouble(8, anomaly.getThreshold());
            ps.setInt(9, anomaly.getDow());
            ps.setInt(10, anomaly.getHour());
            ps.setInt(11, anomaly.getMinute());
        });

        return anomalies.size();
    }

    public List<Anomaly> findAnomalies(TimeSeriesQuery query) {
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

        String sql = """
            SELECT ts, source, metric, value, zscore, mean, std, threshold,
                   dow, hour, minute, inserted_at
            FROM anomalies
            """
                + (clauses.isEmpty() ? "" : "WHERE " + String.join(" AND ", clauses))
                + " ORDER BY ts " + query.getOrder().sql()
                + " LIMIT :limit";

        return namedJdbcTemplate.query(sql, params, new AnomalyRowMapper());
    }

    private static class AnomalyRowMapper implements RowMapper<Anomaly> {
        @Override
        public Anomaly mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Anomaly.builder()
                    .timestamp(SqlTimestamps.get(rs, "ts"))
                    .source(rs.getString("source"))
                    .metric(rs.getString("metric"))
                    .value(rs.getDouble("value"))
                    .zscore(rs.getDouble("zscore"))
                    .mean(rs.getDouble("mean"))
                    .std(rs.getDouble("std"))
                    .threshold(rs.getDouble("threshold"))
                    .dow(rs.getInt("dow"))
                    .hour(rs.getInt("hour"))
                    .minute(rs.getInt("minute"))
                    .insertedAt(SqlTimestamps.get(rs, "inserted_at"))
                    .build();
        }
    }
}
