/*
 * Where: Audit data access
 * What: Counts, reads, deletes and anonymizes audit_logs rows
 * Why: The retention engine and the admin statistics need set-based access to the audit store
 */
package com.example.audit.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.audit.model.ActionFilter;
import com.example.audit.model.AuditRecord;
import com.example.audit.model.ExportCriteria;
import com.google.common.collect.Lists;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AuditLogRepository {

  // the Postgres driver rejects statements with more than 32767 bind parameters
  static final int MAX_IDS_PER_STATEMENT = 10000;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(AuditRecord record) {
    final String sql =
        """
        INSERT INTO audit_logs (user_id, action, message, created_at, ip_address)
        VALUES (:userId, :action, :message, :createdAt, :ipAddress)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", record.userId())
            .addValue("action", record.action())
            .addValue("message", record.message())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("ipAddress", record.ipAddress());
    final KeyHolder keyHolder = new GeneratedKeyHolder();
    jdbcTemplate.update(sql, params, keyHolder, new String[] {"id"});
    final Number key = keyHolder.getKey();
    if (key == null) {
      throw new IllegalStateException("audit_logs insert returned no id");
    }
    return key.longValue();
  }

  public long countExpired(ActionFilter filter, Instant cutoff) {
    final MapSqlParameterSource params = cutoffParams(cutoff);
    final String sql =
        """
        SELECT COUNT(*)
        FROM audit_logs
        WHERE %s
          AND created_at < :cutoff
        """
            .formatted(actionCondition(filter, params));
    return queryForCount(sql, params);
  }

  /** Expired rows in archive order: oldest first, id breaks ties. */
  public List<AuditRecord> findExpired(ActionFilter filter, Instant cutoff) {
    final MapSqlParameterSource params = cutoffParams(cutoff);
    final String sql =
        """
        SELECT id, user_id, action, message, created_at, ip_address
        FROM audit_logs
        WHERE %s
          AND created_at < :cutoff
        ORDER BY created_at, id
        """
            .formatted(actionCondition(filter, params));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Rows for an export, oldest first, at most {@code criteria.limit()} of them. */
  public List<AuditRecord> findForExport(ExportCriteria criteria) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", criteria.limit());
    final List<String> conditions = new ArrayList<>();
    conditions.add("TRUE");
    if (criteria.startDate() != null) {
      params.addValue("startDate", toTimestamp(criteria.startDate()));
      conditions.add("created_at >= :startDate");
    }
    if (criteria.endDate() != null) {
      params.addValue("endDate", toTimestamp(criteria.endDate()));
      conditions.add("created_at <= :endDate");
    }
    if (criteria.actionType() != null) {
      // substring match without LIKE, so % and _ in the filter stay literal
      params.addValue("actionType", criteria.actionType());
      conditions.add("strpos(action, :actionType) > 0");
    }
    if (criteria.userId() != null) {
      params.addValue("userId", criteria.userId());
      conditions.add("user_id = :userId");
    }
    final String sql =
        """
        SELECT id, user_id, action, message, created_at, ip_address
        FROM audit_logs
        WHERE %s
        ORDER BY created_at, id
        LIMIT :limit
        """
            .formatted(String.join(" AND ", conditions));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteExpiredBatch(ActionFilter filter, Instant cutoff, int limit) {
    final MapSqlParameterSource params = cutoffParams(cutoff).addValue("limit", limit);
    // Postgres has no DELETE ... LIMIT, so the batch is chosen by id first
    final String sql =
        """
        DELETE FROM audit_logs
        WHERE id IN (
          SELECT id
          FROM audit_logs
          WHERE %s
            AND created_at < :cutoff
          ORDER BY id
          LIMIT :limit
        )
        """
            .formatted(actionCondition(filter, params));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteByIds(List<Long> ids) {
    if (ids == null || ids.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM audit_logs WHERE id IN (:ids)";
    int deleted = 0;
    for (List<Long> chunk : Lists.partition(ids, MAX_IDS_PER_STATEMENT)) {
      deleted += jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("ids", chunk));
    }
    return deleted;
  }

  public int anonymizeUser(String userId) {
    final String sql =
        """
        UPDATE audit_logs
        SET user_id = NULL
        WHERE user_id = :userId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("userId", userId));
  }

  public long countAll() {
    return queryForCount("SELECT COUNT(*) FROM audit_logs", new MapSqlParameterSource());
  }

  public long countCreatedSince(Instant since) {
    final String sql = "SELECT COUNT(*) FROM audit_logs WHERE created_at >= :since";
    return queryForCount(sql, new MapSqlParameterSource().addValue("since", toTimestamp(since)));
  }

  public Optional<Instant> findOldestCreatedAt() {
    return queryForInstant("SELECT MIN(created_at) FROM audit_logs");
  }

  public Optional<Instant> findNewestCreatedAt() {
    return queryForInstant("SELECT MAX(created_at) FROM audit_logs");
  }

  public List<ActionOccurrence> findTopActions(int limit) {
    final String sql =
        """
        SELECT action, COUNT(*) AS occurrences, MIN(created_at) AS first_seen, MAX(created_at) AS last_seen
        FROM audit_logs
        GROUP BY action
        ORDER BY occurrences DESC, action
        LIMIT :limit
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("limit", limit),
        (rs, rowNum) ->
            new ActionOccurrence(
                rs.getString("action"),
                rs.getLong("occurrences"),
                toInstant(rs.getTimestamp("first_seen")),
                toInstant(rs.getTimestamp("last_seen"))));
  }

  public List<MonthlyActionCount> countByMonthAndActionSince(Instant since) {
    final String sql =
        """
        SELECT to_char(created_at AT TIME ZONE 'UTC', 'YYYY-MM') AS year_month,
               action,
               COUNT(*) AS occurrences
        FROM audit_logs
        WHERE created_at >= :since
        GROUP BY year_month, action
        ORDER BY year_month, occurrences DESC, action
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("since", toTimestamp(since)),
        (rs, rowNum) ->
            new MonthlyActionCount(
                rs.getString("year_month"), rs.getString("action"), rs.getLong("occurrences")));
  }

  public double averageMessageLength() {
    final String sql = "SELECT COALESCE(AVG(LENGTH(message)), 0) FROM audit_logs";
    final Double average =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Double.class);
    return average == null ? 0d : average;
  }

  private String actionCondition(ActionFilter filter, MapSqlParameterSource params) {
    if (!filter.fallback()) {
      params.addValue("action", filter.action());
      return "action = :action";
    }
    if (filter.excludedActions().isEmpty()) {
      return "TRUE";
    }
    params.addValue("excludedActions", filter.sortedExclusions());
    return "action NOT IN (:excludedActions)";
  }

  private MapSqlParameterSource cutoffParams(Instant cutoff) {
    return new MapSqlParameterSource().addValue("cutoff", toTimestamp(cutoff));
  }

  private long queryForCount(String sql, MapSqlParameterSource params) {
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  private Optional<Instant> queryForInstant(String sql) {
    final Timestamp value =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Timestamp.class);
    return Optional.ofNullable(toInstant(value));
  }

  private AuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AuditRecord(
        rs.getLong("id"),
        rs.getString("user_id"),
        rs.getString("action"),
        rs.getString("message"),
        toInstant(rs.getTimestamp("created_at")),
        rs.getString("ip_address"));
  }
}
