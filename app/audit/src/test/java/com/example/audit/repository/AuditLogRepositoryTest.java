/*
 * Where: Audit repository integration tests
 * What: Runs the expiry, batch delete, erasure and statistics queries against Postgres
 * Why: Cutoff boundaries and the DEFAULT exclusion list must hold in real SQL
 */
package com.example.audit.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.example.audit.AbstractPostgresContainerTest;
import com.example.audit.model.ActionFilter;
import com.example.audit.model.AuditRecord;
import com.example.audit.model.ExportCriteria;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AuditLogRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final Instant CUTOFF = NOW.minus(Duration.ofDays(30));

  @Autowired private AuditLogRepository auditLogRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM audit_logs", new MapSqlParameterSource());
  }

  @Test
  void insertReturnsGeneratedIdAndRoundTripsColumns() {
    final long id =
        auditLogRepository.insert(
            AuditRecord.newRecord("u1", "LOGIN", "signed in", NOW.minusMillis(1500), "10.0.0.1"));

    final List<AuditRecord> rows =
        auditLogRepository.findExpired(ActionFilter.only("LOGIN"), NOW);

    assertThat(rows).singleElement().isEqualTo(
        new AuditRecord(id, "u1", "LOGIN", "signed in", NOW.minusMillis(1500), "10.0.0.1"));
  }

  @Test
  void cutoffIsExclusive() {
    insert("BOOK_VIEWED", CUTOFF.minusMillis(1));
    insert("BOOK_VIEWED", CUTOFF);
    insert("BOOK_VIEWED", CUTOFF.plusSeconds(1));

    assertThat(auditLogRepository.countExpired(ActionFilter.only("BOOK_VIEWED"), CUTOFF))
        .isEqualTo(1);
  }

  @Test
  void fallbackFilterExcludesNamedActions() {
    insert("LOGIN", NOW.minus(Duration.ofDays(40)));
    insert("BOOK_VIEWED", NOW.minus(Duration.ofDays(40)));
    insert("CUSTOM_ACTION", NOW.minus(Duration.ofDays(40)));
    insert("OTHER_ACTION", NOW.minus(Duration.ofDays(40)));

    final ActionFilter fallback = ActionFilter.allExcept(List.of("LOGIN", "BOOK_VIEWED"));

    assertThat(auditLogRepository.countExpired(fallback, CUTOFF)).isEqualTo(2);
    assertThat(auditLogRepository.findExpired(fallback, CUTOFF))
        .extracting(AuditRecord::action)
        .containsExactlyInAnyOrder("CUSTOM_ACTION", "OTHER_ACTION");
    assertThat(auditLogRepository.countExpired(ActionFilter.allExcept(List.of()), CUTOFF))
        .isEqualTo(4);
  }

  @Test
  void findExpiredOrdersByCreatedAtThenId() {
    final Instant same = NOW.minus(Duration.ofDays(50));
    final long first = insert("LOGIN", same);
    final long second = insert("LOGIN", same);
    final long oldest = insert("LOGIN", NOW.minus(Duration.ofDays(60)));

    assertThat(auditLogRepository.findExpired(ActionFilter.only("LOGIN"), CUTOFF))
        .extracting(AuditRecord::id)
        .containsExactly(oldest, first, second);
  }

  @Test
  void deleteExpiredBatchHonorsLimitAndCutoff() {
    for (int i = 0; i < 5; i++) {
      insert("LOGOUT", NOW.minus(Duration.ofDays(40 + i)));
    }
    insert("LOGOUT", NOW.minus(Duration.ofDays(1)));
    insert("LOGIN", NOW.minus(Duration.ofDays(40)));

    final ActionFilter filter = ActionFilter.only("LOGOUT");

    assertThat(auditLogRepository.deleteExpiredBatch(filter, CUTOFF, 2)).isEqualTo(2);
    assertThat(auditLogRepository.deleteExpiredBatch(filter, CUTOFF, 2)).isEqualTo(2);
    assertThat(auditLogRepository.deleteExpiredBatch(filter, CUTOFF, 2)).isEqualTo(1);
    assertThat(auditLogRepository.deleteExpiredBatch(filter, CUTOFF, 2)).isZero();
    assertThat(auditLogRepository.countAll()).isEqualTo(2);
  }

  @Test
  void deleteByIdsRemovesOnlyGivenRows() {
    final long keep = insert("LOGIN", NOW.minus(Duration.ofDays(40)));
    final long drop = insert("LOGIN", NOW.minus(Duration.ofDays(40)));

    assertThat(auditLogRepository.deleteByIds(List.of())).isZero();
    assertThat(auditLogRepository.deleteByIds(List.of(drop))).isEqualTo(1);

    assertThat(auditLogRepository.findExpired(ActionFilter.only("LOGIN"), NOW))
        .extracting(AuditRecord::id)
        .containsExactly(keep);
  }

  @Test
  void deleteByIdsAcceptsMoreIdsThanOneStatementCanBind() {
    final long keep = insert("LOGIN", NOW.minus(Duration.ofDays(40)));
    final long first = insert("LOGIN", NOW.minus(Duration.ofDays(40)));
    final long last = insert("LOGIN", NOW.minus(Duration.ofDays(40)));
    // 40000 ids is past the driver's 32767 bind parameter limit
    final List<Long> ids = new ArrayList<>();
    ids.add(first);
    LongStream.rangeClosed(1, 39_998).map(offset -> last + offset).forEach(ids::add);
    ids.add(last);

    assertThat(auditLogRepository.deleteByIds(ids)).isEqualTo(2);
    assertThat(auditLogRepository.findExpired(ActionFilter.only("LOGIN"), NOW))
        .extracting(AuditRecord::id)
        .containsExactly(keep);
  }

  @Test
  void anonymizeUserClearsOnlyThatUser() {
    auditLogRepository.insert(AuditRecord.newRecord("u1", "LOGIN", "m", NOW, null));
    auditLogRepository.insert(AuditRecord.newRecord("u1", "LOGOUT", "m", NOW, null));
    auditLogRepository.insert(AuditRecord.newRecord("u2", "LOGIN", "m", NOW, null));

    assertThat(auditLogRepository.anonymizeUser("u1")).isEqualTo(2);

    final Long remaining =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM audit_logs WHERE user_id IS NOT NULL",
            new MapSqlParameterSource(),
            Long.class);
    assertThat(remaining).isEqualTo(1);
    assertThat(auditLogRepository.countAll()).isEqualTo(3);
  }

  @Test
  void statisticsQueriesAggregateByActionAndMonth() {
    auditLogRepository.insert(
        AuditRecord.newRecord("u1", "LOGIN", "abcd", Instant.parse("2026-01-15T00:00:00Z"), null));
    auditLogRepository.insert(
        AuditRecord.newRecord("u1", "LOGIN", "abcdef", Instant.parse("2026-02-10T00:00:00Z"), null));
    auditLogRepository.insert(
        AuditRecord.newRecord("u2", "LOGOUT", "ab", Instant.parse("2026-02-11T00:00:00Z"), null));

    assertThat(auditLogRepository.findOldestCreatedAt())
        .contains(Instant.parse("2026-01-15T00:00:00Z"));
    assertThat(auditLogRepository.findNewestCreatedAt())
        .contains(Instant.parse("2026-02-11T00:00:00Z"));
    assertThat(auditLogRepository.countCreatedSince(Instant.parse("2026-02-01T00:00:00Z")))
        .isEqualTo(2);
    assertThat(auditLogRepository.averageMessageLength()).isEqualTo(4.0);
    assertThat(auditLogRepository.findTopActions(10))
        .extracting(ActionOccurrence::action, ActionOccurrence::count)
        .containsExactly(
            tuple("LOGIN", 2L),
            tuple("LOGOUT", 1L));
    assertThat(auditLogRepository.countByMonthAndActionSince(Instant.parse("2026-01-01T00:00:00Z")))
        .containsExactly(
            new MonthlyActionCount("2026-01", "LOGIN", 1),
            new MonthlyActionCount("2026-02", "LOGIN", 1),
            new MonthlyActionCount("2026-02", "LOGOUT", 1));
  }

  @Test
  void exportFiltersByWindowActionSubstringAndUser() {
    final Instant start = NOW.minus(Duration.ofDays(10));
    auditLogRepository.insert(AuditRecord.newRecord("u1", "BOOK_VIEWED", "m", start, null));
    auditLogRepository.insert(
        AuditRecord.newRecord("u1", "BOOK_DOWNLOADED", "m", NOW.minus(Duration.ofDays(5)), null));
    auditLogRepository.insert(AuditRecord.newRecord("u1", "BOOK_VIEWED", "m", NOW, null));
    auditLogRepository.insert(
        AuditRecord.newRecord("u2", "BOOK_VIEWED", "m", NOW.minus(Duration.ofDays(4)), null));
    auditLogRepository.insert(
        AuditRecord.newRecord("u1", "LOGIN", "m", NOW.minus(Duration.ofDays(3)), null));
    auditLogRepository.insert(
        AuditRecord.newRecord(
            "u1", "BOOK_VIEWED", "m", start.minus(Duration.ofSeconds(1)), null));

    final List<AuditRecord> rows =
        auditLogRepository.findForExport(new ExportCriteria(start, NOW, "BOOK_", "u1", 100));

    // both ends of the window are inclusive
    assertThat(rows)
        .extracting(AuditRecord::action, AuditRecord::createdAt)
        .containsExactly(
            tuple("BOOK_VIEWED", start),
            tuple("BOOK_DOWNLOADED", NOW.minus(Duration.ofDays(5))),
            tuple("BOOK_VIEWED", NOW));
    // _ is matched literally, so LOGIN is not an instance of LOG_N
    assertThat(auditLogRepository.findForExport(new ExportCriteria(null, null, "LOG_N", null, 100)))
        .isEmpty();
    assertThat(auditLogRepository.findForExport(new ExportCriteria(null, null, null, null, 2)))
        .extracting(AuditRecord::createdAt)
        .containsExactly(start.minus(Duration.ofSeconds(1)), start);
  }

  @Test
  void emptyTableHasNoBounds() {
    assertThat(auditLogRepository.findOldestCreatedAt()).isEmpty();
    assertThat(auditLogRepository.averageMessageLength()).isZero();
  }

  private long insert(String action, Instant createdAt) {
    return auditLogRepository.insert(
        AuditRecord.newRecord("u1", action, action, createdAt, "127.0.0.1"));
  }
}
