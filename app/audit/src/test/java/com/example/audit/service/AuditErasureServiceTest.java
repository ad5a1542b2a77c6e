package com.example.audit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.audit.model.AuditActions;
import com.example.audit.model.AuditRecord;
import com.example.audit.support.InMemoryAuditLogRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class AuditErasureServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  private final InMemoryAuditLogRepository repository = new InMemoryAuditLogRepository();
  private final AuditErasureService service =
      new AuditErasureService(repository, Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void clearsUserIdAndRecordsTheErasure() {
    repository.add("user-7", "LOGIN", NOW.minusSeconds(60));
    repository.add("user-7", "LOGOUT", NOW.minusSeconds(30));
    repository.add("user-8", "LOGIN", NOW.minusSeconds(10));

    final int updated = service.anonymizeUser("user-7", "admin-1", null);

    assertThat(updated).isEqualTo(2);
    assertThat(repository.all()).extracting(AuditRecord::userId).doesNotContain("user-7");
    assertThat(repository.byAction(AuditActions.AUDIT_USER_ANONYMIZED))
        .singleElement()
        .satisfies(
            entry -> {
              assertThat(entry.userId()).isEqualTo("admin-1");
              assertThat(entry.message()).doesNotContain("user-7");
              assertThat(entry.ipAddress()).isEqualTo(AuditActions.LOCAL_IP);
            });
  }

  @Test
  void unknownUserChangesNothing() {
    repository.add("user-8", "LOGIN", NOW);

    assertThat(service.anonymizeUser("nobody", null, null)).isZero();
    assertThat(repository.mutations()).isZero();
  }

  @Test
  void blankUserIdIsRejected() {
    assertThatThrownBy(() -> service.anonymizeUser(" ", "admin", null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
