/*
 * Where: Audit service layer
 * What: Detaches a user's identity from their audit records
 * Why: Erasure requests must not require deleting audit history
 */
package com.example.audit.service;

import com.example.audit.model.AuditActions;
import com.example.audit.model.AuditRecord;
import com.example.audit.repository.AuditLogRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AuditErasureService {

  private static final Logger logger = LoggerFactory.getLogger(AuditErasureService.class);

  private final AuditLogRepository auditLogRepository;
  private final Clock clock;

  /** Sets user_id to NULL on every record of {@code userId}; returns the number of rows changed. */
  @Transactional
  public int anonymizeUser(String userId, String requestedBy, String clientIp) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
    final int updated = auditLogRepository.anonymizeUser(userId);
    if (updated > 0) {
      // message must not carry the erased user id
      auditLogRepository.insert(
          AuditRecord.newRecord(
              requestedBy == null || requestedBy.isBlank() ? AuditActions.SYSTEM_USER : requestedBy,
              AuditActions.AUDIT_USER_ANONYMIZED,
              "Audit records anonymized: " + updated,
              Instant.now(clock),
              clientIp == null || clientIp.isBlank() ? AuditActions.LOCAL_IP : clientIp));
    }
    logger.info("audit records anonymized count={} requestedBy={}", updated, requestedBy);
    return updated;
  }
}
