package com.example.audit.service;

import com.example.audit.model.AuditActions;

/** What started a cleanup run; decides the action of its meta-audit record. */
public enum CleanupTrigger {
  SCHEDULED(AuditActions.AUDIT_CLEANUP),
  FORCED(AuditActions.FORCED_AUTO_CLEANUP),
  MANUAL(AuditActions.MANUAL_AUDIT_CLEANUP);

  private final String metaAuditAction;

  CleanupTrigger(String metaAuditAction) {
    this.metaAuditAction = metaAuditAction;
  }

  public String metaAuditAction() {
    return metaAuditAction;
  }
}
