/*
 * Where: Audit domain model
 * What: Action names and identities this service writes itself
 * Why: Meta-audit records must be recognizable next to application events
 */
package com.example.audit.model;

public final class AuditActions {
  private AuditActions() {}

  public static final String AUDIT_CLEANUP = "AUDIT_CLEANUP";
  public static final String FORCED_AUTO_CLEANUP = "FORCED_AUTO_CLEANUP";
  public static final String MANUAL_AUDIT_CLEANUP = "MANUAL_AUDIT_CLEANUP";
  public static final String AUDIT_USER_ANONYMIZED = "AUDIT_USER_ANONYMIZED";
  public static final String AUDIT_EXPORT = "AUDIT_EXPORT";

  public static final String SYSTEM_USER = "SYSTEM";
  public static final String LOCAL_IP = "127.0.0.1";

  // audit_logs.message is VARCHAR(500)
  public static final int MESSAGE_MAX_LENGTH = 500;
}
