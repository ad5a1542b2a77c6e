/*
 * Where: Audit service layer
 * What: Exports filtered audit records through the archive writer
 * Why: Investigations need a copy of selected history without waiting for retention
 */
package com.example.audit.service;

import com.example.audit.archive.ArchiveContent;
import com.example.audit.archive.ArchiveFormat;
import com.example.audit.archive.ArchiveLifecycleManager;
import com.example.audit.archive.ArchiveWriter;
import com.example.audit.model.AuditActions;
import com.example.audit.model.AuditRecord;
import com.example.audit.model.ExportCriteria;
import com.example.audit.repository.AuditLogRepository;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditExportService {

  private static final Logger logger = LoggerFactory.getLogger(AuditExportService.class);

  public static final int MAX_EXPORT_RECORDS = 10000;
  static final String DEFAULT_LABEL = "CUSTOM_EXPORT";

  private final AuditLogRepository auditLogRepository;
  private final ArchiveWriter archiveWriter;
  private final ArchiveLifecycleManager archiveLifecycleManager;
  private final Clock clock;

  /**
   * Writes the matching records, oldest first and capped at {@value #MAX_EXPORT_RECORDS}, to a new
   * file in the archive directory and returns it ready for download.
   *
   * @throws IllegalArgumentException when nothing matches
   */
  public ArchiveContent export(
      ExportCriteria criteria,
      ArchiveFormat format,
      boolean compress,
      String requestedBy,
      String clientIp) {
    final ExportCriteria capped =
        new ExportCriteria(
            criteria.startDate(),
            criteria.endDate(),
            criteria.actionType(),
            criteria.userId(),
            Math.min(criteria.limit(), MAX_EXPORT_RECORDS));
    final List<AuditRecord> records = auditLogRepository.findForExport(capped);
    if (records.isEmpty()) {
      throw new IllegalArgumentException("no audit records match the export filters");
    }
    final String label = capped.actionType() == null ? DEFAULT_LABEL : capped.actionType();
    final Path file = archiveWriter.writeExport(label, records, format, compress);
    logger.info(
        "audit export written file={} records={} format={} compressed={} requestedBy={}",
        file.getFileName(),
        records.size(),
        format,
        compress,
        requestedBy);
    writeMetaAudit(records.size(), format, requestedBy, clientIp);
    return archiveLifecycleManager.openArchive(file.getFileName().toString());
  }

  private void writeMetaAudit(int count, ArchiveFormat format, String requestedBy, String clientIp) {
    final AuditRecord entry =
        AuditRecord.newRecord(
            requestedBy == null || requestedBy.isBlank() ? AuditActions.SYSTEM_USER : requestedBy,
            AuditActions.AUDIT_EXPORT,
            "Audit export: " + count + " records as " + format,
            Instant.now(clock),
            clientIp == null || clientIp.isBlank() ? AuditActions.LOCAL_IP : clientIp);
    try {
      auditLogRepository.insert(entry);
    } catch (DataAccessException ex) {
      // the file is already written; losing the trail entry must not fail the download
      logger.error("failed to record audit export meta-audit", ex);
    }
  }
}
