/*
 * Where: Audit admin API
 * What: Exposes cleanup, configuration, statistics, archive and erasure endpoints
 * Why: Operators drive retention manually on top of the scheduled loop
 */
package com.example.audit.api;

import com.example.audit.api.request.CleanupRequest;
import com.example.audit.api.request.ExportRequest;
import com.example.audit.api.response.AnonymizeResponse;
import com.example.audit.api.response.ArchivePurgeResponse;
import com.example.audit.api.response.CleanupResponse;
import com.example.audit.api.response.DatabaseStatsResponse;
import com.example.audit.api.response.RetentionConfigResponse;
import com.example.audit.api.response.SchedulerStatusResponse;
import com.example.audit.archive.ArchiveContent;
import com.example.audit.archive.ArchiveFileInfo;
import com.example.audit.archive.ArchiveLifecycleManager;
import com.example.audit.config.RequestMdcInterceptor;
import com.example.audit.service.AuditCleanupService;
import com.example.audit.service.AuditErasureService;
import com.example.audit.service.AuditExportService;
import com.example.audit.service.AuditStatisticsService;
import com.example.audit.service.CleanupOptions;
import com.example.audit.service.CleanupScheduler;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/audit")
@RequiredArgsConstructor
public class AuditAdminController {

  private static final Logger logger = LoggerFactory.getLogger(AuditAdminController.class);

  private static final String HEADER_USER_ID = RequestMdcInterceptor.HEADER_USER_ID;

  private final AuditCleanupService cleanupService;
  private final CleanupScheduler cleanupScheduler;
  private final ArchiveLifecycleManager archiveLifecycleManager;
  private final AuditStatisticsService statisticsService;
  private final AuditErasureService erasureService;
  private final AuditExportService exportService;

  @PostMapping("/cleanup")
  public ResponseEntity<CleanupResponse> cleanup(
      @RequestHeader(value = HEADER_USER_ID, required = false) String userId,
      @Valid @RequestBody CleanupRequest request,
      HttpServletRequest httpRequest) {
    final boolean archiveBeforeDelete =
        request.archiveBeforeDelete() != null
            ? request.archiveBeforeDelete()
            : cleanupService.defaultArchiveBeforeDelete();
    final CleanupOptions options =
        CleanupOptions.manual(
            request.actionType(),
            request.retentionDays(),
            archiveBeforeDelete,
            request.previewOnly(),
            userId,
            RequestMdcInterceptor.resolveClientIp(httpRequest));
    logger.info(
        "manual audit cleanup requested actionType={} retentionDays={} preview={} requestedBy={}",
        request.actionType(),
        request.retentionDays(),
        request.previewOnly(),
        userId);
    return ResponseEntity.ok(CleanupResponse.from(cleanupService.runCleanup(options)));
  }

  @PostMapping("/force-cleanup")
  public ResponseEntity<CleanupResponse> forceCleanup(
      @RequestHeader(value = HEADER_USER_ID, required = false) String userId,
      HttpServletRequest httpRequest) {
    logger.info("forced audit cleanup requested requestedBy={}", userId);
    return ResponseEntity.ok(
        CleanupResponse.from(
            cleanupScheduler.forceRun(userId, RequestMdcInterceptor.resolveClientIp(httpRequest))));
  }

  @GetMapping("/retention-config")
  public ResponseEntity<RetentionConfigResponse> retentionConfig() {
    return ResponseEntity.ok(cleanupService.describeConfiguration());
  }

  @GetMapping("/database-size")
  public ResponseEntity<DatabaseStatsResponse> databaseSize() {
    return ResponseEntity.ok(statisticsService.databaseStats());
  }

  @GetMapping("/archives")
  public ResponseEntity<List<ArchiveFileInfo>> listArchives() {
    return ResponseEntity.ok(archiveLifecycleManager.listArchives());
  }

  @GetMapping("/archives/download/{fileName}")
  public ResponseEntity<Resource> downloadArchive(@PathVariable("fileName") String fileName) {
    return attachment(archiveLifecycleManager.openArchive(fileName));
  }

  @PostMapping("/export")
  public ResponseEntity<Resource> export(
      @RequestHeader(value = HEADER_USER_ID, required = false) String userId,
      @Valid @RequestBody ExportRequest request,
      HttpServletRequest httpRequest) {
    logger.info(
        "audit export requested actionType={} format={} maxRecords={} requestedBy={}",
        request.actionType(),
        request.format(),
        request.maxRecords(),
        userId);
    return attachment(
        exportService.export(
            request.toCriteria(),
            request.format(),
            request.compress(),
            userId,
            RequestMdcInterceptor.resolveClientIp(httpRequest)));
  }

  @DeleteMapping("/archives/cleanup")
  public ResponseEntity<ArchivePurgeResponse> purgeArchives(
      @RequestParam(name = "max_age_days", defaultValue = "365") int maxAgeDays,
      @RequestHeader(value = HEADER_USER_ID, required = false) String userId) {
    logger.info("audit archive purge requested maxAgeDays={} requestedBy={}", maxAgeDays, userId);
    final int deleted = archiveLifecycleManager.purgeOlderThan(maxAgeDays);
    return ResponseEntity.ok(
        new ArchivePurgeResponse(
            deleted + " archive files older than " + maxAgeDays + " days deleted",
            deleted,
            maxAgeDays));
  }

  @GetMapping("/scheduler")
  public ResponseEntity<SchedulerStatusResponse> schedulerStatus() {
    return ResponseEntity.ok(SchedulerStatusResponse.from(cleanupScheduler.status()));
  }

  @PostMapping("/users/{userId}/anonymize")
  public ResponseEntity<AnonymizeResponse> anonymizeUser(
      @PathVariable("userId") String userId,
      @RequestHeader(value = HEADER_USER_ID, required = false) String requestedBy,
      HttpServletRequest httpRequest) {
    final int updated =
        erasureService.anonymizeUser(
            userId, requestedBy, RequestMdcInterceptor.resolveClientIp(httpRequest));
    return ResponseEntity.ok(new AnonymizeResponse(userId, updated));
  }

  private static ResponseEntity<Resource> attachment(ArchiveContent archive) {
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(archive.contentType()))
        .contentLength(archive.sizeBytes())
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(archive.fileName()).build().toString())
        .body(new FileSystemResource(archive.path()));
  }
}
