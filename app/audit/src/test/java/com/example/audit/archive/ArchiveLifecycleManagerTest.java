package com.example.audit.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.audit.config.AuditRetentionProperties;
import com.example.audit.model.AuditRecord;
import com.example.audit.support.TestRetentionProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchiveLifecycleManagerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
  private static final ObjectMapper OBJECT_MAPPER =
      JsonMapper.builder().addModule(new JavaTimeModule()).build();

  @TempDir Path archiveDir;

  @Test
  void listsArchivesNewestFirstWithManifest() throws IOException {
    writeArchive(Instant.parse("2026-02-01T00:00:00Z"), ArchiveFormat.JSON, true, "LOGIN");
    writeArchive(Instant.parse("2026-02-10T00:00:00Z"), ArchiveFormat.CSV, false, "LOGOUT");
    writeArchive(Instant.parse("2026-02-20T12:00:00Z"), ArchiveFormat.JSON, false, "BOOK_VIEWED");
    Files.writeString(archiveDir.resolve("notes.txt"), "ignored");

    final List<ArchiveFileInfo> archives = manager(TestRetentionProperties.builder()).listArchives();

    assertThat(archives)
        .extracting(ArchiveFileInfo::fileName)
        .containsExactly(
            "audit_archive_BOOK_VIEWED_20260220_120000.json",
            "audit_archive_LOGOUT_20260210_000000.csv",
            "audit_archive_LOGIN_20260201_000000.json.gz");
    final ArchiveFileInfo newest = archives.get(0);
    assertThat(newest.actionType()).isEqualTo("BOOK_VIEWED");
    assertThat(newest.format()).isEqualTo(ArchiveFormat.JSON);
    assertThat(newest.compressed()).isFalse();
    assertThat(newest.archiveTimestamp()).isEqualTo(Instant.parse("2026-02-20T12:00:00Z"));
    assertThat(newest.manifest()).isNotNull();
    assertThat(newest.manifest().logCount()).isEqualTo(1);
    assertThat(archives.get(1).manifest()).isNull();
    assertThat(archives.get(2).compressed()).isTrue();
    assertThat(archives.get(2).manifest().actionType()).isEqualTo("LOGIN");
  }

  @Test
  void corruptArchiveIsListedWithoutManifest() throws IOException {
    Files.writeString(
        archiveDir.resolve("audit_archive_LOGIN_20260101_000000.json.gz"), "not gzip at all");

    final List<ArchiveFileInfo> archives = manager(TestRetentionProperties.builder()).listArchives();

    assertThat(archives).singleElement().satisfies(info -> assertThat(info.manifest()).isNull());
  }

  @Test
  void missingDirectoryListsNothing() {
    final ArchiveLifecycleManager manager =
        new ArchiveLifecycleManager(
            TestRetentionProperties.builder().archivePath(archiveDir.resolve("absent")).build(),
            OBJECT_MAPPER,
            CLOCK);

    assertThat(manager.listArchives()).isEmpty();
  }

  @Test
  void openRejectsNamesOutsideTheArchivePattern() {
    final ArchiveLifecycleManager manager = manager(TestRetentionProperties.builder());

    for (String name :
        List.of(
            "../etc/passwd",
            "passwd",
            "audit_archive_LOGIN_20260101_000000.exe",
            "audit_archive_../LOGIN_20260101_000000.json")) {
      assertThatThrownBy(() -> manager.openArchive(name))
          .as(name)
          .isInstanceOf(InvalidArchiveNameException.class);
    }
  }

  @Test
  void openReportsMissingArchive() {
    final ArchiveLifecycleManager manager = manager(TestRetentionProperties.builder());

    assertThatThrownBy(() -> manager.openArchive("audit_archive_LOGIN_20260101_000000.json"))
        .isInstanceOf(ArchiveNotFoundException.class);
  }

  @Test
  void openResolvesContentType() throws IOException {
    writeArchive(Instant.parse("2026-02-01T00:00:00Z"), ArchiveFormat.JSON, true, "LOGIN");
    writeArchive(Instant.parse("2026-02-02T00:00:00Z"), ArchiveFormat.CSV, false, "LOGIN");
    final ArchiveLifecycleManager manager = manager(TestRetentionProperties.builder());

    final ArchiveContent gzip = manager.openArchive("audit_archive_LOGIN_20260201_000000.json.gz");
    final ArchiveContent csv = manager.openArchive("audit_archive_LOGIN_20260202_000000.csv");

    assertThat(gzip.contentType()).isEqualTo("application/gzip");
    assertThat(gzip.sizeBytes()).isEqualTo(Files.size(gzip.path()));
    assertThat(csv.contentType()).isEqualTo("text/csv");
  }

  @Test
  void purgeDeletesByModificationTime() throws IOException {
    final Path old = Files.writeString(archiveDir.resolve("audit_archive_LOGIN_20250101_000000.json"), "{}");
    final Path recent = Files.writeString(archiveDir.resolve("audit_archive_LOGIN_20260201_000000.json"), "{}");
    final Path staleTemp = Files.writeString(archiveDir.resolve(".audit_archive_123.tmp"), "");
    final Path unrelated = Files.writeString(archiveDir.resolve("keep.txt"), "");
    age(old, Duration.ofDays(400));
    age(recent, Duration.ofDays(10));
    age(staleTemp, Duration.ofDays(400));
    age(unrelated, Duration.ofDays(400));

    final int deleted = manager(TestRetentionProperties.builder()).purgeOlderThan(365);

    assertThat(deleted).isEqualTo(2);
    assertThat(old).doesNotExist();
    assertThat(staleTemp).doesNotExist();
    assertThat(recent).exists();
    assertThat(unrelated).exists();
  }

  @Test
  void purgeExpiredUsesConfiguredRetention() throws IOException {
    final Path archive = Files.writeString(archiveDir.resolve("audit_archive_LOGIN_20260101_000000.csv"), "");
    age(archive, Duration.ofDays(40));

    final int deleted =
        manager(TestRetentionProperties.builder().archiveRetentionDays(30)).purgeExpired();

    assertThat(deleted).isEqualTo(1);
  }

  @Test
  void purgeRejectsNonPositiveAge() {
    final ArchiveLifecycleManager manager = manager(TestRetentionProperties.builder());

    assertThatThrownBy(() -> manager.purgeOlderThan(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void formatsSizes() {
    assertThat(ArchiveLifecycleManager.formatSize(512)).isEqualTo("512 B");
    assertThat(ArchiveLifecycleManager.formatSize(1536)).isEqualTo("1.5 KB");
    assertThat(ArchiveLifecycleManager.formatSize(5L * 1024 * 1024)).isEqualTo("5.0 MB");
  }

  private ArchiveLifecycleManager manager(TestRetentionProperties builder) {
    return new ArchiveLifecycleManager(builder.archivePath(archiveDir).build(), OBJECT_MAPPER, CLOCK);
  }

  private void writeArchive(Instant at, ArchiveFormat format, boolean compress, String action) {
    final AuditRetentionProperties properties =
        TestRetentionProperties.builder()
            .archivePath(archiveDir)
            .archiveFormat(format)
            .compressArchives(compress)
            .build();
    new ArchiveWriter(properties, OBJECT_MAPPER, Clock.fixed(at, ZoneOffset.UTC))
        .writeArchive(
            action,
            List.of(new AuditRecord(1L, "u1", action, "m", at.minus(Duration.ofDays(60)), null)),
            at.minus(Duration.ofDays(30)));
  }

  private static void age(Path file, Duration age) throws IOException {
    Files.setLastModifiedTime(file, FileTime.from(NOW.minus(age)));
  }
}
