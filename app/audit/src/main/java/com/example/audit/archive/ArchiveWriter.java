/*
 * Where: Audit archive writer
 * What: Serializes expired records to a JSON or CSV archive, optionally gzip-compressed
 * Why: Records are only deleted once a complete archive is durably in place
 */
package com.example.audit.archive;

import com.example.audit.config.AuditRetentionProperties;
import com.example.audit.model.AuditRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.annotations.VisibleForTesting;
import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ArchiveWriter {

  private static final Logger logger = LoggerFactory.getLogger(ArchiveWriter.class);

  static final String CSV_HEADER = "Id,UserId,Action,Message,CreatedAt,IpAddress";

  private static final DateTimeFormatter CSV_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
  private static final long BYTES_PER_MB = 1024L * 1024L;
  private static final Comparator<AuditRecord> ARCHIVE_ORDER =
      Comparator.comparing(
              AuditRecord::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
          .thenComparing(AuditRecord::id, Comparator.nullsFirst(Comparator.<Long>naturalOrder()));

  private final AuditRetentionProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ArchiveWriter(AuditRetentionProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.properties = properties;
    this.objectMapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    this.clock = clock;
  }

  /**
   * Writes one archive for {@code records} and returns its final path.
   *
   * <p>The file appears under its final name only when complete. On any failure no file is left
   * behind and {@link ArchiveWriteException} is thrown.
   */
  public Path writeArchive(String actionType, List<AuditRecord> records, Instant cutoffDate) {
    return write(
        actionType, records, cutoffDate, properties.archiveFormat(), properties.compressArchives());
  }

  /**
   * Writes an on-demand export with a caller-chosen format. The file lands next to retention
   * archives under the same naming rules and carries no cutoff date.
   */
  public Path writeExport(
      String label, List<AuditRecord> records, ArchiveFormat format, boolean compress) {
    return write(label, records, null, format, compress);
  }

  private Path write(
      String actionType,
      List<AuditRecord> records,
      Instant cutoffDate,
      ArchiveFormat format,
      boolean compress) {
    if (records == null || records.isEmpty()) {
      throw new IllegalArgumentException("records must not be empty");
    }
    final Instant archiveDate = Instant.now(clock);
    final Path directory = archiveDirectory();
    final String fileName = ArchiveFileNames.build(actionType, archiveDate, format, compress);
    final List<AuditRecord> ordered = records.stream().sorted(ARCHIVE_ORDER).toList();

    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, ArchiveFileNames.TEMP_PREFIX, ArchiveFileNames.TEMP_SUFFIX);
      try (OutputStream out = openStream(temp, compress)) {
        if (format == ArchiveFormat.CSV) {
          writeCsv(out, ordered);
        } else {
          writeJson(out, actionType, ordered, cutoffDate, archiveDate);
        }
      }
      enforceSizeLimit(temp, fileName);
      final Path target = publish(temp, directory, actionType, archiveDate, format, compress);
      logger.info(
          "audit archive written file={} actionType={} records={} bytes={}",
          target.getFileName(),
          actionType,
          ordered.size(),
          Files.size(target));
      return target;
    } catch (IOException ex) {
      throw new ArchiveWriteException("failed to write archive " + fileName, ex);
    } finally {
      deleteTemp(temp);
    }
  }

  @VisibleForTesting
  Path archiveDirectory() {
    return Path.of(properties.archivePath()).toAbsolutePath().normalize();
  }

  private OutputStream openStream(Path file, boolean compress) throws IOException {
    final OutputStream out = new BufferedOutputStream(Files.newOutputStream(file));
    return compress ? new GZIPOutputStream(out) : out;
  }

  private void writeJson(
      OutputStream out,
      String actionType,
      List<AuditRecord> records,
      Instant cutoffDate,
      Instant archiveDate)
      throws IOException {
    final ArchiveManifest manifest =
        ArchiveManifest.describe(actionType, records, cutoffDate, archiveDate);
    final List<ArchivedAuditLog> logs = records.stream().map(ArchivedAuditLog::from).toList();
    objectMapper.writeValue(out, new ArchiveDocument(manifest, logs));
  }

  private void writeCsv(OutputStream out, List<AuditRecord> records) throws IOException {
    final Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    writer.write(CSV_HEADER);
    writer.write('\n');
    for (AuditRecord record : records) {
      writer.write(
          String.join(
              ",",
              quote(record.id() == null ? "" : record.id().toString()),
              quote(record.userId()),
              quote(record.action()),
              quote(record.message()),
              quote(record.createdAt() == null ? "" : CSV_TIMESTAMP.format(record.createdAt())),
              quote(record.ipAddress())));
      writer.write('\n');
    }
    writer.flush();
  }

  @VisibleForTesting
  static String quote(String value) {
    if (value == null) {
      return "\"\"";
    }
    return "\"" + value.replace("\"", "\"\"") + "\"";
  }

  private void enforceSizeLimit(Path temp, String fileName) throws IOException {
    final int maxMb = properties.maxArchiveSizeMb();
    if (maxMb <= 0) {
      return;
    }
    final long size = Files.size(temp);
    if (size > maxMb * BYTES_PER_MB) {
      throw new ArchiveWriteException(
          "archive " + fileName + " is " + size + " bytes, above the " + maxMb + " MB limit");
    }
  }

  /** Moves the finished temp file onto the first free name for this action and second. */
  private synchronized Path publish(
      Path temp,
      Path directory,
      String actionType,
      Instant archiveDate,
      ArchiveFormat format,
      boolean compress)
      throws IOException {
    for (int sequence = 1; sequence <= ArchiveFileNames.MAX_SEQUENCE; sequence++) {
      final Path target =
          directory.resolve(
              ArchiveFileNames.build(actionType, archiveDate, format, compress, sequence));
      // ATOMIC_MOVE replaces an existing target on most platforms, so never move onto one
      if (!Files.exists(target)) {
        move(temp, target);
        return target;
      }
    }
    throw new ArchiveWriteException(
        "no free archive name left for "
            + ArchiveFileNames.build(actionType, archiveDate, format, compress));
  }

  private void move(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      logger.warn("atomic move not supported for {}, falling back to plain move", target);
      Files.move(temp, target);
    }
  }

  private void deleteTemp(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException ex) {
      logger.warn("failed to remove temporary archive file {}", temp, ex);
    }
  }
}
