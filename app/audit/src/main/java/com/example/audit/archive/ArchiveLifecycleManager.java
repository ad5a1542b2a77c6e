/*
 * Where: Audit archive lifecycle
 * What: Lists, opens and age-purges archive files
 * Why: Archives outlive the rows they hold and need their own retention
 */
package com.example.audit.archive;

import com.example.audit.config.AuditRetentionProperties;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ArchiveLifecycleManager {

  private static final Logger logger = LoggerFactory.getLogger(ArchiveLifecycleManager.class);

  private static final String MANIFEST_FIELD = "manifest";

  private final AuditRetentionProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ArchiveLifecycleManager(
      AuditRetentionProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.properties = properties;
    this.objectMapper = objectMapper.copy().registerModule(new JavaTimeModule());
    this.clock = clock;
  }

  /** Archives in the archive directory, newest first. */
  public List<ArchiveFileInfo> listArchives() {
    final List<ArchiveFileInfo> archives = new ArrayList<>();
    for (Path file : archiveFiles()) {
      final String fileName = file.getFileName().toString();
      final ArchiveFileNames.ParsedName parsed = ArchiveFileNames.parse(fileName).orElse(null);
      if (parsed == null) {
        continue;
      }
      try {
        final long size = Files.size(file);
        final Instant lastModified = Files.getLastModifiedTime(file).toInstant();
        final ArchiveManifest manifest =
            parsed.format() == ArchiveFormat.JSON ? readManifest(file, parsed.compressed()) : null;
        archives.add(
            new ArchiveFileInfo(
                fileName,
                size,
                formatSize(size),
                lastModified,
                parsed.compressed(),
                parsed.format(),
                parsed.actionType(),
                parsed.timestamp(),
                manifest));
      } catch (NoSuchFileException ex) {
        logger.debug("archive disappeared while listing file={}", fileName);
      } catch (IOException ex) {
        throw new UncheckedIOException("failed to read archive attributes " + fileName, ex);
      }
    }
    archives.sort(
        Comparator.comparing(ArchiveFileInfo::archiveTimestamp)
            .thenComparing(ArchiveFileInfo::lastModified)
            .reversed());
    return archives;
  }

  /** Validates {@code fileName} before touching the filesystem, then resolves it. */
  public ArchiveContent openArchive(String fileName) {
    if (!ArchiveFileNames.isSafe(fileName)) {
      throw new InvalidArchiveNameException(fileName);
    }
    final Path directory = archiveDirectory();
    final Path file = directory.resolve(fileName).normalize();
    if (!file.startsWith(directory)) {
      throw new InvalidArchiveNameException(fileName);
    }
    if (!Files.isRegularFile(file)) {
      throw new ArchiveNotFoundException(fileName);
    }
    final ArchiveFileNames.ParsedName parsed =
        ArchiveFileNames.parse(fileName).orElseThrow(() -> new InvalidArchiveNameException(fileName));
    try {
      final String contentType =
          parsed.compressed() ? "application/gzip" : parsed.format().contentType();
      return new ArchiveContent(fileName, file, Files.size(file), contentType);
    } catch (NoSuchFileException ex) {
      throw new ArchiveNotFoundException(fileName);
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read archive " + fileName, ex);
    }
  }

  /** Deletes archives whose last-modified time is older than {@code maxAgeDays}. */
  public int purgeOlderThan(int maxAgeDays) {
    if (maxAgeDays < 1) {
      throw new IllegalArgumentException("maxAgeDays must be at least 1: " + maxAgeDays);
    }
    final Instant cutoff = Instant.now(clock).minus(Duration.ofDays(maxAgeDays));
    int deleted = 0;
    for (Path file : purgeCandidates()) {
      try {
        if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)
            && Files.deleteIfExists(file)) {
          deleted++;
          logger.info("audit archive purged file={}", file.getFileName());
        }
      } catch (IOException ex) {
        logger.warn("failed to purge audit archive file={}", file.getFileName(), ex);
      }
    }
    logger.info("audit archive purge finished deleted={} maxAgeDays={}", deleted, maxAgeDays);
    return deleted;
  }

  public int purgeExpired() {
    return purgeOlderThan(properties.archiveRetentionDays());
  }

  private Path archiveDirectory() {
    return Path.of(properties.archivePath()).toAbsolutePath().normalize();
  }

  private List<Path> archiveFiles() {
    return listDirectory(false);
  }

  // stale temp files from interrupted writes age out with the archives
  private List<Path> purgeCandidates() {
    return listDirectory(true);
  }

  private List<Path> listDirectory(boolean includeTemp) {
    final Path directory = archiveDirectory();
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(
              file -> {
                final String name = file.getFileName().toString();
                return ArchiveFileNames.isSafe(name)
                    || (includeTemp && ArchiveFileNames.isTempFile(name));
              })
          .toList();
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to list archive directory " + directory, ex);
    }
  }

  private ArchiveManifest readManifest(Path file, boolean compressed) {
    try (InputStream in = openStream(file, compressed);
        JsonParser parser = objectMapper.getFactory().createParser(in)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        return null;
      }
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        final String field = parser.currentName();
        parser.nextToken();
        if (MANIFEST_FIELD.equals(field)) {
          return objectMapper.readValue(parser, ArchiveManifest.class);
        }
        parser.skipChildren();
      }
      return null;
    } catch (IOException | RuntimeException ex) {
      logger.warn("unreadable audit archive manifest file={}", file.getFileName(), ex);
      return null;
    }
  }

  private InputStream openStream(Path file, boolean compressed) throws IOException {
    final InputStream in = new BufferedInputStream(Files.newInputStream(file));
    if (!compressed) {
      return in;
    }
    try {
      return new GZIPInputStream(in);
    } catch (IOException ex) {
      in.close();
      throw ex;
    }
  }

  static String formatSize(long bytes) {
    if (bytes < 1024) {
      return bytes + " B";
    }
    final double kb = bytes / 1024d;
    if (kb < 1024) {
      return String.format(Locale.ROOT, "%.1f KB", kb);
    }
    final double mb = kb / 1024d;
    if (mb < 1024) {
      return String.format(Locale.ROOT, "%.1f MB", mb);
    }
    return String.format(Locale.ROOT, "%.1f GB", mb / 1024d);
  }
}
