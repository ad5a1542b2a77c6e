/*
 * Where: Audit archive naming
 * What: Builds, validates and parses archive file names
 * Why: Names carry action type and timestamp, and gate every download path
 */
package com.example.audit.archive;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class ArchiveFileNames {
  private ArchiveFileNames() {}

  static final String PREFIX = "audit_archive_";
  static final String TEMP_PREFIX = ".audit_archive_";
  static final String TEMP_SUFFIX = ".tmp";
  static final String GZIP_SUFFIX = ".gz";
  static final String UNKNOWN_ACTION = "UNKNOWN";

  // an optional -N after the time separates archives written within the same second
  static final Pattern SAFE_NAME =
      Pattern.compile(
          "^audit_archive_([A-Za-z0-9_-]+)_(\\d{8})_(\\d{6})(?:-(\\d{1,4}))?\\.(json|csv)(\\.gz)?$");

  private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9_-]");
  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  record ParsedName(
      String actionType, Instant timestamp, ArchiveFormat format, boolean compressed) {}

  static final int MAX_SEQUENCE = 9999;

  static String build(String actionType, Instant archivedAt, ArchiveFormat format, boolean gzip) {
    return build(actionType, archivedAt, format, gzip, 1);
  }

  /** Sequence 1 is the plain name; later sequences append {@code -N} to the timestamp. */
  static String build(
      String actionType, Instant archivedAt, ArchiveFormat format, boolean gzip, int sequence) {
    if (sequence < 1 || sequence > MAX_SEQUENCE) {
      throw new IllegalArgumentException("archive sequence out of range: " + sequence);
    }
    final String timestamp = TIMESTAMP.format(archivedAt.atOffset(ZoneOffset.UTC));
    return PREFIX
        + sanitize(actionType)
        + "_"
        + timestamp
        + (sequence == 1 ? "" : "-" + sequence)
        + "."
        + format.extension()
        + (gzip ? GZIP_SUFFIX : "");
  }

  static String sanitize(String actionType) {
    if (actionType == null) {
      return UNKNOWN_ACTION;
    }
    final String sanitized = UNSAFE_CHARS.matcher(actionType).replaceAll("");
    return sanitized.isEmpty() ? UNKNOWN_ACTION : sanitized;
  }

  static boolean isSafe(String fileName) {
    return fileName != null && SAFE_NAME.matcher(fileName).matches();
  }

  static boolean isTempFile(String fileName) {
    return fileName.startsWith(TEMP_PREFIX) && fileName.endsWith(TEMP_SUFFIX);
  }

  static Optional<ParsedName> parse(String fileName) {
    if (fileName == null) {
      return Optional.empty();
    }
    final Matcher matcher = SAFE_NAME.matcher(fileName);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    try {
      final LocalDateTime timestamp =
          LocalDateTime.parse(matcher.group(2) + "_" + matcher.group(3), TIMESTAMP);
      return Optional.of(
          new ParsedName(
              matcher.group(1),
              timestamp.toInstant(ZoneOffset.UTC),
              ArchiveFormat.fromExtension(matcher.group(5)),
              matcher.group(6) != null));
    } catch (DateTimeParseException ex) {
      // digits in the right shape but not a real date, e.g. month 13
      return Optional.empty();
    }
  }
}
