package com.example.audit.archive;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** Listing entry for one archive; {@code manifest} is null for CSV or unreadable archives. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArchiveFileInfo(
    String fileName,
    long sizeBytes,
    String sizeFormatted,
    Instant lastModified,
    boolean compressed,
    ArchiveFormat format,
    String actionType,
    Instant archiveTimestamp,
    ArchiveManifest manifest) {}
