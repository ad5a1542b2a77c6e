package com.example.audit.archive;

import java.nio.file.Path;

/** A validated, existing archive ready to be streamed to a client. */
public record ArchiveContent(String fileName, Path path, long sizeBytes, String contentType) {}
