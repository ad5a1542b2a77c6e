package com.example.audit.repository;

import java.time.Instant;

/** Per-action aggregate row used by the storage statistics. */
public record ActionOccurrence(String action, long count, Instant firstSeen, Instant lastSeen) {}
