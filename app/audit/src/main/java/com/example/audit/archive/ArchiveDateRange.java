package com.example.audit.archive;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

@JsonPropertyOrder({"start", "end"})
public record ArchiveDateRange(Instant start, Instant end) {}
