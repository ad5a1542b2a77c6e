package com.example.audit.archive;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/** Top-level JSON archive layout: the manifest first, then the records. */
@JsonPropertyOrder({"manifest", "logs"})
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "logs is copied into an unmodifiable list in the constructor")
public record ArchiveDocument(ArchiveManifest manifest, List<ArchivedAuditLog> logs) {

  public ArchiveDocument {
    logs = logs == null ? List.of() : List.copyOf(logs);
  }
}
