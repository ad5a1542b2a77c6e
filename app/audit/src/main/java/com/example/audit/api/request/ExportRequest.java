/*
 * Where: Audit admin API request
 * What: Body of POST /api/admin/audit/export
 * Why: Selects the records and file shape of an on-demand export
 */
package com.example.audit.api.request;

import com.example.audit.archive.ArchiveFormat;
import com.example.audit.model.ExportCriteria;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExportRequest(
    Instant startDate,
    Instant endDate,
    @Size(max = 100) String actionType,
    @Size(max = 100) String userId,
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_CASE_INSENSITIVE_VALUES) ArchiveFormat format,
    boolean compress,
    @Positive Integer maxRecords) {

  static final int DEFAULT_MAX_RECORDS = 5000;

  public ExportRequest {
    format = format == null ? ArchiveFormat.CSV : format;
    maxRecords = maxRecords == null ? DEFAULT_MAX_RECORDS : maxRecords;
  }

  @AssertTrue(message = "start_date must not be after end_date")
  public boolean isDateRangeOrdered() {
    return startDate == null || endDate == null || !startDate.isAfter(endDate);
  }

  public ExportCriteria toCriteria() {
    return new ExportCriteria(startDate, endDate, actionType, userId, maxRecords);
  }
}
