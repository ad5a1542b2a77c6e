/*
 * Where: Audit admin API request
 * What: Body of POST /api/admin/audit/cleanup
 * Why: Lets an admin preview or run retention for one action or for every policy
 */
package com.example.audit.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CleanupRequest(
    @Min(1) @Max(3650) Integer retentionDays,
    @Size(max = 100) String actionType,
    Boolean archiveBeforeDelete,
    boolean previewOnly) {}
