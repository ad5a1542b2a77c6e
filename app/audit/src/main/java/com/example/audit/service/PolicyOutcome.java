package com.example.audit.service;

public enum PolicyOutcome {
  SUCCEEDED,
  PREVIEWED,
  ARCHIVE_FAILED,
  STORAGE_FAILED,
  FAILED,
  CANCELLED;

  public boolean isFailure() {
    return this == ARCHIVE_FAILED || this == STORAGE_FAILED || this == FAILED;
  }
}
