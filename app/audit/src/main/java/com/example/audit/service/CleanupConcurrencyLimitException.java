package com.example.audit.service;

/** Raised when every cleanup permit is taken; retrying later can succeed. */
public class CleanupConcurrencyLimitException extends RuntimeException {

  private final int maxConcurrent;

  public CleanupConcurrencyLimitException(int maxConcurrent, CleanupTrigger trigger) {
    super(
        "audit cleanup rejected: "
            + maxConcurrent
            + " concurrent runs already in progress (trigger="
            + trigger
            + ")");
    this.maxConcurrent = maxConcurrent;
  }

  public int maxConcurrent() {
    return maxConcurrent;
  }
}
