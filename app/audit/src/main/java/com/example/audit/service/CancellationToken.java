package com.example.audit.service;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative stop signal; the engine checks it between policies and between batches. */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
