package com.flamingo.ai.esgmaturity.service.pipeline;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation, checked by the pipeline at every stage boundary. */
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

  /**
   * @param stage stage about to start, used in the exception message
   * @throws CancellationException if cancellation was requested
   */
  public void throwIfCancelled(String stage) {
    if (cancelled.get()) {
      throw new CancellationException("Cancelled before " + stage);
    }
  }
}
