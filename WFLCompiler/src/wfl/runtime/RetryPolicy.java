package wfl.runtime;

import java.time.Duration;

/** {@code retry NAME = N times, BACKOFF backoff}: attempts and spacing of agent re-runs. */
public final class RetryPolicy {
  public enum Backoff {
    FIXED,
    LINEAR,
    EXPONENTIAL;
  }

  private final int times;
  private final Backoff backoff;

  public RetryPolicy(int times, Backoff backoff) {
    this.times = times;
    this.backoff = backoff;
  }

  /** Total attempts, the first one included. */
  public int times() {
    return times;
  }

  public Backoff backoff() {
    return backoff;
  }

  /** Wait before attempt {@code attempt + 1}, where the first retry follows attempt 1. */
  public Duration delay(int attempt, Duration base) {
    switch (backoff) {
      case LINEAR:
        return base.multipliedBy(attempt);
      case EXPONENTIAL:
        return base.multipliedBy(1L << Math.min(attempt - 1, 30));
      default:
        return base;
    }
  }
}
