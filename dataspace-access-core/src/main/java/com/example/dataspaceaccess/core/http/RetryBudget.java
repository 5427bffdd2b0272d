package com.example.dataspaceaccess.core.http;

import java.time.Duration;
import java.util.Optional;

/**
 * Remaining retries for one logical request under a {@link RetryPolicy}.
 *
 * <p>Not thread safe; a budget belongs to the request (or download) that created it.
 */
public final class RetryBudget {

  /** Where a failure happened. */
  public enum Phase {
    CONNECT,
    READ,
    STATUS
  }

  private final RetryPolicy policy;
  private int total;
  private int connect;
  private int read;
  private int status;
  private int consumed;

  public RetryBudget(final RetryPolicy policy) {
    this.policy = policy;
    this.total = policy.total();
    this.connect = policy.connect();
    this.read = policy.read();
    this.status = policy.status();
  }

  public RetryPolicy policy() {
    return policy;
  }

  /**
   * Draws one retry for the given phase.
   *
   * @param phase failure phase
   * @return true if a retry is allowed, false once the total or the phase budget is exhausted
   */
  public boolean consume(final Phase phase) {
    if (total <= 0) return false;
    switch (phase) {
      case CONNECT:
        if (connect <= 0) return false;
        connect--;
        break;
      case READ:
        if (read <= 0) return false;
        read--;
        break;
      case STATUS:
        if (status <= 0) return false;
        status--;
        break;
      default:
        throw new IllegalArgumentException("Unknown phase " + phase);
    }
    total--;
    consumed++;
    return true;
  }

  /**
   * Delay before the retry just consumed.
   *
   * <p>A server hint longer than the policy's {@code maxBackoff} is cut down to it.
   *
   * @param retryAfter server hint, honoured when the policy allows it
   * @return delay to wait, never longer than {@code maxBackoff}
   */
  public Duration nextDelay(final Optional<Duration> retryAfter) {
    if (policy.respectRetryAfter() && retryAfter.isPresent()) {
      final var hint = retryAfter.get();
      return hint.compareTo(policy.maxBackoff()) > 0 ? policy.maxBackoff() : hint;
    }
    return policy.backoffFor(consumed);
  }

  /**
   * Number of retries drawn so far.
   *
   * @return consumed retries
   */
  public int consumed() {
    return consumed;
  }
}
