package com.example.dataspaceaccess.core.http;

import com.example.dataspaceaccess.core.config.AccessSettings;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Retry configuration for HTTP requests.
 *
 * <p>Budgets count retries, not attempts: a policy with {@code total = 8} allows the first attempt
 * plus up to eight more. The per-phase budgets are independent of each other and all draw from
 * {@code total}; a request stops retrying as soon as any budget it draws from runs out.
 *
 * <p>The n-th consecutive retry waits {@code backoff * 2^(n-1)}, capped at {@code maxBackoff}. When
 * {@code respectRetryAfter} is set, a {@code Retry-After} header on a retryable status response
 * replaces the computed delay, still capped at {@code maxBackoff}.
 *
 * @param total retries allowed across all phases
 * @param connect retries allowed for failures before a connection is established
 * @param read retries allowed for failures after the request was sent
 * @param status retries allowed for responses whose status is in {@code retryStatuses}
 * @param backoff delay before the first retry
 * @param maxBackoff upper bound on any single delay
 * @param retryStatuses HTTP statuses that are retried
 * @param retryMethods HTTP methods eligible for any retry
 * @param respectRetryAfter whether a server-supplied {@code Retry-After} hint is honoured
 */
public record RetryPolicy(
    int total,
    int connect,
    int read,
    int status,
    Duration backoff,
    Duration maxBackoff,
    Set<Integer> retryStatuses,
    Set<String> retryMethods,
    boolean respectRetryAfter) {

  /** Statuses retried by default: throttling and transient gateway/server failures. */
  public static final Set<Integer> DEFAULT_RETRY_STATUSES = Set.of(429, 500, 502, 503, 504);

  /** Idempotent methods; everything else is never retried. */
  public static final Set<String> IDEMPOTENT_METHODS =
      Set.of("GET", "HEAD", "PUT", "DELETE", "OPTIONS", "TRACE");

  public RetryPolicy {
    if (total < 0 || connect < 0 || read < 0 || status < 0)
      throw new IllegalArgumentException("retry budgets must be >= 0");
    if (backoff == null || backoff.isNegative())
      throw new IllegalArgumentException("backoff must be non-negative");
    if (maxBackoff == null || maxBackoff.compareTo(backoff) < 0)
      throw new IllegalArgumentException("maxBackoff must be >= backoff");
    retryStatuses = Set.copyOf(retryStatuses);
    retryMethods = Set.copyOf(retryMethods);
  }

  /**
   * Default transfer policy: 8 retries in total, at most 5 per phase, 0.5 s initial backoff.
   *
   * @return default policy
   */
  public static RetryPolicy defaults() {
    return new RetryPolicy(
        8,
        5,
        5,
        5,
        Duration.ofMillis(500),
        Duration.ofSeconds(120),
        DEFAULT_RETRY_STATUSES,
        IDEMPOTENT_METHODS,
        true);
  }

  /**
   * Policy that never retries.
   *
   * @return no-retry policy
   */
  public static RetryPolicy none() {
    return new RetryPolicy(
        0, 0, 0, 0, Duration.ZERO, Duration.ZERO, Set.of(), IDEMPOTENT_METHODS, false);
  }

  /**
   * Default policy with budgets and initial backoff taken from settings.
   *
   * @param settings resolved settings
   * @return policy
   */
  public static RetryPolicy from(final AccessSettings settings) {
    final var defaults = defaults();
    return new RetryPolicy(
        settings.retryTotal(),
        settings.retryConnect(),
        settings.retryRead(),
        settings.retryStatus(),
        settings.backoff(),
        defaults.maxBackoff().compareTo(settings.backoff()) < 0
            ? settings.backoff()
            : defaults.maxBackoff(),
        DEFAULT_RETRY_STATUSES,
        IDEMPOTENT_METHODS,
        true);
  }

  /**
   * Returns a copy with a different initial backoff, keeping the cap at least as large.
   *
   * @param newBackoff delay before the first retry
   * @return adjusted policy
   */
  public RetryPolicy withBackoff(final Duration newBackoff) {
    final var cap = maxBackoff.compareTo(newBackoff) < 0 ? newBackoff : maxBackoff;
    return new RetryPolicy(
        total,
        connect,
        read,
        status,
        newBackoff,
        cap,
        retryStatuses,
        retryMethods,
        respectRetryAfter);
  }

  public boolean isRetryableMethod(final String method) {
    return method != null && retryMethods.contains(method.toUpperCase(Locale.ROOT));
  }

  public boolean isRetryableStatus(final int code) {
    return retryStatuses.contains(code);
  }

  /**
   * Calculates the delay before a retry.
   *
   * @param consecutiveRetries number of retries performed so far including this one (1-based)
   * @return delay before the retry
   */
  public Duration backoffFor(final int consecutiveRetries) {
    if (consecutiveRetries < 1 || backoff.isZero()) return Duration.ZERO;

    final var exponent = Math.min(consecutiveRetries - 1, 30);
    final var millis = backoff.toMillis() * Math.pow(2.0, exponent);
    if (millis >= maxBackoff.toMillis()) return maxBackoff;
    return Duration.ofMillis((long) millis);
  }
}
