package com.example.dataspaceaccess.core.config;

import java.net.URI;
import java.time.Duration;

/**
 * Endpoint, timeout and retry settings for the identity and transfer clients.
 *
 * <p>Every value is read from a system property, then an environment variable, then a default:
 *
 * <ul>
 *   <li>dataspace.identity.url / DATASPACE_IDENTITY_URL
 *   <li>dataspace.identity.client-id / DATASPACE_CLIENT_ID
 *   <li>dataspace.probe.url / DATASPACE_PROBE_URL
 *   <li>dataspace.http.connect-timeout.millis / DATASPACE_CONNECT_TIMEOUT_MILLIS
 *   <li>dataspace.http.read-timeout.millis / DATASPACE_READ_TIMEOUT_MILLIS
 *   <li>dataspace.retry.total / DATASPACE_RETRY_TOTAL
 *   <li>dataspace.retry.connect / DATASPACE_RETRY_CONNECT
 *   <li>dataspace.retry.read / DATASPACE_RETRY_READ
 *   <li>dataspace.retry.status / DATASPACE_RETRY_STATUS
 *   <li>dataspace.retry.backoff.millis / DATASPACE_RETRY_BACKOFF_MILLIS
 * </ul>
 *
 * @param identityUrl token endpoint accepting password grants
 * @param clientId OAuth client identifier sent with every grant
 * @param probeUrl endpoint used to check whether a cached access token is still accepted
 * @param connectTimeout connection establishment timeout
 * @param readTimeout time allowed for a response to start arriving
 * @param retryTotal total retry budget for idempotent requests
 * @param retryConnect retry budget for connection-phase failures
 * @param retryRead retry budget for read-phase failures
 * @param retryStatus retry budget for retryable HTTP statuses
 * @param backoff delay before the first retry; doubled for each further consecutive retry
 */
public record AccessSettings(
    URI identityUrl,
    String clientId,
    URI probeUrl,
    Duration connectTimeout,
    Duration readTimeout,
    int retryTotal,
    int retryConnect,
    int retryRead,
    int retryStatus,
    Duration backoff) {

  public static final String DEFAULT_IDENTITY_URL =
      "https://identity.dataspace.copernicus.eu/auth/realms/CDSE/protocol/openid-connect/token";
  public static final String DEFAULT_CLIENT_ID = "cdse-public";
  public static final String DEFAULT_PROBE_URL = "https://stac.dataspace.copernicus.eu/v1";

  public AccessSettings {
    if (identityUrl == null) throw new IllegalArgumentException("identityUrl is required");
    if (clientId == null || clientId.isBlank())
      throw new IllegalArgumentException("clientId is required");
    if (probeUrl == null) throw new IllegalArgumentException("probeUrl is required");
    if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero())
      throw new IllegalArgumentException("connectTimeout must be positive");
    if (readTimeout == null || readTimeout.isNegative() || readTimeout.isZero())
      throw new IllegalArgumentException("readTimeout must be positive");
    if (retryTotal < 0 || retryConnect < 0 || retryRead < 0 || retryStatus < 0)
      throw new IllegalArgumentException("retry budgets must be >= 0");
    if (backoff == null || backoff.isNegative())
      throw new IllegalArgumentException("backoff must be non-negative");
  }

  /**
   * Loads settings from system properties and environment variables.
   *
   * @return resolved settings
   * @throws IllegalArgumentException if a value is malformed
   */
  public static AccessSettings load() {
    return new AccessSettings(
        URI.create(
            Settings.string(
                "dataspace.identity.url", "DATASPACE_IDENTITY_URL", DEFAULT_IDENTITY_URL)),
        Settings.string("dataspace.identity.client-id", "DATASPACE_CLIENT_ID", DEFAULT_CLIENT_ID),
        URI.create(Settings.string("dataspace.probe.url", "DATASPACE_PROBE_URL", DEFAULT_PROBE_URL)),
        Settings.millis(
            "dataspace.http.connect-timeout.millis",
            "DATASPACE_CONNECT_TIMEOUT_MILLIS",
            Duration.ofSeconds(10)),
        Settings.millis(
            "dataspace.http.read-timeout.millis",
            "DATASPACE_READ_TIMEOUT_MILLIS",
            Duration.ofSeconds(600)),
        Settings.integer("dataspace.retry.total", "DATASPACE_RETRY_TOTAL", 8),
        Settings.integer("dataspace.retry.connect", "DATASPACE_RETRY_CONNECT", 5),
        Settings.integer("dataspace.retry.read", "DATASPACE_RETRY_READ", 5),
        Settings.integer("dataspace.retry.status", "DATASPACE_RETRY_STATUS", 5),
        Settings.millis(
            "dataspace.retry.backoff.millis", "DATASPACE_RETRY_BACKOFF_MILLIS", Duration.ofMillis(500)));
  }
}
