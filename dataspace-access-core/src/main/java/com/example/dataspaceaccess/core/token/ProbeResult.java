package com.example.dataspaceaccess.core.token;

/** Outcome of checking a cached access token against the probe endpoint. */
public enum ProbeResult {
  /** The endpoint accepted the token (status below 400). */
  ACCEPTED,
  /** The endpoint refused the token. */
  REJECTED,
  /** No verdict: transport failure, throttling or a server-side error. */
  INCONCLUSIVE;

  /**
   * Maps a probe response status.
   *
   * @param status HTTP status
   * @return probe verdict
   */
  public static ProbeResult ofStatus(final int status) {
    if (status < 400) return ACCEPTED;
    if (status == 429 || status >= 500) return INCONCLUSIVE;
    return REJECTED;
  }
}
