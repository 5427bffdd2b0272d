package com.example.dataspaceaccess.core.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

/**
 * Token endpoint response for a successful grant.
 *
 * @param accessToken opaque access token
 * @param refreshToken opaque refresh token, if issued
 * @param tokenType token type, usually {@code Bearer}
 * @param scope granted scope
 * @param expiresIn lifetime in seconds, or null when the server reports none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenGrant(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("scope") String scope,
    @JsonProperty("expires_in") Long expiresIn) {

  /** Longest lifetime a stored token may carry: 1000 years. */
  public static final long MAX_EXPIRES_IN_SECONDS = Duration.ofDays(365_000L).toSeconds();

  /**
   * Whether the reported lifetime can be turned into an expiry instant.
   *
   * @return true if there is no lifetime or it is at most {@link #MAX_EXPIRES_IN_SECONDS}
   */
  public boolean hasUsableLifetime() {
    return expiresIn == null || expiresIn <= MAX_EXPIRES_IN_SECONDS;
  }

  @Override
  public String toString() {
    return "TokenGrant[tokenType=%s, scope=%s, expiresIn=%s]".formatted(tokenType, scope, expiresIn);
  }
}
