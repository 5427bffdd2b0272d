package com.example.dataspaceaccess.core.token;

import java.time.Duration;
import java.time.Instant;

/**
 * One persisted grant.
 *
 * <p>Only {@code revoked} and {@code updatedAt} ever change after a record is stored; a refresh is a
 * new record.
 *
 * @param id store identifier, 0 before the record is stored
 * @param login account the grant belongs to
 * @param accessToken opaque access token
 * @param refreshToken opaque refresh token, or null
 * @param tokenType token type, or null
 * @param scope granted scope, or null
 * @param expiresInSeconds server-reported lifetime, or null
 * @param issuedAt when the grant was received
 * @param expiresAt when the token stops being valid, or null if it does not expire
 * @param revoked whether the token was revoked
 * @param createdAt row creation time
 * @param updatedAt last change time
 */
public record TokenRecord(
    long id,
    String login,
    String accessToken,
    String refreshToken,
    String tokenType,
    String scope,
    Long expiresInSeconds,
    Instant issuedAt,
    Instant expiresAt,
    boolean revoked,
    Instant createdAt,
    Instant updatedAt) {

  public TokenRecord {
    if (login == null || login.isBlank()) throw new IllegalArgumentException("login is required");
    if (accessToken == null) throw new IllegalArgumentException("accessToken is required");
    if (issuedAt == null) throw new IllegalArgumentException("issuedAt is required");
    if (expiresAt != null && expiresAt.isBefore(issuedAt))
      throw new IllegalArgumentException("expiresAt must not precede issuedAt");
  }

  /**
   * Builds an unsaved record from a grant received at {@code issuedAt}.
   *
   * <p>A negative lifetime is treated as zero.
   *
   * @param login account login
   * @param grant endpoint response
   * @param issuedAt receipt time
   * @return unsaved record
   * @throws IllegalArgumentException if the lifetime exceeds {@link
   *     TokenGrant#MAX_EXPIRES_IN_SECONDS}
   */
  public static TokenRecord fromGrant(
      final String login, final TokenGrant grant, final Instant issuedAt) {
    if (!grant.hasUsableLifetime())
      throw new IllegalArgumentException("expires_in out of range: " + grant.expiresIn());
    final var ttl = grant.expiresIn() == null ? null : Math.max(0L, grant.expiresIn());
    final var expiresAt = ttl == null ? null : issuedAt.plus(Duration.ofSeconds(ttl));
    return new TokenRecord(
        0L,
        login,
        grant.accessToken(),
        grant.refreshToken(),
        grant.tokenType(),
        grant.scope(),
        ttl,
        issuedAt,
        expiresAt,
        false,
        issuedAt,
        issuedAt);
  }

  /**
   * Whether the token can no longer be used at {@code now}.
   *
   * @param now instant to evaluate at
   * @return true if revoked, or if an expiry is set and {@code now} is at or after it
   */
  public boolean isExpiredAt(final Instant now) {
    if (revoked) return true;
    return expiresAt != null && !now.isBefore(expiresAt);
  }

  TokenRecord withId(final long newId) {
    return new TokenRecord(
        newId,
        login,
        accessToken,
        refreshToken,
        tokenType,
        scope,
        expiresInSeconds,
        issuedAt,
        expiresAt,
        revoked,
        createdAt,
        updatedAt);
  }

  @Override
  public String toString() {
    return "TokenRecord[id=%d, login=%s, tokenType=%s, issuedAt=%s, expiresAt=%s, revoked=%s]"
        .formatted(id, login, tokenType, issuedAt, expiresAt, revoked);
  }
}
