package com.example.dataspaceaccess.core.token;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.dataspaceaccess.core.store.UnitOfWorkManager;
import java.lang.System.Logger;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Issues, caches, validates and discards access tokens per login.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var tokens = new TokenLifecycleManager(unitOfWorkManager, HttpIdentityEndpoint.create(settings));
 * var token = tokens.ensureValid("user@example.com", password);
 * transferClient.fetch(uri, destination, token.accessToken(), Timeouts.defaults());
 * }</pre>
 *
 * <p>Every record lives in the store; the current token of a login is its most recently issued
 * non-revoked record. A refresh stores a new record and revokes the one it replaces, so history
 * stays until {@link #purgeExpired()} removes it.
 *
 * <p>No lock is held around issuance. Two threads refreshing the same login concurrently may both
 * obtain a grant; the later one becomes current.
 *
 * <p>Secrets are used for the grant request only and are never stored.
 */
public final class TokenLifecycleManager {

  private static final Logger logger = System.getLogger(TokenLifecycleManager.class.getName());

  private final UnitOfWorkManager store;
  private final IdentityEndpoint endpoint;
  private final TokenRepository repository;
  private final Clock clock;

  public TokenLifecycleManager(final UnitOfWorkManager store, final IdentityEndpoint endpoint) {
    this(store, endpoint, Clock.systemUTC());
  }

  public TokenLifecycleManager(
      final UnitOfWorkManager store, final IdentityEndpoint endpoint, final Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.repository = new TokenRepository();
  }

  /**
   * Requests a new grant and stores it.
   *
   * @param login account login
   * @param secret account password
   * @param otp one-time code, or null
   * @return the stored record
   * @throws AuthRejectedException if the endpoint refuses the credentials
   * @throws NetworkException if the endpoint cannot be reached
   * @throws IllegalArgumentException if login or secret is blank
   */
  public TokenRecord issue(final String login, final String secret, final String otp) {
    return grantAndStore(login, secret, otp, null);
  }

  /**
   * Most recently issued non-revoked record for a login, whether or not it has expired.
   *
   * @param login account login
   * @return current record, or empty
   */
  public Optional<TokenRecord> current(final String login) {
    requireLogin(login);
    return store.runScoped(uow -> repository.findCurrent(uow, login));
  }

  /**
   * Whether a record can no longer be used now.
   *
   * @param record token record
   * @return true if revoked, or if the expiry has been reached
   */
  public boolean isExpired(final TokenRecord record) {
    return record.isExpiredAt(clock.instant());
  }

  /**
   * Returns a usable token for a login, probing the cached one remotely.
   *
   * @see #ensureValid(String, String, String, boolean)
   */
  public TokenRecord ensureValid(final String login, final String secret) {
    return ensureValid(login, secret, null, true);
  }

  /**
   * Returns a usable token for a login, issuing a new one only when needed.
   *
   * <ol>
   *   <li>No current record: issue one.
   *   <li>Current record expired: issue a replacement and revoke the old record.
   *   <li>{@code validateRemote} set and the probe rejects the cached token: same as expired. An
   *       inconclusive probe keeps the cached token.
   *   <li>Otherwise return the cached record unchanged.
   * </ol>
   *
   * @param login account login
   * @param secret account password, used only if a grant is needed
   * @param otp one-time code, or null
   * @param validateRemote whether to probe the cached token against the remote service
   * @return current usable record
   * @throws AuthRejectedException if a grant is needed and the credentials are refused
   * @throws NetworkException if a grant is needed and the endpoint cannot be reached
   */
  public TokenRecord ensureValid(
      final String login, final String secret, final String otp, final boolean validateRemote) {
    final var cached = current(login);
    if (cached.isEmpty()) {
      logger.log(INFO, "No token on record for {0}, requesting one", login);
      return grantAndStore(login, secret, otp, null);
    }

    final var token = cached.get();
    if (isExpired(token)) {
      logger.log(INFO, "Token {0} for {1} expired at {2}", token.id(), login, token.expiresAt());
      return grantAndStore(login, secret, otp, token);
    }

    if (validateRemote) {
      switch (endpoint.probe(token.accessToken())) {
        case REJECTED:
          logger.log(INFO, "Token {0} for {1} was rejected remotely", token.id(), login);
          return grantAndStore(login, secret, otp, token);
        case INCONCLUSIVE:
          logger.log(WARNING, "Could not confirm token {0} for {1}, keeping it", token.id(), login);
          break;
        case ACCEPTED:
        default:
          break;
      }
    }

    logger.log(DEBUG, "Reusing token {0} for {1}", token.id(), login);
    return token;
  }

  /**
   * Revokes every live record of a login.
   *
   * @param login account login
   * @return number of records newly revoked (0 if all were already revoked)
   */
  public int revoke(final String login) {
    requireLogin(login);
    final var count = store.runScoped(uow -> repository.markRevokedForLogin(uow, login, now()));
    logger.log(INFO, "Revoked {0} token(s) for {1}", count, login);
    return count;
  }

  /**
   * Revokes one record. Revoking an already revoked record succeeds without changes.
   *
   * @param id record id
   * @return false if no record has this id
   */
  public boolean revokeById(final long id) {
    return store.runScoped(
        uow -> {
          if (repository.findById(uow, id).isEmpty()) return false;
          if (repository.markRevoked(uow, id, now())) logger.log(INFO, "Revoked token {0}", id);
          return true;
        });
  }

  /**
   * Deletes every revoked or expired record.
   *
   * @return number of records removed
   */
  public int purgeExpired() {
    final var count = store.runScoped(uow -> repository.deleteExpiredOrRevoked(uow, now()));
    logger.log(INFO, "Purged {0} expired or revoked token(s)", count);
    return count;
  }

  public Optional<TokenRecord> findById(final long id) {
    return store.runScoped(uow -> repository.findById(uow, id));
  }

  /**
   * Lists records, newest first.
   *
   * @param login account login, or null for every login
   * @return matching records
   */
  public List<TokenRecord> list(final String login) {
    return store.runScoped(uow -> repository.list(uow, login));
  }

  public boolean deleteById(final long id) {
    return store.runScoped(uow -> repository.deleteById(uow, id));
  }

  public int deleteForLogin(final String login) {
    requireLogin(login);
    return store.runScoped(uow -> repository.deleteForLogin(uow, login));
  }

  private TokenRecord grantAndStore(
      final String login, final String secret, final String otp, final TokenRecord superseded) {
    requireLogin(login);
    if (secret == null || secret.isEmpty())
      throw new IllegalArgumentException("secret is required");

    final var grant = endpoint.requestGrant(login, secret, otp);
    if (!grant.hasUsableLifetime())
      throw new NetworkException("Grant for " + login + " has an unusable expires_in", -1);
    final var issuedAt = now();
    final var stored =
        store.runScoped(
            uow -> {
              final var inserted =
                  repository.insert(uow, TokenRecord.fromGrant(login, grant, issuedAt));
              if (superseded != null) repository.markRevoked(uow, superseded.id(), issuedAt);
              return inserted;
            });

    logger.log(
        INFO,
        "Issued token {0} for {1}, expires {2}",
        stored.id(),
        login,
        stored.expiresAt() == null ? "never" : stored.expiresAt());
    return stored;
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }

  private static void requireLogin(final String login) {
    if (login == null || login.isBlank()) throw new IllegalArgumentException("login is required");
  }
}
