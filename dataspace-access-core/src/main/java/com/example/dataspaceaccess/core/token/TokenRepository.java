package com.example.dataspaceaccess.core.token;

import com.example.dataspaceaccess.core.store.StoreException;
import com.example.dataspaceaccess.core.store.UnitOfWork;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** JDBC access to the {@code credential_token} table through an explicit {@link UnitOfWork}. */
public final class TokenRepository {

  private static final String COLUMNS =
      "id, login, access_token, refresh_token, token_type, scope, expires_in_s, issued_at,"
          + " expires_at, is_revoked, created_at, updated_at";

  private static final String NEWEST_FIRST = " ORDER BY issued_at DESC, id DESC";

  public TokenRecord insert(final UnitOfWork uow, final TokenRecord record) {
    final var sql =
        "INSERT INTO credential_token (login, access_token, refresh_token, token_type, scope,"
            + " expires_in_s, issued_at, expires_at, is_revoked, created_at, updated_at)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    try (final var ps = uow.connection().prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      ps.setString(1, record.login());
      ps.setString(2, record.accessToken());
      ps.setString(3, record.refreshToken());
      ps.setString(4, record.tokenType());
      ps.setString(5, record.scope());
      if (record.expiresInSeconds() == null) ps.setNull(6, Types.BIGINT);
      else ps.setLong(6, record.expiresInSeconds());
      setInstant(ps, 7, record.issuedAt());
      setInstant(ps, 8, record.expiresAt());
      ps.setBoolean(9, record.revoked());
      setInstant(ps, 10, record.createdAt());
      setInstant(ps, 11, record.updatedAt());
      ps.executeUpdate();

      try (final var keys = ps.getGeneratedKeys()) {
        if (!keys.next()) throw new StoreException("No key generated for token", null);
        return record.withId(keys.getLong("id"));
      }
    } catch (final SQLException e) {
      throw new StoreException("Failed to insert token for " + record.login(), e);
    }
  }

  public Optional<TokenRecord> findById(final UnitOfWork uow, final long id) {
    return queryOne(
        uow, "SELECT " + COLUMNS + " FROM credential_token WHERE id = ?", ps -> ps.setLong(1, id));
  }

  /**
   * Most recently issued non-revoked record for a login, expired or not.
   *
   * @param uow unit of work
   * @param login account login
   * @return current record, or empty
   */
  public Optional<TokenRecord> findCurrent(final UnitOfWork uow, final String login) {
    return queryOne(
        uow,
        "SELECT "
            + COLUMNS
            + " FROM credential_token WHERE login = ? AND is_revoked = FALSE"
            + NEWEST_FIRST
            + " LIMIT 1",
        ps -> ps.setString(1, login));
  }

  public List<TokenRecord> list(final UnitOfWork uow, final String login) {
    final var sql =
        login == null
            ? "SELECT " + COLUMNS + " FROM credential_token" + NEWEST_FIRST
            : "SELECT " + COLUMNS + " FROM credential_token WHERE login = ?" + NEWEST_FIRST;
    try (final var ps = uow.connection().prepareStatement(sql)) {
      if (login != null) ps.setString(1, login);
      try (final var rs = ps.executeQuery()) {
        final var records = new ArrayList<TokenRecord>();
        while (rs.next()) records.add(map(rs));
        return records;
      }
    } catch (final SQLException e) {
      throw new StoreException("Failed to list tokens", e);
    }
  }

  public boolean markRevoked(final UnitOfWork uow, final long id, final Instant at) {
    return update(
            uow,
            "UPDATE credential_token SET is_revoked = TRUE, updated_at = ?"
                + " WHERE id = ? AND is_revoked = FALSE",
            ps -> {
              setInstant(ps, 1, at);
              ps.setLong(2, id);
            })
        > 0;
  }

  public int markRevokedForLogin(final UnitOfWork uow, final String login, final Instant at) {
    return update(
        uow,
        "UPDATE credential_token SET is_revoked = TRUE, updated_at = ?"
            + " WHERE login = ? AND is_revoked = FALSE",
        ps -> {
          setInstant(ps, 1, at);
          ps.setString(2, login);
        });
  }

  public boolean deleteById(final UnitOfWork uow, final long id) {
    return update(uow, "DELETE FROM credential_token WHERE id = ?", ps -> ps.setLong(1, id)) > 0;
  }

  public int deleteForLogin(final UnitOfWork uow, final String login) {
    return update(uow, "DELETE FROM credential_token WHERE login = ?", ps -> ps.setString(1, login));
  }

  /**
   * Deletes records that are revoked or whose expiry is at or before {@code now}.
   *
   * @param uow unit of work
   * @param now reference instant
   * @return number of deleted records
   */
  public int deleteExpiredOrRevoked(final UnitOfWork uow, final Instant now) {
    return update(
        uow,
        "DELETE FROM credential_token WHERE is_revoked = TRUE"
            + " OR (expires_at IS NOT NULL AND expires_at <= ?)",
        ps -> setInstant(ps, 1, now));
  }

  @FunctionalInterface
  private interface Binder {
    void bind(final PreparedStatement ps) throws SQLException;
  }

  private Optional<TokenRecord> queryOne(
      final UnitOfWork uow, final String sql, final Binder binder) {
    try (final var ps = uow.connection().prepareStatement(sql)) {
      binder.bind(ps);
      try (final var rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    } catch (final SQLException e) {
      throw new StoreException("Token query failed", e);
    }
  }

  private int update(final UnitOfWork uow, final String sql, final Binder binder) {
    try (final var ps = uow.connection().prepareStatement(sql)) {
      binder.bind(ps);
      return ps.executeUpdate();
    } catch (final SQLException e) {
      throw new StoreException("Token update failed", e);
    }
  }

  private static TokenRecord map(final ResultSet rs) throws SQLException {
    return new TokenRecord(
        rs.getLong("id"),
        rs.getString("login"),
        rs.getString("access_token"),
        rs.getString("refresh_token"),
        rs.getString("token_type"),
        rs.getString("scope"),
        getLong(rs, "expires_in_s"),
        getInstant(rs, "issued_at"),
        getInstant(rs, "expires_at"),
        rs.getBoolean("is_revoked"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }

  private static void setInstant(final PreparedStatement ps, final int index, final Instant value)
      throws SQLException {
    if (value == null) ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
    else ps.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
  }

  private static Long getLong(final ResultSet rs, final String column) throws SQLException {
    final var value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  private static Instant getInstant(final ResultSet rs, final String column) throws SQLException {
    final var value = rs.getObject(column, OffsetDateTime.class);
    return value == null ? null : value.toInstant();
  }
}
