package com.example.dataspaceaccess.core.config;

/**
 * PostgreSQL connection settings for the backing store.
 *
 * <p>Resolved from system properties, then environment variables, then defaults:
 *
 * <ul>
 *   <li>dataspace.pg.host / PG_HOST (localhost)
 *   <li>dataspace.pg.port / PG_PORT (5432)
 *   <li>dataspace.pg.db / PG_DB (sda)
 *   <li>dataspace.pg.user / PG_USER (sda)
 *   <li>dataspace.pg.password / PG_PASS (empty)
 *   <li>dataspace.pg.pool-size / PG_POOL_SIZE (10)
 * </ul>
 *
 * @param host database host
 * @param port database port
 * @param database database name
 * @param username login role
 * @param password login password
 * @param poolSize maximum pooled connections
 */
public record StoreSettings(
    String host, int port, String database, String username, String password, int poolSize) {

  public StoreSettings {
    if (host == null || host.isBlank()) throw new IllegalArgumentException("host is required");
    if (port < 1 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
    if (database == null || database.isBlank())
      throw new IllegalArgumentException("database is required");
    if (username == null || username.isBlank())
      throw new IllegalArgumentException("username is required");
    if (poolSize < 1) throw new IllegalArgumentException("poolSize must be >= 1");
    password = password == null ? "" : password;
  }

  /**
   * Loads settings from system properties and environment variables.
   *
   * @return resolved settings
   */
  public static StoreSettings load() {
    return new StoreSettings(
        Settings.string("dataspace.pg.host", "PG_HOST", "localhost"),
        Settings.integer("dataspace.pg.port", "PG_PORT", 5432),
        Settings.string("dataspace.pg.db", "PG_DB", "sda"),
        Settings.string("dataspace.pg.user", "PG_USER", "sda"),
        Settings.string("dataspace.pg.password", "PG_PASS", ""),
        Settings.integer("dataspace.pg.pool-size", "PG_POOL_SIZE", 10));
  }

  /**
   * JDBC URL for the PostgreSQL driver.
   *
   * @return jdbc:postgresql URL
   */
  public String jdbcUrl() {
    return "jdbc:postgresql://%s:%d/%s".formatted(host, port, database);
  }

  @Override
  public String toString() {
    return "StoreSettings[host=%s, port=%d, database=%s, username=%s, password=***, poolSize=%d]"
        .formatted(host, port, database, username, poolSize);
  }
}
