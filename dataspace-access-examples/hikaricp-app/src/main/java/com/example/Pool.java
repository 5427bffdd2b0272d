package com.example;

import com.example.dataspaceaccess.core.config.StoreSettings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public class Pool {

  private Pool() {}

  /**
   * Builds a HikariCP pool for the token store. Connections start with auto-commit off; the
   * unit-of-work layer owns transaction boundaries.
   */
  public static HikariDataSource hikari(final StoreSettings settings) {
    final var config = new HikariConfig();
    config.setPoolName("dataspace-access");
    config.setJdbcUrl(settings.jdbcUrl());
    config.setUsername(settings.username());
    config.setPassword(settings.password());
    config.setMaximumPoolSize(settings.poolSize());
    config.setAutoCommit(false);
    return new HikariDataSource(config);
  }
}
