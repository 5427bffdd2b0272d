package com.example.dataspaceaccess.core.store;

import static java.lang.System.Logger.Level.INFO;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Objects;

/** Creates and drops the tables owned by this library. */
public final class StoreSchema {

  private static final Logger logger = System.getLogger(StoreSchema.class.getName());

  static final String CREATE_SCRIPT = "/schema/credential_token.sql";
  static final String DROP_SCRIPT = "DROP TABLE IF EXISTS credential_token";

  private final UnitOfWorkManager manager;

  public StoreSchema(final UnitOfWorkManager manager) {
    this.manager = Objects.requireNonNull(manager, "manager");
  }

  /** Creates the token table and its index if they do not exist yet. */
  public void create() {
    execute(loadScript(CREATE_SCRIPT));
    logger.log(INFO, "Token schema is in place");
  }

  /** Drops the token table and every record in it. */
  public void drop() {
    execute(DROP_SCRIPT);
    logger.log(INFO, "Token schema dropped");
  }

  /**
   * Executes a semicolon-separated script in a single scoped transaction.
   *
   * @param script SQL statements
   * @throws StoreException if any statement fails; nothing from the script is kept
   */
  public void execute(final String script) {
    final var statements =
        Arrays.stream(script.split(";")).map(String::trim).filter(s -> !s.isEmpty()).toList();

    manager.runScoped(
        uow -> {
          try (final var st = uow.connection().createStatement()) {
            for (final var sql : statements) st.execute(sql);
          } catch (final SQLException e) {
            throw new StoreException("Schema script failed", e);
          }
          return null;
        });
  }

  private static String loadScript(final String resource) {
    try (final var in = StoreSchema.class.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalStateException("Missing schema resource " + resource);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
