package com.example.dataspaceaccess.core.store;

import static org.junit.jupiter.api.Assertions.*;

import com.example.dataspaceaccess.core.TestSupport;
import java.sql.SQLException;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class StoreSchemaTest {

  private UnitOfWorkManager manager;
  private StoreSchema schema;

  @BeforeEach
  void setUp() {
    manager = new UnitOfWorkManager(TestSupport.h2DataSource());
    schema = new StoreSchema(manager);
  }

  @Test
  @DisplayName("Create should be repeatable")
  void createShouldBeIdempotent() throws SQLException {
    schema.create();
    schema.create();

    assertTrue(tableExists());
  }

  @Test
  @DisplayName("Drop should remove the token table")
  void dropShouldRemoveTable() throws SQLException {
    schema.create();
    schema.drop();

    assertFalse(tableExists());
  }

  @Test
  @DisplayName("A failing statement should discard the whole script")
  void failingScriptShouldRollBack() throws SQLException {
    schema.execute("CREATE TABLE scratch (id INT PRIMARY KEY); INSERT INTO scratch VALUES (1)");

    final var thrown =
        assertThrows(
            StoreException.class,
            () -> schema.execute("INSERT INTO scratch VALUES (2); INSERT INTO scratch VALUES (1)"));

    assertInstanceOf(SQLException.class, thrown.getCause());
    assertEquals(1, count("scratch"));
  }

  @Test
  @DisplayName("The expiry check constraint should reject an expiry before issuance")
  void checkConstraintShouldRejectInvertedExpiry() throws SQLException {
    schema.create();

    assertThrows(
        StoreException.class,
        () ->
            schema.execute(
                "INSERT INTO credential_token (login, access_token, issued_at, expires_at,"
                    + " created_at, updated_at) VALUES ('a', 't', TIMESTAMP WITH TIME ZONE"
                    + " '2024-01-01 10:00:00+00', TIMESTAMP WITH TIME ZONE '2024-01-01 09:00:00+00',"
                    + " CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)"));
    assertEquals(0, count("credential_token"));
  }

  private boolean tableExists() throws SQLException {
    return manager.runScoped(
        uow -> {
          try (final var rs =
              uow.connection().getMetaData().getTables(null, null, null, new String[] {"TABLE"})) {
            while (rs.next())
              if ("credential_token".equalsIgnoreCase(rs.getString("TABLE_NAME"))) return true;
            return false;
          }
        });
  }

  private int count(final String table) throws SQLException {
    return manager.runScoped(
        uow -> {
          try (final var st = uow.connection().createStatement();
              final var rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
          }
        });
  }
}
