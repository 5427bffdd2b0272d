package com.example;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.dataspaceaccess.core.config.AccessSettings;
import com.example.dataspaceaccess.core.config.StoreSettings;
import com.example.dataspaceaccess.core.store.StoreSchema;
import com.example.dataspaceaccess.core.store.UnitOfWorkManager;
import com.example.dataspaceaccess.core.token.HttpIdentityEndpoint;
import com.example.dataspaceaccess.core.token.TokenLifecycleManager;
import com.example.dataspaceaccess.core.transfer.Timeouts;
import com.example.dataspaceaccess.core.transfer.TransferClient;
import java.lang.System.Logger;
import java.net.URI;
import java.nio.file.Path;

/**
 * Downloads one resource from the dataspace with a token cached in PostgreSQL.
 *
 * <p>Usage: {@code App <url> <destination>} with {@code CDSE_USER} and {@code CDSE_PASS} (and
 * optionally {@code CDSE_TOTP}) in the environment.
 */
public class App {

  private static final Logger logger = System.getLogger(App.class.getName());

  private final UnitOfWorkManager store;
  private final TokenLifecycleManager tokens;
  private final TransferClient transfers;
  private final Timeouts timeouts;

  public App(final StoreSettings storeSettings, final AccessSettings accessSettings) {
    this.store = new UnitOfWorkManager(Pool.hikari(storeSettings));
    new StoreSchema(store).create();
    this.tokens = new TokenLifecycleManager(store, HttpIdentityEndpoint.create(accessSettings));
    this.transfers = TransferClient.create(accessSettings);
    this.timeouts = Timeouts.from(accessSettings);
  }

  /**
   * Fetches {@code url} to {@code destination} with a valid token for {@code login}.
   *
   * @return the destination path
   */
  public Path download(
      final URI url,
      final Path destination,
      final String login,
      final String secret,
      final String otp) {
    final var token = tokens.ensureValid(login, secret, otp, true);
    return transfers.fetch(url, destination, token.accessToken(), timeouts);
  }

  public TokenLifecycleManager tokens() {
    return tokens;
  }

  public void shutdown() {
    store.shutdown();
  }

  public static void main(final String[] args) {
    if (args.length != 2) {
      System.err.println("usage: App <url> <destination>");
      System.exit(2);
    }
    final var login = System.getenv("CDSE_USER");
    final var secret = System.getenv("CDSE_PASS");
    if (login == null || secret == null) {
      System.err.println("CDSE_USER and CDSE_PASS must be set");
      System.exit(2);
    }

    final var app = new App(StoreSettings.load(), AccessSettings.load());
    var status = 0;
    try {
      final var otp = System.getenv("CDSE_TOTP");
      final var path = app.download(URI.create(args[0]), Path.of(args[1]), login, secret, otp);
      logger.log(INFO, "Saved {0}", path.toAbsolutePath());
    } catch (final RuntimeException e) {
      logger.log(ERROR, "Download failed", e);
      status = 1;
    } finally {
      app.shutdown();
    }
    System.exit(status);
  }
}
