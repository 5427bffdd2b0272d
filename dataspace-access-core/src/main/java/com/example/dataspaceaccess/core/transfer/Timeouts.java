package com.example.dataspaceaccess.core.transfer;

import com.example.dataspaceaccess.core.config.AccessSettings;
import java.time.Duration;

/**
 * Per-download timeouts.
 *
 * @param connect time allowed to establish a connection
 * @param read time allowed for the response to start arriving
 */
public record Timeouts(Duration connect, Duration read) {

  public Timeouts {
    if (connect == null || connect.isNegative() || connect.isZero())
      throw new IllegalArgumentException("connect timeout must be positive");
    if (read == null || read.isNegative() || read.isZero())
      throw new IllegalArgumentException("read timeout must be positive");
  }

  /** 10 s to connect, 600 s for the response to start. */
  public static Timeouts defaults() {
    return new Timeouts(Duration.ofSeconds(10), Duration.ofSeconds(600));
  }

  public static Timeouts from(final AccessSettings settings) {
    return new Timeouts(settings.connectTimeout(), settings.readTimeout());
  }
}
