package com.example.dataspaceaccess.core.transfer;

import java.net.URI;
import java.util.OptionalInt;

/** Raised when a download cannot be completed: terminal status, exhausted retries or abort. */
public class TransferFailedException extends RuntimeException {

  private final URI source;
  private final int lastStatus;

  public TransferFailedException(
      final String message, final URI source, final int lastStatus, final Throwable cause) {
    super(message, cause);
    this.source = source;
    this.lastStatus = lastStatus;
  }

  public URI source() {
    return source;
  }

  /**
   * HTTP status of the last response received, if any response arrived.
   *
   * @return last status or empty
   */
  public OptionalInt lastStatus() {
    return lastStatus > 0 ? OptionalInt.of(lastStatus) : OptionalInt.empty();
  }
}
