package com.example.dataspaceaccess.core.token;

import java.util.OptionalInt;

/**
 * Raised when the identity endpoint cannot be reached or answers with something other than a grant
 * or a credential rejection.
 */
public class NetworkException extends RuntimeException {

  private final int status;

  public NetworkException(final String message, final Throwable cause) {
    super(message, cause);
    this.status = -1;
  }

  public NetworkException(final String message, final int status) {
    super(message);
    this.status = status;
  }

  public OptionalInt status() {
    return status > 0 ? OptionalInt.of(status) : OptionalInt.empty();
  }
}
