package com.example.dataspaceaccess.core.store;

/** Raised when no connection to the backing store can be obtained. */
public class StoreUnavailableException extends StoreException {

  public StoreUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
