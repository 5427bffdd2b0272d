package com.example.dataspaceaccess.core.token;

/** Raised when the identity endpoint refuses the presented credentials. Never retried. */
public class AuthRejectedException extends RuntimeException {

  private final String login;
  private final int status;

  public AuthRejectedException(final String login, final int status, final String reason) {
    super(
        "Identity endpoint rejected credentials for %s (HTTP %d)%s"
            .formatted(login, status, reason == null ? "" : ": " + reason));
    this.login = login;
    this.status = status;
  }

  public String login() {
    return login;
  }

  public int status() {
    return status;
  }
}
