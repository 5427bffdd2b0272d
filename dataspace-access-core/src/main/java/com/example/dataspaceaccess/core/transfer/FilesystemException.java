package com.example.dataspaceaccess.core.transfer;

import java.nio.file.Path;

/** Raised when the destination of a download cannot be prepared, written or moved into place. */
public class FilesystemException extends RuntimeException {

  private final Path path;

  public FilesystemException(final String message, final Path path, final Throwable cause) {
    super(message + ": " + path, cause);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
