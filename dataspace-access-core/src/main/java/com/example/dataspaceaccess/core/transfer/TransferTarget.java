package com.example.dataspaceaccess.core.transfer;

import java.net.URI;
import java.nio.file.Path;

/**
 * One download: where from, where to, and the bearer token to present.
 *
 * @param source remote resource
 * @param destination final file path
 * @param accessToken bearer token sent in the {@code Authorization} header
 */
public record TransferTarget(URI source, Path destination, String accessToken) {

  public TransferTarget {
    if (source == null) throw new IllegalArgumentException("source is required");
    if (destination == null) throw new IllegalArgumentException("destination is required");
    if (accessToken == null || accessToken.isBlank())
      throw new IllegalArgumentException("accessToken is required");
  }

  @Override
  public String toString() {
    return "TransferTarget[source=%s, destination=%s]".formatted(source, destination);
  }
}
