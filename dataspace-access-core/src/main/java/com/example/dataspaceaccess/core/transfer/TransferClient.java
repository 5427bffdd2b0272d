package com.example.dataspaceaccess.core.transfer;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.dataspaceaccess.core.config.AccessSettings;
import com.example.dataspaceaccess.core.http.HttpTransport;
import com.example.dataspaceaccess.core.http.RetryBudget;
import com.example.dataspaceaccess.core.http.RetryBudget.Phase;
import com.example.dataspaceaccess.core.http.RetryPolicy;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.System.Logger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Streams remote resources to disk under a bearer token.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var client = TransferClient.builder().build();
 * var file = client.fetch(uri, Path.of("data/scene.zip"), token.accessToken(), Timeouts.defaults());
 * }</pre>
 *
 * <p>Bytes are written to {@code <destination>.part} next to the destination and moved onto the
 * destination only once the whole body has arrived, so the destination either does not exist or is
 * complete. Connection failures, read failures and retryable statuses are retried under the
 * configured {@link RetryPolicy}; a read failure after some bytes arrived resumes with a {@code
 * Range} request. Any other status fails at once.
 *
 * <p>A part file left behind by a failed transfer is overwritten by the next fetch of the same
 * destination.
 *
 * <p>One {@link HttpClient} is built per distinct connect timeout and reused by every later fetch
 * with that timeout.
 */
public final class TransferClient {

  private static final Logger logger = System.getLogger(TransferClient.class.getName());

  private static final Pattern CONTENT_RANGE = Pattern.compile("bytes (\\d+)-(\\d+)/(\\d+|\\*)");

  static final String PART_SUFFIX = ".part";

  private final RetryPolicy retryPolicy;
  private final Function<Duration, HttpClient> clientFactory;
  private final HttpTransport.Sleeper sleeper;
  private final Clock clock;
  private final int chunkSize;
  private final Map<Duration, HttpClient> clients = new ConcurrentHashMap<>();

  private TransferClient(final Builder builder) {
    this.retryPolicy = builder.retryPolicy;
    this.clientFactory = builder.clientFactory;
    this.sleeper = builder.sleeper;
    this.clock = builder.clock;
    this.chunkSize = builder.chunkSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a client whose retry budgets and backoff come from settings.
   *
   * @param settings resolved settings
   * @return client
   */
  public static TransferClient create(final AccessSettings settings) {
    return builder().retryPolicy(RetryPolicy.from(settings)).build();
  }

  /** Builder for {@link TransferClient}. */
  public static class Builder {
    private RetryPolicy retryPolicy = RetryPolicy.defaults();
    private Function<Duration, HttpClient> clientFactory = HttpTransport::newClient;
    private HttpTransport.Sleeper sleeper;
    private Clock clock = Clock.systemUTC();
    private int chunkSize = 1024 * 1024;

    private Builder() {}

    /**
     * Sets the retry policy.
     *
     * <p>Default: {@link RetryPolicy#defaults()}
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(final RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the factory building an HTTP client for a given connect timeout.
     *
     * @param clientFactory factory
     * @return this builder
     */
    public Builder clientFactory(final Function<Duration, HttpClient> clientFactory) {
      this.clientFactory = clientFactory;
      return this;
    }

    /**
     * Sets how the client waits between attempts.
     *
     * <p>Default: waits on the transfer's {@link TransferControl}, so an abort ends the wait early
     *
     * @param sleeper wait strategy, or null for the default
     * @return this builder
     */
    public Builder sleeper(final HttpTransport.Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the read buffer size.
     *
     * <p>Default: 1 MiB
     *
     * @param chunkSize bytes per read
     * @return this builder
     */
    public Builder chunkSize(final int chunkSize) {
      this.chunkSize = chunkSize;
      return this;
    }

    public TransferClient build() {
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy cannot be null");
      if (clientFactory == null) throw new IllegalStateException("clientFactory cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
      return new TransferClient(this);
    }
  }

  /**
   * Downloads {@code url} to {@code destination}.
   *
   * @param url source
   * @param destination final path
   * @param accessToken bearer token
   * @param timeouts connect and read timeouts
   * @return {@code destination}
   * @throws TransferFailedException if the transfer cannot be completed
   * @throws FilesystemException if the destination cannot be prepared or written
   */
  public Path fetch(
      final URI url, final Path destination, final String accessToken, final Timeouts timeouts) {
    return fetch(
        new TransferTarget(url, destination, accessToken),
        timeouts,
        TransferListener.none(),
        new TransferControl());
  }

  /**
   * Downloads {@code url} to {@code destination}, reporting progress.
   *
   * @param url source
   * @param destination final path
   * @param accessToken bearer token
   * @param timeouts connect and read timeouts
   * @param listener progress callback
   * @return {@code destination}
   */
  public Path fetch(
      final URI url,
      final Path destination,
      final String accessToken,
      final Timeouts timeouts,
      final TransferListener listener) {
    return fetch(
        new TransferTarget(url, destination, accessToken),
        timeouts,
        listener,
        new TransferControl());
  }

  /**
   * Downloads a target, reporting progress and honouring aborts.
   *
   * @param target source, destination and token
   * @param timeouts connect and read timeouts
   * @param listener progress callback
   * @param control abort handle; another thread may call {@link TransferControl#abort()}
   * @return the target's destination
   * @throws TransferFailedException if the transfer cannot be completed or was aborted
   * @throws FilesystemException if the destination cannot be prepared or written
   */
  public Path fetch(
      final TransferTarget target,
      final Timeouts timeouts,
      final TransferListener listener,
      final TransferControl control) {
    final var source = target.source();
    final var destination = target.destination().toAbsolutePath();
    final var part = partFileFor(destination);

    prepareDirectory(destination.getParent());

    final HttpTransport.Sleeper wait = sleeper != null ? sleeper : control::await;
    final var transport =
        new HttpTransport(clients.computeIfAbsent(timeouts.connect(), clientFactory), wait, clock);
    final var budget = new RetryBudget(retryPolicy);
    var written = 0L;
    var lastStatus = -1;

    try {
      while (true) {
        if (control.isAborted())
          throw new TransferFailedException("Transfer aborted", source, lastStatus, null);

        final HttpResponse<InputStream> response;
        try {
          response =
              transport.send(
                  request(target, timeouts, written),
                  HttpResponse.BodyHandlers.ofInputStream(),
                  budget,
                  control::isAborted);
        } catch (final IOException e) {
          if (control.isAborted())
            throw new TransferFailedException("Transfer aborted", source, lastStatus, e);
          throw new TransferFailedException(
              "Transfer of %s failed after %d retries".formatted(source, budget.consumed()),
              source,
              lastStatus,
              e);
        }

        lastStatus = response.statusCode();
        final var range = contentRange(response);
        final boolean append;
        if (lastStatus == 206 && range.start() == written) {
          append = written > 0;
        } else if (lastStatus >= 200 && lastStatus < 300 && lastStatus != 206) {
          append = false;
          written = 0L;
        } else if (lastStatus == 206 && written > 0) {
          closeBody(response.body());
          logger.log(WARNING, "Partial content for {0} does not continue the part file", source);
          written = 0L;
          if (!budget.consume(Phase.READ))
            throw new TransferFailedException(
                "Transfer of %s could not be resumed".formatted(source), source, lastStatus, null);
          continue;
        } else {
          closeBody(response.body());
          throw new TransferFailedException(
              "Transfer of %s failed with HTTP %d".formatted(source, lastStatus),
              source,
              lastStatus,
              null);
        }

        final var expected =
            lastStatus == 206
                ? range.total()
                : response.headers().firstValueAsLong("Content-Length").orElse(-1L);

        final var in = response.body();
        control.attach(in);
        try (in) {
          written = copy(in, part, append, written, expected, listener);
          if (expected >= 0 && written < expected)
            throw new EOFException("Body ended after %d of %d bytes".formatted(written, expected));
          break;
        } catch (final IOException e) {
          if (control.isAborted())
            throw new TransferFailedException("Transfer aborted", source, lastStatus, e);

          written = sizeOf(part);
          if (!budget.consume(Phase.READ))
            throw new TransferFailedException(
                "Transfer of %s failed after %d retries".formatted(source, budget.consumed()),
                source,
                lastStatus,
                e);

          final var delay = budget.nextDelay(Optional.empty());
          logger.log(
              DEBUG,
              "Read of {0} failed at byte {1} ({2}), retry {3} in {4} ms",
              source,
              written,
              e.getMessage(),
              budget.consumed(),
              delay.toMillis());
          wait.sleep(delay);
        } finally {
          control.detach(in);
        }
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransferFailedException("Transfer interrupted", source, lastStatus, e);
    }

    moveIntoPlace(part, destination);
    logger.log(
        INFO,
        "Fetched {0} ({1} bytes, {2} retries)",
        destination.getFileName(),
        written,
        budget.consumed());
    return target.destination();
  }

  static Path partFileFor(final Path destination) {
    return destination.resolveSibling(destination.getFileName() + PART_SUFFIX);
  }

  private static HttpRequest request(
      final TransferTarget target, final Timeouts timeouts, final long offset) {
    final var builder =
        HttpRequest.newBuilder(target.source())
            .header("Authorization", "Bearer " + target.accessToken())
            .header("Accept-Encoding", "identity")
            .timeout(timeouts.read())
            .GET();
    if (offset > 0) builder.header("Range", "bytes=" + offset + "-");
    return builder.build();
  }

  private long copy(
      final InputStream in,
      final Path part,
      final boolean append,
      final long offset,
      final long expected,
      final TransferListener listener)
      throws IOException {
    final var out = openPart(part, append);
    var written = offset;
    Throwable failure = null;
    try {
      listener.onProgress(written, expected);
      final var buffer = new byte[chunkSize];
      int n;
      while ((n = in.read(buffer)) != -1) {
        if (n == 0) continue;
        try {
          out.write(buffer, 0, n);
        } catch (final IOException e) {
          throw new FilesystemException("Cannot write part file", part, e);
        }
        written += n;
        listener.onProgress(written, expected);
      }
    } catch (final IOException | RuntimeException e) {
      failure = e;
      throw e;
    } finally {
      closePart(out, part, failure);
    }
    return written;
  }

  /**
   * Closes a part file stream.
   *
   * <p>If the copy already failed, a close failure is attached to that failure as suppressed.
   *
   * @param out part file stream
   * @param part part file path
   * @param failure the failure that ended the copy, or null if it completed
   * @throws FilesystemException if closing fails after a complete copy
   */
  static void closePart(final OutputStream out, final Path part, final Throwable failure) {
    try {
      out.close();
    } catch (final IOException e) {
      if (failure == null) throw new FilesystemException("Cannot flush part file", part, e);
      failure.addSuppressed(e);
    }
  }

  private static OutputStream openPart(final Path part, final boolean append) {
    try {
      return Files.newOutputStream(
          part,
          StandardOpenOption.CREATE,
          StandardOpenOption.WRITE,
          append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING);
    } catch (final IOException e) {
      throw new FilesystemException("Cannot open part file", part, e);
    }
  }

  private static long sizeOf(final Path part) {
    try {
      return Files.exists(part) ? Files.size(part) : 0L;
    } catch (final IOException e) {
      throw new FilesystemException("Cannot inspect part file", part, e);
    }
  }

  private static void prepareDirectory(final Path directory) {
    try {
      Files.createDirectories(directory);
    } catch (final IOException e) {
      throw new FilesystemException("Cannot create destination directory", directory, e);
    }
  }

  private static void moveIntoPlace(final Path part, final Path destination) {
    try {
      try {
        Files.move(
            part, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (final AtomicMoveNotSupportedException e) {
        Files.move(part, destination, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (final IOException e) {
      throw new FilesystemException("Cannot move part file into place", destination, e);
    }
  }

  private static void closeBody(final InputStream body) {
    try {
      body.close();
    } catch (final IOException e) {
      logger.log(DEBUG, "Failed to close response body: {0}", e.getMessage());
    }
  }

  private static ContentRange contentRange(final HttpResponse<?> response) {
    return response
        .headers()
        .firstValue("Content-Range")
        .map(CONTENT_RANGE::matcher)
        .filter(Matcher::matches)
        .map(
            m ->
                new ContentRange(
                    Long.parseLong(m.group(1)),
                    "*".equals(m.group(3)) ? -1L : Long.parseLong(m.group(3))))
        .orElse(new ContentRange(-1L, -1L));
  }

  private record ContentRange(long start, long total) {}
}
