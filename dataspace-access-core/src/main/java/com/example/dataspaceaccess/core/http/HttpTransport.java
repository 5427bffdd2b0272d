package com.example.dataspaceaccess.core.http;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.dataspaceaccess.core.http.RetryBudget.Phase;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.lang.System.Logger;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.channels.UnresolvedAddressException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Sends HTTP requests and retries them according to a {@link RetryPolicy}.
 *
 * <p>Only idempotent methods are retried. Connection failures draw from the connect budget, other
 * I/O failures (including response timeouts) from the read budget, and responses with a retryable
 * status from the status budget. Once a status budget runs out the last response is returned
 * unchanged so the caller can report its status; once a connect or read budget runs out the last
 * {@link IOException} is rethrown.
 */
public final class HttpTransport {

  private static final Logger logger = System.getLogger(HttpTransport.class.getName());

  /** Waits between attempts. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(final Duration duration) throws InterruptedException;
  }

  private final HttpClient client;
  private final Sleeper sleeper;
  private final Clock clock;

  public HttpTransport(final HttpClient client) {
    this(client, duration -> Thread.sleep(duration.toMillis()), Clock.systemUTC());
  }

  public HttpTransport(final HttpClient client, final Sleeper sleeper, final Clock clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds an HTTP/1.1 client that follows same-protocol redirects.
   *
   * @param connectTimeout connection establishment timeout
   * @return configured client
   */
  public static HttpClient newClient(final Duration connectTimeout) {
    return HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(connectTimeout)
        .build();
  }

  public Sleeper sleeper() {
    return sleeper;
  }

  /**
   * Sends a request with a fresh budget drawn from {@code policy}.
   *
   * @param request request to send
   * @param handler response body handler
   * @param policy retry policy
   * @param <T> body type
   * @return the first non-retryable response, or the last response once the status budget is spent
   * @throws IOException if the request fails and no retry is left
   * @throws InterruptedException if interrupted while sending or waiting
   */
  public <T> HttpResponse<T> send(
      final HttpRequest request,
      final HttpResponse.BodyHandler<T> handler,
      final RetryPolicy policy)
      throws IOException, InterruptedException {
    return send(request, handler, new RetryBudget(policy));
  }

  /**
   * Sends a request drawing retries from a shared budget.
   *
   * @param request request to send
   * @param handler response body handler
   * @param budget remaining retries, shared with the caller's own retry loop
   * @param <T> body type
   * @return the first non-retryable response, or the last response once the status budget is spent
   * @throws IOException if the request fails and no retry is left
   * @throws InterruptedException if interrupted while sending or waiting
   */
  public <T> HttpResponse<T> send(
      final HttpRequest request, final HttpResponse.BodyHandler<T> handler, final RetryBudget budget)
      throws IOException, InterruptedException {
    return send(request, handler, budget, () -> false);
  }

  /**
   * Sends a request drawing retries from a shared budget, giving up once {@code cancelled} holds.
   *
   * <p>{@code cancelled} is checked before every attempt, so a cancellation during a wait between
   * attempts stops the request before it is sent again.
   *
   * @param request request to send
   * @param handler response body handler
   * @param budget remaining retries, shared with the caller's own retry loop
   * @param cancelled whether the caller has given up on the request
   * @param <T> body type
   * @return the first non-retryable response, or the last response once the status budget is spent
   * @throws InterruptedIOException if the request was cancelled
   * @throws IOException if the request fails and no retry is left
   * @throws InterruptedException if interrupted while sending or waiting
   */
  public <T> HttpResponse<T> send(
      final HttpRequest request,
      final HttpResponse.BodyHandler<T> handler,
      final RetryBudget budget,
      final BooleanSupplier cancelled)
      throws IOException, InterruptedException {
    final var policy = budget.policy();
    final var retryable = policy.isRetryableMethod(request.method());

    while (true) {
      if (cancelled.getAsBoolean())
        throw new InterruptedIOException(request.method() + " " + request.uri() + " cancelled");

      final HttpResponse<T> response;
      try {
        response = client.send(request, handler);
      } catch (final IOException e) {
        final var phase = phaseOf(e);
        if (!retryable || !budget.consume(phase)) {
          if (retryable)
            logger.log(WARNING, "{0} {1}: {2} retries exhausted", request.method(), request.uri(), phase);
          throw e;
        }
        final var delay = budget.nextDelay(Optional.empty());
        logger.log(
            DEBUG,
            "{0} {1} failed ({2}: {3}), retry {4} in {5} ms",
            request.method(),
            request.uri(),
            phase,
            e.getClass().getSimpleName(),
            budget.consumed(),
            delay.toMillis());
        sleeper.sleep(delay);
        continue;
      }

      final var code = response.statusCode();
      if (!retryable || !policy.isRetryableStatus(code)) return response;

      if (!budget.consume(Phase.STATUS)) {
        logger.log(
            WARNING, "{0} {1}: still HTTP {2} after retries", request.method(), request.uri(), code);
        return response;
      }

      final var delay = budget.nextDelay(RetryAfter.parse(response.headers(), clock));
      logger.log(
          DEBUG,
          "{0} {1} returned HTTP {2}, retry {3} in {4} ms",
          request.method(),
          request.uri(),
          code,
          budget.consumed(),
          delay.toMillis());
      discard(response);
      sleeper.sleep(delay);
    }
  }

  /**
   * Classifies a transport failure.
   *
   * @param e failure raised by the HTTP client
   * @return {@link Phase#CONNECT} if no connection was established, otherwise {@link Phase#READ}
   */
  static Phase phaseOf(final IOException e) {
    Throwable cur = e;
    while (cur != null) {
      if (cur instanceof ConnectException
          || cur instanceof HttpConnectTimeoutException
          || cur instanceof UnresolvedAddressException) return Phase.CONNECT;
      cur = cur.getCause();
    }
    return Phase.READ;
  }

  private static void discard(final HttpResponse<?> response) {
    if (response.body() instanceof AutoCloseable body) {
      try {
        body.close();
      } catch (final Exception e) {
        logger.log(DEBUG, "Failed to discard response body: {0}", e.getMessage());
      }
    }
  }
}
