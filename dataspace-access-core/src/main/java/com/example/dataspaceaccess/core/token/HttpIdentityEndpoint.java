package com.example.dataspaceaccess.core.token;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.dataspaceaccess.core.config.AccessSettings;
import com.example.dataspaceaccess.core.http.HttpTransport;
import com.example.dataspaceaccess.core.http.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.lang.System.Logger;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * OpenID Connect token endpoint accessed with the resource-owner password grant.
 *
 * <p>Grants are POSTed as {@code application/x-www-form-urlencoded} with {@code username}, {@code
 * password}, {@code grant_type=password}, {@code client_id} and, when present, {@code totp}. The
 * transport never retries a POST, so a grant is attempted exactly once per call.
 */
public final class HttpIdentityEndpoint implements IdentityEndpoint {

  private static final Logger logger = System.getLogger(HttpIdentityEndpoint.class.getName());

  static final String GRANT_TYPE_PASSWORD = "password";
  static final Set<Integer> REJECTION_STATUSES = Set.of(400, 401, 403);

  private static final Duration GRANT_TIMEOUT = Duration.ofSeconds(60);
  private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(20);

  private final URI tokenUrl;
  private final String clientId;
  private final URI probeUrl;
  private final HttpTransport transport;
  private final ObjectMapper mapper;
  private final Duration grantTimeout;
  private final Duration probeTimeout;

  public HttpIdentityEndpoint(
      final URI tokenUrl, final String clientId, final URI probeUrl, final HttpTransport transport) {
    this(tokenUrl, clientId, probeUrl, transport, new ObjectMapper(), GRANT_TIMEOUT, PROBE_TIMEOUT);
  }

  public HttpIdentityEndpoint(
      final URI tokenUrl,
      final String clientId,
      final URI probeUrl,
      final HttpTransport transport,
      final ObjectMapper mapper,
      final Duration grantTimeout,
      final Duration probeTimeout) {
    this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.probeUrl = Objects.requireNonNull(probeUrl, "probeUrl");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.grantTimeout = Objects.requireNonNull(grantTimeout, "grantTimeout");
    this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout");
  }

  /**
   * Creates an endpoint from settings.
   *
   * @param settings resolved settings
   * @return endpoint
   */
  public static HttpIdentityEndpoint create(final AccessSettings settings) {
    return new HttpIdentityEndpoint(
        settings.identityUrl(),
        settings.clientId(),
        settings.probeUrl(),
        new HttpTransport(HttpTransport.newClient(settings.connectTimeout())));
  }

  @Override
  public TokenGrant requestGrant(final String login, final String secret, final String otp) {
    final var form = new LinkedHashMap<String, String>();
    form.put("username", login);
    form.put("password", secret);
    form.put("grant_type", GRANT_TYPE_PASSWORD);
    form.put("client_id", clientId);
    if (otp != null) form.put("totp", otp);

    final var request =
        HttpRequest.newBuilder(tokenUrl)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .timeout(grantTimeout)
            .POST(HttpRequest.BodyPublishers.ofString(encode(form)))
            .build();

    final HttpResponse<String> response;
    try {
      response =
          transport.send(request, HttpResponse.BodyHandlers.ofString(), RetryPolicy.defaults());
    } catch (final IOException e) {
      throw new NetworkException("Identity endpoint " + tokenUrl + " is unreachable", e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NetworkException("Interrupted while requesting a grant", e);
    }

    final var status = response.statusCode();
    if (REJECTION_STATUSES.contains(status))
      throw new AuthRejectedException(login, status, errorDescription(response.body()));
    if (status < 200 || status >= 300)
      throw new NetworkException("Identity endpoint returned HTTP " + status, status);

    final TokenGrant grant;
    try {
      grant = mapper.readValue(response.body(), TokenGrant.class);
    } catch (final JsonProcessingException e) {
      throw new NetworkException("Identity endpoint returned a malformed grant", e);
    }
    if (grant == null || grant.accessToken() == null || grant.accessToken().isBlank())
      throw new NetworkException("Identity endpoint response carried no access_token", status);
    if (!grant.hasUsableLifetime())
      throw new NetworkException(
          "Identity endpoint returned an unusable expires_in: " + grant.expiresIn(), status);

    logger.log(DEBUG, "Received grant for {0}: {1}", login, grant);
    return grant;
  }

  @Override
  public ProbeResult probe(final String accessToken) {
    final var request =
        HttpRequest.newBuilder(probeUrl)
            .header("Authorization", "Bearer " + accessToken)
            .timeout(probeTimeout)
            .GET()
            .build();
    try {
      final var response =
          transport.send(request, HttpResponse.BodyHandlers.discarding(), RetryPolicy.none());
      final var result = ProbeResult.ofStatus(response.statusCode());
      logger.log(DEBUG, "Probe returned HTTP {0}: {1}", response.statusCode(), result);
      return result;
    } catch (final IOException e) {
      logger.log(WARNING, "Probe of {0} failed: {1}", probeUrl, e.toString());
      return ProbeResult.INCONCLUSIVE;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return ProbeResult.INCONCLUSIVE;
    }
  }

  private String errorDescription(final String body) {
    if (body == null || body.isBlank()) return null;
    try {
      final var json = mapper.readTree(body);
      if (json.hasNonNull("error_description")) return json.get("error_description").asText();
      if (json.hasNonNull("error")) return json.get("error").asText();
    } catch (final JsonProcessingException e) {
      logger.log(DEBUG, "Rejection body is not JSON");
    }
    return null;
  }

  private static String encode(final Map<String, String> form) {
    return form.entrySet().stream()
        .map(
            e ->
                URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }
}
