package com.example.dataspaceaccess.core.token;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.*;

import com.example.dataspaceaccess.core.TestSupport;
import com.example.dataspaceaccess.core.http.HttpTransport;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class HttpIdentityEndpointTest {

  private static final String TOKEN_PATH = "/realms/test/protocol/openid-connect/token";
  private static final String PROBE_PATH = "/v1";

  private WireMockServer wireMock;
  private HttpIdentityEndpoint endpoint;

  @BeforeAll
  void startServer() {
    wireMock = new WireMockServer(options().dynamicPort());
    wireMock.start();
    endpoint = endpointAt(wireMock.baseUrl());
  }

  @AfterAll
  void stopServer() {
    wireMock.stop();
  }

  @BeforeEach
  void reset() {
    wireMock.resetAll();
  }

  private static HttpIdentityEndpoint endpointAt(final String baseUrl) {
    final var transport =
        new HttpTransport(
            HttpTransport.newClient(Duration.ofSeconds(2)), duration -> {}, Clock.systemUTC());
    return new HttpIdentityEndpoint(
        URI.create(baseUrl + TOKEN_PATH),
        "cdse-public",
        URI.create(baseUrl + PROBE_PATH),
        transport);
  }

  @Nested
  @DisplayName("Grant")
  class Grant {

    @Test
    @DisplayName("Should post the password grant form and map the response")
    void shouldRequestGrant() {
      wireMock.stubFor(
          post(TOKEN_PATH)
              .willReturn(
                  okJson(
                      "{\"access_token\":\"abc\",\"refresh_token\":\"def\",\"token_type\":\"Bearer\","
                          + "\"scope\":\"openid email\",\"expires_in\":600,"
                          + "\"refresh_expires_in\":3600,\"not-before-policy\":0}")));

      final var grant = endpoint.requestGrant("user@example.com", "p&ss word", null);

      assertEquals("abc", grant.accessToken());
      assertEquals("def", grant.refreshToken());
      assertEquals("Bearer", grant.tokenType());
      assertEquals("openid email", grant.scope());
      assertEquals(600L, grant.expiresIn());
      wireMock.verify(
          1,
          postRequestedFor(urlEqualTo(TOKEN_PATH))
              .withHeader("Content-Type", containing("application/x-www-form-urlencoded"))
              .withRequestBody(containing("username=user%40example.com"))
              .withRequestBody(containing("password=p%26ss+word"))
              .withRequestBody(containing("grant_type=password"))
              .withRequestBody(containing("client_id=cdse-public"))
              .withRequestBody(notContaining("totp")));
    }

    @Test
    @DisplayName("Should include the one-time code when given")
    void shouldSendOtp() {
      wireMock.stubFor(post(TOKEN_PATH).willReturn(okJson("{\"access_token\":\"abc\"}")));

      final var grant = endpoint.requestGrant("user", "secret", "654321");

      assertNull(grant.expiresIn());
      wireMock.verify(
          postRequestedFor(urlEqualTo(TOKEN_PATH)).withRequestBody(containing("totp=654321")));
    }

    @Test
    @DisplayName("Should report refused credentials with the server's description")
    void shouldRejectInvalidCredentials() {
      wireMock.stubFor(
          post(TOKEN_PATH)
              .willReturn(
                  aResponse()
                      .withStatus(401)
                      .withHeader("Content-Type", "application/json")
                      .withBody(
                          "{\"error\":\"invalid_grant\","
                              + "\"error_description\":\"Invalid user credentials\"}")));

      final var thrown =
          assertThrows(
              AuthRejectedException.class, () -> endpoint.requestGrant("user", "wrong", null));

      assertEquals(401, thrown.status());
      assertEquals("user", thrown.login());
      assertTrue(thrown.getMessage().contains("Invalid user credentials"));
      assertFalse(thrown.getMessage().contains("wrong"));
    }

    @Test
    @DisplayName("Should refuse a lifetime too long to turn into an expiry")
    void shouldRefuseUnusableLifetime() {
      wireMock.stubFor(
          post(TOKEN_PATH)
              .willReturn(
                  okJson("{\"access_token\":\"abc\",\"expires_in\":9223372036854775807}")));

      final var thrown =
          assertThrows(NetworkException.class, () -> endpoint.requestGrant("user", "secret", null));

      assertEquals(200, thrown.status().getAsInt());
      assertTrue(thrown.getMessage().contains("expires_in"));
    }

    @Test
    @DisplayName("Should not retry a grant that hits a server error")
    void shouldNotRetryServerError() {
      wireMock.stubFor(post(TOKEN_PATH).willReturn(aResponse().withStatus(503)));

      final var thrown =
          assertThrows(NetworkException.class, () -> endpoint.requestGrant("user", "secret", null));

      assertEquals(503, thrown.status().getAsInt());
      wireMock.verify(1, postRequestedFor(urlEqualTo(TOKEN_PATH)));
    }

    @Test
    @DisplayName("Should fail with a network error when the endpoint is unreachable")
    void shouldFailWhenUnreachable() {
      final var unreachable = endpointAt("http://localhost:" + TestSupport.closedPort());

      final var thrown =
          assertThrows(
              NetworkException.class, () -> unreachable.requestGrant("user", "secret", null));

      assertTrue(thrown.status().isEmpty());
      assertNotNull(thrown.getCause());
    }

    @Test
    @DisplayName("Should fail with a network error when the connection drops")
    void shouldFailOnDroppedConnection() {
      wireMock.stubFor(
          post(TOKEN_PATH).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

      assertThrows(NetworkException.class, () -> endpoint.requestGrant("user", "secret", null));
      wireMock.verify(1, postRequestedFor(urlEqualTo(TOKEN_PATH)));
    }

    @Test
    @DisplayName("Should reject malformed or empty grant bodies")
    void shouldRejectUnusableBodies() {
      wireMock.stubFor(post(TOKEN_PATH).willReturn(okJson("{not json")));
      assertThrows(NetworkException.class, () -> endpoint.requestGrant("user", "secret", null));

      wireMock.stubFor(post(TOKEN_PATH).willReturn(okJson("{\"token_type\":\"Bearer\"}")));
      assertThrows(NetworkException.class, () -> endpoint.requestGrant("user", "secret", null));
    }
  }

  @Nested
  @DisplayName("Probe")
  class Probe {

    @Test
    @DisplayName("Should send the token as a bearer credential")
    void shouldSendBearer() {
      wireMock.stubFor(get(PROBE_PATH).willReturn(ok()));

      assertEquals(ProbeResult.ACCEPTED, endpoint.probe("abc"));
      wireMock.verify(
          getRequestedFor(urlEqualTo(PROBE_PATH))
              .withHeader("Authorization", equalTo("Bearer abc")));
    }

    @Test
    @DisplayName("Should report a refused token as rejected")
    void shouldReportRejected() {
      wireMock.stubFor(get(PROBE_PATH).willReturn(unauthorized()));

      assertEquals(ProbeResult.REJECTED, endpoint.probe("stale"));
    }

    @Test
    @DisplayName("Should report server errors and throttling as inconclusive without retrying")
    void shouldReportInconclusive() {
      wireMock.stubFor(get(PROBE_PATH).willReturn(aResponse().withStatus(503)));
      assertEquals(ProbeResult.INCONCLUSIVE, endpoint.probe("abc"));
      wireMock.verify(1, getRequestedFor(urlEqualTo(PROBE_PATH)));

      wireMock.stubFor(get(PROBE_PATH).willReturn(aResponse().withStatus(429)));
      assertEquals(ProbeResult.INCONCLUSIVE, endpoint.probe("abc"));
    }

    @Test
    @DisplayName("Should report an unreachable probe endpoint as inconclusive")
    void shouldReportUnreachableAsInconclusive() {
      final var unreachable = endpointAt("http://localhost:" + TestSupport.closedPort());

      assertEquals(ProbeResult.INCONCLUSIVE, unreachable.probe("abc"));
    }
  }
}
