package com.example.dataspaceaccess.core.http;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.junit.jupiter.api.Assertions.*;

import com.example.dataspaceaccess.core.TestSupport;
import com.example.dataspaceaccess.core.http.RetryBudget.Phase;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class HttpTransportTest {

  private WireMockServer wireMock;
  private List<Duration> sleeps;
  private HttpTransport transport;

  @BeforeAll
  void startServer() {
    wireMock = new WireMockServer(options().dynamicPort());
    wireMock.start();
  }

  @AfterAll
  void stopServer() {
    wireMock.stop();
  }

  @BeforeEach
  void setUp() {
    wireMock.resetAll();
    sleeps = new CopyOnWriteArrayList<>();
    transport =
        new HttpTransport(
            HttpTransport.newClient(Duration.ofSeconds(2)), sleeps::add, Clock.systemUTC());
  }

  private HttpRequest request(final String path) {
    return HttpRequest.newBuilder(URI.create(wireMock.baseUrl() + path)).GET().build();
  }

  private void stubSequence(final String path, final int... statuses) {
    var state = STARTED;
    for (int i = 0; i < statuses.length; i++) {
      final var next = i == statuses.length - 1 ? state : "attempt-" + (i + 1);
      wireMock.stubFor(
          get(path)
              .inScenario(path)
              .whenScenarioStateIs(state)
              .willReturn(aResponse().withStatus(statuses[i]).withBody("status " + statuses[i]))
              .willSetStateTo(next));
      state = next;
    }
  }

  @Test
  @DisplayName("Should retry transient statuses with exponential backoff")
  void shouldRetryTransientStatuses() throws Exception {
    stubSequence("/flaky", 503, 503, 200);

    final var response =
        transport.send(request("/flaky"), BodyHandlers.ofString(), RetryPolicy.defaults());

    assertEquals(200, response.statusCode());
    assertEquals("status 200", response.body());
    assertEquals(List.of(Duration.ofMillis(500), Duration.ofSeconds(1)), sleeps);
    wireMock.verify(3, getRequestedFor(urlEqualTo("/flaky")));
  }

  @Test
  @DisplayName("Should return a non-retryable status after a single request")
  void shouldNotRetryTerminalStatus() throws Exception {
    wireMock.stubFor(get("/missing").willReturn(notFound()));

    final var response =
        transport.send(request("/missing"), BodyHandlers.discarding(), RetryPolicy.defaults());

    assertEquals(404, response.statusCode());
    assertTrue(sleeps.isEmpty());
    wireMock.verify(1, getRequestedFor(urlEqualTo("/missing")));
  }

  @Test
  @DisplayName("Should never retry a POST")
  void shouldNotRetryPost() throws Exception {
    wireMock.stubFor(post("/submit").willReturn(serviceUnavailable()));
    final var request =
        HttpRequest.newBuilder(URI.create(wireMock.baseUrl() + "/submit"))
            .POST(HttpRequest.BodyPublishers.ofString("x"))
            .build();

    final var response = transport.send(request, BodyHandlers.discarding(), RetryPolicy.defaults());

    assertEquals(503, response.statusCode());
    wireMock.verify(1, postRequestedFor(urlEqualTo("/submit")));
  }

  @Test
  @DisplayName("Should wait as long as Retry-After asks")
  void shouldHonourRetryAfter() throws Exception {
    wireMock.stubFor(
        get("/throttled")
            .inScenario("throttle")
            .whenScenarioStateIs(STARTED)
            .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "7"))
            .willSetStateTo("open"));
    wireMock.stubFor(
        get("/throttled")
            .inScenario("throttle")
            .whenScenarioStateIs("open")
            .willReturn(ok()));

    final var response =
        transport.send(request("/throttled"), BodyHandlers.discarding(), RetryPolicy.defaults());

    assertEquals(200, response.statusCode());
    assertEquals(List.of(Duration.ofSeconds(7)), sleeps);
  }

  @Test
  @DisplayName("Should cap an absurd Retry-After at the maximum backoff")
  void shouldCapHugeRetryAfter() throws Exception {
    wireMock.stubFor(
        get("/busy")
            .willReturn(
                aResponse().withStatus(503).withHeader("Retry-After", "9999999999999999")));

    final var response =
        transport.send(request("/busy"), BodyHandlers.discarding(), RetryPolicy.defaults());

    assertEquals(503, response.statusCode());
    assertEquals(Collections.nCopies(5, Duration.ofSeconds(120)), sleeps);
    wireMock.verify(6, getRequestedFor(urlEqualTo("/busy")));
  }

  @Test
  @DisplayName("Should return the last response once the status budget is spent")
  void shouldStopAfterStatusBudget() throws Exception {
    wireMock.stubFor(
        get("/down").willReturn(serviceUnavailable()));

    final var response =
        transport.send(request("/down"), BodyHandlers.discarding(), RetryPolicy.defaults());

    assertEquals(503, response.statusCode());
    assertEquals(5, sleeps.size());
    wireMock.verify(6, getRequestedFor(urlEqualTo("/down")));
  }

  @Test
  @DisplayName("Should retry refused connections up to the connect budget")
  void shouldRetryRefusedConnection() {
    final var request =
        HttpRequest.newBuilder(URI.create("http://localhost:" + TestSupport.closedPort() + "/x"))
            .GET()
            .build();

    assertThrows(
        ConnectException.class,
        () -> transport.send(request, BodyHandlers.discarding(), RetryPolicy.defaults()));
    assertEquals(5, sleeps.size());
  }

  @Test
  @DisplayName("Should retry dropped connections from the read budget")
  void shouldRetryDroppedConnection() {
    wireMock.stubFor(
        get("/reset")
            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));
    final var policy = RetryPolicy.defaults();

    assertThrows(
        IOException.class,
        () -> transport.send(request("/reset"), BodyHandlers.discarding(), policy));
    assertEquals(5, sleeps.size());
    wireMock.verify(moreThanOrExactly(6), getRequestedFor(urlEqualTo("/reset")));
  }

  @Test
  @DisplayName("Should share one budget between calls")
  void shouldDrawFromSharedBudget() throws Exception {
    wireMock.stubFor(
        get("/down").willReturn(serviceUnavailable()));
    final var budget = new RetryBudget(RetryPolicy.defaults());
    budget.consume(Phase.STATUS);
    budget.consume(Phase.STATUS);
    budget.consume(Phase.STATUS);

    transport.send(request("/down"), BodyHandlers.discarding(), budget);

    wireMock.verify(3, getRequestedFor(urlEqualTo("/down")));
  }

  @Test
  @DisplayName("Failures before a connection exists should count as connect failures")
  void shouldClassifyFailures() {
    assertEquals(Phase.CONNECT, HttpTransport.phaseOf(new ConnectException("refused")));
    assertEquals(Phase.CONNECT, HttpTransport.phaseOf(new HttpConnectTimeoutException("slow")));
    assertEquals(
        Phase.CONNECT, HttpTransport.phaseOf(new IOException("wrapped", new ConnectException())));
    assertEquals(Phase.READ, HttpTransport.phaseOf(new HttpTimeoutException("request timed out")));
    assertEquals(Phase.READ, HttpTransport.phaseOf(new IOException("connection reset")));
  }
}
