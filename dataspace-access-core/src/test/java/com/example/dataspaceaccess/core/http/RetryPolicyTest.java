package com.example.dataspaceaccess.core.http;

import static org.junit.jupiter.api.Assertions.*;

import com.example.dataspaceaccess.core.http.RetryBudget.Phase;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class RetryPolicyTest {

  @Nested
  @DisplayName("Policy")
  class Policy {

    @Test
    @DisplayName("Defaults should allow 8 retries with 5 per phase")
    void defaults() {
      final var policy = RetryPolicy.defaults();

      assertEquals(8, policy.total());
      assertEquals(5, policy.connect());
      assertEquals(5, policy.read());
      assertEquals(5, policy.status());
      assertEquals(Set.of(429, 500, 502, 503, 504), policy.retryStatuses());
      assertTrue(policy.respectRetryAfter());
    }

    @Test
    @DisplayName("Backoff should double per retry and stop at the cap")
    void backoffShouldGrowExponentially() {
      final var policy = RetryPolicy.defaults();

      assertEquals(Duration.ZERO, policy.backoffFor(0));
      assertEquals(Duration.ofMillis(500), policy.backoffFor(1));
      assertEquals(Duration.ofSeconds(1), policy.backoffFor(2));
      assertEquals(Duration.ofSeconds(2), policy.backoffFor(3));
      assertEquals(Duration.ofSeconds(64), policy.backoffFor(8));
      assertEquals(Duration.ofSeconds(120), policy.backoffFor(9));
      assertEquals(Duration.ofSeconds(120), policy.backoffFor(1000));
    }

    @Test
    @DisplayName("A zero backoff should never wait")
    void zeroBackoff() {
      assertEquals(Duration.ZERO, RetryPolicy.defaults().withBackoff(Duration.ZERO).backoffFor(4));
    }

    @Test
    @DisplayName("Only idempotent methods should be retryable")
    void idempotentMethodsOnly() {
      final var policy = RetryPolicy.defaults();

      assertTrue(policy.isRetryableMethod("GET"));
      assertTrue(policy.isRetryableMethod("put"));
      assertFalse(policy.isRetryableMethod("POST"));
      assertFalse(policy.isRetryableMethod("PATCH"));
      assertFalse(policy.isRetryableMethod(null));
    }

    @Test
    @DisplayName("Should reject negative budgets and an inverted cap")
    void shouldValidate() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new RetryPolicy(
                  -1, 0, 0, 0, Duration.ZERO, Duration.ZERO, Set.of(), Set.of(), false));
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new RetryPolicy(
                  1, 1, 1, 1, Duration.ofSeconds(2), Duration.ofSeconds(1), Set.of(), Set.of(),
                  false));
    }
  }

  @Nested
  @DisplayName("Budget")
  class Budget {

    @Test
    @DisplayName("Each phase should run out independently")
    void phasesShouldBeIndependent() {
      final var budget = new RetryBudget(RetryPolicy.defaults());

      for (int i = 0; i < 5; i++) assertTrue(budget.consume(Phase.STATUS));
      assertFalse(budget.consume(Phase.STATUS));
      assertTrue(budget.consume(Phase.READ));
      assertEquals(6, budget.consumed());
    }

    @Test
    @DisplayName("The total budget should cap retries across phases")
    void totalShouldCapAllPhases() {
      final var budget = new RetryBudget(RetryPolicy.defaults());

      for (int i = 0; i < 4; i++) assertTrue(budget.consume(Phase.CONNECT));
      for (int i = 0; i < 4; i++) assertTrue(budget.consume(Phase.READ));
      assertFalse(budget.consume(Phase.STATUS));
      assertEquals(8, budget.consumed());
    }

    @Test
    @DisplayName("A no-retry policy should refuse every retry")
    void noneShouldRefuse() {
      final var budget = new RetryBudget(RetryPolicy.none());

      assertFalse(budget.consume(Phase.CONNECT));
      assertFalse(budget.consume(Phase.READ));
      assertFalse(budget.consume(Phase.STATUS));
    }

    @Test
    @DisplayName("A server hint should override the computed delay")
    void retryAfterShouldOverrideBackoff() {
      final var budget = new RetryBudget(RetryPolicy.defaults());
      budget.consume(Phase.STATUS);
      budget.consume(Phase.STATUS);

      assertEquals(Duration.ofSeconds(1), budget.nextDelay(Optional.empty()));
      assertEquals(Duration.ofSeconds(7), budget.nextDelay(Optional.of(Duration.ofSeconds(7))));
    }

    @Test
    @DisplayName("A server hint longer than maxBackoff should be cut down to it")
    void retryAfterShouldNotExceedMaxBackoff() {
      final var budget = new RetryBudget(RetryPolicy.defaults());
      budget.consume(Phase.STATUS);

      assertEquals(
          Duration.ofSeconds(120), budget.nextDelay(Optional.of(Duration.ofSeconds(121))));
      assertEquals(
          Duration.ofSeconds(120),
          budget.nextDelay(Optional.of(Duration.ofSeconds(9_999_999_999_999_999L))));
      assertEquals(
          Duration.ofSeconds(120), budget.nextDelay(Optional.of(Duration.ofSeconds(120))));
    }
  }
}
