package com.example.pms.router.refresh;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

  private MutableClock clock;
  private CircuitBreaker breaker;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-04-01T00:00:00Z"));
    breaker = new CircuitBreaker(3, Duration.ofSeconds(60), clock);
  }

  @Test
  void opensAfterConsecutiveFailures() {
    assertThat(breaker.recordFailure()).isFalse();
    assertThat(breaker.recordFailure()).isFalse();
    assertThat(breaker.recordFailure()).isTrue();

    assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.OPEN);
    assertThat(breaker.allowRequest()).isFalse();
    assertThat(breaker.trips()).isEqualTo(1);
  }

  @Test
  void successResetsTheFailureCount() {
    breaker.recordFailure();
    breaker.recordFailure();
    breaker.recordSuccess();
    breaker.recordFailure();

    assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.CLOSED);
    assertThat(breaker.consecutiveFailures()).isEqualTo(1);
  }

  @Test
  void singleProbeAfterCooldown_closesOnSuccess() {
    tripOpen();
    clock.advance(Duration.ofSeconds(59));
    assertThat(breaker.allowRequest()).isFalse();

    clock.advance(Duration.ofSeconds(1));
    assertThat(breaker.allowRequest()).isTrue();
    assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
    assertThat(breaker.allowRequest()).as("second caller while probing").isFalse();

    breaker.recordSuccess();
    assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.CLOSED);
    assertThat(breaker.allowRequest()).isTrue();
  }

  @Test
  void failedProbe_reopensForAnotherCooldown() {
    tripOpen();
    clock.advance(Duration.ofSeconds(60));
    assertThat(breaker.allowRequest()).isTrue();

    assertThat(breaker.recordFailure()).isTrue();
    assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.OPEN);
    assertThat(breaker.trips()).isEqualTo(2);

    clock.advance(Duration.ofSeconds(30));
    assertThat(breaker.allowRequest()).isFalse();
  }

  private void tripOpen() {
    for (int i = 0; i < 3; i++) {
      breaker.recordFailure();
    }
  }

  @Test
  void neutralOutcomeLetsTheNextHalfOpenCallThrough() {
    breaker.recordFailure();
    breaker.recordFailure();
    breaker.recordFailure();
    clock.advance(Duration.ofSeconds(61));

    assertThat(breaker.allowRequest()).isTrue();
    assertThat(breaker.allowRequest()).isFalse();
    breaker.ignoreOutcome();

    assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
    assertThat(breaker.trips()).isEqualTo(1);
    assertThat(breaker.allowRequest()).isTrue();
  }
}
