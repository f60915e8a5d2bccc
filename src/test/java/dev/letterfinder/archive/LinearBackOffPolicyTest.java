package dev.letterfinder.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.letterfinder.fixture.FakeTime;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;

class LinearBackOffPolicyTest {

  private final FakeTime time = new FakeTime();

  @AfterEach
  void clearInterruptFlag() {
    Thread.interrupted();
  }

  @Test
  void delayGrowsLinearlyWithFailedAttempts() {
    LinearBackOffPolicy policy = new LinearBackOffPolicy(Duration.ofSeconds(2), time);
    BackOffContext context = policy.start(null);

    policy.backOff(context);
    policy.backOff(context);
    policy.backOff(context);

    assertThat(time.sleeps()).containsExactly(2000L, 4000L, 6000L);
  }

  @Test
  void eachRetryContextStartsFromTheBaseDelay() {
    LinearBackOffPolicy policy = new LinearBackOffPolicy(Duration.ofMillis(500), time);

    policy.backOff(policy.start(null));
    policy.backOff(policy.start(null));

    assertThat(time.sleeps()).containsExactly(500L, 500L);
  }

  @Test
  void interruptionIsReportedAndFlagRestored() {
    Sleeper interrupted =
        millis -> {
          throw new InterruptedException("stop");
        };
    LinearBackOffPolicy policy = new LinearBackOffPolicy(Duration.ofSeconds(2), interrupted);
    BackOffContext context = policy.start(null);

    assertThatThrownBy(() -> policy.backOff(context))
        .isInstanceOf(BackOffInterruptedException.class);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }
}
