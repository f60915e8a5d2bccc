package dev.letterfinder.archive;

import java.time.Duration;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * Backoff that waits {@code failedAttempts × baseDelay} between attempts: 1 × base after the first
 * failure, 2 × base after the second, and so on. The template does not call it after the final
 * attempt.
 */
public class LinearBackOffPolicy implements BackOffPolicy {

    private final Duration baseDelay;
    private final Sleeper sleeper;

    public LinearBackOffPolicy(Duration baseDelay, Sleeper sleeper) {
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new AttemptCounter();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        AttemptCounter counter = (AttemptCounter) backOffContext;
        long delayMillis = baseDelay.toMillis() * counter.nextFailure();
        try {
            sleeper.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted during linear backoff", e);
        }
    }

    private static final class AttemptCounter implements BackOffContext {

        private static final long serialVersionUID = 1L;

        private int failures;

        int nextFailure() {
            return ++failures;
        }
    }
}
