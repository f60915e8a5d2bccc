package dev.letterfinder.archive;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;

/**
 * Last-call-timestamp guard enforcing a minimum interval between two requests of one client.
 *
 * <p>Each {@link ArchiveClient} owns its own pacer, so archives are paced independently. Time is
 * read from the injected {@link Clock} and waiting goes through the injected {@link Sleeper}, which
 * lets tests substitute a fake clock.
 */
public class RequestPacer {

    private static final Logger log = LoggerFactory.getLogger(RequestPacer.class);

    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    private @Nullable Instant lastRequestAt;

    public RequestPacer(Duration minInterval, Clock clock, Sleeper sleeper) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Block until at least the minimum interval has elapsed since the previous call, then record
     * the current instant as the latest request time.
     */
    public synchronized void awaitTurn() {
        if (lastRequestAt != null) {
            Duration remaining = minInterval.minus(Duration.between(lastRequestAt, clock.instant()));
            if (!remaining.isNegative() && !remaining.isZero()) {
                sleep(remaining);
            }
        }
        lastRequestAt = clock.instant();
    }

    private void sleep(Duration remaining) {
        // round up so sub-millisecond remainders still wait
        long millis = (remaining.toNanos() + 999_999) / 1_000_000;
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting {} ms for the rate limit", millis);
        }
    }
}
