package kb.platform.polling;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;
import java.util.function.Supplier;
import kb.core.batch.Batch;
import kb.core.batch.BatchTracker;
import kb.core.errors.RemoteStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repeats a single-shot batch poll on the caller's thread until the batch is complete or the
 * deadline passes. The same batch is always re-polled; nothing is ever re-enqueued.
 */
public class BatchAwaiter {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchAwaiter.class);

  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final long intervalMillis;
  private final int maxTransientFailures;
  private final Clock clock;
  private final Sleeper sleeper;
  private final LongUnaryOperator jitter;

  public BatchAwaiter(long intervalMillis, int maxTransientFailures) {
    this(
        intervalMillis,
        maxTransientFailures,
        Clock.systemUTC(),
        Thread::sleep,
        base -> ThreadLocalRandom.current().nextLong(base / 2 + 1));
  }

  BatchAwaiter(
      long intervalMillis,
      int maxTransientFailures,
      Clock clock,
      Sleeper sleeper,
      LongUnaryOperator jitter) {
    if (intervalMillis < 0) {
      throw new IllegalArgumentException("intervalMillis must not be negative.");
    }
    this.intervalMillis = intervalMillis;
    this.maxTransientFailures = Math.max(0, maxTransientFailures);
    this.clock = Objects.requireNonNull(clock, "clock must not be null.");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null.");
    this.jitter = Objects.requireNonNull(jitter, "jitter must not be null.");
  }

  /**
   * Polls until complete or until {@code timeout} elapses, returning the last observed batch.
   *
   * @throws RemoteStoreException when more consecutive polls fail than allowed, or when the very
   *     first poll fails past the deadline
   */
  public Batch await(Supplier<Batch> poll, Duration timeout) {
    Objects.requireNonNull(poll, "poll must not be null.");
    Instant deadline = clock.instant().plus(timeout == null ? Duration.ZERO : timeout);

    Batch last = null;
    int failures = 0;
    while (true) {
      long delay = intervalMillis;
      try {
        last = poll.get();
        failures = 0;
        if (BatchTracker.isComplete(last)) {
          return last;
        }
      } catch (RemoteStoreException e) {
        failures++;
        if (failures > maxTransientFailures) {
          throw e;
        }
        delay = intervalMillis + jitter.applyAsLong(intervalMillis);
        LOGGER.warn(
            "Batch poll failed ({} of {} allowed): {}", failures, maxTransientFailures, e.getMessage());
      }

      if (!clock.instant().plusMillis(delay).isBefore(deadline)) {
        if (last == null) {
          throw new RemoteStoreException("Batch status could not be read before the deadline.");
        }
        return last;
      }
      sleep(delay);
    }
  }

  private void sleep(long millis) {
    try {
      sleeper.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteStoreException("Interrupted while waiting for batch completion.", e);
    }
  }
}
