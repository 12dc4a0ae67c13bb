package org.waabox.fanout;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how long the {@link ConnectionManager} waits between reconnection
 * attempts while it is degraded or running on its non-preferred transport.
 *
 * <p>The wait starts at the initial backoff and doubles on each failed
 * attempt, capped at the maximum backoff. A policy whose initial and maximum
 * backoff are equal retries at a fixed interval. The default policy starts at
 * 5 seconds and never waits more than 30 seconds.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default initial backoff. */
  private static final Duration DEFAULT_INITIAL_BACKOFF =
      Duration.ofSeconds(5);

  /** The default maximum backoff. */
  private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);

  /** The wait before the first retry. */
  private final Duration initialBackoff;

  /** The upper bound of the wait between retries. */
  private final Duration maxBackoff;

  /**
   * Creates a new retry policy.
   *
   * @param initialBackoff the wait before the first retry, never null
   * @param maxBackoff     the upper bound of the wait, never null
   */
  private RetryPolicy(final Duration initialBackoff,
      final Duration maxBackoff) {
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
  }

  /**
   * Creates a retry policy with exponential backoff bounded by a maximum.
   *
   * @param initialBackoff the wait before the first retry, must be positive,
   *                       never null
   * @param maxBackoff     the upper bound of the wait, must not be smaller
   *                       than initialBackoff, never null
   * @return a new retry policy, never null
   *
   * @throws NullPointerException     if any argument is null
   * @throws IllegalArgumentException if initialBackoff is not positive or
   *                                  maxBackoff is smaller than it
   */
  public static RetryPolicy of(final Duration initialBackoff,
      final Duration maxBackoff) {
    Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
    Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    if (initialBackoff.isNegative() || initialBackoff.isZero()) {
      throw new IllegalArgumentException(
          "initialBackoff must be positive, got: " + initialBackoff);
    }
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException(
          "maxBackoff must not be smaller than initialBackoff, got: "
              + maxBackoff);
    }
    return new RetryPolicy(initialBackoff, maxBackoff);
  }

  /**
   * Creates a retry policy that always waits the same interval.
   *
   * @param interval the wait between retries, must be positive, never null
   * @return a new retry policy, never null
   */
  public static RetryPolicy fixed(final Duration interval) {
    return of(interval, interval);
  }

  /**
   * Creates a retry policy with sensible defaults: 5 seconds, doubling up
   * to 30 seconds.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF);
  }

  /**
   * Returns the wait before the given retry attempt.
   *
   * @param attempt the 1-based number of consecutive failed attempts
   * @return the wait, between the initial and the maximum backoff, never
   *         null
   */
  public Duration backoff(final int attempt) {
    if (attempt <= 1) {
      return initialBackoff;
    }
    // Past 2^20 the cap is reached for any sane initial backoff.
    final int shift = Math.min(attempt - 1, 20);
    final Duration candidate = initialBackoff.multipliedBy(1L << shift);
    return candidate.compareTo(maxBackoff) > 0 ? maxBackoff : candidate;
  }

  /**
   * Returns the wait before the first retry.
   *
   * @return the initial backoff, never null
   */
  public Duration initialBackoff() {
    return initialBackoff;
  }

  /**
   * Returns the upper bound of the wait between retries.
   *
   * @return the maximum backoff, never null
   */
  public Duration maxBackoff() {
    return maxBackoff;
  }
}
