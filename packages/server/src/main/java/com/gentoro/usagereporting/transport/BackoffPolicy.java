package com.gentoro.usagereporting.transport;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff between delivery attempts.
 *
 * @param maxAttempts total attempts including the first one
 * @param minimumDelay wait before the second attempt
 * @param factor growth of the wait per further attempt
 * @param randomize multiply each wait by a random factor in [1, 2)
 */
public record BackoffPolicy(
    int maxAttempts, Duration minimumDelay, double factor, boolean randomize) {

  public BackoffPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (minimumDelay.isNegative()) {
      throw new IllegalArgumentException("minimumDelay must not be negative");
    }
  }

  public static BackoffPolicy exponential(int maxAttempts, Duration minimumDelay) {
    return new BackoffPolicy(maxAttempts, minimumDelay, 2, false);
  }

  /** Wait after the given failed attempt (1-based) before the next one. */
  public Duration delayAfterAttempt(int attempt) {
    double millis = minimumDelay.toMillis() * Math.pow(factor, attempt - 1);
    if (randomize) {
      millis *= 1 + ThreadLocalRandom.current().nextDouble();
    }
    return Duration.ofMillis(Math.round(millis));
  }
}
