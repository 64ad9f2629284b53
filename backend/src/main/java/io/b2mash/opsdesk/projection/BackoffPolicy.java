package io.b2mash.opsdesk.projection;

import java.time.Duration;

/** Exponential delay between projection retries, capped at {@code max}. */
public record BackoffPolicy(Duration initial, Duration max) {

  public Duration delayFor(int attempt) {
    if (attempt <= 0) {
      return Duration.ZERO;
    }
    int shift = Math.min(attempt - 1, 30);
    long millis = initial.toMillis() << shift;
    if (millis <= 0 || millis > max.toMillis()) {
      return max;
    }
    return Duration.ofMillis(millis);
  }
}
