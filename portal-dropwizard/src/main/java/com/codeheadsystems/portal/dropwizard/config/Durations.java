package com.codeheadsystems.portal.dropwizard.config;

import io.dropwizard.util.Duration;

/**
 * Converts configuration durations.
 */
public final class Durations {

  private Durations() {
  }

  public static java.time.Duration toJava(final Duration duration) {
    return java.time.Duration.ofMillis(duration.toMilliseconds());
  }
}
