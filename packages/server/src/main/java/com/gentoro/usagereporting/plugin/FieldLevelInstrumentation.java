package com.gentoro.usagereporting.plugin;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides per operation whether fields are traced, and with what weight they count in field
 * statistics. A weight of zero disables field tracing for the operation.
 */
@FunctionalInterface
public interface FieldLevelInstrumentation {

  double weight(RequestContext context);

  /**
   * Traces a random share of operations. Traced operations get weight {@code 1 / rate}, so
   * estimated execution counts stay unbiased.
   */
  static FieldLevelInstrumentation sampled(double rate) {
    if (rate < 0 || rate > 1) {
      throw new IllegalArgumentException("rate must be between 0 and 1: " + rate);
    }
    if (rate == 0) return context -> 0;
    if (rate == 1) return context -> 1;
    return context -> ThreadLocalRandom.current().nextDouble() < rate ? 1 / rate : 0;
  }
}
