package com.gentoro.usagereporting.trace;

import java.time.Instant;

/** Wall-clock instant as seconds plus nanoseconds since the epoch. */
public record Timestamp(long seconds, int nanos) {

  public static Timestamp of(Instant instant) {
    return new Timestamp(instant.getEpochSecond(), instant.getNano());
  }

  public static Timestamp now() {
    return of(Instant.now());
  }

  public Instant toInstant() {
    return Instant.ofEpochSecond(seconds, nanos);
  }
}
