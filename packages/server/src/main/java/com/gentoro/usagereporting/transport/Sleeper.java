package com.gentoro.usagereporting.transport;

import java.time.Duration;

/** Waits between delivery attempts. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = delay -> Thread.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
