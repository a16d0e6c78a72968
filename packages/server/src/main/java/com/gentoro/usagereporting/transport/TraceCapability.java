package com.gentoro.usagereporting.transport;

import com.gentoro.usagereporting.logging.LoggingService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;

/**
 * Whether operations may still be sent as full traces. Can only go from enabled to disabled, and
 * stays disabled for the life of the process.
 */
public final class TraceCapability {
  private static final Logger log = LoggingService.getLogger(TraceCapability.class);

  private final AtomicBoolean enabled;

  public TraceCapability(boolean enabled) {
    this.enabled = new AtomicBoolean(enabled);
  }

  public boolean isEnabled() {
    return enabled.get();
  }

  public void demote() {
    if (enabled.compareAndSet(true, false)) {
      log.debug(
          "This graph's organization does not have access to traces;"
              + " sending all subsequent operations as stats");
    }
  }
}
