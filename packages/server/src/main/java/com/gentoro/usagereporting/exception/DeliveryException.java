package com.gentoro.usagereporting.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A report could not be delivered: the network failed or the collector answered with a non-2xx
 * status once retries were exhausted (or the status was not retryable).
 */
public class DeliveryException extends UsageReportingException {
  private final int status;
  private final int attempts;

  public DeliveryException(String message, int status, int attempts) {
    super(UsageReportingErrorCode.NETWORK_ERROR, message, context(status, attempts));
    this.status = status;
    this.attempts = attempts;
  }

  public DeliveryException(String message, int status, int attempts, Throwable cause) {
    super(UsageReportingErrorCode.NETWORK_ERROR, message, context(status, attempts), cause);
    this.status = status;
    this.attempts = attempts;
  }

  /** Final HTTP status, or -1 when the last attempt never produced a response. */
  public int getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  private static Map<String, Object> context(int status, int attempts) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    if (status >= 0) ctx.put("status", status);
    ctx.put("attempts", attempts);
    return ctx;
  }
}
