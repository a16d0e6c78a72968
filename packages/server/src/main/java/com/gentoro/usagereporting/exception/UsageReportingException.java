package com.gentoro.usagereporting.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the library's unchecked exceptions. Every failure carries a {@link
 * UsageReportingErrorCode} and an unmodifiable map of details (status, attempt count and the like)
 * that error sinks can log or route on.
 */
public class UsageReportingException extends RuntimeException {
  private final UsageReportingErrorCode code;
  private final Map<String, Object> context;

  public UsageReportingException(UsageReportingErrorCode code, String message) {
    this(code, message, Map.of(), null);
  }

  public UsageReportingException(UsageReportingErrorCode code, String message, Throwable cause) {
    this(code, message, Map.of(), cause);
  }

  public UsageReportingException(
      UsageReportingErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public UsageReportingException(
      UsageReportingErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public UsageReportingErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append('[').append(code).append("] ").append(getMessage());
    if (!context.isEmpty()) sb.append(' ').append(context);
    return sb.toString();
  }
}
