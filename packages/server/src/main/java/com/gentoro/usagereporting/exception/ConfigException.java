package com.gentoro.usagereporting.exception;

/** Configuration problem detected at startup, before any background work begins. */
public class ConfigException extends UsageReportingException {
  public ConfigException(String message) {
    super(UsageReportingErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(UsageReportingErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
