package com.gentoro.usagereporting.exception;

import java.util.Map;

/**
 * The collector accepted the report but its response body could not be parsed. The batch counts as
 * delivered; this only surfaces the anomaly.
 */
public class ResponseParseException extends UsageReportingException {
  public ResponseParseException(String message, Throwable cause) {
    super(UsageReportingErrorCode.SERIALIZATION_ERROR, message, Map.of("delivered", true), cause);
  }
}
