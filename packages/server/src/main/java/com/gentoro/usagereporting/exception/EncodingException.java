package com.gentoro.usagereporting.exception;

/** A trace or report could not be serialized or failed verification. Fatal for one batch only. */
public class EncodingException extends UsageReportingException {
  public EncodingException(String message) {
    super(UsageReportingErrorCode.SERIALIZATION_ERROR, message);
  }

  public EncodingException(String message, Throwable cause) {
    super(UsageReportingErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
