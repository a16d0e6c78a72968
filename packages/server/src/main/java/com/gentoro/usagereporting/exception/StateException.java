package com.gentoro.usagereporting.exception;

/** Illegal or unexpected lifecycle state encountered. */
public class StateException extends UsageReportingException {
  public StateException(String message) {
    super(UsageReportingErrorCode.FAILED_PRECONDITION, message);
  }
}
