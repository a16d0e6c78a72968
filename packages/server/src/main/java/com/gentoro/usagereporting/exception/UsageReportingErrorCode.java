package com.gentoro.usagereporting.exception;

/** Stable failure categories, safe to match on in custom error sinks. */
public enum UsageReportingErrorCode {
  /** Options are missing or out of range, or the YAML file could not be read. */
  CONFIGURATION_ERROR,
  /** A trace, report or collector response could not be encoded or decoded. */
  SERIALIZATION_ERROR,
  /** The collector could not be reached or rejected a report. */
  NETWORK_ERROR,
  /** The reporting lifecycle was used out of order. */
  FAILED_PRECONDITION
}
