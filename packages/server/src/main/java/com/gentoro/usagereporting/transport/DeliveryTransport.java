package com.gentoro.usagereporting.transport;

import com.gentoro.usagereporting.report.Report;

/** Ships finished reports to the collector. */
public interface DeliveryTransport {

  /**
   * Delivers one report, blocking until it was accepted or delivery gave up.
   *
   * @throws com.gentoro.usagereporting.exception.EncodingException if the report cannot be encoded
   * @throws com.gentoro.usagereporting.exception.DeliveryException if the collector could not be
   *     reached or rejected the report
   * @throws com.gentoro.usagereporting.exception.ResponseParseException if the report was accepted
   *     but the response body was malformed
   */
  void send(Report report);
}
