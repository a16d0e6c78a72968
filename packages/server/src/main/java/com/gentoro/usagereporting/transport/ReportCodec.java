package com.gentoro.usagereporting.transport;

import com.gentoro.usagereporting.report.Report;
import com.gentoro.usagereporting.trace.Trace;

/**
 * Binary wire format of reports and traces. Every method throws {@link
 * com.gentoro.usagereporting.exception.EncodingException} when a value cannot be written or read.
 */
public interface ReportCodec {

  /** Checks that the report is complete enough to be encoded. */
  void verify(Report report);

  byte[] encode(Report report);

  Report decode(byte[] bytes);

  byte[] encodeTrace(Trace trace);

  Trace decodeTrace(byte[] bytes);

  /** Decodes an encoded report, traces included, and renders it as JSON for debugging. */
  String toDebugJson(byte[] encodedReport);
}
