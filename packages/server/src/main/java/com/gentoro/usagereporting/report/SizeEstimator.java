package com.gentoro.usagereporting.report;

import java.nio.charset.StandardCharsets;

/**
 * Running estimate of the encoded size of a report. Only ever grows; a fresh report starts from
 * zero.
 */
public class SizeEstimator {
  private long bytes;

  public long bytes() {
    return bytes;
  }

  public void add(long delta) {
    if (delta < 0) {
      throw new IllegalArgumentException("Size estimate cannot shrink: " + delta);
    }
    bytes += delta;
  }

  /** Length prefix plus the UTF-8 bytes of the string. */
  public static long estimatedBytesForString(String s) {
    return 2 + (s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length);
  }
}
