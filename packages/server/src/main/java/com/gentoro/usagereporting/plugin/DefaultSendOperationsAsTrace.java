package com.gentoro.usagereporting.plugin;

import com.gentoro.usagereporting.report.DurationHistogram;
import com.gentoro.usagereporting.trace.Trace;
import com.gentoro.usagereporting.utility.JacksonUtility;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Sends one trace per stats key, duration bucket and minute; traces with errors additionally get
 * one per five seconds. Everything else goes to stats.
 *
 * <p>Seen keys are kept in a cache bounded to {@value #MAX_KEY_BYTES} bytes of keys.
 */
public class DefaultSendOperationsAsTrace implements SendOperationAsTrace {
  static final long MAX_KEY_BYTES = 1L << 20;

  private final Cache<String, Boolean> seen =
      Caffeine.newBuilder()
          .maximumWeight(MAX_KEY_BYTES)
          .weigher((String key, Boolean value) -> key.getBytes(StandardCharsets.UTF_8).length)
          .build();

  @Override
  public boolean shouldSend(Trace trace, String statsReportKey) {
    if (trace.getEndTime() == null) {
      throw new IllegalStateException("Trace has no end time");
    }
    long endSeconds = trace.getEndTime().seconds();
    String key =
        JacksonUtility.toJson(
            List.of(
                statsReportKey,
                DurationHistogram.durationToBucket(trace.getDurationNs()),
                Math.floorDiv(endSeconds, 60),
                hasErrors(trace) ? Math.floorDiv(endSeconds, 5) : ""));
    return seen.asMap().putIfAbsent(key, Boolean.TRUE) == null;
  }

  private static boolean hasErrors(Trace trace) {
    if (trace.getRoot() == null) return false;
    Deque<Trace.Node> pending = new ArrayDeque<>();
    pending.push(trace.getRoot());
    while (!pending.isEmpty()) {
      Trace.Node node = pending.pop();
      if (node.getErrors() != null && !node.getErrors().isEmpty()) return true;
      if (node.getChildren() != null) node.getChildren().forEach(pending::push);
    }
    return false;
  }
}
