package com.gentoro.usagereporting.report;

import com.gentoro.usagereporting.schema.ReferencedFieldsForType;
import com.gentoro.usagereporting.trace.Timestamp;
import com.gentoro.usagereporting.trace.Trace;
import com.gentoro.usagereporting.transport.ReportCodec;
import java.util.List;
import java.util.Map;

/**
 * The live report of one executable schema id.
 *
 * <p>Traces are added either as full encoded traces or folded into per-client stats. A running
 * size estimate is updated on every call, so callers can decide to flush without encoding the
 * report. Not thread-safe; owned by the reporting loop until it is detached and sent.
 */
public class ReportAccumulator {
  private final Report report;
  private final SizeEstimator sizeEstimator = new SizeEstimator();
  private final ReportCodec codec;
  private final long maxTraceBytes;

  public ReportAccumulator(ReportHeader header, ReportCodec codec, long maxTraceBytes) {
    this.report = new Report(header);
    this.codec = codec;
    this.maxTraceBytes = maxTraceBytes;
  }

  public String executableSchemaId() {
    return report.getHeader().getExecutableSchemaId();
  }

  /**
   * Records one request.
   *
   * @param asTrace keep the full trace; falls back to stats when its encoding is larger than the
   *     configured trace limit
   */
  public void addTrace(
      String statsReportKey,
      Trace trace,
      boolean asTrace,
      Map<String, ReferencedFieldsForType> referencedFieldsByType,
      List<NonFtv1ErrorPath> nonFtv1ErrorPaths) {
    TracesAndStats tracesAndStats = tracesAndStats(statsReportKey, referencedFieldsByType);
    if (asTrace) {
      byte[] encoded = codec.encodeTrace(trace);
      if (encoded.length <= maxTraceBytes) {
        tracesAndStats.addEncodedTrace(encoded);
        sizeEstimator.add(2L + encoded.length);
        return;
      }
    }
    tracesAndStats.addStats(trace, sizeEstimator, nonFtv1ErrorPaths);
  }

  public void incrementOperationCount() {
    report.setOperationCount(report.getOperationCount() + 1);
  }

  public long operationCount() {
    return report.getOperationCount();
  }

  public long sizeEstimate() {
    return sizeEstimator.bytes();
  }

  /** No stats key was ever recorded and no operation was counted. */
  public boolean isEmpty() {
    return report.getTracesPerQuery().isEmpty() && report.getOperationCount() == 0;
  }

  /** Rounds counters that accumulate fractional field execution weights. */
  public void ensureCountsAreIntegers() {
    report.getTracesPerQuery().values().forEach(TracesAndStats::ensureCountsAreIntegers);
  }

  /** Stamps the end time, rounds counters and hands out the report for delivery. */
  public Report finish(Timestamp endTime) {
    report.setEndTime(endTime);
    ensureCountsAreIntegers();
    return report;
  }

  /** Read access for inspection; the returned report must not be modified. */
  public Report report() {
    return report;
  }

  private TracesAndStats tracesAndStats(
      String statsReportKey, Map<String, ReferencedFieldsForType> referencedFieldsByType) {
    TracesAndStats existing = report.getTracesPerQuery().get(statsReportKey);
    if (existing != null) return existing;

    sizeEstimator.add(SizeEstimator.estimatedBytesForString(statsReportKey));
    for (Map.Entry<String, ReferencedFieldsForType> entry : referencedFieldsByType.entrySet()) {
      ReferencedFieldsForType fields = entry.getValue();
      sizeEstimator.add(4);
      if (fields.isInterface()) sizeEstimator.add(2);
      sizeEstimator.add(SizeEstimator.estimatedBytesForString(entry.getKey()));
      for (String fieldName : fields.fieldNames()) {
        sizeEstimator.add(SizeEstimator.estimatedBytesForString(fieldName));
      }
    }
    TracesAndStats created = new TracesAndStats(referencedFieldsByType);
    report.getTracesPerQuery().put(statsReportKey, created);
    return created;
  }
}
