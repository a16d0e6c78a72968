package com.gentoro.usagereporting.report;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usagereporting.schema.ReferencedFieldsForType;
import com.gentoro.usagereporting.trace.Timestamp;
import com.gentoro.usagereporting.trace.Trace;
import com.gentoro.usagereporting.transport.CborReportCodec;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReportAccumulatorTest {

  private static final String KEY = StatsReportKeys.forOperation("Q", "query Q{user{name}}");
  private static final Map<String, ReferencedFieldsForType> FIELDS =
      Map.of("Query", new ReferencedFieldsForType(List.of("user"), false));

  private final CborReportCodec codec = new CborReportCodec();

  private ReportAccumulator newAccumulator(long maxTraceBytes) {
    return new ReportAccumulator(
        ReportHeader.forSchema("graph@current", "schema-1"), codec, maxTraceBytes);
  }

  static Trace sampleTrace(String clientName, boolean withError) {
    Trace trace = new Trace();
    trace.setStartTime(Timestamp.of(Instant.parse("2024-05-01T10:00:00Z")));
    trace.setEndTime(Timestamp.of(Instant.parse("2024-05-01T10:00:01Z")));
    trace.setDurationNs(1_500_000);
    trace.setFieldExecutionWeight(1);
    trace.setClientName(clientName);

    Trace.Node root = new Trace.Node();
    Trace.Node user = new Trace.Node();
    user.setResponseName("user");
    user.setParentType("Query");
    user.setType("User");
    user.setStartTime(100);
    user.setEndTime(600);
    if (withError) {
      user.getErrors().add(new Trace.Error("boom", List.of(), "{\"message\":\"boom\"}"));
    }
    root.getChildren().add(user);
    trace.setRoot(root);
    return trace;
  }

  @Test
  void keepsFullTraceWhenSmallEnough() {
    ReportAccumulator accumulator = newAccumulator(1024 * 1024);

    accumulator.addTrace(KEY, sampleTrace("web", false), true, FIELDS, List.of());

    TracesAndStats entry = accumulator.report().getTracesPerQuery().get(KEY);
    assertEquals(1, entry.getTrace().size());
    assertFalse(entry.hasStats());
    assertEquals(FIELDS, entry.getReferencedFieldsByType());
    assertEquals("web", codec.decodeTrace(entry.getTrace().get(0)).getClientName());
  }

  @Test
  @DisplayName("A trace larger than the limit is folded into stats instead")
  void oversizedTraceFallsBackToStats() {
    ReportAccumulator accumulator = newAccumulator(8);

    accumulator.addTrace(KEY, sampleTrace("web", false), true, FIELDS, List.of());

    TracesAndStats entry = accumulator.report().getTracesPerQuery().get(KEY);
    assertTrue(entry.getTrace().isEmpty());
    ContextualizedStats stats = entry.statsFor(new StatsContext("web", null));
    assertNotNull(stats);
    assertEquals(1, stats.getQueryLatencyStats().getRequestCount());
    FieldStat user = stats.getPerTypeStat().get("Query").getPerFieldStat().get("user");
    assertEquals("User", user.getReturnType());
    assertEquals(1, user.getObservedExecutionCount());
  }

  @Test
  void statsAreKeptPerClient() {
    ReportAccumulator accumulator = newAccumulator(1024);

    accumulator.addTrace(KEY, sampleTrace("web", false), false, FIELDS, List.of());
    accumulator.addTrace(KEY, sampleTrace("web", true), false, FIELDS, List.of());
    accumulator.addTrace(KEY, sampleTrace("ios", false), false, FIELDS, List.of());

    TracesAndStats entry = accumulator.report().getTracesPerQuery().get(KEY);
    QueryLatencyStats web = entry.statsFor(new StatsContext("web", "")).getQueryLatencyStats();
    assertEquals(2, web.getRequestCount());
    assertEquals(1, web.getRequestsWithErrorsCount());
    assertEquals(1, web.getRootErrorStats().getChildren().get("user").getErrorsCount());
    assertEquals(
        1, entry.statsFor(new StatsContext("ios", "")).getQueryLatencyStats().getRequestCount());
  }

  @Test
  void nonFtv1ErrorsAreCountedPerService() {
    ReportAccumulator accumulator = newAccumulator(1024);

    accumulator.addTrace(
        KEY,
        sampleTrace(null, false),
        false,
        FIELDS,
        List.of(new NonFtv1ErrorPath("accounts", List.of("user", 0, "name"))));

    QueryLatencyStats stats =
        accumulator
            .report()
            .getTracesPerQuery()
            .get(KEY)
            .statsFor(new StatsContext(null, null))
            .getQueryLatencyStats();
    PathErrorStats service = stats.getRootErrorStats().getChildren().get("service:accounts");
    PathErrorStats name = service.getChildren().get("user").getChildren().get("name");
    assertEquals(1, name.getErrorsCount());
    assertEquals(1, name.getRequestsWithErrorsCount());
    assertEquals(1, stats.getRequestsWithErrorsCount());
  }

  @Test
  @DisplayName("The size estimate never shrinks and grows with every new key")
  void sizeEstimateIsMonotonic() {
    ReportAccumulator accumulator = newAccumulator(1024 * 1024);
    long previous = accumulator.sizeEstimate();
    assertEquals(0, previous);

    for (int i = 0; i < 5; i++) {
      accumulator.addTrace(KEY + i, sampleTrace("web", false), i % 2 == 0, FIELDS, List.of());
      assertTrue(accumulator.sizeEstimate() > previous);
      previous = accumulator.sizeEstimate();
    }
    accumulator.addTrace(KEY + 1, sampleTrace("web", false), false, FIELDS, List.of());
    assertTrue(accumulator.sizeEstimate() >= previous);
  }

  @Test
  void emptyUntilSomethingIsRecorded() {
    ReportAccumulator accumulator = newAccumulator(1024);
    assertTrue(accumulator.isEmpty());

    accumulator.incrementOperationCount();

    assertFalse(accumulator.isEmpty());
    assertEquals(1, accumulator.operationCount());
    assertEquals("schema-1", accumulator.executableSchemaId());
  }

  @Test
  void finishStampsEndTimeAndRoundsWeights() {
    ReportAccumulator accumulator = newAccumulator(1024);
    Trace trace = sampleTrace("web", false);
    trace.setFieldExecutionWeight(2.5);
    accumulator.addTrace(KEY, trace, false, FIELDS, List.of());

    Timestamp end = Timestamp.of(Instant.parse("2024-05-01T10:01:00Z"));
    Report report = accumulator.finish(end);

    assertEquals(end, report.getEndTime());
    ContextualizedStats stats =
        report.getTracesPerQuery().get(KEY).statsFor(new StatsContext("web", ""));
    FieldStat user = stats.getPerTypeStat().get("Query").getPerFieldStat().get("user");
    assertEquals(3.0, user.getEstimatedExecutionCount());
  }

  @Test
  void stringSizeCountsUtf8Bytes() {
    assertEquals(2, SizeEstimator.estimatedBytesForString(""));
    assertEquals(5, SizeEstimator.estimatedBytesForString("abc"));
    assertEquals(4, SizeEstimator.estimatedBytesForString("é"));
  }
}
