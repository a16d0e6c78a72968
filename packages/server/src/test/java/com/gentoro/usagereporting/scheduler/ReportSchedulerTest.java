package com.gentoro.usagereporting.scheduler;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.usagereporting.exception.DeliveryException;
import com.gentoro.usagereporting.exception.StateException;
import com.gentoro.usagereporting.report.ContextualizedStats;
import com.gentoro.usagereporting.report.Report;
import com.gentoro.usagereporting.report.ReportAccumulator;
import com.gentoro.usagereporting.report.ReportHeader;
import com.gentoro.usagereporting.report.TracesAndStats;
import com.gentoro.usagereporting.trace.Timestamp;
import com.gentoro.usagereporting.trace.Trace;
import com.gentoro.usagereporting.transport.CborReportCodec;
import com.gentoro.usagereporting.transport.DeliveryTransport;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReportSchedulerTest {

  private static final String KEY = "# Q\nquery Q{a}";
  private static final String OTHER_KEY = "# R\nquery R{b}";
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Mock private ErrorSink errorSink;

  private final List<Report> sent = new CopyOnWriteArrayList<>();
  private final CborReportCodec codec = new CborReportCodec();
  private final ReportingLoop loop = new ReportingLoop("report-scheduler-test");
  private ReportRegistry registry;

  @AfterEach
  void tearDown() {
    loop.close();
  }

  private ReportScheduler newScheduler(
      DeliveryTransport transport, boolean immediate, long maxSize, long intervalMs) {
    registry =
        new ReportRegistry(
            id -> new ReportAccumulator(ReportHeader.forSchema("graph@current", id), codec, 1024));
    return new ReportScheduler(
        loop,
        registry,
        transport,
        Runnable::run,
        errorSink,
        immediate,
        maxSize,
        intervalMs,
        () -> NOW);
  }

  private ReportScheduler newScheduler(boolean immediate, long maxSize) {
    return newScheduler(sent::add, immediate, maxSize, 60_000);
  }

  private static Consumer<ReportAccumulator> oneOperation() {
    return oneOperation(KEY);
  }

  private static Consumer<ReportAccumulator> oneOperation(String statsReportKey) {
    return report -> {
      Trace trace = new Trace();
      trace.setDurationNs(1_000_000);
      trace.setRoot(new Trace.Node());
      report.incrementOperationCount();
      report.addTrace(statsReportKey, trace, false, Map.of(), List.of());
    };
  }

  private static long requestCount(TracesAndStats entry) {
    long total = 0;
    for (ContextualizedStats stats : entry.getStatsWithContext()) {
      total += stats.getQueryLatencyStats().getRequestCount();
    }
    return total;
  }

  private long liveSizeEstimate(String schemaId) {
    return loop.submit(() -> registry.ensure(schemaId).sizeEstimate()).join();
  }

  private void awaitSent(int count) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5_000;
    while (sent.size() < count && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
  }

  @Test
  @DisplayName("One timer tick sends one report grouped by stats key, then a fresh report fills up")
  void timerFlushesRecordedOperations() throws Exception {
    ReportScheduler scheduler = newScheduler(sent::add, false, 1 << 20, 300);
    scheduler.start();

    CompletableFuture.allOf(
            scheduler.record("schema-1", oneOperation(KEY)),
            scheduler.record("schema-1", oneOperation(KEY)),
            scheduler.record("schema-1", oneOperation(OTHER_KEY)))
        .join();

    awaitSent(1);
    Thread.sleep(700);
    assertEquals(1, sent.size());
    Report report = sent.get(0);
    assertEquals(3, report.getOperationCount());
    assertEquals(Timestamp.of(NOW), report.getEndTime());
    assertEquals(Set.of(KEY, OTHER_KEY), report.getTracesPerQuery().keySet());
    assertEquals(2, requestCount(report.getTracesPerQuery().get(KEY)));
    assertEquals(1, requestCount(report.getTracesPerQuery().get(OTHER_KEY)));

    scheduler.record("schema-1", oneOperation(KEY)).join();
    scheduler.flushAll().join();

    assertEquals(2, sent.size());
    assertEquals(1, sent.get(1).getOperationCount());
    assertEquals(1, requestCount(sent.get(1).getTracesPerQuery().get(KEY)));
  }

  @Test
  @DisplayName("Flushing detaches the report, so the size estimate starts again from zero")
  void flushResetsSizeEstimate() {
    ReportScheduler scheduler = newScheduler(false, 1 << 20);

    scheduler.record("schema-1", oneOperation()).join();
    assertTrue(liveSizeEstimate("schema-1") > 0);

    scheduler.flush("schema-1").join();

    assertEquals(1, sent.size());
    assertEquals(0, liveSizeEstimate("schema-1"));
  }

  @Test
  @DisplayName("Work arriving after the loop is closed is dropped without an error")
  void closedLoopDropsWork() {
    ReportScheduler scheduler = newScheduler(false, 1 << 20);
    loop.close();

    assertDoesNotThrow(() -> scheduler.record("schema-1", oneOperation()).join());
    assertDoesNotThrow(() -> scheduler.flushAll().join());
    assertDoesNotThrow(scheduler::stop);

    assertTrue(sent.isEmpty());
    assertTrue(scheduler.isStopped());
    verifyNoInteractions(errorSink);
  }

  @Test
  void nothingIsSentBeforeTheInterval() {
    ReportScheduler scheduler = newScheduler(false, 1 << 20);
    scheduler.start();

    scheduler.record("schema-1", oneOperation()).join();

    assertTrue(sent.isEmpty());
    scheduler.flushAll().join();
    assertEquals(1, sent.size());
  }

  @Test
  @DisplayName("Reaching the size limit flushes before record completes")
  void sizeLimitFlushesSynchronously() {
    ReportScheduler scheduler = newScheduler(false, 1);

    scheduler.record("schema-1", oneOperation()).join();

    assertEquals(1, sent.size());
    assertEquals(1, sent.get(0).getOperationCount());
  }

  @Test
  void immediateModeSendsEveryOperation() {
    ReportScheduler scheduler = newScheduler(true, 1 << 20);
    scheduler.start();

    scheduler.record("schema-1", oneOperation()).join();
    scheduler.record("schema-1", oneOperation()).join();

    assertEquals(2, sent.size());
  }

  @Test
  void emptyReportsAreNotSent() {
    ReportScheduler scheduler = newScheduler(false, 1 << 20);

    scheduler.record("schema-1", report -> {}).join();
    scheduler.flushAll().join();

    assertTrue(sent.isEmpty());
  }

  @Test
  @DisplayName("Stopping flushes every schema id and drops later operations")
  void stopFlushesAllAndDropsLaterWork() {
    ReportScheduler scheduler = newScheduler(false, 1 << 20);
    scheduler.start();
    scheduler.record("schema-a", oneOperation()).join();
    scheduler.record("schema-b", oneOperation()).join();

    scheduler.stop();

    assertEquals(2, sent.size());
    assertEquals(
        List.of("schema-a", "schema-b"),
        List.of(
            sent.get(0).getHeader().getExecutableSchemaId(),
            sent.get(1).getHeader().getExecutableSchemaId()));
    assertTrue(scheduler.isStopped());

    scheduler.record("schema-a", oneOperation()).join();
    scheduler.flushAll().join();
    assertEquals(2, sent.size());
  }

  @Test
  void operationCountWithoutTracesIsStillReported() {
    ReportScheduler scheduler = newScheduler(false, 1 << 20);

    scheduler.record("schema-1", ReportAccumulator::incrementOperationCount).join();
    scheduler.flush("schema-1").join();

    assertEquals(1, sent.size());
    assertEquals(1, sent.get(0).getOperationCount());
    assertTrue(sent.get(0).getTracesPerQuery().isEmpty());
  }

  @Test
  void deliveryFailuresGoToTheErrorSink() {
    DeliveryException failure = new DeliveryException("collector down", 503, 5);
    ReportScheduler scheduler =
        newScheduler(
            report -> {
              throw failure;
            },
            false,
            1,
            60_000);

    scheduler.record("schema-1", oneOperation()).join();

    verify(errorSink).report(failure);
  }

  @Test
  void mutationFailuresGoToTheErrorSink() {
    ReportScheduler scheduler = newScheduler(false, 1 << 20);

    scheduler
        .record(
            "schema-1",
            report -> {
              throw new IllegalStateException("broken mutation");
            })
        .join();

    verify(errorSink).report(any(IllegalStateException.class));
  }

  @Test
  void recordOnLoopRejectsOtherThreads() {
    ReportScheduler scheduler = newScheduler(false, 1 << 20);

    assertThrows(StateException.class, () -> scheduler.recordOnLoop("schema-1", oneOperation()));
  }
}
