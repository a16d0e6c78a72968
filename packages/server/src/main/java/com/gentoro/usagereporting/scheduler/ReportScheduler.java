package com.gentoro.usagereporting.scheduler;

import com.gentoro.usagereporting.exception.StateException;
import com.gentoro.usagereporting.logging.LoggingService;
import com.gentoro.usagereporting.report.Report;
import com.gentoro.usagereporting.report.ReportAccumulator;
import com.gentoro.usagereporting.trace.Timestamp;
import com.gentoro.usagereporting.transport.DeliveryTransport;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Decides when live reports are flushed and hands them to the {@link DeliveryTransport}.
 *
 * <p>Reports are flushed by a periodic timer (unless reports are sent immediately), right after a
 * request when immediate mode is on, as soon as the size estimate reaches the configured limit, and
 * on {@link #stop()}. Each flush detaches the live report first, so new requests start a fresh one
 * while the old one is being sent.
 *
 * <p>Delivery failures go to the {@link ErrorSink} and the report is dropped.
 */
public class ReportScheduler {
  private static final Logger log = LoggingService.getLogger(ReportScheduler.class);

  private final ReportingLoop loop;
  private final ReportRegistry registry;
  private final DeliveryTransport transport;
  private final Executor senderExecutor;
  private final ErrorSink errorSink;
  private final boolean sendReportsImmediately;
  private final long maxUncompressedReportSize;
  private final long reportIntervalMs;
  private final Supplier<Instant> clock;

  private ScheduledFuture<?> timer;
  private volatile boolean stopped;

  public ReportScheduler(
      ReportingLoop loop,
      ReportRegistry registry,
      DeliveryTransport transport,
      Executor senderExecutor,
      ErrorSink errorSink,
      boolean sendReportsImmediately,
      long maxUncompressedReportSize,
      long reportIntervalMs,
      Supplier<Instant> clock) {
    this.loop = Objects.requireNonNull(loop, "loop");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.senderExecutor = Objects.requireNonNull(senderExecutor, "senderExecutor");
    this.errorSink = Objects.requireNonNull(errorSink, "errorSink");
    this.sendReportsImmediately = sendReportsImmediately;
    this.maxUncompressedReportSize = maxUncompressedReportSize;
    this.reportIntervalMs = reportIntervalMs;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Starts the periodic timer. Does nothing in immediate mode. */
  public synchronized void start() {
    if (sendReportsImmediately || timer != null) return;
    timer = loop.scheduleAtFixedRate(this::flushAllOnLoop, reportIntervalMs);
  }

  public boolean isStopped() {
    return stopped;
  }

  /**
   * Applies a mutation to the live report of the schema id on the loop thread, then flushes it if
   * immediate mode is on or the report has grown past the size limit.
   *
   * <p>The returned future completes once the mutation and any flush it triggered have finished.
   * It never completes exceptionally; failures go to the error sink. After {@link #stop()} the
   * mutation is dropped.
   */
  public CompletableFuture<Void> record(
      String executableSchemaId, Consumer<ReportAccumulator> mutation) {
    return loop.submitAndChain(() -> recordOnLoop(executableSchemaId, mutation))
        .exceptionally(this::reportError);
  }

  /**
   * Same as {@link #record}, for callers already running on the loop. The live report is fetched
   * here, right before the mutation. Exceptions from the mutation are thrown to the caller; the
   * returned future is the flush it triggered, if any.
   */
  public CompletableFuture<Void> recordOnLoop(
      String executableSchemaId, Consumer<ReportAccumulator> mutation) {
    if (!loop.inLoop()) {
      throw new StateException("Reports may only be modified on the reporting loop");
    }
    if (stopped) {
      log.debug("Dropping usage data received after shutdown");
      return CompletableFuture.completedFuture(null);
    }
    ReportAccumulator report = registry.ensure(executableSchemaId);
    mutation.accept(report);
    if (sendReportsImmediately || report.sizeEstimate() >= maxUncompressedReportSize) {
      return flushOnLoop(executableSchemaId);
    }
    return CompletableFuture.completedFuture(null);
  }

  /** Flushes one schema id. Completes when delivery has settled. */
  public CompletableFuture<Void> flush(String executableSchemaId) {
    return loop.submitAndChain(() -> flushOnLoop(executableSchemaId));
  }

  /** Flushes every live report. Completes when all deliveries have settled. */
  public CompletableFuture<Void> flushAll() {
    return loop.submitAndChain(this::flushAllOnLoop);
  }

  /**
   * Cancels the timer, drops everything recorded from now on and flushes all live reports, blocking
   * until their delivery has settled. Calling it again only waits for another (empty) flush.
   */
  public void stop() {
    CompletableFuture<Void> done =
        loop.submitAndChain(
            () -> {
              synchronized (this) {
                if (timer != null) {
                  timer.cancel(false);
                  timer = null;
                }
              }
              stopped = true;
              return flushAllOnLoop();
            });
    try {
      done.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while flushing usage reports on shutdown");
    } catch (ExecutionException e) {
      errorSink.report(e.getCause());
    } finally {
      // The task never runs on a closed loop.
      stopped = true;
    }
  }

  private CompletableFuture<Void> flushAllOnLoop() {
    List<String> ids = registry.schemaIds();
    CompletableFuture<?>[] flushes = new CompletableFuture<?>[ids.size()];
    for (int i = 0; i < ids.size(); i++) {
      flushes[i] = flushOnLoop(ids.get(i));
    }
    return CompletableFuture.allOf(flushes);
  }

  private CompletableFuture<Void> flushOnLoop(String executableSchemaId) {
    ReportAccumulator detached = registry.detach(executableSchemaId);
    if (detached == null || detached.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    Report report = detached.finish(Timestamp.of(clock.get()));
    log.debug(
        "Flushing usage report for schema {} ({} operations, ~{} bytes)",
        executableSchemaId,
        report.getOperationCount(),
        detached.sizeEstimate());
    return CompletableFuture.runAsync(() -> transport.send(report), senderExecutor)
        .exceptionally(this::reportError);
  }

  private Void reportError(Throwable error) {
    Throwable cause = error;
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    errorSink.report(cause);
    return null;
  }
}
