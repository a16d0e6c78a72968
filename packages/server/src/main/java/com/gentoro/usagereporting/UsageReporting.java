package com.gentoro.usagereporting;

import com.gentoro.usagereporting.cache.OperationDerivedDataCache;
import com.gentoro.usagereporting.logging.LoggingService;
import com.gentoro.usagereporting.plugin.OperationRecorder;
import com.gentoro.usagereporting.plugin.RequestContext;
import com.gentoro.usagereporting.plugin.RequestListener;
import com.gentoro.usagereporting.plugin.UsageReportingRequestListener;
import com.gentoro.usagereporting.report.ReportAccumulator;
import com.gentoro.usagereporting.report.ReportHeader;
import com.gentoro.usagereporting.scheduler.ReportRegistry;
import com.gentoro.usagereporting.scheduler.ReportScheduler;
import com.gentoro.usagereporting.scheduler.ReportingLoop;
import com.gentoro.usagereporting.schema.CoreSchemaHash;
import com.gentoro.usagereporting.schema.SchemaIdMemo;
import com.gentoro.usagereporting.transport.BackoffPolicy;
import com.gentoro.usagereporting.transport.CborReportCodec;
import com.gentoro.usagereporting.transport.DeliveryTransport;
import com.gentoro.usagereporting.transport.HttpDeliveryTransport;
import com.gentoro.usagereporting.transport.OkHttpFactory;
import com.gentoro.usagereporting.transport.ReportCodec;
import com.gentoro.usagereporting.transport.Sleeper;
import com.gentoro.usagereporting.transport.TraceCapability;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Entry point of usage reporting. Wires the reporting loop, the scheduler and the HTTP transport,
 * and hands out one {@link RequestListener} per request.
 *
 * <p>Invalid options fail construction with a {@link
 * com.gentoro.usagereporting.exception.ConfigException} before any thread is started.
 */
public class UsageReporting implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(UsageReporting.class);

  private final UsageReportingOptions options;
  private final TraceCapability traceCapability;
  private final ReportingLoop loop;
  private final ExecutorService senderExecutor;
  private final ReportScheduler scheduler;
  private final OperationRecorder recorder;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private volatile Thread shutdownHook;

  public UsageReporting(UsageReportingOptions options) {
    this(options, null, Instant::now);
  }

  /**
   * @param transport replaces the HTTP transport when non-null
   */
  UsageReporting(
      UsageReportingOptions options, DeliveryTransport transport, Supplier<Instant> clock) {
    this.options = options;
    this.traceCapability = new TraceCapability(options.sendTraces());
    ReportCodec codec = new CborReportCodec();
    DeliveryTransport delivery =
        transport != null
            ? transport
            : new HttpDeliveryTransport(
                OkHttpFactory.create(options.requestTimeoutMs()),
                options.endpointUrl(),
                options.apiKey(),
                codec,
                BackoffPolicy.exponential(
                    options.maxAttempts(), Duration.ofMillis(options.minimumRetryDelayMs())),
                Sleeper.SYSTEM,
                traceCapability,
                options.debugPrintReports());

    String graphRef = options.graphRef();
    ReportRegistry registry =
        new ReportRegistry(
            schemaId ->
                new ReportAccumulator(
                    ReportHeader.forSchema(graphRef, schemaId), codec, options.maxTraceBytes()));

    this.loop = new ReportingLoop("usage-reporting-loop");
    this.senderExecutor =
        Executors.newCachedThreadPool(
            runnable -> {
              Thread t = new Thread(runnable, "usage-reporting-sender");
              t.setDaemon(true);
              return t;
            });
    this.scheduler =
        new ReportScheduler(
            loop,
            registry,
            delivery,
            senderExecutor,
            options.errorSink(),
            options.sendReportsImmediately(),
            options.maxUncompressedReportSize(),
            options.reportIntervalMs(),
            clock);

    String overriddenSchemaId =
        options.overrideReportedSchema() == null
            ? null
            : CoreSchemaHash.compute(options.overrideReportedSchema());
    this.recorder =
        new OperationRecorder(
            loop,
            scheduler,
            new SchemaIdMemo(options.schemaIdGenerator()),
            overriddenSchemaId,
            new OperationDerivedDataCache(
                options.signatureCalculator(),
                options.referencedFieldsCalculator(),
                options.operationDerivedDataCacheMaxBytes()),
            traceCapability,
            options.sendOperationAsTrace(),
            options.sendUnexecutableOperationDocuments(),
            options.errorSink());
  }

  /** Loads {@code usageReporting.*} from the given YAML location and applies its logging levels. */
  public static UsageReporting fromConfiguration(String location) {
    Configuration config = new ConfigurationProvider(location).config();
    LoggingService.applyConfiguration(config);
    return new UsageReporting(UsageReportingOptions.fromConfiguration(config).build());
  }

  /** Starts the periodic report timer. Calling it again has no effect. */
  public void start() {
    if (!started.compareAndSet(false, true)) return;
    log.info(
        "Usage reporting starting for graph {} (immediate={}, interval={}ms)",
        options.graphRef(),
        options.sendReportsImmediately(),
        options.reportIntervalMs());
    scheduler.start();
  }

  /** Registers a JVM shutdown hook that flushes pending reports. */
  public void registerShutdownHook() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::stop, "usage-reporting-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
  }

  /** Creates the listener of one request. Timing starts now. */
  public RequestListener requestDidStart(RequestContext context) {
    return new UsageReportingRequestListener(options, recorder, context);
  }

  /** Flushes every pending report. */
  public CompletableFuture<Void> flush() {
    return scheduler.flushAll();
  }

  public boolean isStopped() {
    return shuttingDown.get();
  }

  /**
   * Stops the timer, sends every pending report and releases the threads. Safe to call multiple
   * times; executed only once.
   */
  public void stop() {
    if (!shuttingDown.compareAndSet(false, true)) return;
    log.info("Usage reporting stopping for graph {}", options.graphRef());
    try {
      scheduler.stop();
    } finally {
      loop.close();
      senderExecutor.shutdown();
      try {
        if (!senderExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("Report sender did not terminate in time");
          senderExecutor.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        senderExecutor.shutdownNow();
      }
    }
  }

  @Override
  public void close() {
    stop();
  }

  TraceCapability traceCapability() {
    return traceCapability;
  }
}
