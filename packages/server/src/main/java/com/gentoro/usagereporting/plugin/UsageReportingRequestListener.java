package com.gentoro.usagereporting.plugin;

import com.gentoro.usagereporting.UsageReportingOptions;
import com.gentoro.usagereporting.logging.LoggingService;
import com.gentoro.usagereporting.report.StatsReportKeys;
import com.gentoro.usagereporting.trace.ExecutionError;
import com.gentoro.usagereporting.trace.FieldCompletion;
import com.gentoro.usagereporting.trace.FieldInfo;
import com.gentoro.usagereporting.trace.Trace;
import com.gentoro.usagereporting.trace.TraceTreeBuilder;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;

/**
 * Records one request. Created when the request starts; timing starts immediately.
 *
 * <p>Requests that fail before their source is known (for example an unknown persisted query) are
 * not reported.
 */
public class UsageReportingRequestListener implements RequestListener {
  private static final Logger log = LoggingService.getLogger(UsageReportingRequestListener.class);

  private final UsageReportingOptions options;
  private final OperationRecorder recorder;
  private final RequestMetrics metrics;
  private final TraceTreeBuilder treeBuilder;

  private boolean didResolveSource;
  private boolean validationFailure;
  private boolean unknownOperationName;
  private Boolean includeRequest;
  private boolean finished;

  public UsageReportingRequestListener(
      UsageReportingOptions options, OperationRecorder recorder, RequestContext context) {
    this.options = options;
    this.recorder = recorder;
    this.metrics = context.getMetrics();
    this.treeBuilder = new TraceTreeBuilder(options.sendErrors());
    treeBuilder.startTiming();

    HttpRequestInfo http = context.getHttp();
    if (http != null) {
      Trace.Http traceHttp = new Trace.Http();
      traceHttp.setMethod(Trace.Http.Method.fromName(http.method()));
      HttpHeadersRecorder.record(traceHttp, http.headers(), options.sendHeaders());
      treeBuilder.trace().setHttp(traceHttp);
    }
  }

  /** The trace being built; exposed for inspection. */
  public Trace trace() {
    return treeBuilder.trace();
  }

  @Override
  public void didResolveSource(RequestContext context) {
    didResolveSource = true;
    Trace trace = treeBuilder.trace();
    if (metrics.isPersistedQueryHit()) trace.setPersistedQueryHit(true);
    if (metrics.isPersistedQueryRegister()) trace.setPersistedQueryRegister(true);

    if (context.getVariables() != null) {
      trace.setDetails(
          TraceDetailsFactory.create(context.getVariables(), options.sendVariableValues()));
    }

    ClientInfo clientInfo = options.clientInfoGenerator().generate(context);
    if (clientInfo != null) {
      trace.setClientName(clientInfo.clientName());
      trace.setClientVersion(clientInfo.clientVersion());
    }
  }

  @Override
  public void didValidate(List<ExecutionError> errors) {
    validationFailure = errors != null && !errors.isEmpty();
  }

  @Override
  public void didResolveOperation(RequestContext context) {
    unknownOperationName = !context.isOperationResolved();
    evaluateIncludeRequest(context);

    if (includeRequest && !unknownOperationName && metrics.getCaptureTraces() == null) {
      double weight = options.fieldLevelInstrumentation().weight(context);
      treeBuilder.trace().setFieldExecutionWeight(weight);
      metrics.setCaptureTraces(weight != 0);
    }
  }

  @Override
  public boolean executionDidStart() {
    return Boolean.TRUE.equals(metrics.getCaptureTraces());
  }

  @Override
  public FieldCompletion willResolveField(FieldInfo info) {
    if (!Boolean.TRUE.equals(metrics.getCaptureTraces())) {
      return FieldCompletion.NO_OP;
    }
    return treeBuilder.willResolveField(info);
  }

  @Override
  public void didEncounterErrors(List<ExecutionError> errors) {
    treeBuilder.didEncounterErrors(errors);
  }

  @Override
  public void didEncounterSubsequentErrors(List<ExecutionError> errors) {
    treeBuilder.didEncounterErrors(errors);
  }

  @Override
  public CompletableFuture<Void> willSendResponse(RequestContext context) {
    if (!didResolveSource) {
      return CompletableFuture.completedFuture(null);
    }
    if (!context.getErrors().isEmpty()) {
      treeBuilder.didEncounterErrors(context.getErrors());
    }
    if (context.isIncremental()) {
      return CompletableFuture.completedFuture(null);
    }
    return operationFinished(context);
  }

  @Override
  public CompletableFuture<Void> willSendSubsequentPayload(
      RequestContext context, boolean hasNext) {
    if (hasNext || !didResolveSource) {
      return CompletableFuture.completedFuture(null);
    }
    return operationFinished(context);
  }

  private void evaluateIncludeRequest(RequestContext context) {
    if (includeRequest != null) return;
    try {
      includeRequest = options.includeRequest().test(context);
    } catch (RuntimeException e) {
      log.warn("The includeRequest predicate failed; including the request: {}", e.getMessage());
      includeRequest = true;
    }
  }

  private CompletableFuture<Void> operationFinished(RequestContext context) {
    if (finished) {
      log.debug("Operation already finished; ignoring repeated completion");
      return CompletableFuture.completedFuture(null);
    }
    finished = true;

    boolean resolvedOperation = context.isOperationResolved();
    // Parse and validation failures never reach didResolveOperation.
    evaluateIncludeRequest(context);
    treeBuilder.stopTiming();

    if (!includeRequest) {
      return recorder.record(
          new FinishedOperation(
              context.getSchema(),
              null,
              null,
              null,
              null,
              null,
              resolvedOperation,
              false,
              false,
              List.of(),
              null,
              null));
    }

    Trace trace = treeBuilder.trace();
    trace.setFullQueryCacheHit(metrics.isResponseCacheHit());
    trace.setForbiddenOperation(metrics.isForbiddenOperation());
    trace.setRegisteredOperation(metrics.isRegisteredOperation());
    if (context.getOverallCachePolicy() != null) {
      trace.setCachePolicy(context.getOverallCachePolicy().toTraceCachePolicy());
    }
    if (metrics.getQueryPlanTrace() != null) {
      trace.setQueryPlan(metrics.getQueryPlanTrace());
    }

    String unexecutableKey = null;
    if (context.getDocument() == null) {
      unexecutableKey = StatsReportKeys.PARSE_FAILURE;
    } else if (validationFailure) {
      unexecutableKey = StatsReportKeys.VALIDATION_FAILURE;
    } else if (unknownOperationName) {
      unexecutableKey = StatsReportKeys.UNKNOWN_OPERATION_NAME;
    }

    return recorder.record(
        new FinishedOperation(
            context.getSchema(),
            trace,
            unexecutableKey,
            context.getDocument(),
            context.getQueryHash(),
            context.getOperationName() == null ? "" : context.getOperationName(),
            resolvedOperation,
            true,
            Boolean.TRUE.equals(metrics.getCaptureTraces()),
            metrics.getNonFtv1ErrorPaths(),
            context.getSource(),
            context.getRequestOperationName()));
  }
}
