package com.gentoro.usagereporting.plugin;

import com.gentoro.usagereporting.cache.OperationDerivedData;
import com.gentoro.usagereporting.cache.OperationDerivedDataCache;
import com.gentoro.usagereporting.report.ReportAccumulator;
import com.gentoro.usagereporting.report.StatsReportKeys;
import com.gentoro.usagereporting.scheduler.ErrorSink;
import com.gentoro.usagereporting.scheduler.ReportScheduler;
import com.gentoro.usagereporting.scheduler.ReportingLoop;
import com.gentoro.usagereporting.schema.ReferencedFieldsForType;
import com.gentoro.usagereporting.schema.SchemaIdMemo;
import com.gentoro.usagereporting.trace.Trace;
import com.gentoro.usagereporting.transport.TraceCapability;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Turns finished requests into report entries.
 *
 * <p>Work is queued on the reporting loop, so the request thread returns immediately. The schema
 * id, stats key and signature are computed there, then the trace is added to the live report of
 * its schema id. Failures go to the error sink.
 */
public class OperationRecorder {
  private final ReportingLoop loop;
  private final ReportScheduler scheduler;
  private final SchemaIdMemo schemaIdMemo;
  private final String overriddenSchemaId;
  private final OperationDerivedDataCache derivedDataCache;
  private final TraceCapability traceCapability;
  private final SendOperationAsTrace sendOperationAsTrace;
  private final boolean sendUnexecutableOperationDocuments;
  private final ErrorSink errorSink;

  public OperationRecorder(
      ReportingLoop loop,
      ReportScheduler scheduler,
      SchemaIdMemo schemaIdMemo,
      String overriddenSchemaId,
      OperationDerivedDataCache derivedDataCache,
      TraceCapability traceCapability,
      SendOperationAsTrace sendOperationAsTrace,
      boolean sendUnexecutableOperationDocuments,
      ErrorSink errorSink) {
    this.loop = loop;
    this.scheduler = scheduler;
    this.schemaIdMemo = schemaIdMemo;
    this.overriddenSchemaId = overriddenSchemaId;
    this.derivedDataCache = derivedDataCache;
    this.traceCapability = traceCapability;
    this.sendOperationAsTrace = sendOperationAsTrace;
    this.sendUnexecutableOperationDocuments = sendUnexecutableOperationDocuments;
    this.errorSink = errorSink;
  }

  /** Completes once the operation was recorded, and flushed if that was due. Never fails. */
  public CompletableFuture<Void> record(FinishedOperation operation) {
    if (scheduler.isStopped()) {
      return CompletableFuture.completedFuture(null);
    }
    return loop.submitAndChain(() -> recordOnLoop(operation))
        .exceptionally(
            error -> {
              errorSink.report(
                  error instanceof CompletionException && error.getCause() != null
                      ? error.getCause()
                      : error);
              return null;
            });
  }

  private CompletableFuture<Void> recordOnLoop(FinishedOperation operation) {
    String schemaId =
        overriddenSchemaId != null
            ? overriddenSchemaId
            : schemaIdMemo.executableSchemaId(operation.schema());

    if (!operation.included()) {
      if (!operation.resolvedOperation()) return CompletableFuture.completedFuture(null);
      return scheduler.recordOnLoop(schemaId, ReportAccumulator::incrementOperationCount);
    }

    Trace trace = operation.trace();
    String statsReportKey;
    Map<String, ReferencedFieldsForType> referencedFieldsByType;
    if (!operation.executable()) {
      statsReportKey = operation.unexecutableKey();
      referencedFieldsByType = Map.of();
      if (sendUnexecutableOperationDocuments) {
        trace.setUnexecutedOperationBody(operation.source());
        trace.setUnexecutedOperationName(
            operation.requestOperationName() == null ? "" : operation.requestOperationName());
      }
    } else {
      OperationDerivedData derived =
          derivedDataCache.get(
              operation.schema(),
              operation.queryHash(),
              operation.operationName(),
              operation.document());
      statsReportKey = StatsReportKeys.forOperation(operation.operationName(), derived.signature());
      referencedFieldsByType = derived.referencedFieldsByType();
    }

    // Unexecutable operations may go out as traces even without field tracing, for error analysis.
    boolean asTrace =
        traceCapability.isEnabled()
            && (!operation.executable() || operation.captureTraces())
            && operation.nonFtv1ErrorPaths().isEmpty()
            && sendOperationAsTrace.shouldSend(trace, statsReportKey);

    return scheduler.recordOnLoop(
        schemaId,
        report -> {
          if (operation.resolvedOperation()) report.incrementOperationCount();
          report.addTrace(
              statsReportKey,
              trace,
              asTrace,
              referencedFieldsByType,
              operation.nonFtv1ErrorPaths());
        });
  }
}
