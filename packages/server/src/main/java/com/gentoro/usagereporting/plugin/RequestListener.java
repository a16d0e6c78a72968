package com.gentoro.usagereporting.plugin;

import com.gentoro.usagereporting.trace.ExecutionError;
import com.gentoro.usagereporting.trace.FieldCompletion;
import com.gentoro.usagereporting.trace.FieldInfo;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Callbacks a host invokes while serving one request, in this order:
 *
 * <ol>
 *   <li>{@link #didResolveSource} once the operation text is known;
 *   <li>{@link #didValidate} after validation;
 *   <li>{@link #didResolveOperation} once the operation to execute was selected (or found missing);
 *   <li>{@link #executionDidStart} when execution begins;
 *   <li>{@link #willResolveField} for each field, in any order and from any thread;
 *   <li>{@link #didEncounterErrors} for execution errors, and {@link
 *       #didEncounterSubsequentErrors} for errors of later incremental payloads;
 *   <li>{@link #willSendResponse} before the (first) response is written;
 *   <li>{@link #willSendSubsequentPayload} before each later incremental payload.
 * </ol>
 *
 * <p>Steps 2 to 6 are skipped for requests that fail earlier. Requests whose source never resolved
 * are not reported.
 */
public interface RequestListener {

  void didResolveSource(RequestContext context);

  /** @param errors validation errors; empty when the document is valid */
  void didValidate(List<ExecutionError> errors);

  void didResolveOperation(RequestContext context);

  /** Returns whether field resolution is traced, so whether {@link #willResolveField} matters. */
  boolean executionDidStart();

  FieldCompletion willResolveField(FieldInfo info);

  void didEncounterErrors(List<ExecutionError> errors);

  void didEncounterSubsequentErrors(List<ExecutionError> errors);

  /**
   * Returns a future that completes once the usage data of a non-incremental response was recorded.
   * Hosts do not need to wait for it.
   */
  CompletableFuture<Void> willSendResponse(RequestContext context);

  /** Returns a future that completes once the usage data was recorded, after the last payload. */
  CompletableFuture<Void> willSendSubsequentPayload(RequestContext context, boolean hasNext);
}
