package com.gentoro.usagereporting.trace;

import com.gentoro.usagereporting.exception.StateException;
import com.gentoro.usagereporting.logging.LoggingService;
import com.gentoro.usagereporting.utility.JacksonUtility;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Builds the {@link Trace} of one request while it executes.
 *
 * <p>Lifecycle is {@code idle -> timing -> stopped}. Field nodes are addressed by their response
 * path, so list elements may complete in any order. Hosts may complete fields from worker threads;
 * every mutation is synchronized on the builder.
 *
 * <p>Field errors can be passed either to the {@link FieldCompletion} or to {@link
 * #didEncounterErrors(List)}. A host should use one of the two for a given error, not both.
 */
public class TraceTreeBuilder {
  private static final Logger log = LoggingService.getLogger(TraceTreeBuilder.class);

  private enum State {
    IDLE,
    TIMING,
    STOPPED
  }

  private final Trace trace = new Trace();
  private final Trace.Node rootNode = new Trace.Node();
  private final Map<String, Trace.Node> nodes = new HashMap<>();
  private final SendErrorsPolicy sendErrors;
  private final LongSupplier nanoClock;
  private final Supplier<Instant> wallClock;

  private State state = State.IDLE;
  private long startNanos;

  public TraceTreeBuilder(SendErrorsPolicy sendErrors) {
    this(sendErrors, System::nanoTime, Instant::now);
  }

  TraceTreeBuilder(
      SendErrorsPolicy sendErrors, LongSupplier nanoClock, Supplier<Instant> wallClock) {
    this.sendErrors = sendErrors == null ? SendErrorsPolicy.masked() : sendErrors;
    this.nanoClock = nanoClock;
    this.wallClock = wallClock;
    trace.setRoot(rootNode);
  }

  public Trace trace() {
    return trace;
  }

  public synchronized void startTiming() {
    if (state != State.IDLE) {
      throw new StateException("Trace timing has already started");
    }
    startNanos = nanoClock.getAsLong();
    trace.setStartTime(Timestamp.of(wallClock.get()));
    state = State.TIMING;
  }

  /** Records the end of the request. Calls after the first one are ignored. */
  public synchronized void stopTiming() {
    if (state == State.IDLE) {
      throw new StateException("Trace timing has not started");
    }
    if (state == State.STOPPED) return;
    trace.setDurationNs(nanoClock.getAsLong() - startNanos);
    trace.setEndTime(Timestamp.of(wallClock.get()));
    state = State.STOPPED;
  }

  public synchronized boolean isStopped() {
    return state == State.STOPPED;
  }

  /** Starts timing a field. Once the trace is stopped the returned callback does nothing. */
  public synchronized FieldCompletion willResolveField(FieldInfo info) {
    if (state == State.IDLE) {
      throw new StateException("willResolveField called before startTiming");
    }
    if (state == State.STOPPED) {
      return FieldCompletion.NO_OP;
    }

    ResponsePath path = info.path();
    Trace.Node node = nodeFor(path);
    node.setType(info.returnType());
    node.setParentType(info.parentType());
    node.setStartTime(offsetNanos());
    if (path.key() instanceof String && !path.key().equals(info.fieldName())) {
      node.setOriginalFieldName(info.fieldName());
    }

    return error -> fieldCompleted(node, path, error);
  }

  private synchronized void fieldCompleted(
      Trace.Node node, ResponsePath path, ExecutionError error) {
    if (state == State.STOPPED) return;
    node.setEndTime(offsetNanos());
    if (error != null) {
      recordError(error.path() == null ? withPath(error, path) : error);
    }
  }

  /** Attaches errors to the node at their path, or to the root when there is no such node. */
  public synchronized void didEncounterErrors(List<ExecutionError> errors) {
    for (ExecutionError error : errors) {
      recordError(error);
    }
  }

  private void recordError(ExecutionError error) {
    // Already reported in the trace of the service that produced it.
    if (error.extensions().get("serviceName") != null) return;

    ExecutionError reported = sendErrors.apply(error);
    if (reported == null) return;

    Trace.Node node = rootNode;
    ResponsePath path = ResponsePath.fromList(reported.path());
    if (path != null) {
      Trace.Node specific = nodes.get(path.asString());
      if (specific != null) {
        node = specific;
      } else {
        log.warn("Could not find node with path {}; attaching the error to the root node", path);
      }
    }
    String json = JacksonUtility.toJson(reported);
    node.getErrors().add(new Trace.Error(reported.message(), reported.locations(), json));
  }

  private static ExecutionError withPath(ExecutionError error, ResponsePath path) {
    return new ExecutionError(
        error.message(), error.locations(), path.asList(), error.extensions());
  }

  private long offsetNanos() {
    return nanoClock.getAsLong() - startNanos;
  }

  private Trace.Node nodeFor(ResponsePath path) {
    Trace.Node existing = nodes.get(path.asString());
    if (existing != null) return existing;

    Trace.Node node = new Trace.Node();
    if (path.isIndex()) {
      node.setIndex((Integer) path.key());
    } else {
      node.setResponseName((String) path.key());
    }
    nodes.put(path.asString(), node);
    Trace.Node parent = path.prev() == null ? rootNode : nodeFor(path.prev());
    parent.getChildren().add(node);
    return node;
  }
}
