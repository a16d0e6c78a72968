package com.gentoro.usagereporting.plugin;

import com.gentoro.usagereporting.report.NonFtv1ErrorPath;
import com.gentoro.usagereporting.schema.OperationDocument;
import com.gentoro.usagereporting.schema.SchemaSnapshot;
import com.gentoro.usagereporting.trace.Trace;
import java.util.List;

/**
 * A request whose response has been sent, ready to be recorded in a report.
 *
 * @param unexecutableKey sentinel stats key when the operation could not be executed, else null
 * @param included false when the include predicate rejected the request; only the operation count
 *     is then updated
 */
public record FinishedOperation(
    SchemaSnapshot schema,
    Trace trace,
    String unexecutableKey,
    OperationDocument document,
    String queryHash,
    String operationName,
    boolean resolvedOperation,
    boolean included,
    boolean captureTraces,
    List<NonFtv1ErrorPath> nonFtv1ErrorPaths,
    String source,
    String requestOperationName) {

  public FinishedOperation {
    nonFtv1ErrorPaths = nonFtv1ErrorPaths == null ? List.of() : List.copyOf(nonFtv1ErrorPaths);
  }

  public boolean executable() {
    return unexecutableKey == null;
  }
}
