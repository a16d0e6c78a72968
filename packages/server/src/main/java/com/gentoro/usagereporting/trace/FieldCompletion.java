package com.gentoro.usagereporting.trace;

/** Handed out when a field starts resolving; invoked once the field has a value or failed. */
@FunctionalInterface
public interface FieldCompletion {
  FieldCompletion NO_OP = error -> {};

  /**
   * @param error the field error, or null when the field resolved
   */
  void complete(ExecutionError error);

  default void complete() {
    complete(null);
  }
}
