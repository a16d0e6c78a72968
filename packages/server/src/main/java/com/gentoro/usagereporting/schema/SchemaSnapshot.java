package com.gentoro.usagereporting.schema;

/**
 * One immutable version of the served schema, as supplied by the host.
 *
 * <p>Identity matters: caches scoped to a schema compare snapshots with {@code ==}, so a host must
 * hand out the same instance for as long as the schema does not change.
 */
public interface SchemaSnapshot {

  /** Printed SDL of the schema; input to the default executable schema id. */
  String printSchema();
}
