package com.gentoro.usagereporting.schema;

import java.util.Map;

/** Computes which {@code type.field} pairs an operation statically touches. */
@FunctionalInterface
public interface ReferencedFieldsCalculator {

  /**
   * @return referenced fields keyed by type name
   */
  Map<String, ReferencedFieldsForType> referencedFieldsByType(
      OperationDocument document, SchemaSnapshot schema, String resolvedOperationName);
}
