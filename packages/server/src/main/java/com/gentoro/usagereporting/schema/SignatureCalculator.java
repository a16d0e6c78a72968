package com.gentoro.usagereporting.schema;

/** Computes the normalized signature used to group equivalent operations. */
@FunctionalInterface
public interface SignatureCalculator {

  /**
   * @param document a document that parsed and validated
   * @param operationName the resolved operation name, empty for an anonymous operation
   */
  String signature(OperationDocument document, String operationName);
}
