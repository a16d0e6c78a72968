package com.gentoro.usagereporting.cache;

/** Identity of one operation within a document: the query hash plus the selected operation. */
public record OperationDerivedDataKey(String queryHash, String operationName) {

  public OperationDerivedDataKey {
    operationName = operationName == null ? "" : operationName;
  }
}
