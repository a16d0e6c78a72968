package com.gentoro.usagereporting.schema;

/**
 * A parsed and validated executable document, as supplied by the host. Only documents that parsed
 * successfully are ever represented by this type.
 */
public interface OperationDocument {

  /** Source text the document was parsed from. */
  String source();
}
