package com.gentoro.usagereporting.cache;

import com.gentoro.usagereporting.schema.ReferencedFieldsForType;
import java.util.Map;

/** Per-operation values that are expensive to compute and only depend on the schema. */
public record OperationDerivedData(
    String signature, Map<String, ReferencedFieldsForType> referencedFieldsByType) {

  public OperationDerivedData {
    referencedFieldsByType = Map.copyOf(referencedFieldsByType);
  }
}
