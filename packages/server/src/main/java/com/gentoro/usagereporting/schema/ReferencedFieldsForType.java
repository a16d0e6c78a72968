package com.gentoro.usagereporting.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Fields of one type that an operation statically references.
 *
 * @param fieldNames referenced field names, in the order the calculator found them
 * @param isInterface whether the type is an interface type
 */
public record ReferencedFieldsForType(
    @JsonProperty("fieldNames") List<String> fieldNames,
    @JsonProperty("isInterface") boolean isInterface) {
  public ReferencedFieldsForType {
    fieldNames = fieldNames == null ? List.of() : List.copyOf(fieldNames);
  }
}
