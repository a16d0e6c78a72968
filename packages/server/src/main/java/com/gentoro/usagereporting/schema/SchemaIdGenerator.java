package com.gentoro.usagereporting.schema;

/** Produces the stable executable schema id for a schema snapshot. */
@FunctionalInterface
public interface SchemaIdGenerator {

  String executableSchemaId(SchemaSnapshot schema);

  /** SHA-256 of the printed schema. */
  static SchemaIdGenerator coreSchemaHash() {
    return schema -> CoreSchemaHash.compute(schema.printSchema());
  }
}
