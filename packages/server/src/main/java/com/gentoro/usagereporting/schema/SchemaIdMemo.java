package com.gentoro.usagereporting.schema;

import java.util.Objects;

/**
 * One-slot memo of the last schema snapshot seen and its executable schema id. Printing and hashing
 * a schema is expensive while schema changes are rare, so a single entry is enough.
 *
 * <p>Not thread-safe; owned by the reporting loop.
 */
public final class SchemaIdMemo {
  private final SchemaIdGenerator generator;
  private SchemaSnapshot lastSchema;
  private String lastId;

  public SchemaIdMemo(SchemaIdGenerator generator) {
    this.generator = Objects.requireNonNull(generator, "generator");
  }

  public String executableSchemaId(SchemaSnapshot schema) {
    if (lastSchema != null && lastSchema == schema) {
      return lastId;
    }
    String id = generator.executableSchemaId(schema);
    lastSchema = schema;
    lastId = id;
    return id;
  }
}
