package com.gentoro.usagereporting.schema;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SchemaIdMemoTest {

  @Test
  void coreSchemaHashIsLowercaseSha256Hex() {
    // SHA-256 of the empty string
    assertEquals(
        "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
        CoreSchemaHash.compute(""));
    assertEquals(64, CoreSchemaHash.compute("type Query { a: Int }").length());
  }

  @Test
  void generatorRunsOnlyWhenSchemaInstanceChanges() {
    AtomicInteger calls = new AtomicInteger();
    SchemaIdMemo memo =
        new SchemaIdMemo(
            schema -> {
              calls.incrementAndGet();
              return CoreSchemaHash.compute(schema.printSchema());
            });
    SchemaSnapshot first = () -> "type Query { a: Int }";
    SchemaSnapshot second = () -> "type Query { b: Int }";

    String id = memo.executableSchemaId(first);
    assertEquals(id, memo.executableSchemaId(first));
    assertEquals(1, calls.get());

    assertNotEquals(id, memo.executableSchemaId(second));
    assertEquals(2, calls.get());

    // A one-slot memo forgets the earlier schema.
    assertEquals(id, memo.executableSchemaId(first));
    assertEquals(3, calls.get());
  }

  @Test
  void defaultGeneratorHashesPrintedSchema() {
    SchemaSnapshot schema = () -> "type Query { a: Int }";
    assertEquals(
        CoreSchemaHash.compute("type Query { a: Int }"),
        SchemaIdGenerator.coreSchemaHash().executableSchemaId(schema));
  }
}
