package com.gentoro.usagereporting.cache;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usagereporting.schema.LexicalSignatureCalculator;
import com.gentoro.usagereporting.schema.OperationDocument;
import com.gentoro.usagereporting.schema.ReferencedFieldsForType;
import com.gentoro.usagereporting.schema.SchemaSnapshot;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OperationDerivedDataCacheTest {

  private final SchemaSnapshot schemaV1 = () -> "type Query { user: User }";
  private final SchemaSnapshot schemaV2 = () -> "type Query { user: User, me: User }";
  private final OperationDocument document = () -> "query Q { user { name } }";

  private OperationDerivedDataCache newCache(long maxBytes) {
    return new OperationDerivedDataCache(
        new LexicalSignatureCalculator(),
        (doc, schema, name) ->
            Map.of("User", new ReferencedFieldsForType(List.of("name"), false)),
        maxBytes);
  }

  @Test
  void repeatedLookupIsServedFromCache() {
    OperationDerivedDataCache cache = newCache(1024 * 1024);

    OperationDerivedData first = cache.get(schemaV1, "hash-1", "Q", document);
    OperationDerivedData second = cache.get(schemaV1, "hash-1", "Q", document);

    assertSame(first, second);
    assertEquals(1, cache.computationCount());
    assertEquals("query Q{user{name}}", first.signature());
    assertEquals(List.of("name"), first.referencedFieldsByType().get("User").fieldNames());
  }

  @Test
  void operationNameIsPartOfTheKey() {
    OperationDerivedDataCache cache = newCache(1024 * 1024);
    OperationDocument multi = () -> "query A { a } query B { b }";

    assertEquals("query A{a}", cache.get(schemaV1, "h", "A", multi).signature());
    assertEquals("query B{b}", cache.get(schemaV1, "h", "B", multi).signature());
    assertEquals(2, cache.computationCount());
  }

  @Test
  void schemaChangeDropsEveryEntry() {
    OperationDerivedDataCache cache = newCache(1024 * 1024);

    cache.get(schemaV1, "hash-1", "Q", document);
    cache.get(schemaV2, "hash-1", "Q", document);
    cache.get(schemaV1, "hash-1", "Q", document);

    assertEquals(3, cache.computationCount());
  }

  @Test
  void rejectsNonPositiveWeight() {
    assertThrows(IllegalArgumentException.class, () -> newCache(0));
  }
}
