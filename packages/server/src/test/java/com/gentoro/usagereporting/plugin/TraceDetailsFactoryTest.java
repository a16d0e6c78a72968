package com.gentoro.usagereporting.plugin;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usagereporting.trace.Trace;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TraceDetailsFactoryTest {

  public static class Unserializable {
    public String getValue() {
      throw new IllegalStateException("cannot read");
    }
  }

  private static Map<String, Object> variables() {
    Map<String, Object> variables = new LinkedHashMap<>();
    variables.put("id", "42");
    variables.put("filter", Map.of("tags", List.of("a")));
    variables.put("password", "hunter2");
    return variables;
  }

  @Test
  void permittedValuesAreJson() {
    Trace.Details details = TraceDetailsFactory.create(variables(), SendValuesPolicy.all());

    assertEquals("\"42\"", details.getVariablesJson().get("id"));
    assertEquals("{\"tags\":[\"a\"]}", details.getVariablesJson().get("filter"));
  }

  @Test
  void otherValuesAreBlankedButNamesKept() {
    Trace.Details details =
        TraceDetailsFactory.create(variables(), SendValuesPolicy.except(List.of("password")));

    assertEquals("", details.getVariablesJson().get("password"));
    assertEquals("\"42\"", details.getVariablesJson().get("id"));
    assertEquals(3, details.getVariablesJson().size());
  }

  @Test
  void noneKeepsOnlyNames() {
    Trace.Details details = TraceDetailsFactory.create(variables(), SendValuesPolicy.none());

    assertEquals(Map.of("id", "", "filter", "", "password", ""), details.getVariablesJson());
  }

  @Test
  void unserializableValueIsReplaced() {
    Map<String, Object> variables = new LinkedHashMap<>();
    variables.put("broken", new Unserializable());

    Trace.Details details = TraceDetailsFactory.create(variables, SendValuesPolicy.all());

    assertEquals(
        "\"[Unable to convert value to JSON]\"", details.getVariablesJson().get("broken"));
  }
}
