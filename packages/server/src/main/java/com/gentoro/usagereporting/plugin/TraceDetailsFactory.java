package com.gentoro.usagereporting.plugin;

import com.gentoro.usagereporting.exception.EncodingException;
import com.gentoro.usagereporting.trace.Trace;
import com.gentoro.usagereporting.utility.JacksonUtility;
import java.util.Map;

/** Records operation variables on a trace. */
public final class TraceDetailsFactory {
  static final String UNSERIALIZABLE = JacksonUtility.toJson("[Unable to convert value to JSON]");

  private TraceDetailsFactory() {}

  /**
   * Every variable name is recorded. Values the policy does not permit are recorded as an empty
   * string; the others as JSON.
   */
  public static Trace.Details create(Map<String, Object> variables, SendValuesPolicy policy) {
    Trace.Details details = new Trace.Details();
    variables.forEach(
        (name, value) -> {
          if (policy == null || !policy.permits(name)) {
            details.getVariablesJson().put(name, "");
            return;
          }
          try {
            details.getVariablesJson().put(name, JacksonUtility.toJson(value));
          } catch (EncodingException e) {
            details.getVariablesJson().put(name, UNSERIALIZABLE);
          }
        });
    return details;
  }
}
