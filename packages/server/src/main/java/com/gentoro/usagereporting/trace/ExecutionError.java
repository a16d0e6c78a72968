package com.gentoro.usagereporting.trace;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An error reported by the host, in the shape of a GraphQL response error.
 *
 * @param path response path of the failing field, or null for request-level errors
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ExecutionError(
    String message,
    List<Trace.Location> locations,
    List<Object> path,
    Map<String, Object> extensions) {

  public ExecutionError {
    locations = locations == null ? List.of() : List.copyOf(locations);
    path = path == null ? null : List.copyOf(path);
    extensions =
        extensions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
  }

  public static ExecutionError of(String message) {
    return new ExecutionError(message, null, null, null);
  }

  public ExecutionError withMessage(String message) {
    return new ExecutionError(message, locations, path, extensions);
  }

  public ExecutionError withExtensions(Map<String, Object> extensions) {
    return new ExecutionError(message, locations, path, extensions);
  }
}
