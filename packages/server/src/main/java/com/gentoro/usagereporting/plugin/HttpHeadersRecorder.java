package com.gentoro.usagereporting.plugin;

import com.gentoro.usagereporting.trace.Trace;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Copies the request headers a {@link SendValuesPolicy} permits onto a trace. */
public final class HttpHeadersRecorder {
  /** Never recorded, whatever the policy. */
  static final Set<String> ALWAYS_REDACTED = Set.of("authorization", "cookie", "set-cookie");

  private HttpHeadersRecorder() {}

  public static void record(Trace.Http http, Map<String, String> headers, SendValuesPolicy policy) {
    if (policy == null || policy.kind() == SendValuesPolicy.Kind.NONE) return;
    headers.forEach(
        (name, value) -> {
          if (!policy.permitsIgnoreCase(name)) return;
          if (ALWAYS_REDACTED.contains(name.toLowerCase(Locale.ROOT))) return;
          http.getRequestHeaders().put(name, List.of(value));
        });
  }
}
