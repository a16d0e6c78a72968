package com.gentoro.usagereporting.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP request that carried an operation.
 *
 * @param headers header values by name; names are lower-cased, repeated headers joined by the host
 */
public record HttpRequestInfo(String method, Map<String, String> headers) {

  public HttpRequestInfo {
    Map<String, String> lowerCased = new LinkedHashMap<>();
    if (headers != null) {
      headers.forEach((name, value) -> lowerCased.put(name.toLowerCase(Locale.ROOT), value));
    }
    headers = Collections.unmodifiableMap(lowerCased);
  }

  public String header(String name) {
    return headers.get(name.toLowerCase(Locale.ROOT));
  }
}
