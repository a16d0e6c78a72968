package com.gentoro.usagereporting.plugin;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usagereporting.trace.Trace;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SendValuesPolicyTest {

  @Test
  void variableNamesMatchExactly() {
    SendValuesPolicy only = SendValuesPolicy.only(List.of("id"));
    assertTrue(only.permits("id"));
    assertFalse(only.permits("ID"));

    SendValuesPolicy except = SendValuesPolicy.except(List.of("password"));
    assertTrue(except.permits("id"));
    assertFalse(except.permits("password"));

    assertFalse(SendValuesPolicy.none().permits("id"));
    assertTrue(SendValuesPolicy.all().permits("id"));
  }

  @Test
  void headerNamesIgnoreCase() {
    assertTrue(SendValuesPolicy.only(List.of("X-Request-Id")).permitsIgnoreCase("x-request-id"));
    assertFalse(SendValuesPolicy.except(List.of("X-Secret")).permitsIgnoreCase("x-secret"));
  }

  @Test
  @DisplayName("Credentials headers are never recorded, even when all headers are allowed")
  void credentialsAreAlwaysRedacted() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("authorization", "Bearer abc");
    headers.put("cookie", "session=1");
    headers.put("set-cookie", "session=2");
    headers.put("Authorization", "Bearer def");
    headers.put("COOKIE", "session=3");
    headers.put("Set-Cookie", "session=4");
    headers.put("x-request-id", "r-1");
    Trace.Http http = new Trace.Http();

    HttpHeadersRecorder.record(http, headers, SendValuesPolicy.all());

    assertEquals(Map.of("x-request-id", List.of("r-1")), http.getRequestHeaders());
  }

  @Test
  void noHeadersUnderNonePolicy() {
    Trace.Http http = new Trace.Http();

    HttpHeadersRecorder.record(http, Map.of("x-request-id", "r-1"), SendValuesPolicy.none());

    assertTrue(http.getRequestHeaders().isEmpty());
  }

  @Test
  void exceptPolicyFiltersHeaders() {
    Trace.Http http = new Trace.Http();

    HttpHeadersRecorder.record(
        http,
        Map.of("x-request-id", "r-1", "x-secret", "s"),
        SendValuesPolicy.except(List.of("X-Secret")));

    assertEquals(Map.of("x-request-id", List.of("r-1")), http.getRequestHeaders());
  }
}
