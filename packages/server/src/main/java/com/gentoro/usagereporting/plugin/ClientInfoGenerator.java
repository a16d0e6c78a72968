package com.gentoro.usagereporting.plugin;

import java.util.Map;

/** Identifies the client of a request; stats are grouped by client. */
@FunctionalInterface
public interface ClientInfoGenerator {
  String CLIENT_NAME_HEADER = "graphql-client-name";
  String CLIENT_VERSION_HEADER = "graphql-client-version";

  ClientInfo generate(RequestContext context);

  /**
   * Reads the client name and version headers. When neither is present, falls back to the {@code
   * clientInfo} request extension.
   */
  static ClientInfoGenerator defaultGenerator() {
    return context -> {
      HttpRequestInfo http = context.getHttp();
      if (http != null) {
        String name = http.header(CLIENT_NAME_HEADER);
        String version = http.header(CLIENT_VERSION_HEADER);
        if (notEmpty(name) || notEmpty(version)) {
          return new ClientInfo(name, version);
        }
      }
      Object extension = context.getExtensions().get("clientInfo");
      if (extension instanceof Map<?, ?> info) {
        return new ClientInfo(
            asString(info.get("clientName")), asString(info.get("clientVersion")));
      }
      return ClientInfo.EMPTY;
    };
  }

  private static boolean notEmpty(String s) {
    return s != null && !s.isEmpty();
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }
}
