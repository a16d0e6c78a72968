package com.gentoro.usagereporting.report;

/** Stats are kept separately for each client name and version. */
public record StatsContext(String clientName, String clientVersion) {

  public StatsContext {
    clientName = clientName == null ? "" : clientName;
    clientVersion = clientVersion == null ? "" : clientVersion;
  }
}
