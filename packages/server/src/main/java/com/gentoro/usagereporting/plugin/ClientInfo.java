package com.gentoro.usagereporting.plugin;

/** Name and version of the client application that sent a request. Both may be empty. */
public record ClientInfo(String clientName, String clientVersion) {
  public static final ClientInfo EMPTY = new ClientInfo("", "");

  public ClientInfo {
    clientName = clientName == null ? "" : clientName;
    clientVersion = clientVersion == null ? "" : clientVersion;
  }
}
