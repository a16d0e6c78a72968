package com.gentoro.usagereporting.report;

import java.util.List;

/**
 * An error a subgraph reported without sending a trace of its own.
 *
 * @param path response path of the error; may be null when unknown
 */
public record NonFtv1ErrorPath(String subgraph, List<Object> path) {

  public NonFtv1ErrorPath {
    path = path == null ? null : List.copyOf(path);
  }
}
