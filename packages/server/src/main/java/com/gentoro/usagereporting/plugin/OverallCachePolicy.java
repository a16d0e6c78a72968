package com.gentoro.usagereporting.plugin;

import com.gentoro.usagereporting.trace.Trace;

/** Cache policy of a cacheable response, as computed by the host. */
public record OverallCachePolicy(Trace.CachePolicy.Scope scope, double maxAgeSeconds) {

  Trace.CachePolicy toTraceCachePolicy() {
    return new Trace.CachePolicy(
        scope == null ? Trace.CachePolicy.Scope.UNKNOWN : scope, (long) (maxAgeSeconds * 1e9));
  }
}
