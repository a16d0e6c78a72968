package com.gentoro.usagereporting.plugin;

import com.gentoro.usagereporting.trace.Trace;

/** Decides whether a finished trace is sent in full or folded into stats. */
@FunctionalInterface
public interface SendOperationAsTrace {

  boolean shouldSend(Trace trace, String statsReportKey);
}
