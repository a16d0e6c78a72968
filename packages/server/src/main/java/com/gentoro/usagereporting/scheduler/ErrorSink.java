package com.gentoro.usagereporting.scheduler;

import com.gentoro.usagereporting.exception.ExceptionUtil;
import com.gentoro.usagereporting.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Receives failures of background work: trace finalization, report encoding and delivery. None of
 * them is ever thrown back to the request that caused it.
 *
 * <p>Implementations must not throw and should return quickly; they are called from the reporting
 * threads.
 */
@FunctionalInterface
public interface ErrorSink {

  void report(Throwable error);

  /** Logs the message at error and a compact stack trace at debug. */
  static ErrorSink logging() {
    return LoggingErrorSink.INSTANCE;
  }

  final class LoggingErrorSink implements ErrorSink {
    private static final Logger log = LoggingService.getLogger(ErrorSink.class);
    private static final LoggingErrorSink INSTANCE = new LoggingErrorSink();

    private LoggingErrorSink() {}

    @Override
    public void report(Throwable error) {
      log.error(ExceptionUtil.describe(error));
      if (log.isDebugEnabled()) {
        log.debug(ExceptionUtil.formatCompactStackTrace(error));
      }
    }
  }
}
