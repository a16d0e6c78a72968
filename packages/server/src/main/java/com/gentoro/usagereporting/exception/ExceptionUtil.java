package com.gentoro.usagereporting.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/** Short renderings of failures for the error sink's log lines. */
public final class ExceptionUtil {
  static final int DEFAULT_FRAMES = 10;

  private ExceptionUtil() {}

  /**
   * One line per failure: the message of the throwable followed by the messages of its causes, e.g.
   * {@code Error sending report: HTTP status 503 <- connection reset}. A cause whose message
   * repeats the previous one is left out.
   */
  public static String describe(Throwable t) {
    StringJoiner line = new StringJoiner(" <- ");
    String previous = null;
    for (Throwable cause : causeChain(t)) {
      String message = messageOf(cause);
      if (!message.equals(previous)) {
        line.add(message);
      }
      previous = message;
    }
    return line.toString();
  }

  /**
   * The top frames of the innermost cause, in call order, e.g. {@code
   * okhttp3.internal.connection.RealCall.execute(RealCall.kt:154) > ...}.
   *
   * @param maxFrames non-positive means all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    List<Throwable> chain = causeChain(t);
    if (chain.isEmpty()) return "";
    StackTraceElement[] frames = chain.get(chain.size() - 1).getStackTrace();
    int limit = maxFrames <= 0 ? frames.length : Math.min(frames.length, maxFrames);

    StringJoiner trace = new StringJoiner(" > ");
    for (int i = 0; i < limit; i++) {
      StackTraceElement frame = frames[i];
      String location =
          frame.getFileName() == null
              ? "Unknown Source"
              : frame.getLineNumber() >= 0
                  ? frame.getFileName() + ":" + frame.getLineNumber()
                  : frame.getFileName();
      trace.add(frame.getClassName() + "." + frame.getMethodName() + "(" + location + ")");
    }
    if (limit < frames.length) {
      trace.add("... " + (frames.length - limit) + " more");
    }
    return trace.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_FRAMES);
  }

  private static List<Throwable> causeChain(Throwable t) {
    List<Throwable> chain = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable cause = t; cause != null && seen.add(cause); cause = cause.getCause()) {
      chain.add(cause);
    }
    return chain;
  }

  private static String messageOf(Throwable t) {
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }
}
