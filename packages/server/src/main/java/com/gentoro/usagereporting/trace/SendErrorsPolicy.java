package com.gentoro.usagereporting.trace;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * How errors are rewritten before they are recorded on a trace.
 *
 * <p>A rewrite may change the message and the extensions. The path and locations of the original
 * error are always kept. Returning null drops the error from the trace.
 */
public final class SendErrorsPolicy {
  public static final String MASKED_MESSAGE = "<masked>";
  public static final String MASKED_BY = "UsageReporting";

  public enum Kind {
    MASKED,
    UNMODIFIED,
    TRANSFORM
  }

  private static final SendErrorsPolicy MASKED =
      new SendErrorsPolicy(
          Kind.MASKED,
          error -> ExecutionError.of(MASKED_MESSAGE).withExtensions(Map.of("maskedBy", MASKED_BY)));
  private static final SendErrorsPolicy UNMODIFIED =
      new SendErrorsPolicy(Kind.UNMODIFIED, UnaryOperator.identity());

  private final Kind kind;
  private final UnaryOperator<ExecutionError> rewrite;

  private SendErrorsPolicy(Kind kind, UnaryOperator<ExecutionError> rewrite) {
    this.kind = kind;
    this.rewrite = rewrite;
  }

  public static SendErrorsPolicy masked() {
    return MASKED;
  }

  public static SendErrorsPolicy unmodified() {
    return UNMODIFIED;
  }

  public static SendErrorsPolicy transform(UnaryOperator<ExecutionError> transform) {
    return new SendErrorsPolicy(Kind.TRANSFORM, Objects.requireNonNull(transform, "transform"));
  }

  /** Parses {@code masked} or {@code unmodified}; a transform cannot be configured by name. */
  public static SendErrorsPolicy fromName(String name) {
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "masked" -> MASKED;
      case "unmodified" -> UNMODIFIED;
      default -> throw new IllegalArgumentException("Unknown sendErrors policy: " + name);
    };
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the error to record, or null to drop it. */
  public ExecutionError apply(ExecutionError error) {
    ExecutionError rewritten = rewrite.apply(error);
    if (rewritten == null) return null;
    return new ExecutionError(
        rewritten.message(),
        error.locations(),
        error.path(),
        rewritten.extensions().isEmpty() ? error.extensions() : rewritten.extensions());
  }
}
