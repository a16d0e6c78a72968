package com.gentoro.usagereporting.trace;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Position of a value in the response: a chain of field response names and list indices, innermost
 * last. Instances are immutable and share their prefixes.
 */
public final class ResponsePath {
  private final ResponsePath prev;
  private final Object key;

  private ResponsePath(ResponsePath prev, Object key) {
    if (!(key instanceof String) && !(key instanceof Integer)) {
      throw new IllegalArgumentException("Path keys are response names or list indices: " + key);
    }
    this.prev = prev;
    this.key = key;
  }

  /** Builds a path from its keys, outermost first. */
  public static ResponsePath of(Object... keys) {
    if (keys.length == 0) {
      throw new IllegalArgumentException("A response path has at least one key");
    }
    ResponsePath path = null;
    for (Object key : keys) {
      path = new ResponsePath(path, key);
    }
    return path;
  }

  /**
   * Same as {@link #of(Object...)}, accepting any numeric type for list indices. Returns null for a
   * null or empty list.
   */
  public static ResponsePath fromList(List<?> keys) {
    if (keys == null || keys.isEmpty()) return null;
    ResponsePath path = null;
    for (Object key : keys) {
      path = new ResponsePath(path, key instanceof Number number ? number.intValue() : key);
    }
    return path;
  }

  public ResponsePath child(Object key) {
    return new ResponsePath(this, key);
  }

  public ResponsePath prev() {
    return prev;
  }

  public Object key() {
    return key;
  }

  public boolean isIndex() {
    return key instanceof Integer;
  }

  public List<Object> asList() {
    Deque<Object> keys = new ArrayDeque<>();
    for (ResponsePath p = this; p != null; p = p.prev) {
      keys.addFirst(p.key);
    }
    return List.copyOf(keys);
  }

  /** Keys joined with dots, for example {@code user.friends.0.name}. */
  public String asString() {
    return prev == null ? String.valueOf(key) : prev.asString() + "." + key;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ResponsePath that)) return false;
    return key.equals(that.key) && Objects.equals(prev, that.prev);
  }

  @Override
  public int hashCode() {
    return Objects.hash(prev, key);
  }

  @Override
  public String toString() {
    return asString();
  }
}
