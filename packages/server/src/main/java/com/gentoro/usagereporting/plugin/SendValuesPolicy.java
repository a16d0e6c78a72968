package com.gentoro.usagereporting.plugin;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** Which named values (headers, variables) may be sent with traces. */
public final class SendValuesPolicy {

  public enum Kind {
    NONE,
    ALL,
    EXCEPT,
    ONLY
  }

  private static final SendValuesPolicy NONE = new SendValuesPolicy(Kind.NONE, Set.of());
  private static final SendValuesPolicy ALL = new SendValuesPolicy(Kind.ALL, Set.of());

  private final Kind kind;
  private final Set<String> names;

  private SendValuesPolicy(Kind kind, Set<String> names) {
    this.kind = kind;
    this.names = names;
  }

  public static SendValuesPolicy none() {
    return NONE;
  }

  public static SendValuesPolicy all() {
    return ALL;
  }

  public static SendValuesPolicy except(Collection<String> names) {
    return new SendValuesPolicy(Kind.EXCEPT, Set.copyOf(names));
  }

  public static SendValuesPolicy only(Collection<String> names) {
    return new SendValuesPolicy(Kind.ONLY, Set.copyOf(names));
  }

  public Kind kind() {
    return kind;
  }

  public Set<String> names() {
    return names;
  }

  /** Exact name match, as used for variables. */
  public boolean permits(String name) {
    return switch (kind) {
      case NONE -> false;
      case ALL -> true;
      case EXCEPT -> !names.contains(name);
      case ONLY -> names.contains(name);
    };
  }

  /** Case-insensitive name match, as used for headers. */
  public boolean permitsIgnoreCase(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return switch (kind) {
      case NONE -> false;
      case ALL -> true;
      case EXCEPT -> !lowerCasedNames().contains(lower);
      case ONLY -> lowerCasedNames().contains(lower);
    };
  }

  private Set<String> lowerCasedNames() {
    return names.stream().map(n -> n.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
  }

  @Override
  public String toString() {
    return kind == Kind.NONE || kind == Kind.ALL ? kind.name() : kind.name() + names;
  }
}
