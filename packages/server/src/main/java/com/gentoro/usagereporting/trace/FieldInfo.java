package com.gentoro.usagereporting.trace;

/** What the host knows about a field when it starts resolving it. */
public record FieldInfo(
    String fieldName, String parentType, String returnType, ResponsePath path) {}
