package com.gentoro.usagereporting.schema;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Token-level operation signature.
 *
 * <p>The document source is tokenized and rewritten so that requests that differ only in
 * formatting, aliases or literal values share a signature:
 *
 * <ul>
 *   <li>only the selected operation and the fragments it reaches are kept, fragments ordered by
 *       name;
 *   <li>comments and insignificant commas are dropped, whitespace is reduced to the single spaces
 *       needed between adjacent names;
 *   <li>field aliases are removed;
 *   <li>literals are replaced: numbers by {@code 0}, strings by {@code ""}, lists by {@code []} and
 *       input objects by {@code {}}. Variable types are kept.
 * </ul>
 *
 * <p>Selections are not reordered.
 */
public class LexicalSignatureCalculator implements SignatureCalculator {

  @Override
  public String signature(OperationDocument document, String operationName) {
    List<Token> tokens = tokenize(document.source());
    List<Definition> definitions = split(tokens);

    Definition operation = selectOperation(definitions, operationName);
    Map<String, Definition> fragments = new HashMap<>();
    for (Definition def : definitions) {
      if (def.fragment) fragments.put(def.name, def);
    }

    TreeMap<String, Definition> reached = new TreeMap<>();
    Deque<Definition> pending = new ArrayDeque<>();
    pending.push(operation);
    while (!pending.isEmpty()) {
      Definition def = pending.pop();
      for (String spread : def.spreads()) {
        Definition fragment = fragments.get(spread);
        if (fragment != null && !reached.containsKey(spread)) {
          reached.put(spread, fragment);
          pending.push(fragment);
        }
      }
    }

    StringBuilder out = new StringBuilder();
    print(operation, out);
    for (Definition fragment : reached.values()) {
      print(fragment, out);
    }
    return out.toString();
  }

  private static Definition selectOperation(List<Definition> definitions, String operationName) {
    Definition first = null;
    for (Definition def : definitions) {
      if (def.fragment) continue;
      if (operationName != null && !operationName.isEmpty()) {
        if (operationName.equals(def.name)) return def;
      } else if (first == null) {
        first = def;
      }
    }
    if (first == null) {
      throw new IllegalArgumentException("Operation '" + operationName + "' not found in document");
    }
    return first;
  }

  private static void print(Definition def, StringBuilder out) {
    List<Token> tokens = def.tokens;
    int parenDepth = 0;
    boolean inVariableDefinitions = false;
    int braceDepth = 0;

    for (int i = 0; i < tokens.size(); i++) {
      Token t = tokens.get(i);

      if (parenDepth == 0) {
        if (t.kind == Kind.NAME
            && isPunct(tokens, i + 1, ":")
            && isKind(tokens, i + 2, Kind.NAME)) {
          // alias and its colon
          i++;
          continue;
        }
        if (t.is("(")) {
          inVariableDefinitions =
              !def.fragment && braceDepth == 0 && followsOperationName(tokens, i);
          parenDepth++;
          emit(out, "(");
          continue;
        }
        if (t.is("{")) braceDepth++;
        if (t.is("}")) braceDepth--;
        emit(out, t.text);
        continue;
      }

      Token previous = tokens.get(i - 1);
      boolean typePosition = inVariableDefinitions && parenDepth == 1 && previous.is(":");
      boolean valueStart = (previous.is(":") || previous.is("=")) && !typePosition;

      if (valueStart && (t.is("[") || t.is("{"))) {
        i = matching(tokens, i);
        emit(out, t.is("[") ? "[]" : "{}");
        continue;
      }
      if (t.kind == Kind.INT || t.kind == Kind.FLOAT) {
        emit(out, "0");
        continue;
      }
      if (t.kind == Kind.STRING) {
        emit(out, "\"\"");
        continue;
      }
      if (t.is("(")) {
        parenDepth++;
      } else if (t.is(")")) {
        parenDepth--;
        if (parenDepth == 0) inVariableDefinitions = false;
      } else if (startsItem(tokens, i) && out.charAt(out.length() - 1) != '(') {
        emit(out, ",");
      }
      emit(out, t.text);
    }
  }

  /** The {@code (} at {@code i} follows the operation keyword or name, not a directive. */
  private static boolean followsOperationName(List<Token> tokens, int i) {
    return isKind(tokens, i - 1, Kind.NAME) && !isPunct(tokens, i - 2, "@");
  }

  /** An argument ({@code name:}) or a variable definition ({@code $name:}) begins at {@code i}. */
  private static boolean startsItem(List<Token> tokens, int i) {
    Token t = tokens.get(i);
    if (t.is("$")) {
      return isKind(tokens, i + 1, Kind.NAME) && isPunct(tokens, i + 2, ":");
    }
    return t.kind == Kind.NAME && isPunct(tokens, i + 1, ":") && !tokens.get(i - 1).is("$");
  }

  private static void emit(StringBuilder out, String text) {
    if (out.length() > 0
        && isWordChar(out.charAt(out.length() - 1))
        && isWordChar(text.charAt(0))) {
      out.append(' ');
    }
    out.append(text);
  }

  private static int matching(List<Token> tokens, int open) {
    String o = tokens.get(open).text;
    String c = o.equals("[") ? "]" : "}";
    int depth = 0;
    for (int j = open; j < tokens.size(); j++) {
      Token t = tokens.get(j);
      if (t.is(o)) {
        depth++;
      } else if (t.is(c) && --depth == 0) {
        return j;
      }
    }
    throw new IllegalArgumentException("Unbalanced '" + o + "' in document");
  }

  private static boolean isPunct(List<Token> tokens, int i, String text) {
    return i >= 0 && i < tokens.size() && tokens.get(i).is(text);
  }

  private static boolean isKind(List<Token> tokens, int i, Kind kind) {
    return i >= 0 && i < tokens.size() && tokens.get(i).kind == kind;
  }

  private static List<Definition> split(List<Token> tokens) {
    List<Definition> definitions = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < tokens.size(); i++) {
      Token t = tokens.get(i);
      if (t.is("{")) {
        depth++;
      } else if (t.is("}") && --depth == 0) {
        definitions.add(new Definition(tokens.subList(start, i + 1)));
        start = i + 1;
      }
    }
    if (start != tokens.size()) {
      throw new IllegalArgumentException("Document ends inside a definition");
    }
    return definitions;
  }

  static List<Token> tokenize(String source) {
    List<Token> tokens = new ArrayList<>();
    int n = source.length();
    int i = 0;
    while (i < n) {
      char c = source.charAt(i);
      if (c == '﻿' || c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == ',') {
        i++;
      } else if (c == '#') {
        while (i < n && source.charAt(i) != '\n' && source.charAt(i) != '\r') i++;
      } else if (source.startsWith("...", i)) {
        tokens.add(new Token(Kind.PUNCT, "..."));
        i += 3;
      } else if ("!$&():=@[]{}|".indexOf(c) >= 0) {
        tokens.add(new Token(Kind.PUNCT, String.valueOf(c)));
        i++;
      } else if (c == '_' || Character.isLetter(c)) {
        int start = i;
        while (i < n && isWordChar(source.charAt(i))) i++;
        tokens.add(new Token(Kind.NAME, source.substring(start, i)));
      } else if (c == '-' || Character.isDigit(c)) {
        int start = i++;
        boolean isFloat = false;
        while (i < n && Character.isDigit(source.charAt(i))) i++;
        if (i < n && source.charAt(i) == '.') {
          isFloat = true;
          i++;
          while (i < n && Character.isDigit(source.charAt(i))) i++;
        }
        if (i < n && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
          isFloat = true;
          i++;
          if (i < n && (source.charAt(i) == '+' || source.charAt(i) == '-')) i++;
          while (i < n && Character.isDigit(source.charAt(i))) i++;
        }
        tokens.add(new Token(isFloat ? Kind.FLOAT : Kind.INT, source.substring(start, i)));
      } else if (c == '"') {
        int start = i;
        i = source.startsWith("\"\"\"", i) ? endOfBlockString(source, i) : endOfString(source, i);
        tokens.add(new Token(Kind.STRING, source.substring(start, i)));
      } else {
        throw new IllegalArgumentException("Unexpected character '" + c + "' at offset " + i);
      }
    }
    return tokens;
  }

  private static int endOfString(String source, int open) {
    int i = open + 1;
    while (i < source.length()) {
      char ch = source.charAt(i);
      if (ch == '\\') {
        i += 2;
      } else if (ch == '"') {
        return i + 1;
      } else if (ch == '\n' || ch == '\r') {
        break;
      } else {
        i++;
      }
    }
    throw new IllegalArgumentException("Unterminated string at offset " + open);
  }

  private static int endOfBlockString(String source, int open) {
    int i = open + 3;
    while (i < source.length()) {
      if (source.startsWith("\\\"\"\"", i)) {
        i += 4;
      } else if (source.startsWith("\"\"\"", i)) {
        return i + 3;
      } else {
        i++;
      }
    }
    throw new IllegalArgumentException("Unterminated block string at offset " + open);
  }

  private static boolean isWordChar(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }

  enum Kind {
    PUNCT,
    NAME,
    INT,
    FLOAT,
    STRING
  }

  record Token(Kind kind, String text) {
    boolean is(String punct) {
      return kind == Kind.PUNCT && text.equals(punct);
    }
  }

  private static final class Definition {
    final List<Token> tokens;
    final boolean fragment;
    final String name;

    Definition(List<Token> tokens) {
      this.tokens = tokens;
      Token head = tokens.get(0);
      this.fragment = head.kind == Kind.NAME && head.text.equals("fragment");
      if (head.is("{")) {
        this.name = "";
      } else if (tokens.size() > 1 && tokens.get(1).kind == Kind.NAME) {
        this.name = tokens.get(1).text;
      } else {
        this.name = "";
      }
    }

    List<String> spreads() {
      List<String> names = new ArrayList<>();
      for (int i = 0; i + 1 < tokens.size(); i++) {
        Token next = tokens.get(i + 1);
        if (tokens.get(i).is("...") && next.kind == Kind.NAME && !next.text.equals("on")) {
          names.add(next.text);
        }
      }
      return names;
    }
  }
}
