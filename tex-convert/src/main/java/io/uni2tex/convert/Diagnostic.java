/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert;


import java.util.Objects;

import io.uni2tex.tables.TableConstants;

/**
 * A non-fatal conversion problem, located in the input.
 * 
 * @param kind      the kind of problem
 * @param source    name of the input (a file name, or e.g. {@code "cmdline"})
 * @param lineNo    1-based line number
 * @param charNo    1-based code point position within the line
 * @param codepoint the offending code point
 * @param detail    extra detail (e.g. the unsupported decomposition tag);
 *                  may be empty
 */
public record Diagnostic(
    Kind kind, String source, long lineNo, long charNo, int codepoint, String detail) {
  
  public enum Kind {
    /** A combining accent with nothing before it to accent. */
    NO_PRECEDING_BASE,
    /** A decomposition (or decomposition tag) the converter doesn't handle. */
    UNSUPPORTED,
    /** A non-ASCII character with no LaTeX form; passed through as is. */
    NOT_CONVERTIBLE;
  }
  
  
  public Diagnostic {
    Objects.requireNonNull(kind, "null kind");
    Objects.requireNonNull(source, "null source");
    if (detail == null)
      detail = "";
  }
  
  
  /** Returns the location prefix, e.g. {@code 'cmdline':1:3}. */
  public String location() {
    return "'" + source + "':" + lineNo + ":" + charNo;
  }
  
  
  /** Returns a human-readable message. */
  public String message() {
    var ch = Character.toString(codepoint);
    var code = TableConstants.codeLabel(codepoint);
    switch (kind) {
    case NO_PRECEDING_BASE:
      return location() + " accent " + code + " with no preceding character";
    case UNSUPPORTED:
      return location() + " unsupported " + detail + " for '" + ch + "' " + code;
    case NOT_CONVERTIBLE:
    default:
      return location() + " could not convert '" + ch + "' " + code + " to ascii";
    }
  }
  
  
  @Override
  public String toString() {
    return message();
  }

}
