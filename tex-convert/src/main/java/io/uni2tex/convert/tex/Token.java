/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert.tex;


import java.util.Objects;

/**
 * A lexical unit of TeX source.
 * 
 * @param kind  the token kind
 * @param text  the kind-specific text: the macro name (sans backslash) for
 *              escape sequences; the comment text (sans {@code '%'} and
 *              newline) for comments; {@code "active::"} followed by the
 *              character for active characters; otherwise the literal text
 * 
 * @see #source()
 */
public record Token(Kind kind, String text) {
  
  public enum Kind {
    ESCAPE_SEQUENCE,
    COMMENT,
    GROUP_DELIMITER,
    ACTIVE_CHAR,
    PLAIN_TEXT;
  }
  
  /** Prefix of active-character token text, and of their lookup keys. */
  public final static String ACTIVE_PREFIX = "active::";
  
  
  public Token {
    Objects.requireNonNull(kind, "null kind");
    Objects.requireNonNull(text, "null text");
  }
  
  
  public static Token escape(String name) {
    return new Token(Kind.ESCAPE_SEQUENCE, name);
  }
  
  public static Token comment(String text) {
    return new Token(Kind.COMMENT, text);
  }
  
  public static Token group(char brace) {
    return new Token(Kind.GROUP_DELIMITER, String.valueOf(brace));
  }
  
  public static Token active(char c) {
    return new Token(Kind.ACTIVE_CHAR, ACTIVE_PREFIX + c);
  }
  
  public static Token plain(String text) {
    return new Token(Kind.PLAIN_TEXT, text);
  }
  
  
  /**
   * Returns the source text this token was scanned from.
   */
  public String source() {
    switch (kind) {
    case ESCAPE_SEQUENCE:   return "\\" + text;
    case COMMENT:           return "%" + text;
    case ACTIVE_CHAR:       return text.substring(ACTIVE_PREFIX.length());
    default:                return text;
    }
  }

}
