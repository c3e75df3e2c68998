/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.Objects;

/**
 * A Greek-letter macro and the code point it denotes (math italic for
 * the lowercase letters, upright for the uppercase).
 * 
 * @param macro      LaTeX macro, with leading backslash
 * @param codepoint  Unicode scalar value
 */
public record GreekLetter(String macro, int codepoint) {
  
  public GreekLetter {
    Objects.requireNonNull(macro, "null macro");
    if (!macro.startsWith("\\") || macro.length() < 2)
      throw new IllegalArgumentException("not a macro: " + macro);
    if (!Character.isValidCodePoint(codepoint))
      throw new IllegalArgumentException("invalid code point: " + codepoint);
  }

}
