/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert;


import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UCharacterCategory;

/**
 * The character-database facts the forward converter needs about a code
 * point: its name, whether it's a combining mark, and its decomposition.
 * 
 * @param codepoint       the Unicode scalar value
 * @param name            the Unicode character name; empty if it has none
 * @param combiningMark   {@code true} iff the general category is
 *                        {@code Mn} or {@code Mc}
 * @param decomposition   the classified decomposition
 */
public record CharInfo(
    int codepoint, String name, boolean combiningMark, Decomposition decomposition) {
  
  
  public static CharInfo of(int codepoint) {
    String name = UCharacter.getName(codepoint);
    int type = UCharacter.getType(codepoint);
    boolean mark =
        type == UCharacterCategory.NON_SPACING_MARK ||
        type == UCharacterCategory.COMBINING_SPACING_MARK;
    return new CharInfo(
        codepoint,
        name == null ? "" : name,
        mark,
        Decomposition.of(codepoint));
  }
  
  
  /** Determines whether the character name starts with {@code GREEK}. */
  public boolean isGreek() {
    return name.startsWith("GREEK");
  }

}
