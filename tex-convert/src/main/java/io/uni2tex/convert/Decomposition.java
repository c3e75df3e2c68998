/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert;


import java.util.Arrays;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import com.ibm.icu.text.Normalizer2;

/**
 * The (single-level) Unicode decomposition of a code point, classified by
 * its tag. Derived from the Unicode Character Database via ICU.
 * 
 * @see #of(int)
 */
public sealed interface Decomposition {
  
  /** Discriminator, for exhaustive switching. */
  enum Kind {
    NONE,
    FONT,
    SMALL,
    COMPAT,
    SUPER,
    SUB,
    FRACTION,
    ACCENT_PAIR,
    SINGLETON,
    UNSUPPORTED;
  }
  
  
  Kind kind();
  
  
  int HANGUL_FIRST = 0xAC00;
  int HANGUL_LAST = 0xD7A3;
  
  /** Fraction slash separating numerator from denominator. */
  int FRACTION_SLASH = 0x2044;
  
  
  /** No decomposition. */
  record None() implements Decomposition {
    public Kind kind() {  return Kind.NONE;  }
  }
  
  final static None NONE = new None();
  
  
  /** {@code <font>} variant of the base, e.g. U+211D to {@code R}. */
  record Font(int base) implements Decomposition {
    public Kind kind() {  return Kind.FONT;  }
  }
  
  /** {@code <small>} variant of the base. */
  record Small(int base) implements Decomposition {
    public Kind kind() {  return Kind.SMALL;  }
  }
  
  /**
   * {@code <compat>} decomposition, e.g. a ligature or a Greek symbol variant.
   */
  record Compat(int[] bases) implements Decomposition {
    public Compat {
      if (bases.length == 0)
        throw new IllegalArgumentException("empty bases");
    }
    public Kind kind() {  return Kind.COMPAT;  }
    public int first() {  return bases[0];  }
  }
  
  /**
   * {@code <super>} or {@code <sub>} modifier of the bases (usually just one;
   * U+2122 TRADE MARK SIGN has two).
   */
  record Modifier(boolean superscript, int[] bases) implements Decomposition {
    public Kind kind() {  return superscript ? Kind.SUPER : Kind.SUB;  }
  }
  
  /**
   * {@code <fraction>} decomposition, split on the {@linkplain #FRACTION_SLASH}.
   * Either side may be empty.
   */
  record Fraction(int[] numerator, int[] denominator) implements Decomposition {
    public Kind kind() {  return Kind.FRACTION;  }
  }
  
  /** Canonical base-plus-combining-mark pair, e.g. U+00E9 to {@code e U+0301}. */
  record AccentPair(int base, int accent) implements Decomposition {
    public Kind kind() {  return Kind.ACCENT_PAIR;  }
  }
  
  /** Canonical singleton, e.g. U+212B (ANGSTROM SIGN) to U+00C5. */
  record Singleton(int target) implements Decomposition {
    public Kind kind() {  return Kind.SINGLETON;  }
  }
  
  /**
   * A decomposition with a tag the converter doesn't handle (e.g.
   * {@code <square>}), or a canonical one that is not a pair.
   */
  record Unsupported(String tag, int[] scalars) implements Decomposition {
    public Kind kind() {  return Kind.UNSUPPORTED;  }
  }
  
  
  
  /**
   * Returns the classified decomposition of the given code point.
   * Hangul syllables are treated as having none.
   */
  static Decomposition of(int codepoint) {
    // algorithmic, not in the character database proper
    if (codepoint >= HANGUL_FIRST && codepoint <= HANGUL_LAST)
      return NONE;
    String raw = Normalizer2.getNFKCInstance().getRawDecomposition(codepoint);
    if (raw == null)
      return NONE;
    int[] scalars = raw.codePoints().toArray();
    if (scalars.length == 0)
      return NONE;
    
    int type = UCharacter.getIntPropertyValue(codepoint, UProperty.DECOMPOSITION_TYPE);
    switch (type) {
    case UCharacter.DecompositionType.CANONICAL:
      if (scalars.length == 1)
        return new Singleton(scalars[0]);
      if (scalars.length == 2)
        return new AccentPair(scalars[0], scalars[1]);
      return new Unsupported("<canonical>", scalars);
    case UCharacter.DecompositionType.FONT:
      return scalars.length == 1 ? new Font(scalars[0]) : unsupported(type, scalars);
    case UCharacter.DecompositionType.SMALL:
      return scalars.length == 1 ? new Small(scalars[0]) : unsupported(type, scalars);
    case UCharacter.DecompositionType.SUPER:
      return new Modifier(true, scalars);
    case UCharacter.DecompositionType.SUB:
      return new Modifier(false, scalars);
    case UCharacter.DecompositionType.COMPAT:
      return new Compat(scalars);
    case UCharacter.DecompositionType.FRACTION:
      return fraction(scalars);
    default:
      return unsupported(type, scalars);
    }
  }
  
  
  private static Fraction fraction(int[] scalars) {
    int slash = 0;
    while (slash < scalars.length && scalars[slash] != FRACTION_SLASH)
      ++slash;
    int[] numerator = Arrays.copyOfRange(scalars, 0, slash);
    int[] denominator =
        slash < scalars.length ?
            Arrays.copyOfRange(scalars, slash + 1, scalars.length) :
            new int[0];
    return new Fraction(numerator, denominator);
  }
  
  
  private static Unsupported unsupported(int type, int[] scalars) {
    return new Unsupported(tag(type), scalars);
  }
  
  
  /**
   * Returns the decomposition tag for the given ICU decomposition type,
   * e.g. {@code <square>}.
   */
  static String tag(int type) {
    String name = UCharacter.getPropertyValueName(
        UProperty.DECOMPOSITION_TYPE, type, UProperty.NameChoice.LONG);
    return "<" + (name == null ? "unknown" : name.toLowerCase()) + ">";
  }

}
