/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert;


import java.util.Objects;

import io.uni2tex.tables.CodepointMapping;

/**
 * Forward (Unicode to LaTeX) conversion settings. Immutable; the
 * "wither" methods return a possibly new instance.
 * 
 * @param addFontModifiers    if {@code true}, math-alphanumeric characters
 *                            are wrapped in their font command (e.g.
 *                            <code>\symbb{R}</code>); otherwise only the base
 *                            character is rendered
 * @param convertAccents      if {@code true}, accents are rendered as LaTeX
 *                            accent commands; otherwise accented characters
 *                            pass through
 * @param preferUnicodeMath   if {@code true}, the unicode-math macro of a
 *                            non-ASCII character is used before any other rule
 * @param accentMode          text or math accents
 * @param convertQuotes       if {@code true}, typographic quotes become ASCII
 *                            LaTeX quotes
 * @param convertDashes       if {@code true}, typographic dashes and spaces
 *                            become their ASCII LaTeX forms
 * @param extraOverrides      user mappings consulted before any table
 * 
 * @see #DEFAULT
 */
public record ForwardConfig(
    boolean addFontModifiers,
    boolean convertAccents,
    boolean preferUnicodeMath,
    AccentMode accentMode,
    boolean convertQuotes,
    boolean convertDashes,
    CodepointMapping extraOverrides) {
  
  /**
   * Fonts and accents on (text mode); unicode-math preference, quotes and
   * dashes off; no overrides.
   */
  public final static ForwardConfig DEFAULT =
      new ForwardConfig(true, true, false, AccentMode.TEXT, false, false, CodepointMapping.EMPTY);
  
  
  public ForwardConfig {
    Objects.requireNonNull(accentMode, "null accentMode");
    if (extraOverrides == null)
      extraOverrides = CodepointMapping.EMPTY;
  }
  
  
  public ForwardConfig addFontModifiers(boolean on) {
    return on == addFontModifiers ? this :
      new ForwardConfig(on, convertAccents, preferUnicodeMath, accentMode, convertQuotes, convertDashes, extraOverrides);
  }
  
  public ForwardConfig convertAccents(boolean on) {
    return on == convertAccents ? this :
      new ForwardConfig(addFontModifiers, on, preferUnicodeMath, accentMode, convertQuotes, convertDashes, extraOverrides);
  }
  
  public ForwardConfig preferUnicodeMath(boolean on) {
    return on == preferUnicodeMath ? this :
      new ForwardConfig(addFontModifiers, convertAccents, on, accentMode, convertQuotes, convertDashes, extraOverrides);
  }
  
  public ForwardConfig accentMode(AccentMode mode) {
    return mode == accentMode ? this :
      new ForwardConfig(addFontModifiers, convertAccents, preferUnicodeMath, mode, convertQuotes, convertDashes, extraOverrides);
  }
  
  public ForwardConfig convertQuotes(boolean on) {
    return on == convertQuotes ? this :
      new ForwardConfig(addFontModifiers, convertAccents, preferUnicodeMath, accentMode, on, convertDashes, extraOverrides);
  }
  
  public ForwardConfig convertDashes(boolean on) {
    return on == convertDashes ? this :
      new ForwardConfig(addFontModifiers, convertAccents, preferUnicodeMath, accentMode, convertQuotes, on, extraOverrides);
  }
  
  public ForwardConfig extraOverrides(CodepointMapping overrides) {
    if (overrides == null)
      overrides = CodepointMapping.EMPTY;
    return overrides.equals(extraOverrides) ? this :
      new ForwardConfig(addFontModifiers, convertAccents, preferUnicodeMath, accentMode, convertQuotes, convertDashes, overrides);
  }

}
