/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The complete, immutable set of lookup tables the conversion engines
 * consult. Instances are safe to share across threads.
 * 
 * @param math                code point to math macros
 * @param mathReverse         math macro to code points
 * @param mathAccents         combining code point to math-accent macros
 * @param mathAccentsReverse  math-accent macro to combining code points
 * @param accents             combining code point to text-accent tag
 * @param accentModes         text-accent tag to math-accent command name
 * @param greek               Greek code point to macro
 * @param greekReverse        Greek macro to code point
 * @param replacements        macros that do not survive a round trip, mapped
 *                            to the macro they come back as
 * @param quotes              typographic quote to ASCII substitute
 * @param dashes              dash and space to ASCII substitute
 * 
 * @see TableBuilder
 * @see TableSets
 */
public record TableSet(
    CodepointMapping math,
    MacroMapping mathReverse,
    CodepointMapping mathAccents,
    MacroMapping mathAccentsReverse,
    AccentTable accents,
    AccentModeTable accentModes,
    CodepointMapping greek,
    MacroMapping greekReverse,
    Map<String, String> replacements,
    Map<Integer, String> quotes,
    Map<Integer, String> dashes) {
  
  public TableSet {
    Objects.requireNonNull(math, "null math");
    Objects.requireNonNull(mathReverse, "null mathReverse");
    Objects.requireNonNull(mathAccents, "null mathAccents");
    Objects.requireNonNull(mathAccentsReverse, "null mathAccentsReverse");
    Objects.requireNonNull(accents, "null accents");
    Objects.requireNonNull(accentModes, "null accentModes");
    Objects.requireNonNull(greek, "null greek");
    Objects.requireNonNull(greekReverse, "null greekReverse");
    replacements = Collections.unmodifiableMap(new LinkedHashMap<>(replacements));
    quotes = Collections.unmodifiableMap(new LinkedHashMap<>(quotes));
    dashes = Collections.unmodifiableMap(new LinkedHashMap<>(dashes));
  }
  
  
  /**
   * Returns the macro-to-string substitutions for math symbols: each macro in
   * the reverse math table maps to its canonical code point.
   */
  public Map<String, String> mathSubstitutions() {
    return mathReverse.substitutions();
  }
  
  
  /** Returns the macro-to-string substitutions for Greek letters. */
  public Map<String, String> greekSubstitutions() {
    return greekReverse.substitutions();
  }

}
