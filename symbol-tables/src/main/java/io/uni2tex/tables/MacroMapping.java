/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LaTeX macro to code point candidates, e.g. {@code \cap -> [U+2229]}.
 * Macro keys include the leading backslash.
 */
public final class MacroMapping extends CandidateMapping<String, Integer> {
  
  public final static MacroMapping EMPTY = new MacroMapping(Map.of());
  

  public MacroMapping(Map<String, ? extends List<Integer>> map) {
    super(map);
  }
  
  
  /**
   * Returns the macro-to-string substitutions of this mapping: each macro
   * maps to the string form of its canonical code point.
   */
  public Map<String, String> substitutions() {
    var subs = new LinkedHashMap<String, String>();
    for (var e : asMap().entrySet())
      subs.put(e.getKey(), Character.toString(e.getValue().get(0)));
    return subs;
  }

}
