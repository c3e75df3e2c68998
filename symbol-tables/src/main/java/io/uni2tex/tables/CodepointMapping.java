/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Code point to LaTeX macro candidates, e.g. {@code U+2229 -> [\cap]}.
 */
public final class CodepointMapping extends CandidateMapping<Integer, String> {
  
  public final static CodepointMapping EMPTY = new CodepointMapping(Map.of());
  
  
  /**
   * Returns a single-candidate mapping, preserving the argument's iteration
   * order.
   */
  public static CodepointMapping of(Map<Integer, String> singles) {
    var map = new LinkedHashMap<Integer, List<String>>();
    singles.forEach((cp, macro) -> map.put(cp, List.of(macro)));
    return new CodepointMapping(map);
  }
  

  public CodepointMapping(Map<Integer, ? extends List<String>> map) {
    super(map);
  }
  
  
  /** Returns the canonical macro, or {@code null} if not mapped. */
  public String macro(int codepoint) {
    return canonical(codepoint).orElse(null);
  }

}
