/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Combining accent code point to LaTeX text-accent tag, e.g.
 * {@code U+0301 -> '}, so that {@code e} followed by {@code U+0301} renders
 * as <code>\'{e}</code>. Bijective.
 */
public final class AccentTable {
  
  private final Map<Integer, String> tags;
  private final Map<String, Integer> codes;
  
  
  /**
   * @param tags  insertion-ordered accent code points to tags
   * @throws IllegalArgumentException if two code points share a tag
   */
  public AccentTable(Map<Integer, String> tags) {
    var t = new LinkedHashMap<Integer, String>();
    var c = new LinkedHashMap<String, Integer>();
    for (var e : tags.entrySet()) {
      var prev = c.put(e.getValue(), e.getKey());
      if (prev != null)
        throw new IllegalArgumentException(
            "duplicate accent tag '" + e.getValue() + "' for " +
            TableConstants.codeLabel(prev) + " and " +
            TableConstants.codeLabel(e.getKey()));
      t.put(e.getKey(), e.getValue());
    }
    this.tags = Collections.unmodifiableMap(t);
    this.codes = Collections.unmodifiableMap(c);
  }
  
  
  /** Returns the text-accent tag for the given combining code point. */
  public Optional<String> tag(int codepoint) {
    return Optional.ofNullable(tags.get(codepoint));
  }
  
  /** Returns the combining code point for the given tag. */
  public Optional<Integer> codepoint(String tag) {
    return Optional.ofNullable(codes.get(tag));
  }
  
  
  public boolean contains(int codepoint) {
    return tags.containsKey(codepoint);
  }
  
  
  /** Returns an unmodifiable, ordered view. */
  public Map<Integer, String> asMap() {
    return tags;
  }
  
  
  @Override
  public boolean equals(Object o) {
    return o == this ||
        o instanceof AccentTable other && other.tags.equals(tags);
  }
  
  
  @Override
  public int hashCode() {
    return tags.hashCode();
  }

}
