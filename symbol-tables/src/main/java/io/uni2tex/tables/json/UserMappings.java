/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables.json;


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.uni2tex.tables.CodepointMapping;

/**
 * User-supplied mappings, typically loaded from a JSON file.
 * 
 * @param overrides     code point to macro, consulted before any table
 *                      by the forward converter
 * @param replacements  macro to replacement text, applied by the reverse
 *                      converter on top of the standard substitutions
 * 
 * @see UserMappingsParser
 */
public record UserMappings(CodepointMapping overrides, Map<String, String> replacements) {
  
  public final static UserMappings EMPTY = new UserMappings(CodepointMapping.EMPTY, Map.of());
  
  public UserMappings {
    Objects.requireNonNull(overrides, "null overrides");
    replacements = Collections.unmodifiableMap(new LinkedHashMap<>(replacements));
  }
  
  
  public boolean isEmpty() {
    return overrides.isEmpty() && replacements.isEmpty();
  }

}
