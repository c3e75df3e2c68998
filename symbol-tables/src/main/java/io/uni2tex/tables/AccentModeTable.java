/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Text-accent tag to math-accent command name, e.g. {@code ' -> acute}.
 * Tags with no math form are absent.
 */
public final class AccentModeTable {
  
  private final Map<String, String> commands;
  

  public AccentModeTable(Map<String, String> commands) {
    this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
  }
  
  
  /** Returns the math command name (sans backslash) for the given tag. */
  public Optional<String> mathCommand(String tag) {
    return Optional.ofNullable(commands.get(tag));
  }
  
  
  public Map<String, String> asMap() {
    return commands;
  }
  
  
  @Override
  public boolean equals(Object o) {
    return o == this ||
        o instanceof AccentModeTable other && other.commands.equals(commands);
  }
  
  
  @Override
  public int hashCode() {
    return commands.hashCode();
  }

}
