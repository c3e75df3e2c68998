/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.Objects;

/**
 * A <code>\def</code> alias from {@code unicode-math-xetex.sty}: {@code name}
 * is defined as {@code target}. Both include the leading backslash.
 */
public record AliasRecord(String name, String target) {
  
  public AliasRecord {
    Objects.requireNonNull(name, "null name");
    Objects.requireNonNull(target, "null target");
  }

}
