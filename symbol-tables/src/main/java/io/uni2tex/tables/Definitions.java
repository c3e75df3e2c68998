/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.List;

/**
 * The records read from the unicode-math definition files, in file order.
 * 
 * @param symbols   from {@code unicode-math-table.tex}
 * @param aliases   from {@code unicode-math-xetex.sty}
 */
public record Definitions(List<SymbolRecord> symbols, List<AliasRecord> aliases) {
  
  /** No definitions. Tables built from this are seed-only. */
  public final static Definitions EMPTY = new Definitions(List.of(), List.of());
  
  public Definitions {
    symbols = List.copyOf(symbols);
    aliases = List.copyOf(aliases);
  }
  
  
  public boolean isEmpty() {
    return symbols.isEmpty() && aliases.isEmpty();
  }
  
  
  public Definitions symbols(List<SymbolRecord> symbols) {
    return new Definitions(symbols, aliases);
  }
  
  public Definitions aliases(List<AliasRecord> aliases) {
    return new Definitions(symbols, aliases);
  }

}
