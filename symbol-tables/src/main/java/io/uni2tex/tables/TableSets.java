/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


/**
 * Ready-made {@linkplain TableSet}s.
 */
public class TableSets {
  // no-one calls
  private TableSets() {  }
  
  
  /**
   * Returns the standard tables: the {@linkplain Seed#DEFAULT default seed}
   * reconciled with the definition files found by {@linkplain DefinitionLocator}.
   * Built once, on first access.
   */
  public static TableSet standard() {
    return Standard.TABLES;
  }
  
  
  /**
   * Returns the default seed reconciled with the bundled definition subset
   * only. Unlike {@linkplain #standard()}, the result does not depend on the
   * environment.
   */
  public static TableSet bundled() {
    return Bundled.TABLES;
  }
  
  
  /** Returns tables built from the default seed alone. */
  public static TableSet seedOnly() {
    return TableBuilder.build(Seed.DEFAULT, Definitions.EMPTY);
  }
  
  
  // class-holder idiom: built on first access
  
  private static class Standard {
    final static TableSet TABLES =
        TableBuilder.build(Seed.DEFAULT, new DefinitionLocator().load());
  }
  
  private static class Bundled {
    final static TableSet TABLES =
        TableBuilder.build(Seed.DEFAULT, DefinitionLocator.loadBundled());
  }

}
