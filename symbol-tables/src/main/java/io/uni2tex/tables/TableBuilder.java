/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reconciles the {@linkplain Seed seed} data with the records of the
 * unicode-math definition files into a {@linkplain TableSet}. Records are
 * applied in order:
 * <ol>
 * <li>Symbol records. Accents (category contains "accent") are routed to
 * the math-accent tables; everything else to the math tables. A forward
 * entry is added if new, otherwise the macro is appended as a secondary
 * candidate; seed entries thus keep precedence. Reverse entries are
 * registered the same way, except for code points in the seed's skip list.
 * Alternate names in the info field ({@code /name}) become reverse aliases.</li>
 * <li>Alias records. If the target macro is a known reverse-math key, the
 * alias gets a copy of the target's code points (merged, without duplicates,
 * if the alias already exists). Unknown targets are skipped.</li>
 * </ol>
 * <p>
 * The output is a deterministic function of the seed and the records.
 * Instances are not thread-safe.
 * </p>
 */
public class TableBuilder {
  
  /**
   * Builds and returns the tables from the given seed and definitions.
   */
  public static TableSet build(Seed seed, Definitions definitions) {
    return new TableBuilder(seed).addAll(definitions).build();
  }
  
  
  
  private final Seed seed;
  
  private final Map<Integer, List<String>> math = new LinkedHashMap<>();
  private final Map<String, List<Integer>> mathReverse = new LinkedHashMap<>();
  private final Map<Integer, List<String>> accentMath = new LinkedHashMap<>();
  private final Map<String, List<Integer>> accentMathReverse = new LinkedHashMap<>();
  
  
  /**
   * Creates an instance initialized with the given seed.
   */
  public TableBuilder(Seed seed) {
    this.seed = Objects.requireNonNull(seed, "null seed");
    for (var e : seed.math().entrySet()) {
      addMacro(math, e.getKey(), e.getValue());
      addCode(mathReverse, e.getValue(), e.getKey());
    }
    for (var e : seed.reverseOnly().entrySet())
      addCode(mathReverse, e.getKey(), e.getValue());
  }
  
  
  
  /** Adds the given symbol records, then the alias records. */
  public TableBuilder addAll(Definitions definitions) {
    definitions.symbols().forEach(this::add);
    definitions.aliases().forEach(this::add);
    return this;
  }
  
  
  /**
   * Adds the given symbol record.
   */
  public TableBuilder add(SymbolRecord symbol) {
    final int code = symbol.codepoint();
    final String latex = symbol.command();
    
    Map<Integer, List<String>> forward = math;
    Map<String, List<Integer>> reverse = mathReverse;
    if (symbol.isAccent()) {
      if (!symbol.inCombiningRange())
        TableConstants.logWarning(
            "accent " + latex + " code " + TableConstants.codeLabel(code) +
            " out of standard unicode combining ranges");
      forward = accentMath;
      reverse = accentMathReverse;
    }
    
    if (seed.reverseSkip().contains(code))
      TableConstants.logDebug(() -> "skip " + latex + " -> " + TableConstants.codeLabel(code));
    else
      addCode(reverse, latex, code);
    
    addMacro(forward, code, latex);
    
    for (var alias : symbol.infoAliases())
      addCode(reverse, alias, code);
    
    return this;
  }
  
  
  /**
   * Adds the given alias record. Aliases apply to the math reverse table only.
   */
  public TableBuilder add(AliasRecord alias) {
    var codes = mathReverse.get(alias.target());
    if (codes == null) {
      TableConstants.logDebug(() ->
          "alias " + alias.name() + " to unknown " + alias.target() + " skipped");
      return this;
    }
    // copy: later merges into one must not show through the other
    for (int code : new ArrayList<>(codes))
      addCode(mathReverse, alias.name(), code);
    return this;
  }
  
  
  
  private static void addMacro(Map<Integer, List<String>> forward, int code, String latex) {
    var macros = forward.computeIfAbsent(code, c -> new ArrayList<>(1));
    if (!macros.contains(latex))
      macros.add(latex);
  }
  
  private static void addCode(Map<String, List<Integer>> reverse, String latex, int code) {
    var codes = reverse.computeIfAbsent(latex, l -> new ArrayList<>(1));
    if (!codes.contains(code))
      codes.add(code);
  }
  
  
  
  /**
   * Derives the replacement table: every reverse-math macro whose canonical
   * code point maps forward to a different macro. Macros whose code point has
   * no forward entry are not recorded.
   */
  private Map<String, String> replacements() {
    var replacements = new LinkedHashMap<String, String>();
    for (var e : mathReverse.entrySet()) {
      var macros = math.get(e.getValue().get(0));
      if (macros == null)
        continue;
      String back = macros.get(0);
      if (!back.equals(e.getKey()))
        replacements.put(e.getKey(), back);
    }
    return replacements;
  }
  
  
  /**
   * Builds and returns the tables. The builder may continue to be used.
   */
  public TableSet build() {
    var greek = new LinkedHashMap<Integer, List<String>>();
    var greekReverse = new LinkedHashMap<String, List<Integer>>();
    for (var letter : seed.greek()) {
      greekReverse.put(letter.macro(), List.of(letter.codepoint()));
      greek.put(letter.codepoint(), List.of(letter.macro()));
    }
    
    var tables = new TableSet(
        new CodepointMapping(math),
        new MacroMapping(mathReverse),
        new CodepointMapping(accentMath),
        new MacroMapping(accentMathReverse),
        new AccentTable(seed.accents()),
        new AccentModeTable(seed.accentModes()),
        new CodepointMapping(greek),
        new MacroMapping(greekReverse),
        replacements(),
        seed.quotes(),
        seed.dashes());
    
    checkAccentModes(tables);
    if (TableConstants.isDebugEnabled())
      reportMultiplicity(tables);
    
    return tables;
  }
  
  
  /** Warns about accent-mode entries whose text tag is not a known accent. */
  private static void checkAccentModes(TableSet tables) {
    for (var tag : tables.accentModes().asMap().keySet()) {
      if (tables.accents().codepoint(tag).isEmpty())
        TableConstants.logWarning(
            "accent mode entry for unknown text accent '" + tag + "' is never used");
    }
  }
  
  
  private void reportMultiplicity(TableSet tables) {
    for (var e : tables.math().asMap().entrySet()) {
      if (e.getValue().size() > 1)
        TableConstants.logDebug(() ->
            "multiple unicode to latex, " + TableConstants.codeLabel(e.getKey()) +
            " -> " + e.getValue());
    }
    for (var e : tables.mathReverse().asMap().entrySet()) {
      if (e.getValue().size() > 1)
        TableConstants.logDebug(() ->
            "multiple latex to unicode, " + e.getKey() + " -> " + labels(e.getValue()));
    }
    TableConstants.logDebug(() ->
        "built tables: " + tables.math().size() + " math, " +
        tables.mathReverse().size() + " reverse math, " +
        tables.mathAccents().size() + " math accents, " +
        tables.replacements().size() + " replacements; " +
        tables.math().ambiguousCount() + " code points, " +
        tables.mathReverse().ambiguousCount() + " macros with several candidates");
  }
  
  
  private static List<String> labels(List<Integer> codes) {
    var labels = new ArrayList<String>(codes.size());
    codes.forEach(c -> labels.add(TableConstants.codeLabel(c)));
    return labels;
  }

}
