/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Hand-curated table data. Seed entries take precedence over anything read
 * from the unicode-math definition files.
 * 
 * @param math          code point to math macro; these forward entries win
 *                      over the definition files. Their inverses seed the
 *                      reverse table.
 * @param reverseOnly   one-way macro to code point entries added to the
 *                      reverse table (after the inverses of {@code math})
 * @param reverseSkip   code points never registered in the reverse table
 *                      from definition-file records
 * @param accents       combining code point to text-accent tag
 * @param accentModes   text-accent tag to math-accent command name
 * @param greek         ordered Greek letter list
 * @param quotes        typographic quote to ASCII substitutes
 * @param dashes        dash and space code point to ASCII substitutes
 * 
 * @see #DEFAULT
 */
public record Seed(
    Map<Integer, String> math,
    Map<String, Integer> reverseOnly,
    Set<Integer> reverseSkip,
    Map<Integer, String> accents,
    Map<String, String> accentModes,
    List<GreekLetter> greek,
    Map<Integer, String> quotes,
    Map<Integer, String> dashes) {
  
  /** The standard seed. */
  public final static Seed DEFAULT;
  
  static {
    var math = new LinkedHashMap<Integer, String>();
    math.put(0xD7, "\\times");
    math.put(0x221E, "\\infty");
    math.put(0xAB, "\\guillemotleft");
    math.put(0xBB, "\\guillemotright");
    // RING OPERATOR (the table's \vysmwhtcircle)
    math.put(0x2218, "\\circ");
    // the table says \Leftrightarrow
    math.put(0x21D4, "\\iff");
    // one-way: --- is not converted back
    math.put(0x2014, "---");
    
    var reverseOnly = new LinkedHashMap<String, Integer>();
    reverseOnly.put("\\|", 0x2016);
    reverseOnly.put("\\iff", 0x21D4);
    
    var skip = new LinkedHashSet<Integer>();
    skip.add(0x221A);   // SQUARE ROOT
    skip.add(0x23DF);   // BOTTOM CURLY BRACKET
    
    var accents = new LinkedHashMap<Integer, String>();
    accents.put(0x0300, "`");
    accents.put(0x0301, "'");
    accents.put(0x0302, "^");
    accents.put(0x0308, "\"");
    accents.put(0x030B, "H");
    accents.put(0x0303, "~");
    accents.put(0x0327, "c");
    accents.put(0x0328, "k");
    accents.put(0x0304, "=");
    accents.put(0x0331, "b");
    accents.put(0x0307, ".");
    accents.put(0x0323, "d");
    accents.put(0x030A, "r");
    accents.put(0x0306, "u");
    accents.put(0x030C, "v");
    
    // H c k b d r have no math form
    var modes = new LinkedHashMap<String, String>();
    modes.put("`", "grave");
    modes.put("'", "acute");
    modes.put("^", "hat");
    modes.put("~", "tilde");
    modes.put("\"", "ddot");
    modes.put("=", "bar");
    modes.put(".", "dot");
    modes.put("u", "breve");
    modes.put("v", "check");
    
    // lowercase letters render as math italic under XeLaTeX
    var greek = List.of(
        new GreekLetter("\\Gamma", 0x0393),
        new GreekLetter("\\Theta", 0x0398),
        new GreekLetter("\\Lambda", 0x039B),
        new GreekLetter("\\Xi", 0x039E),
        new GreekLetter("\\Pi", 0x03A0),
        new GreekLetter("\\Sigma", 0x03A3),
        new GreekLetter("\\Upsilon", 0x03A5),
        new GreekLetter("\\Phi", 0x03A6),
        new GreekLetter("\\Psi", 0x03A8),
        new GreekLetter("\\alpha", 0x1D6FC),
        new GreekLetter("\\beta", 0x1D6FD),
        new GreekLetter("\\gamma", 0x1D6FE),
        new GreekLetter("\\delta", 0x1D6FF),
        new GreekLetter("\\varepsilon", 0x1D700),
        new GreekLetter("\\zeta", 0x1D701),
        new GreekLetter("\\eta", 0x1D702),
        new GreekLetter("\\theta", 0x1D703),
        new GreekLetter("\\vartheta", 0x1D717),
        new GreekLetter("\\iota", 0x1D704),
        new GreekLetter("\\kappa", 0x1D705),
        new GreekLetter("\\lambda", 0x1D706),
        new GreekLetter("\\mu", 0x1D707),
        new GreekLetter("\\nu", 0x1D708),
        new GreekLetter("\\xi", 0x1D709),
        new GreekLetter("\\pi", 0x1D70B),
        new GreekLetter("\\rho", 0x1D70C),
        new GreekLetter("\\varsigma", 0x1D70D),
        new GreekLetter("\\sigma", 0x1D70E),
        new GreekLetter("\\tau", 0x1D70F),
        new GreekLetter("\\upsilon", 0x1D710),
        new GreekLetter("\\phi", 0x1D719),
        new GreekLetter("\\varphi", 0x1D711),
        new GreekLetter("\\chi", 0x1D712),
        new GreekLetter("\\psi", 0x1D713),
        new GreekLetter("\\omega", 0x1D714),
        new GreekLetter("\\Omega", 0x03A9),
        new GreekLetter("\\Delta", 0x0394),
        new GreekLetter("\\epsilon", 0x1D716),
        new GreekLetter("\\varrho", 0x1D71A),
        new GreekLetter("\\varpi", 0x1D71B));
    
    var quotes = new LinkedHashMap<Integer, String>();
    quotes.put(0x2018, "`");
    quotes.put(0x2019, "'");
    quotes.put(0x201C, "``");
    quotes.put(0x201D, "''");
    
    var dashes = new LinkedHashMap<Integer, String>();
    dashes.put(0x2010, "-");    // HYPHEN
    dashes.put(0x2011, "-");    // NON-BREAKING HYPHEN
    dashes.put(0x2012, "--");   // FIGURE DASH
    dashes.put(0x2013, "--");   // EN DASH
    dashes.put(0x2014, "---");  // EM DASH
    dashes.put(0x2015, "---");  // HORIZONTAL BAR
    dashes.put(0x00A0, "~");    // NO-BREAK SPACE
    for (int cp = 0x2002; cp <= 0x200A; ++cp)
      dashes.put(cp, " ");      // EN SPACE .. HAIR SPACE
    dashes.put(0x202F, " ");    // NARROW NO-BREAK SPACE
    
    DEFAULT = new Seed(math, reverseOnly, skip, accents, modes, greek, quotes, dashes);
  }
  
  
  /** Seed with no data. */
  public final static Seed EMPTY = new Seed(
      Map.of(), Map.of(), Set.of(), Map.of(), Map.of(), List.of(), Map.of(), Map.of());
  
  
  
  public Seed {
    math = freeze(math);
    reverseOnly = freeze(reverseOnly);
    reverseSkip = Collections.unmodifiableSet(
        new LinkedHashSet<>(Objects.requireNonNull(reverseSkip, "null reverseSkip")));
    accents = freeze(accents);
    accentModes = freeze(accentModes);
    greek = List.copyOf(greek);
    quotes = freeze(quotes);
    dashes = freeze(dashes);
  }
  
  
  private static <K, V> Map<K, V> freeze(Map<K, V> map) {
    return Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(map, "null map")));
  }
  
  
  /**
   * Returns a version with the given forward math entry overriding (or added
   * to) this seed's.
   */
  public Seed math(int codepoint, String macro) {
    if (macro.equals(math.get(codepoint)))
      return this;
    var m = new LinkedHashMap<>(math);
    m.put(codepoint, macro);
    return new Seed(m, reverseOnly, reverseSkip, accents, accentModes, greek, quotes, dashes);
  }

}
