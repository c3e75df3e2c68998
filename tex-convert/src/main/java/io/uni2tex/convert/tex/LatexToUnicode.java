/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert.tex;


import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.uni2tex.tables.TableConstants;
import io.uni2tex.tables.TableSet;

/**
 * Converts LaTeX source to Unicode by substituting known macros and active
 * characters; everything else passes through verbatim (whitespace and
 * comments included).
 * 
 * <h2>Substitution keys</h2>
 * <p>
 * Macros are looked up with their leading backslash (e.g. <code>\alpha</code>);
 * active characters by {@code "active::"} followed by the character (e.g.
 * {@code "active::~"}). Unmatched tokens are emitted as scanned.
 * </p>
 * <p>
 * Instances are immutable and safe to share across threads.
 * </p>
 */
public class LatexToUnicode {
  
  /**
   * Returns the standard substitution map built from the given tables.
   * 
   * @param math    include math symbols (canonical code point of each macro)
   * @param greek   include Greek letters (applied last, so they win)
   */
  public static Map<String, String> substitutions(TableSet tables, boolean math, boolean greek) {
    var map = new LinkedHashMap<String, String>();
    if (math)
      map.putAll(tables.mathSubstitutions());
    if (greek)
      map.putAll(tables.greekSubstitutions());
    return map;
  }
  
  
  
  private final Map<String, String> substitutions;
  
  
  /**
   * @param substitutions  macro (or active-character key) to replacement text
   */
  public LatexToUnicode(Map<String, String> substitutions) {
    this.substitutions = Collections.unmodifiableMap(new LinkedHashMap<>(substitutions));
  }
  
  /** Creates an instance with math and Greek substitutions from the given tables. */
  public LatexToUnicode(TableSet tables) {
    this(substitutions(tables, true, true));
  }
  
  
  public Map<String, String> substitutions() {
    return substitutions;
  }
  
  
  /**
   * Returns an instance with the given substitutions layered on top of
   * this instance's.
   */
  public LatexToUnicode with(Map<String, String> more) {
    if (more.isEmpty())
      return this;
    var map = new LinkedHashMap<>(substitutions);
    map.putAll(more);
    return new LatexToUnicode(map);
  }
  
  
  /** Returns the replacement text for the given token. */
  public String substitute(Token token) {
    switch (token.kind()) {
    case ESCAPE_SEQUENCE: {
      var src = token.source();
      var sub = substitutions.get(src);
      if (sub == null)
        TableConstants.logDebug(() -> "unknown macro passed through: " + src);
      return sub == null ? src : sub;
    }
    case ACTIVE_CHAR:
      return substitutions.getOrDefault(token.text(), token.source());
    default:
      return token.source();
    }
  }
  
  
  /** Converts the given source. */
  public String convert(String source) {
    var out = new StringWriter(source.length());
    try {
      convert(new StringReader(source), out);
    } catch (IOException iox) {
      // not expected from string streams
      throw new UncheckedIOException(iox);
    }
    return out.toString();
  }
  
  
  /**
   * Converts the given stream, writing to the given writer. Neither stream
   * is closed.
   * 
   * @return the number of tokens scanned
   */
  public long convert(Reader in, Writer out) throws IOException {
    long count = 0;
    try {
      var tokens = new TexTokenizer(in);
      while (tokens.hasNext()) {
        out.write(substitute(tokens.next()));
        ++count;
      }
    } catch (UncheckedIOException uiox) {
      throw uiox.getCause();
    }
    out.flush();
    return count;
  }

}
