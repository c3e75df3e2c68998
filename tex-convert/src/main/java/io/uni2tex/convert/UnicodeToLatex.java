/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert;


import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.stream.IntStream;

import io.uni2tex.convert.Diagnostic.Kind;
import io.uni2tex.tables.FontStyle;
import io.uni2tex.tables.TableConstants;
import io.uni2tex.tables.TableSet;
import io.uni2tex.tables.TableSets;

/**
 * Converts Unicode text to LaTeX source. Each code point is rendered by
 * the first of these rules that applies:
 * <ol>
 * <li>Quote and dash substitution, if {@linkplain ForwardConfig#convertQuotes()
 * enabled}.</li>
 * <li>User {@linkplain ForwardConfig#extraOverrides() overrides}.</li>
 * <li>The unicode-math macro, if {@linkplain ForwardConfig#preferUnicodeMath()
 * preferred} (non-ASCII only).</li>
 * <li>Combining accents wrap the previously emitted fragment, e.g.
 * {@code e U+0301} becomes <code>\'{e}</code>.</li>
 * <li>Decompositions: fonts (<code>\symbb{R}</code>), small forms,
 * compatibility forms, super- and subscripts, vulgar fractions, and
 * precomposed accented characters.</li>
 * <li>Greek letters by name, e.g. <code>\alpha</code>.</li>
 * <li>The unicode-math macro.</li>
 * <li>Otherwise the character passes through (with a
 * {@linkplain Diagnostic.Kind#NOT_CONVERTIBLE diagnostic} if non-ASCII).</li>
 * </ol>
 * <p>
 * Macros are emitted with a trailing space so that they are terminated
 * regardless of what follows. ASCII input passes through unchanged unless
 * overridden.
 * </p>
 * <h2>Concurrency</h2>
 * <p>
 * Instances are immutable and may be shared across threads; per-conversion
 * state (line and character position) is local to each call.
 * </p>
 */
public class UnicodeToLatex {
  
  /** Source name used when none is given. */
  public final static String DEFAULT_SOURCE = "cmdline";
  
  
  private final TableSet tables;
  private final ForwardConfig config;
  private final Diagnostics diagnostics;
  
  
  /** Creates an instance with the standard tables and default settings. */
  public UnicodeToLatex() {
    this(TableSets.standard(), ForwardConfig.DEFAULT);
  }
  
  /** Creates an instance that logs its diagnostics. */
  public UnicodeToLatex(TableSet tables, ForwardConfig config) {
    this(tables, config, Diagnostics.LOG);
  }
  
  
  public UnicodeToLatex(TableSet tables, ForwardConfig config, Diagnostics diagnostics) {
    this.tables = Objects.requireNonNull(tables, "null tables");
    this.config = Objects.requireNonNull(config, "null config");
    this.diagnostics = Objects.requireNonNull(diagnostics, "null diagnostics");
  }
  
  
  public TableSet tables() {
    return tables;
  }
  
  public ForwardConfig config() {
    return config;
  }
  
  
  /** Returns an instance with the given settings and the same tables and diagnostics. */
  public UnicodeToLatex config(ForwardConfig config) {
    return config.equals(this.config) ? this : new UnicodeToLatex(tables, config, diagnostics);
  }
  
  
  
  /** Converts the given text. */
  public String convert(CharSequence text) {
    return convert(text, DEFAULT_SOURCE);
  }
  
  
  /**
   * Converts the given text.
   * 
   * @param source  name of the input, used in diagnostics
   */
  public String convert(CharSequence text, String source) {
    return convert(text.codePoints().iterator(), source);
  }
  
  
  /** Converts a single code point. */
  public String convert(int codepoint) {
    if (!Character.isValidCodePoint(codepoint))
      throw new IllegalArgumentException("invalid code point: " + codepoint);
    return new Run(DEFAULT_SOURCE).convert(IntStream.of(codepoint).iterator());
  }
  
  
  /**
   * Converts the given sequence of Unicode scalar values. The sequence is
   * consumed lazily.
   * 
   * @param source  name of the input, used in diagnostics
   */
  public String convert(PrimitiveIterator.OfInt scalars, String source) {
    return new Run(source).convert(scalars);
  }
  
  
  /**
   * Converts the given stream line-by-line, writing each converted line
   * (including its line terminator) to the given writer. Neither stream
   * is closed.
   * 
   * @param source  name of the input, used in diagnostics
   * @return the number of lines converted
   */
  public long convert(Reader in, Writer out, String source) throws IOException {
    var run = new Run(source);
    var line = new StringBuilder(128);
    long lines = 0;
    while (readLine(in, line)) {
      out.write(run.convert(line.codePoints().iterator()));
      ++lines;
    }
    out.flush();
    return lines;
  }
  
  
  /**
   * Reads the next line into {@code line} (cleared first), including any
   * terminating {@code '\n'}.
   * 
   * @return {@code false} at end of stream (nothing read)
   */
  private static boolean readLine(Reader in, StringBuilder line) throws IOException {
    line.setLength(0);
    for (int c = in.read(); c != -1; c = in.read()) {
      line.append((char) c);
      if (c == '\n')
        break;
    }
    return line.length() > 0;
  }
  
  
  
  
  /** Per-conversion state. */
  private final class Run {
    
    private final String source;
    private long lineNo = 1;
    private long charNo;
    
    Run(String source) {
      this.source = source == null ? DEFAULT_SOURCE : source;
    }
    
    String convert(PrimitiveIterator.OfInt scalars) {
      var out = new ArrayList<String>();
      while (scalars.hasNext()) {
        int cp = scalars.nextInt();
        ++charNo;
        process(cp, out, this);
        if (cp == '\n') {
          ++lineNo;
          charNo = 0;
        }
      }
      return String.join("", out);
    }
    
    void report(Kind kind, int codepoint, String detail) {
      diagnostics.report(
          new Diagnostic(kind, source, lineNo, charNo, codepoint, detail));
    }
    
    String location() {
      return "'" + source + "':" + lineNo + ":" + charNo;
    }
  }
  
  
  
  /**
   * Renders the given code points into a fresh fragment list, and returns
   * the joined result. Accents in the sequence thus never reach back into
   * the caller's output.
   */
  private String render(Run run, int... codepoints) {
    var out = new ArrayList<String>(codepoints.length);
    for (int cp : codepoints)
      process(cp, out, run);
    return String.join("", out);
  }
  
  
  private static String raw(int codepoint) {
    return Character.toString(codepoint);
  }
  
  
  
  private void process(int cp, List<String> out, Run run) {
    
    if (config.convertQuotes()) {
      var quote = tables.quotes().get(cp);
      if (quote != null) {
        out.add(quote);
        return;
      }
    }
    if (config.convertDashes()) {
      var dash = tables.dashes().get(cp);
      if (dash != null) {
        out.add(dash);
        return;
      }
    }
    
    var extra = config.extraOverrides().macro(cp);
    if (extra != null) {
      TableConstants.logDebug(() ->
          run.location() + " extra " + TableConstants.codeLabel(cp) + " " + extra);
      out.add(extra + ' ');
      return;
    }
    
    if (cp < 0x80) {
      out.add(raw(cp));
      return;
    }
    
    if (config.preferUnicodeMath()) {
      var latex = tables.math().macro(cp);
      if (latex != null) {
        TableConstants.logDebug(() ->
            run.location() + " math " + TableConstants.codeLabel(cp) + " " + latex);
        out.add(latex + ' ');
        return;
      }
    }
    
    var info = CharInfo.of(cp);
    if (info.decomposition().kind() != Decomposition.Kind.NONE)
      TableConstants.logDebug(() ->
          run.location() + " decomposing " + TableConstants.codeLabel(cp) + " " +
          info.decomposition() + " " + info.name());
    
    if (info.combiningMark() && config.convertAccents() && tables.accents().contains(cp)) {
      String base;
      if (out.isEmpty()) {
        run.report(Kind.NO_PRECEDING_BASE, cp, "");
        base = " ";
      } else
        base = out.remove(out.size() - 1);
      out.add(accent(cp, base));
      return;
    }
    
    if (decompose(info, out, run))
      return;
    
    if (info.isGreek()) {
      out.add(greekMacro(info.name()) + ' ');
      return;
    }
    
    var latex = tables.math().macro(cp);
    if (latex != null) {
      TableConstants.logDebug(() ->
          run.location() + " math " + TableConstants.codeLabel(cp) + " " + latex);
      out.add(latex + ' ');
      return;
    }
    
    run.report(Kind.NOT_CONVERTIBLE, cp, "");
    out.add(raw(cp));
  }
  
  
  /**
   * Renders the given accent over the given (already rendered) base,
   * per the configured accent mode.
   */
  private String accent(int accent, String base) {
    String tag = tables.accents().tag(accent).orElseThrow();
    String command;
    switch (config.accentMode()) {
    case MATH:
      command = tables.accentModes().mathCommand(tag).orElse(tag);
      break;
    case TEXT:
    case AUTO:
    default:
      command = tag;
    }
    return "\\" + command + "{" + base + "}";
  }
  
  
  /**
   * Returns the macro for a Greek letter from its character name. The last
   * word of the name, lowercased, is the letter; it's capitalized unless the
   * name says {@code SMALL}.
   */
  static String greekMacro(String name) {
    String letter = name.substring(name.lastIndexOf(' ') + 1).toLowerCase();
    if (letter.equals("lamda"))
      letter = "lambda";
    if (!name.contains("SMALL") && !letter.isEmpty())
      letter = Character.toUpperCase(letter.charAt(0)) + letter.substring(1);
    return "\\" + letter;
  }
  
  
  
  /**
   * Applies the decomposition rules.
   * 
   * @return {@code true} iff the code point was rendered
   */
  private boolean decompose(CharInfo info, List<String> out, Run run) {
    var dec = info.decomposition();
    final int cp = info.codepoint();
    switch (dec.kind()) {
    
    case NONE:
      return false;
    
    case FONT: {
      String base = render(run, ((Decomposition.Font) dec).base());
      out.add(config.addFontModifiers() ? FontStyle.wrap(info.name(), base) : base);
      return true;
    }
    
    case SMALL:
      out.add("{\\scriptsize{" + render(run, ((Decomposition.Small) dec).base()) + "}}");
      return true;
    
    case SUPER:
      out.add("^{" + render(run, ((Decomposition.Modifier) dec).bases()) + "}");
      return true;
    
    case SUB:
      out.add("_{" + render(run, ((Decomposition.Modifier) dec).bases()) + "}");
      return true;
    
    case FRACTION: {
      var fraction = (Decomposition.Fraction) dec;
      out.add(
          "{\\sfrac{" + render(run, fraction.numerator()) + "}{" +
          render(run, fraction.denominator()) + "}}");
      return true;
    }
    
    case COMPAT:
      return compat(info, (Decomposition.Compat) dec, out, run);
    
    case ACCENT_PAIR: {
      var pair = (Decomposition.AccentPair) dec;
      if (!tables.accents().contains(pair.accent())) {
        run.report(Kind.UNSUPPORTED, cp, "decomposition");
        return false;
      }
      if (!config.convertAccents())
        out.add(raw(cp));
      else if (info.combiningMark()) {
        // both scalars are marks (e.g. U+0344): each accents the preceding output
        process(pair.base(), out, run);
        process(pair.accent(), out, run);
      } else
        out.add(accent(pair.accent(), render(run, pair.base())));
      return true;
    }
    
    case SINGLETON: {
      int target = ((Decomposition.Singleton) dec).target();
      if (info.combiningMark())
        process(target, out, run);    // e.g. U+0341 to U+0301, applied to the preceding output
      else
        out.add(render(run, target));
      return true;
    }
    
    case UNSUPPORTED:
    default: {
      var unsupported = (Decomposition.Unsupported) dec;
      run.report(Kind.UNSUPPORTED, cp, "modifier '" + unsupported.tag() + "'");
      out.add(raw(cp));
      return true;
    }
    }
  }
  
  
  private boolean compat(CharInfo info, Decomposition.Compat dec, List<String> out, Run run) {
    int first = dec.first();
    if (first >= 0x370 && first <= 0x3FF) {
      // Greek symbol variants, e.g. U+03D1 to \vartheta
      String letter = render(run, first);
      out.add(letter.startsWith("\\") ? "\\var" + letter.substring(1) : letter);
      return true;
    }
    if (info.name().contains("LIGATURE")) {
      out.add(render(run, dec.bases()));
      return true;
    }
    // left to the remaining rules (e.g. U+2026 is in the math table)
    run.report(Kind.UNSUPPORTED, info.codepoint(), "modifier '<compat>'");
    return false;
  }

}
