/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert;


import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import io.uni2tex.convert.Diagnostic.Kind;
import io.uni2tex.tables.CodepointMapping;
import io.uni2tex.tables.Definitions;
import io.uni2tex.tables.Seed;
import io.uni2tex.tables.TableBuilder;
import io.uni2tex.tables.TableSet;
import io.uni2tex.tables.TableSets;

/**
 * 
 */
public class UnicodeToLatexTest {
  
  final static TableSet TABLES = TableSets.bundled();
  
  
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  
  
  private UnicodeToLatex converter(ForwardConfig config) {
    return new UnicodeToLatex(TABLES, config, Diagnostics.IGNORE.collectingTo(diagnostics));
  }
  
  private String forward(String text) {
    return forward(text, ForwardConfig.DEFAULT);
  }
  
  private String forward(String text, ForwardConfig config) {
    return converter(config).convert(text);
  }
  
  private String mathAccents(String text) {
    return forward(text, ForwardConfig.DEFAULT.accentMode(AccentMode.MATH));
  }
  
  
  
  @Test
  public void testAsciiUnchanged() {
    assertEquals("hello world", forward("hello world"));
    var tex = "x^2 + {y}_1 \\alpha % $a$ & ~\n\t";
    assertEquals(tex, forward(tex));
    assertEquals(tex, forward(tex, ForwardConfig.DEFAULT.preferUnicodeMath(true)));
    assertTrue(diagnostics.isEmpty());
  }
  
  
  @Test
  public void testEmpty() {
    assertEquals("", forward(""));
  }
  
  
  @Test
  public void testMathSymbols() {
    assertEquals("\\times ", forward("×"));
    assertEquals("\\infty ", forward("∞"));
    assertEquals("\\cap ", forward("∩"));
    assertEquals("\\in ", forward("∈"));
    assertEquals("\\subset ", forward("⊂"));
    assertEquals("\\int ", forward("∫"));
    assertEquals("\\circ ", forward("∘"));
    assertEquals("\\iff ", forward("⇔"));
    assertEquals("a \\times  b", forward("a × b"));
    assertTrue(forward("—").contains("---"));
    assertTrue(diagnostics.isEmpty());
  }
  
  
  @Test
  public void testGreekByName() {
    assertEquals("\\alpha ", forward("α"));
    assertEquals("\\Gamma ", forward("Γ"));
    assertEquals("\\Delta ", forward("Δ"));
    assertEquals("\\Omega ", forward("Ω"));
    assertEquals("\\Omega ", forward("\u2126"));
    assertEquals("\\lambda ", forward("λ"));
    assertEquals("\\Lambda ", forward("Λ"));
  }
  
  
  @Test
  public void testPreferUnicodeMath() {
    var config = ForwardConfig.DEFAULT.preferUnicodeMath(true);
    assertEquals("\\upalpha ", forward("α", config));
    assertEquals("\\BbbR ", forward("ℝ", config));
    assertEquals("\\mitalpha ", forward("𝛼", config));
    // falls back when there's no macro
    assertEquals("\\omega ", forward("\u03C9", config));
  }
  
  
  @Test
  public void testTextAccents() {
    assertEquals("\\'{e}", forward("é"));
    assertEquals("\\'{e}", forward("é"));
    assertEquals("\\`{e}", forward("è"));
    assertEquals("\\^{e}", forward("ê"));
    assertEquals("\\~{n}", forward("ñ"));
    assertEquals("\\\"{u}", forward("ü"));
    assertEquals("\\={a}", forward("ā"));
    assertEquals("\\.{a}", forward("ȧ"));
    assertEquals("\\u{a}", forward("ă"));
    assertEquals("\\v{c}", forward("č"));
    assertEquals("\\c{c}", forward("ç"));
    assertEquals("\\H{o}", forward("ő"));
    assertEquals("caf\\'{e}", forward("café"));
  }
  
  
  @Test
  public void testMathAccents() {
    assertEquals("\\acute{e}", mathAccents("é"));
    assertEquals("\\grave{e}", mathAccents("è"));
    assertEquals("\\hat{e}", mathAccents("ê"));
    assertEquals("\\tilde{n}", mathAccents("ñ"));
    assertEquals("\\ddot{u}", mathAccents("ü"));
    assertEquals("\\bar{a}", mathAccents("ā"));
    assertEquals("\\dot{a}", mathAccents("ȧ"));
    assertEquals("\\breve{a}", mathAccents("ă"));
    assertEquals("\\check{c}", mathAccents("č"));
    assertEquals("\\acute{e}", mathAccents("é"));
    // no math form: text tag
    assertEquals("\\c{c}", mathAccents("ç"));
    assertEquals("\\H{o}", mathAccents("ő"));
  }
  
  
  @Test
  public void testAutoAccentsRenderAsText() {
    var config = ForwardConfig.DEFAULT.accentMode(AccentMode.AUTO);
    assertEquals("\\'{e}", forward("é", config));
    assertEquals("\\c{c}", forward("ç", config));
  }
  
  
  @Test
  public void testNestedAccents() {
    // U+1EC7 = U+1EB9 (e, dot below) + circumflex
    assertEquals("\\^{\\d{e}}", forward("ệ"));
    // Greek with tonos
    assertEquals("\\'{\\alpha }", forward("ά"));
    // accent on a macro
    assertEquals("\\'{\\times }", forward("×́"));
  }
  
  
  @Test
  public void testCanonicalSingleton() {
    // ANGSTROM SIGN -> U+00C5 -> A + ring
    assertEquals("\\r{A}", forward("\u212B"));
  }
  
  
  @Test
  public void testNoAccents() {
    var config = ForwardConfig.DEFAULT.convertAccents(false);
    assertEquals("é", forward("é", config));
    assertEquals("café", forward("café", config));
    assertEquals("é", forward("é", config));
  }
  
  
  @Test
  public void testAccentWithNoBase() {
    assertEquals("\\'{ }e", forward("́e"));
    assertEquals(1, diagnostics.size());
    var d = diagnostics.get(0);
    assertEquals(Kind.NO_PRECEDING_BASE, d.kind());
    assertEquals(0x301, d.codepoint());
    assertEquals(1, d.charNo());
  }
  
  
  @Test
  public void testCombiningMarkDecomposition() {
    // tone marks decompose canonically to known accents
    assertEquals("\\'{e}", forward("e\u0341"));
    assertEquals("\\`{e}", forward("e\u0340"));
    // U+0344 = diaeresis + acute, both applied to the preceding base
    assertEquals("\\'{\\\"{e}}", forward("e\u0344"));
    assertEquals("caf\\'{e} ok", forward("cafe\u0341 ok"));
    assertEquals("\\acute{e}", mathAccents("e\u0341"));
    assertTrue(diagnostics.isEmpty());
  }
  
  
  @Test
  public void testCombiningMarkDecompositionNoBase() {
    assertEquals("\\'{ }e", forward("\u0341e"));
    assertEquals(1, diagnostics.size());
    assertEquals(Kind.NO_PRECEDING_BASE, diagnostics.get(0).kind());
  }
  
  
  @Test
  public void testSuperSub() {
    assertEquals("x^{0}", forward("x⁰"));
    assertEquals("x_{0}", forward("x₀"));
    assertEquals("x^{2}", forward("x²"));
    assertEquals("^{TM}", forward("™"));
  }
  
  
  @Test
  public void testFractions() {
    assertEquals("{\\sfrac{1}{4}}", forward("¼"));
    assertEquals("{\\sfrac{1}{2}}", forward("½"));
    assertEquals("{\\sfrac{3}{4}}", forward("¾"));
    assertEquals("{\\sfrac{1}{10}}", forward("⅒"));
    assertEquals("{\\sfrac{1}{}}", forward("⅟"));
  }
  
  
  @Test
  public void testFonts() {
    assertEquals("\\symbb{R}", forward("ℝ"));
    assertEquals("\\symbf{A}", forward("𝐀"));
    assertEquals("\\symit{A}", forward("𝐴"));
    assertEquals("\\symbfit{A}", forward("𝑨"));
    assertEquals("\\symscr{A}", forward("𝒜"));
    assertEquals("\\symbfscr{A}", forward("𝓐"));
    assertEquals("\\symfrak{A}", forward("𝔄"));
    assertEquals("\\symfrak{C}", forward("ℭ"));
    assertEquals("\\symbb{A}", forward("𝔸"));
    assertEquals("\\symbbit{D}", forward("ⅅ"));
    assertEquals("\\symsf{A}", forward("𝖠"));
    assertEquals("\\symbfsf{A}", forward("𝗔"));
    assertEquals("\\symsfit{A}", forward("𝘈"));
    assertEquals("\\symbfsfit{A}", forward("𝘼"));
    assertEquals("\\symtt{A}", forward("𝙰"));
    assertEquals("\\symit{\\alpha }", forward("𝛼"));
  }
  
  
  @Test
  public void testNoFonts() {
    var config = ForwardConfig.DEFAULT.addFontModifiers(false);
    assertEquals("R", forward("ℝ", config));
    assertEquals("A", forward("𝘼", config));
    assertEquals("\\alpha ", forward("𝛼", config));
  }
  
  
  @Test
  public void testSmallAndLigatures() {
    assertEquals("{\\scriptsize{&}}", forward("﹠"));
    assertEquals("fi", forward("ﬁ"));
    assertEquals("ij", forward("ĳ"));
  }
  
  
  @Test
  public void testGreekVariants() {
    assertEquals("\\vartheta ", forward("ϑ"));
    assertEquals("\\varphi ", forward("ϕ"));
    assertEquals("\\varepsilon ", forward("ϵ"));
  }
  
  
  @Test
  public void testCompatFallsThrough() {
    assertEquals("\\unicodeellipsis ", forward("…"));
    assertEquals(1, diagnostics.size());
    assertEquals(Kind.UNSUPPORTED, diagnostics.get(0).kind());
  }
  
  
  @Test
  public void testUnsupportedModifier() {
    assertEquals("㎏", forward("㎏"));
    assertEquals(1, diagnostics.size());
    var d = diagnostics.get(0);
    assertEquals(Kind.UNSUPPORTED, d.kind());
    assertTrue(d.detail().contains("<square>"), d.detail());
  }
  
  
  @Test
  public void testUnsupportedAccent() {
    // o with horn: the horn is not a known accent
    assertEquals("ơ", forward("ơ"));
    assertEquals(2, diagnostics.size());
    assertEquals(Kind.UNSUPPORTED, diagnostics.get(0).kind());
    assertEquals(Kind.NOT_CONVERTIBLE, diagnostics.get(1).kind());
  }
  
  
  @Test
  public void testNotConvertible() {
    assertEquals("ab☺", forward("ab☺"));
    assertEquals(1, diagnostics.size());
    var d = diagnostics.get(0);
    assertEquals(Kind.NOT_CONVERTIBLE, d.kind());
    assertEquals(0x263A, d.codepoint());
    assertEquals(1, d.lineNo());
    assertEquals(3, d.charNo());
    assertEquals(UnicodeToLatex.DEFAULT_SOURCE, d.source());
    assertTrue(d.message().contains("could not convert"));
  }
  
  
  @Test
  public void testOverrides() {
    var overrides = CodepointMapping.of(Map.of(0x263A, "\\smiley", 0xD7, "\\mult"));
    var config = ForwardConfig.DEFAULT.extraOverrides(overrides);
    assertEquals("\\smiley ", forward("☺", config));
    assertEquals("\\mult ", forward("×", config));
    assertEquals("\\infty ", forward("∞", config));
    assertTrue(diagnostics.isEmpty());
  }
  
  
  @Test
  public void testQuotes() {
    var config = ForwardConfig.DEFAULT.convertQuotes(true);
    assertEquals("`quoted' text", forward("‘quoted’ text", config));
    assertEquals("``quoted'' text", forward("“quoted” text", config));
  }
  
  
  @Test
  public void testDashes() {
    var config = ForwardConfig.DEFAULT.convertDashes(true);
    assertEquals("a-b", forward("a‐b", config));
    assertEquals("1--2", forward("1–2", config));
    assertEquals("a---b", forward("a—b", config));
    assertEquals("A~B", forward("A B", config));
    assertEquals("    ", forward("    ", config));
    assertTrue(diagnostics.isEmpty());
  }
  
  
  @Test
  public void testQuotesBeforeDashes() {
    var seed = Seed.DEFAULT;
    // U+2015 is in the dash table too (as ---)
    var overlapping = new Seed(
        seed.math(), seed.reverseOnly(), seed.reverseSkip(), seed.accents(),
        seed.accentModes(), seed.greek(), Map.of(0x2015, "``"), seed.dashes());
    var tables = TableBuilder.build(overlapping, Definitions.EMPTY);
    var both = ForwardConfig.DEFAULT.convertQuotes(true).convertDashes(true);
    
    assertEquals("a``b", new UnicodeToLatex(tables, both).convert("a\u2015b"));
    assertEquals(
        "a---b",
        new UnicodeToLatex(tables, both.convertQuotes(false)).convert("a\u2015b"));
  }
  
  
  @Test
  public void testMixed() {
    assertEquals("\\alpha  \\in  \\symbb{R}", forward("α ∈ ℝ"));
  }
  
  
  @Test
  public void testConvertCodepoint() {
    var converter = converter(ForwardConfig.DEFAULT);
    assertEquals("\\cap ", converter.convert(0x2229));
    assertEquals("a", converter.convert('a'));
    assertThrows(IllegalArgumentException.class, () -> converter.convert(-1));
  }
  
  
  @Test
  public void testStream() throws IOException {
    var in = new StringReader("α\nb ☺\n\nlast");
    var out = new StringWriter();
    long lines = converter(ForwardConfig.DEFAULT).convert(in, out, "test.txt");
    assertEquals(4, lines);
    assertEquals("\\alpha \nb ☺\n\nlast", out.toString());
    assertEquals(1, diagnostics.size());
    var d = diagnostics.get(0);
    assertEquals("test.txt", d.source());
    assertEquals(2, d.lineNo());
    assertEquals(3, d.charNo());
  }
  
  
  @Test
  public void testLineNumbersInText() {
    forward("a\n☺");
    assertEquals(1, diagnostics.size());
    assertEquals(2, diagnostics.get(0).lineNo());
    assertEquals(1, diagnostics.get(0).charNo());
  }
  
  
  @Test
  public void testConcurrent() throws InterruptedException, ExecutionException {
    var converter = new UnicodeToLatex(TABLES, ForwardConfig.DEFAULT, Diagnostics.IGNORE);
    final String text = "α ∈ ℝ, é ½ x² ☺ ";
    final String expected = converter.convert(text);
    var pool = Executors.newFixedThreadPool(4);
    try {
      var futures = new ArrayList<Future<String>>();
      for (int i = 0; i < 32; ++i)
        futures.add(pool.submit(() -> converter.convert(text.repeat(20))));
      for (var f : futures)
        assertEquals(expected.repeat(20), f.get());
    } finally {
      pool.shutdown();
    }
  }

}
