/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert.tex;


import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.uni2tex.convert.tex.Token.Kind;

/**
 * 
 */
public class TexTokenizerTest {
  
  
  private List<Token> tokens(String source) {
    var list = new ArrayList<Token>();
    new TexTokenizer(source).forEachRemaining(list::add);
    return list;
  }
  
  private String rejoin(String source) {
    var out = new StringBuilder();
    tokens(source).forEach(t -> out.append(t.source()));
    return out.toString();
  }
  
  
  @Test
  public void testEmpty() {
    assertTrue(tokens("").isEmpty());
  }
  
  
  @Test
  public void testMacros() {
    assertEquals(
        List.of(Token.escape("alpha"), Token.plain("+"), Token.escape("beta")),
        tokens("\\alpha+\\beta"));
    assertEquals(
        List.of(Token.escape("alpha"), Token.plain(" x")),
        tokens("\\alpha x"));
    assertEquals(List.of(Token.escape("alpha"), Token.escape("beta")), tokens("\\alpha\\beta"));
  }
  
  
  @Test
  public void testSingleCharMacros() {
    assertEquals(List.of(Token.escape("{")), tokens("\\{"));
    assertEquals(List.of(Token.escape("|")), tokens("\\|"));
    assertEquals(List.of(Token.escape("\\"), Token.plain("x")), tokens("\\\\x"));
    assertEquals(List.of(Token.escape("1"), Token.plain("2")), tokens("\\12"));
    assertEquals(List.of(Token.plain("a"), Token.escape("")), tokens("a\\"));
    assertEquals(List.of(Token.escape("𝛼")), tokens("\\𝛼"));
  }
  
  
  @Test
  public void testComment() {
    assertEquals(
        List.of(Token.plain("x "), Token.comment(" note"), Token.plain("\ny")),
        tokens("x % note\ny"));
    assertEquals(List.of(Token.comment("")), tokens("%"));
  }
  
  
  @Test
  public void testGroupsAndActive() {
    var tokens = tokens("{$x$}~");
    assertEquals(6, tokens.size());
    assertEquals(Kind.GROUP_DELIMITER, tokens.get(0).kind());
    assertEquals(Token.active('$'), tokens.get(1));
    assertEquals("active::$", tokens.get(1).text());
    assertEquals("$", tokens.get(1).source());
    assertEquals(Token.plain("x"), tokens.get(2));
    assertEquals(Kind.GROUP_DELIMITER, tokens.get(4).kind());
    assertEquals(Token.active('~'), tokens.get(5));
  }
  
  
  @Test
  public void testPassThrough() {
    var src =
        "\\documentclass{article} % comment\n" +
        "$\\alpha_1 + \\beta^{2}$ & x~y #1 \\\\ \n" +
        "\\{ braces \\} and \\% percent \\";
    assertEquals(src, rejoin(src));
  }

}
