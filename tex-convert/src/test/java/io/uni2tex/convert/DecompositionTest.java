/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import io.uni2tex.convert.Decomposition.Kind;

/**
 * 
 */
public class DecompositionTest {
  
  
  @Test
  public void testNone() {
    assertSame(Decomposition.NONE, Decomposition.of('a'));
    assertSame(Decomposition.NONE, Decomposition.of(0x2229));
    // Hangul syllable
    assertSame(Decomposition.NONE, Decomposition.of(0xAC00));
  }
  
  
  @Test
  public void testAccentPair() {
    var dec = Decomposition.of(0xE9);
    assertEquals(Kind.ACCENT_PAIR, dec.kind());
    assertEquals(new Decomposition.AccentPair('e', 0x301), dec);
  }
  
  
  @Test
  public void testSingleton() {
    assertEquals(new Decomposition.Singleton(0xC5), Decomposition.of(0x212B));
  }
  
  
  @Test
  public void testFontAndSmall() {
    assertEquals(new Decomposition.Font('R'), Decomposition.of(0x211D));
    assertEquals(new Decomposition.Small('&'), Decomposition.of(0xFE60));
  }
  
  
  @Test
  public void testModifiers() {
    var sup = (Decomposition.Modifier) Decomposition.of(0x2070);
    assertEquals(Kind.SUPER, sup.kind());
    assertArrayEquals(new int[] { '0' }, sup.bases());
    
    var sub = (Decomposition.Modifier) Decomposition.of(0x2080);
    assertEquals(Kind.SUB, sub.kind());
    
    var tm = (Decomposition.Modifier) Decomposition.of(0x2122);
    assertArrayEquals(new int[] { 'T', 'M' }, tm.bases());
  }
  
  
  @Test
  public void testFraction() {
    var half = (Decomposition.Fraction) Decomposition.of(0xBD);
    assertArrayEquals(new int[] { '1' }, half.numerator());
    assertArrayEquals(new int[] { '2' }, half.denominator());
    
    var tenth = (Decomposition.Fraction) Decomposition.of(0x2152);
    assertArrayEquals(new int[] { '1', '0' }, tenth.denominator());
    
    var oneOver = (Decomposition.Fraction) Decomposition.of(0x215F);
    assertEquals(0, oneOver.denominator().length);
  }
  
  
  @Test
  public void testCompat() {
    var fi = (Decomposition.Compat) Decomposition.of(0xFB01);
    assertArrayEquals(new int[] { 'f', 'i' }, fi.bases());
    var theta = (Decomposition.Compat) Decomposition.of(0x3D1);
    assertEquals(0x3B8, theta.first());
  }
  
  
  @Test
  public void testUnsupported() {
    var square = (Decomposition.Unsupported) Decomposition.of(0x338F);
    assertEquals("<square>", square.tag());
    var nbsp = (Decomposition.Unsupported) Decomposition.of(0xA0);
    assertEquals("<nobreak>", nbsp.tag());
  }
  
  
  @Test
  public void testCharInfo() {
    var info = CharInfo.of(0x301);
    assertTrue(info.combiningMark());
    assertEquals("COMBINING ACUTE ACCENT", info.name());
    
    info = CharInfo.of(0x3B1);
    assertTrue(info.isGreek());
    assertFalse(info.combiningMark());
    
    assertEquals("", CharInfo.of(0x10FFFF).name());
  }
  
  
  @Test
  public void testGreekMacro() {
    assertEquals("\\alpha", UnicodeToLatex.greekMacro("GREEK SMALL LETTER ALPHA"));
    assertEquals("\\Gamma", UnicodeToLatex.greekMacro("GREEK CAPITAL LETTER GAMMA"));
    assertEquals("\\lambda", UnicodeToLatex.greekMacro("GREEK SMALL LETTER LAMDA"));
    assertEquals("\\Lambda", UnicodeToLatex.greekMacro("GREEK CAPITAL LETTER LAMDA"));
  }

}
