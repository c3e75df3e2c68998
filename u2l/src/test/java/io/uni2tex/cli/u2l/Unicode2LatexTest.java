/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.cli.u2l;


import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.uni2tex.tables.TableSets;
import picocli.CommandLine;

/**
 * 
 */
public class Unicode2LatexTest {
  
  final static String NL = System.lineSeparator();
  
  @TempDir
  File tempDir;
  
  private final StringWriter out = new StringWriter();
  private final StringWriter err = new StringWriter();
  
  private Unicode2Latex newCommand() {
    var cmd = new Unicode2Latex();
    cmd.tables = TableSets.bundled();
    return cmd;
  }
  
  private int execute(Unicode2Latex cmd, String... args) {
    return new CommandLine(cmd)
        .setOut(new PrintWriter(out))
        .setErr(new PrintWriter(err))
        .execute(args);
  }
  
  private int execute(String... args) {
    return execute(newCommand(), args);
  }
  
  private int executeStdin(byte[] input, String... args) {
    var cmd = newCommand();
    cmd.io.stdinStream = new ByteArrayInputStream(input);
    return execute(cmd, args);
  }
  
  
  
  @Test
  public void testTextArgs() {
    assertEquals(0, execute("café", "a × b"));
    assertEquals("caf\\'{e}" + NL + "a \\times  b" + NL, out.toString());
  }
  
  
  @Test
  public void testAccentMode() {
    assertEquals(0, execute("--accent-mode=math", "é"));
    assertEquals("\\acute{e}" + NL, out.toString());
  }
  
  
  @Test
  public void testBadAccentMode() {
    assertEquals(IoOptions.ERR_USER, execute("--accent-mode=bogus", "é"));
    assertTrue(err.toString().contains("accent mode must be one of"));
    assertEquals("", out.toString());
  }
  
  
  @Test
  public void testNoAccents() {
    assertEquals(0, execute("--no-accents", "é"));
    assertEquals("é" + NL, out.toString());
  }
  
  
  @Test
  public void testQuotesAndDashes() {
    assertEquals(0, execute("--convert-quotes", "--convert-dashes", "“a”–b"));
    assertEquals("``a''--b" + NL, out.toString());
  }
  
  
  @Test
  public void testNoInput() {
    assertEquals(IoOptions.ERR_USER, execute());
    assertTrue(err.toString().contains("exactly one input source"));
  }
  
  
  @Test
  public void testTooManyInputs() {
    assertEquals(IoOptions.ERR_USER, executeStdin(new byte[0], "--stdin", "é"));
  }
  
  
  @Test
  public void testMissingInputFile() {
    var file = new File(tempDir, "missing.txt");
    assertEquals(IoOptions.ERR_USER, execute("-i", file.getPath()));
    assertTrue(err.toString().contains("not found"));
  }
  
  
  @Test
  public void testStdin() {
    var input = "a × b\ncafé\n".getBytes(StandardCharsets.UTF_8);
    assertEquals(0, executeStdin(input, "--stdin"));
    assertEquals("a \\times  b\ncaf\\'{e}\n", out.toString());
  }
  
  
  @Test
  public void testStdinLeftOpen() {
    var closed = new boolean[1];
    var stdin = new ByteArrayInputStream("é\n".getBytes(StandardCharsets.UTF_8)) {
      @Override
      public void close() {
        closed[0] = true;
      }
    };
    var cmd = newCommand();
    cmd.io.stdinStream = stdin;
    assertEquals(0, execute(cmd, "--stdin"));
    assertEquals("\\'{e}\n", out.toString());
    assertFalse(closed[0]);
  }
  
  
  @Test
  public void testFileToFile() throws IOException {
    var in = new File(tempDir, "in.txt");
    var outFile = new File(tempDir, "out.tex");
    Files.writeString(in.toPath(), "∞ é\nplain\n", StandardCharsets.UTF_8);
    
    assertEquals(0, execute("-i", in.getPath(), "-o", outFile.getPath()));
    assertEquals("", out.toString());
    assertEquals(
        "\\infty  \\'{e}\nplain\n",
        Files.readString(outFile.toPath(), StandardCharsets.UTF_8));
  }
  
  
  @Test
  public void testOutputDirMissing() {
    var outFile = new File(tempDir, "no/such/out.tex");
    assertEquals(IoOptions.ERR_USER, execute("-o", outFile.getPath(), "é"));
  }
  
  
  @Test
  public void testLatin1Input() {
    byte[] input = { 'c', 'a', 'f', (byte) 0xE9 };
    assertEquals(0, executeStdin(input, "--stdin", "--input-enc=ISO-8859-1"));
    assertEquals("caf\\'{e}", out.toString());
  }
  
  
  @Test
  public void testAutoEncodingWithBom() {
    byte[] text = "café".getBytes(StandardCharsets.UTF_16LE);
    byte[] input = new byte[text.length + 2];
    input[0] = (byte) 0xFF;
    input[1] = (byte) 0xFE;
    System.arraycopy(text, 0, input, 2, text.length);
    
    assertEquals(0, executeStdin(input, "--stdin", "--input-encoding=AUTO"));
    assertEquals("caf\\'{e}", out.toString());
  }
  
  
  @Test
  public void testAutoEncodingFails() {
    byte[] input = { 'c', 'a', 'f', (byte) 0xE9, ' ', 'x' };
    assertEquals(IoOptions.ERR_USER, executeStdin(input, "--stdin", "--input-encoding=auto"));
    assertTrue(err.toString().contains("could not auto-detect"));
  }
  
  
  @Test
  public void testUnknownEncoding() {
    assertEquals(IoOptions.ERR_USER, execute("--input-encoding=NO-SUCH-ENC", "é"));
    assertTrue(err.toString().contains("unknown encoding"));
  }
  
  
  @Test
  public void testOverrides() throws IOException {
    var json = new File(tempDir, "overrides.json");
    Files.writeString(
        json.toPath(),
        "{\"overrides\": {\"U+263A\": \"\\\\smiley\", \"×\": \"\\\\cross\"}}",
        StandardCharsets.UTF_8);
    assertEquals(0, execute("--overrides", json.getPath(), "☺ ×"));
    assertEquals("\\smiley  \\cross " + NL, out.toString());
  }
  
  
  @Test
  public void testMalformedOverrides() throws IOException {
    var json = new File(tempDir, "bad.json");
    Files.writeString(json.toPath(), "{\"overrides\": [1, 2", StandardCharsets.UTF_8);
    assertEquals(IoOptions.ERR_USER, execute("--overrides", json.getPath(), "é"));
    assertTrue(err.toString().contains("malformed --overrides file"));
  }
  
  
  @Test
  public void testVersion() {
    assertEquals(0, execute("--version"));
    assertTrue(out.toString().contains("unicode2latex"));
  }

}
