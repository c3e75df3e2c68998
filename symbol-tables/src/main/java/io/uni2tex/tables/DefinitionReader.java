/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the unicode-math definition files. Both are read line-by-line; lines
 * that do not parse are ignored (they're mostly TeX plumbing).
 * 
 * <h2>Formats</h2>
 * <p>
 * The symbol table ({@code unicode-math-table.tex}) has records of the form
 * </p><pre>
 *  \UnicodeMathSymbol{"02229}{\cap}{\mathbin}{intersection}%
 * </pre><p>
 * The alias file ({@code unicode-math-xetex.sty}) is scanned for simple
 * definitions of either form
 * </p><pre>
 *  \def{\neq}{\ne}
 *  \def\neq{\ne}
 * </pre>
 */
public class DefinitionReader {
  
  public final static String SYMBOL_KEYWORD = "\\UnicodeMathSymbol";
  
  private final static Pattern SYMBOL = Pattern.compile(
      "^\\s*\\\\UnicodeMathSymbol\\s*" +
      "\\{\\s*\"?([0-9A-Fa-f]+)\\s*\\}\\s*" +
      "\\{\\s*(\\S+?)\\s*\\}\\s*" +
      "\\{\\s*(\\S*?)\\s*\\}\\s*" +
      "\\{(.*)\\}");
  
  private final static Pattern BRACED_DEF = Pattern.compile(
      "\\\\def\\s*\\{(\\\\[a-zA-Z]*)\\s*\\}\\s*\\{\\s*(\\\\[a-zA-Z]*)\\s*\\}");
  
  private final static Pattern BARE_DEF = Pattern.compile(
      "\\\\def\\s*(\\\\[a-zA-Z]*)\\s*\\{\\s*(\\\\[a-zA-Z]*)\\s*\\}");
  
  
  
  /**
   * Parses a single symbol-table line.
   * 
   * @return {@code null} if the line is not a well-formed symbol record
   */
  public static SymbolRecord parseSymbol(String line) {
    if (!line.stripLeading().startsWith(SYMBOL_KEYWORD))
      return null;
    Matcher m = SYMBOL.matcher(line);
    if (!m.find()) {
      TableConstants.logDebug(() -> "malformed symbol record: " + line);
      return null;
    }
    int codepoint;
    try {
      codepoint = Integer.parseInt(m.group(1), 16);
    } catch (NumberFormatException nfx) {
      TableConstants.logDebug(() -> "bad code point in symbol record: " + line);
      return null;
    }
    if (!Character.isValidCodePoint(codepoint))
      return null;
    return new SymbolRecord(codepoint, m.group(2), m.group(3), m.group(4));
  }
  
  
  /**
   * Parses the aliases defined on a single alias-file line. Braced forms are
   * listed before bare ones.
   */
  public static List<AliasRecord> parseAliases(String line) {
    if (!line.contains("\\def"))
      return List.of();
    var aliases = new ArrayList<AliasRecord>(2);
    collect(BRACED_DEF.matcher(line), aliases);
    collect(BARE_DEF.matcher(line), aliases);
    return aliases;
  }
  
  private static void collect(Matcher m, List<AliasRecord> aliases) {
    while (m.find())
      aliases.add(new AliasRecord(m.group(1), m.group(2)));
  }
  
  
  
  
  /** Reads the symbol records from the given stream. Does not close it. */
  public List<SymbolRecord> readSymbols(Reader in) throws IOException {
    var lines = buffered(in);
    var records = new ArrayList<SymbolRecord>();
    for (String line = lines.readLine(); line != null; line = lines.readLine()) {
      var r = parseSymbol(line);
      if (r != null)
        records.add(r);
    }
    return records;
  }
  
  
  /** Reads the alias records from the given stream. Does not close it. */
  public List<AliasRecord> readAliases(Reader in) throws IOException {
    var lines = buffered(in);
    var records = new ArrayList<AliasRecord>();
    for (String line = lines.readLine(); line != null; line = lines.readLine())
      records.addAll(parseAliases(line));
    return records;
  }
  
  
  private BufferedReader buffered(Reader in) {
    return in instanceof BufferedReader b ? b : new BufferedReader(in);
  }
  
  
  
  /**
   * Reads the given definition files. Either may be {@code null}.
   * 
   * @throws UncheckedIOException on I/O error
   */
  public Definitions read(File table, File aliases) throws UncheckedIOException {
    try {
      List<SymbolRecord> symbols = List.of();
      if (table != null) {
        try (var in = Files.newBufferedReader(table.toPath(), StandardCharsets.UTF_8)) {
          symbols = readSymbols(in);
        }
      }
      List<AliasRecord> defs = List.of();
      if (aliases != null) {
        try (var in = Files.newBufferedReader(aliases.toPath(), StandardCharsets.UTF_8)) {
          defs = readAliases(in);
        }
      }
      return new Definitions(symbols, defs);
      
    } catch (IOException iox) {
      throw new UncheckedIOException(
          "on reading definitions (" + table + ", " + aliases + "): " + iox.getMessage(),
          iox);
    }
  }
  
  
  /**
   * Reads the given definition streams. Either may be {@code null}. The
   * streams are closed on return.
   * 
   * @throws UncheckedIOException on I/O error
   */
  public Definitions read(InputStream table, InputStream aliases) throws UncheckedIOException {
    try (table; aliases) {
      var symbols = table == null ?
          List.<SymbolRecord>of() :
          readSymbols(new InputStreamReader(table, StandardCharsets.UTF_8));
      var defs = aliases == null ?
          List.<AliasRecord>of() :
          readAliases(new InputStreamReader(aliases, StandardCharsets.UTF_8));
      return new Definitions(symbols, defs);
      
    } catch (IOException iox) {
      throw new UncheckedIOException("on reading definitions: " + iox.getMessage(), iox);
    }
  }

}
