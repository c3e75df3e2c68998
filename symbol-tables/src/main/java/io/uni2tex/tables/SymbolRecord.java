/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed <code>\UnicodeMathSymbol{"hhhhh}{\cmd}{\category}{info}</code>
 * record from {@code unicode-math-table.tex}.
 * 
 * @param codepoint the Unicode scalar value
 * @param command   the LaTeX command, with leading backslash
 * @param category  the math category, e.g. {@code \mathbin} or {@code \mathaccent}
 * @param info      free-form description; words starting with {@code '/'}
 *                  name alternate commands
 */
public record SymbolRecord(int codepoint, String command, String category, String info) {
  
  public SymbolRecord {
    if (!Character.isValidCodePoint(codepoint))
      throw new IllegalArgumentException("invalid code point: " + codepoint);
    Objects.requireNonNull(command, "null command");
    if (command.isEmpty())
      throw new IllegalArgumentException("empty command");
    Objects.requireNonNull(category, "null category");
    if (info == null)
      info = "";
  }
  
  
  /** Determines whether this is an accent (category contains "accent"). */
  public boolean isAccent() {
    return category.contains("accent");
  }
  
  
  /**
   * Determines whether the code point lies in one of the standard combining
   * ranges, U+0300..U+036F or U+20D0..U+20FF.
   */
  public boolean inCombiningRange() {
    return
        codepoint >= 0x300 && codepoint <= 0x36F ||
        codepoint >= 0x20D0 && codepoint <= 0x20FF;
  }
  
  
  /**
   * Returns the alternate commands named in the info field, with a leading
   * backslash. For example, info <code>/ne /neq r: not equal</code> yields
   * <code>[\ne, \neq]</code>.
   */
  public List<String> infoAliases() {
    if (info.indexOf('/') == -1)
      return List.of();
    var aliases = new ArrayList<String>();
    for (var word : info.split(" ")) {
      if (word.length() > 1 && word.charAt(0) == '/')
        aliases.add("\\" + word.substring(1));
    }
    return aliases;
  }

}
