/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


/**
 * Math-alphanumeric font styles, keyed by the fragment of the Unicode
 * character name that identifies them. Declaration order is significant:
 * longer (more specific) fragments come first, and the first match is
 * the innermost wrap.
 * 
 * <h2>Example</h2>
 * <p>
 * {@code MATHEMATICAL BOLD ITALIC CAPITAL A} matches {@linkplain #BOLD_ITALIC}
 * (the fragment is then removed from the name) and nothing else, yielding
 * <code>\symbfit{A}</code>.
 * </p>
 */
public enum FontStyle {
  
  SANS_SERIF_BOLD_ITALIC("SANS-SERIF BOLD ITALIC", "\\symbfsfit"),
  SANS_SERIF_BOLD("SANS-SERIF BOLD", "\\symbfsf"),
  SANS_SERIF_ITALIC("SANS-SERIF ITALIC", "\\symsfit"),
  BOLD_ITALIC("BOLD ITALIC", "\\symbfit"),
  BOLD_SCRIPT("BOLD SCRIPT", "\\symbfscr"),
  DOUBLE_STRUCK_ITALIC("DOUBLE-STRUCK ITALIC", "\\symbbit"),
  DOUBLE_STRUCK("DOUBLE-STRUCK", "\\symbb"),
  BLACK_LETTER("BLACK-LETTER", "\\symfrak"),
  FRAKTUR("FRAKTUR", "\\symfrak"),
  SANS_SERIF("SANS-SERIF", "\\symsf"),
  MONOSPACE("MONOSPACE", "\\symtt"),
  SCRIPT("SCRIPT", "\\symscr"),
  BOLD("BOLD", "\\symbf"),
  ITALIC("ITALIC", "\\symit");
  
  
  private final String fragment;
  private final String command;
  
  
  private FontStyle(String fragment, String command) {
    this.fragment = fragment;
    this.command = command;
  }
  
  
  /**
   * Wraps the given rendering with every style found in the character
   * name, innermost first.
   * 
   * @param charName  Unicode character name
   * @param rendered  the already-rendered base character
   */
  public static String wrap(String charName, String rendered) {
    String name = charName;
    for (var style : values()) {
      int index = name.indexOf(style.fragment);
      if (index == -1)
        continue;
      rendered = style.command + "{" + rendered + "}";
      name = name.substring(0, index) + name.substring(index + style.fragment.length());
    }
    return rendered;
  }

}
