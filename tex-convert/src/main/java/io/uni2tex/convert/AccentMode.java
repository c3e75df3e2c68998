/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert;


/**
 * How combining accents are rendered.
 */
public enum AccentMode {
  
  /** Text accents, e.g. <code>\'{e}</code>. */
  TEXT,
  /** Math accents, e.g. <code>\acute{e}</code>, where one exists. */
  MATH,
  /** Currently renders the same as {@linkplain #TEXT}. */
  AUTO;
  
  
  /**
   * Parses the given mode name, case-insensitively.
   * 
   * @throws IllegalArgumentException if {@code name} is not one of
   *         {@code text}, {@code math}, {@code auto}
   */
  public static AccentMode parse(String name) throws IllegalArgumentException {
    if (name != null) {
      for (var mode : values())
        if (mode.name().equalsIgnoreCase(name.strip()))
          return mode;
    }
    throw new IllegalArgumentException(
        "accent mode must be one of text, math, auto: " + name);
  }

}
