/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.lang.System.Logger.Level;
import java.util.function.Supplier;

/**
 * Logging and other constants shared across the uni2tex modules.
 */
public class TableConstants {
  // no-one calls
  private TableConstants() {  }
  
  
  /** Logger name used by every uni2tex module. */
  public final static String LOG_NAME = "io.uni2tex";
  
  
  private static System.Logger logger() {
    return System.getLogger(LOG_NAME);
  }
  
  private static void log(Level level, String message) {
    logger().log(level, message);
  }
  
  public static void logWarning(String message) {
    log(Level.WARNING, message);
  }
  
  /** Logs a lazily constructed debug trace. */
  public static void logDebug(Supplier<String> message) {
    var logger = logger();
    if (logger.isLoggable(Level.DEBUG))
      logger.log(Level.DEBUG, message);
  }
  
  /** Determines whether debug traces are recorded. */
  public static boolean isDebugEnabled() {
    return logger().isLoggable(Level.DEBUG);
  }
  
  
  /** Formats the given code point as <code>U+hhhh</code>. */
  public static String codeLabel(int codepoint) {
    return String.format("U+%04X", codepoint);
  }

}
