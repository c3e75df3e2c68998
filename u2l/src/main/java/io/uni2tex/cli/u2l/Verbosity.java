/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.cli.u2l;


import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.uni2tex.tables.TableConstants;

/**
 * Maps the number of {@code -v} flags onto the {@code java.util.logging}
 * level of the uni2tex logger (the default {@code System.Logger} backend).
 * <ul>
 * <li>0: defaults (warnings and above)</li>
 * <li>1: {@code FINE} (System.Logger DEBUG)</li>
 * <li>2 or more: {@code FINEST} (System.Logger TRACE)</li>
 * </ul>
 */
final class Verbosity {
  
  private Verbosity() {  }
  
  // strong reference: j.u.l. loggers are otherwise weakly held
  private static Logger logger;
  private static Handler handler;
  
  
  static Level level(int count) {
    if (count <= 0)
      return null;
    return count == 1 ? Level.FINE : Level.FINEST;
  }
  
  
  static synchronized void apply(int count) {
    Level level = level(count);
    if (level == null)
      return;
    if (logger == null)
      logger = Logger.getLogger(TableConstants.LOG_NAME);
    if (handler != null)
      logger.removeHandler(handler);
    
    handler = new ConsoleHandler();
    handler.setLevel(level);
    logger.setLevel(level);
    logger.addHandler(handler);
    logger.setUseParentHandlers(false);
  }

}
