/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert;


import java.util.List;

import io.uni2tex.tables.TableConstants;

/**
 * Receives non-fatal conversion problems. Implementations must be
 * thread-safe if the converter reporting to them is shared across threads.
 * 
 * @see #LOG
 */
@FunctionalInterface
public interface Diagnostics {
  
  /** Logs each diagnostic as a warning. */
  Diagnostics LOG = d -> TableConstants.logWarning(d.message());
  
  /** Ignores diagnostics. */
  Diagnostics IGNORE = d -> { };
  
  
  /** Invoked once per problem, in input order. */
  void report(Diagnostic diagnostic);
  
  
  
  /**
   * Returns an instance that collects into the given list (synchronizing on it)
   * and then forwards to this one.
   */
  default Diagnostics collectingTo(List<Diagnostic> list) {
    return d -> {
      synchronized (list) {
        list.add(d);
      }
      report(d);
    };
  }

}
