/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.cli.u2l;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;

import io.uni2tex.convert.tex.LatexToUnicode;
import io.uni2tex.tables.TableSet;
import io.uni2tex.tables.TableSets;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Substitutes known LaTeX macros with their Unicode characters.
 */
@Command(
    name = "latex2unicode",
    mixinStandardHelpOptions = true,
    version = "latex2unicode 0.2",
    description = {
        "Replaces LaTeX macros with Unicode characters.",
        "Unknown macros, comments and other text are copied unchanged.%n",
    }
    )
public class Latex2Unicode implements Callable<Integer> {
  
  public static void main(String[] args) {
    int exitCode = new CommandLine(new Latex2Unicode()).execute(args);
    System.exit(exitCode);
  }
  
  
  @Spec
  private CommandSpec spec;
  
  @Mixin
  IoOptions io = new IoOptions();
  
  @Option(
      names = { "-M", "--math" },
      description = "Substitute math macros (\\cap, \\infty, ..)")
  boolean math;
  
  @Option(
      names = { "-G", "--greek" },
      description = "Substitute Greek letter macros (\\alpha, \\Gamma, ..)")
  boolean greek;
  
  @Option(
      names = "--replacements",
      paramLabel = "FILE",
      description = {
          "JSON file with extra macro replacements, e.g.",
          "{\"replacements\": {\"\\\\R\": \"ℝ\"}}"
      })
  File replacementsFile;
  
  
  /** Tables used for conversion. Tests substitute their own. */
  TableSet tables;
  
  
  LatexToUnicode converter() {
    var substitutions = LatexToUnicode.substitutions(
        tables == null ? TableSets.standard() : tables, math, greek);
    var converter = new LatexToUnicode(substitutions);
    if (replacementsFile != null) {
      var mappings = IoOptions.loadMappings(replacementsFile, "--replacements", spec);
      converter = converter.with(mappings.replacements());
    }
    return converter;
  }
  
  
  @Override
  public Integer call() {
    io.validate(spec);
    io.applyVerbosity();
    
    var converter = converter();
    
    try {
      var out = io.openWriter(spec);
      try {
        if (io.hasText()) {
          for (var arg : io.text()) {
            out.write(converter.convert(arg));
            out.write(System.lineSeparator());
          }
        } else {
          var in = io.openReader();
          try {
            converter.convert(in, out);
          } finally {
            io.closeReader(in);
          }
        }
      } finally {
        io.closeWriter(out);
      }
    } catch (EncodingDetectionException edx) {
      return IoOptions.userError(spec, edx.getMessage());
    } catch (IOException | UncheckedIOException iox) {
      return IoOptions.ioError(spec, iox);
    }
    return 0;
  }

}
