/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.cli.u2l;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;

import io.uni2tex.convert.AccentMode;
import io.uni2tex.convert.ForwardConfig;
import io.uni2tex.convert.UnicodeToLatex;
import io.uni2tex.tables.TableSet;
import io.uni2tex.tables.TableSets;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.TypeConversionException;

/**
 * Converts Unicode text to LaTeX source.
 */
@Command(
    name = "unicode2latex",
    mixinStandardHelpOptions = true,
    version = "unicode2latex 0.2",
    description = {
        "Converts Unicode text to LaTeX.",
        "Accented, mathematical and stylized characters are written as (nested) LaTeX commands.",
        "Characters that cannot be converted are passed through and reported on stderr.%n",
    }
    )
public class Unicode2Latex implements Callable<Integer> {
  
  public static void main(String[] args) {
    int exitCode = new CommandLine(new Unicode2Latex()).execute(args);
    System.exit(exitCode);
  }
  
  
  @Spec
  private CommandSpec spec;
  
  @Mixin
  IoOptions io = new IoOptions();
  
  @Option(
      names = { "-P", "--prefer-unicode-math" },
      description = "Prefer unicode-math commands (e.g. \\mbfA) over decomposition")
  boolean preferUnicodeMath;
  
  @Option(
      names = "--no-fonts",
      description = "Don't emit font-style commands (\\mathbf{..} etc.)")
  boolean noFonts;
  
  @Option(
      names = "--no-accents",
      description = "Don't convert accented characters")
  boolean noAccents;
  
  @Option(
      names = "--accent-mode",
      paramLabel = "MODE",
      defaultValue = "text",
      converter = AccentModeConverter.class,
      description = {
          "Accent commands to use: text, math, or auto",
          "Default: ${DEFAULT-VALUE}"
      })
  AccentMode accentMode = AccentMode.TEXT;
  
  @Option(
      names = "--convert-quotes",
      description = "Convert typographic quotes (‘ ’ “ ”) to LaTeX quote ligatures")
  boolean convertQuotes;
  
  @Option(
      names = "--convert-dashes",
      description = "Convert Unicode dashes and spaces to LaTeX (-- --- ~)")
  boolean convertDashes;
  
  @Option(
      names = "--overrides",
      paramLabel = "FILE",
      description = {
          "JSON file with extra character mappings, e.g.",
          "{\"overrides\": {\"U+2665\": \"\\\\heart\"}}"
      })
  File overridesFile;
  
  
  /** Tables used for conversion. Tests substitute their own. */
  TableSet tables;
  
  
  ForwardConfig config() {
    var config = ForwardConfig.DEFAULT
        .addFontModifiers(!noFonts)
        .convertAccents(!noAccents)
        .preferUnicodeMath(preferUnicodeMath)
        .accentMode(accentMode)
        .convertQuotes(convertQuotes)
        .convertDashes(convertDashes);
    
    if (overridesFile != null) {
      var mappings = IoOptions.loadMappings(overridesFile, "--overrides", spec);
      config = config.extraOverrides(mappings.overrides());
    }
    return config;
  }
  
  
  @Override
  public Integer call() {
    io.validate(spec);
    io.applyVerbosity();
    
    var converter = new UnicodeToLatex(
        tables == null ? TableSets.standard() : tables,
        config());
    
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
            converter.convert(in, out, io.sourceName());
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
  
  
  
  static class AccentModeConverter implements ITypeConverter<AccentMode> {
    @Override
    public AccentMode convert(String value) {
      try {
        return AccentMode.parse(value);
      } catch (IllegalArgumentException iax) {
        throw new TypeConversionException(iax.getMessage());
      }
    }
  }

}
