/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.cli.u2l;


import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import io.uni2tex.tables.json.JsonParsingException;
import io.uni2tex.tables.json.UserMappings;
import io.uni2tex.tables.json.UserMappingsParser;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;

/**
 * Input, output and verbosity options shared by both commands.
 * Exactly one input source must be given.
 */
class IoOptions {
  
  final static int ERR_USER = 2;
  final static int ERR_IO = 3;
  
  final static String STDIN_SOURCE = "stdin";
  
  
  @Option(
      names = { "-v", "--verbose" },
      description = {
          "Verbose logging. Repeat for more detail (-vv)"
      })
  boolean[] verbosity = new boolean[0];
  
  @Option(
      names = { "-i", "--input" },
      paramLabel = "FILE",
      description = "Read input from file")
  File inputFile;
  
  @Option(
      names = "--stdin",
      description = "Read input from standard input")
  boolean stdin;
  
  @Option(
      names = { "-o", "--output" },
      paramLabel = "FILE",
      description = "Write output to file (default: standard output)")
  File outputFile;
  
  @Option(
      names = { "--input-encoding", "--input-enc" },
      paramLabel = "ENC",
      defaultValue = "UTF-8",
      converter = InputEncoding.Converter.class,
      description = {
          "Input encoding: a charset name, or AUTO",
          "Default: ${DEFAULT-VALUE}"
      })
  InputEncoding encoding = InputEncoding.UTF_8;
  
  @Parameters(
      paramLabel = "TEXT",
      arity = "0..*",
      description = "Text to convert (one result line per argument)")
  List<String> text = new ArrayList<>();
  
  
  /** Standard input. Tests substitute their own. */
  InputStream stdinStream = System.in;
  
  
  
  /**
   * Checks there's exactly one input source, and the files make sense.
   */
  void validate(CommandSpec spec) {
    int sources = 0;
    if (hasText())
      ++sources;
    if (inputFile != null)
      ++sources;
    if (stdin)
      ++sources;
    if (sources != 1)
      throw new ParameterException(
          spec.commandLine(),
          "specify exactly one input source: TEXT..., --input FILE, or --stdin");
    
    if (inputFile != null && !inputFile.isFile())
      throw new ParameterException(
          spec.commandLine(),
          "input file not found: " + inputFile);
    
    if (outputFile != null) {
      if (outputFile.isDirectory())
        throw new ParameterException(
            spec.commandLine(),
            "output path is a directory: " + outputFile);
      File dir = outputFile.getAbsoluteFile().getParentFile();
      if (dir != null && !dir.isDirectory())
        throw new ParameterException(
            spec.commandLine(),
            "output directory does not exist: " + dir);
    }
  }
  
  
  void applyVerbosity() {
    Verbosity.apply(verbosity.length);
  }
  
  
  boolean hasText() {
    return text != null && !text.isEmpty();
  }
  
  
  List<String> text() {
    return text == null ? List.of() : text;
  }
  
  
  /** Name of the input source, as reported in diagnostics. */
  String sourceName() {
    return stdin ? STDIN_SOURCE : inputFile.getPath();
  }
  
  
  Reader openReader() throws IOException {
    InputStream in = stdin ? stdinStream : new FileInputStream(inputFile);
    try {
      return encoding.open(in);
    } catch (IOException iox) {
      if (!stdin)
        in.close();
      throw iox;
    }
  }
  
  
  /** Closes the reader, unless it reads standard input (which is left open). */
  void closeReader(Reader in) throws IOException {
    if (!stdin)
      in.close();
  }
  
  
  Writer openWriter(CommandSpec spec) throws IOException {
    return outputFile == null ?
        spec.commandLine().getOut() :
        Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8);
  }
  
  
  /** Closes the writer, unless it's the command's standard output (which is flushed). */
  void closeWriter(Writer out) throws IOException {
    if (outputFile == null)
      out.flush();
    else
      out.close();
  }
  
  
  /**
   * Loads a JSON user mappings file. Bad files are parameter errors.
   */
  static UserMappings loadMappings(File file, String option, CommandSpec spec) {
    if (!file.isFile())
      throw new ParameterException(
          spec.commandLine(),
          option + " file not found: " + file);
    try {
      return UserMappingsParser.INSTANCE.toEntity(file);
    } catch (JsonParsingException jpx) {
      throw new ParameterException(
          spec.commandLine(),
          "malformed " + option + " file " + file + ": " + jpx.getMessage(),
          jpx, null, file.getPath());
    } catch (UncheckedIOException uiox) {
      throw new ParameterException(
          spec.commandLine(),
          "failed to read " + option + " file " + file + ": " + uiox.getCause().getMessage(),
          uiox, null, file.getPath());
    }
  }
  
  
  /** Reports an I/O error on stderr and returns the exit code. */
  static int ioError(CommandSpec spec, Exception x) {
    String message = x instanceof UncheckedIOException uiox ?
        uiox.getCause().getMessage() : x.getMessage();
    spec.commandLine().getErr().println("I/O error: " + message);
    return ERR_IO;
  }
  
  
  /** Reports a user (input) error on stderr and returns the exit code. */
  static int userError(CommandSpec spec, String message) {
    spec.commandLine().getErr().println(message);
    return ERR_USER;
  }

}
