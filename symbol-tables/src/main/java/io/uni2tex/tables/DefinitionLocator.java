/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables;


import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Locates the unicode-math definition files. Each file is searched for in
 * the following order; the first hit wins.
 * <ol>
 * <li>The directory named by the {@value #DIR_PROPERTY} system property.</li>
 * <li>The directory named by the {@value #DIR_ENV} environment variable.</li>
 * <li>The path reported by {@code kpsewhich} (if installed).</li>
 * <li>The TeX Live default directory, {@linkplain #TEXLIVE_DIR}.</li>
 * <li>The subset bundled on the classpath (see {@linkplain #loadBundled()}).</li>
 * </ol>
 */
public class DefinitionLocator {
  
  public final static String TABLE_FILE = "unicode-math-table.tex";
  public final static String ALIAS_FILE = "unicode-math-xetex.sty";
  
  public final static String DIR_PROPERTY = "uni2tex.texdir";
  public final static String DIR_ENV = "UNI2TEX_TEXDIR";
  
  public final static File TEXLIVE_DIR =
      new File("/usr/share/texlive/texmf-dist/tex/latex/unicode-math");
  
  /** Classpath directory of the bundled subset. */
  public final static String BUNDLED_PATH = "/io/uni2tex/tables/";
  
  private final static long KPSEWHICH_TIMEOUT_MILLIS = 5000;
  
  
  /** Lookup command (the file name is appended); {@code null} if not used. */
  private final List<String> kpsewhich;
  private final long timeoutMillis;
  
  
  /** Creates an instance that consults {@code kpsewhich}. */
  public DefinitionLocator() {
    this(true);
  }
  
  /**
   * @param useKpsewhich if {@code false}, {@code kpsewhich} is not invoked
   */
  public DefinitionLocator(boolean useKpsewhich) {
    this(useKpsewhich ? List.of("kpsewhich") : null, KPSEWHICH_TIMEOUT_MILLIS);
  }
  
  /**
   * @param kpsewhich     lookup command and leading arguments; the file name
   *                      is appended. {@code null} for none.
   * @param timeoutMillis how long the command is given to exit
   */
  DefinitionLocator(List<String> kpsewhich, long timeoutMillis) {
    this.kpsewhich = kpsewhich == null ? null : List.copyOf(kpsewhich);
    this.timeoutMillis = timeoutMillis;
    if (timeoutMillis <= 0)
      throw new IllegalArgumentException("timeoutMillis " + timeoutMillis);
  }
  
  
  
  /**
   * Returns the candidate directories (property, environment), in search
   * order.
   */
  public List<File> configuredDirs() {
    var dirs = new ArrayList<File>(2);
    var prop = System.getProperty(DIR_PROPERTY);
    if (prop != null && !prop.isBlank())
      dirs.add(new File(prop.strip()));
    var env = System.getenv(DIR_ENV);
    if (env != null && !env.isBlank())
      dirs.add(new File(env.strip()));
    return dirs;
  }
  
  
  /**
   * Locates the given definition file on the file system.
   * 
   * @param filename  e.g. {@linkplain #TABLE_FILE}
   * @return empty, if not found (the bundled subset is not considered)
   */
  public Optional<File> locate(String filename) {
    for (var dir : configuredDirs()) {
      var file = new File(dir, filename);
      if (file.isFile())
        return Optional.of(file);
      TableConstants.logDebug(() -> "not found: " + file);
    }
    if (kpsewhich != null) {
      var file = kpsewhich(filename);
      if (file.isPresent())
        return file;
    }
    var file = new File(TEXLIVE_DIR, filename);
    return file.isFile() ? Optional.of(file) : Optional.empty();
  }
  
  
  /**
   * Runs the lookup command for the given file. The command must exit
   * within the timeout; its output is read only after it has.
   */
  Optional<File> kpsewhich(String filename) {
    var command = new ArrayList<String>(kpsewhich);
    command.add(filename);
    Process proc;
    try {
      proc = new ProcessBuilder(command)
          .redirectError(ProcessBuilder.Redirect.DISCARD)
          .start();
    } catch (IOException iox) {
      TableConstants.logDebug(() -> "kpsewhich not available: " + iox.getMessage());
      return Optional.empty();
    }
    try {
      if (!proc.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
        proc.destroyForcibly();
        TableConstants.logWarning("kpsewhich timed out looking for " + filename);
        return Optional.empty();
      }
      if (proc.exitValue() != 0)
        return Optional.empty();
      
      String path;
      try (var out = new BufferedReader(
          new InputStreamReader(proc.getInputStream(), StandardCharsets.UTF_8))) {
        path = out.readLine();
      }
      if (path == null || path.isBlank())
        return Optional.empty();
      var file = new File(path.strip());
      return file.isFile() ? Optional.of(file) : Optional.empty();
      
    } catch (IOException iox) {
      TableConstants.logWarning("on reading kpsewhich output: " + iox.getMessage());
      return Optional.empty();
    } catch (InterruptedException ix) {
      proc.destroyForcibly();
      Thread.currentThread().interrupt();
      TableConstants.logWarning("interrupted running kpsewhich for " + filename);
      return Optional.empty();
    }
  }
  
  
  
  /**
   * Loads the definitions. Each file is read from where it's located, or
   * failing that, from the bundled subset. Failures are logged and yield no
   * records for that file; this method does not throw on I/O error.
   */
  public Definitions load() {
    var reader = new DefinitionReader();
    List<SymbolRecord> symbols;
    try {
      symbols = locate(TABLE_FILE)
          .map(f -> reader.read(f, null).symbols())
          .orElseGet(() -> loadBundled().symbols());
    } catch (UncheckedIOException uiox) {
      TableConstants.logWarning(
          "failed to load " + TABLE_FILE + ", continuing with seed tables: " +
          uiox.getMessage());
      symbols = List.of();
    }
    List<AliasRecord> aliases;
    try {
      aliases = locate(ALIAS_FILE)
          .map(f -> reader.read(null, f).aliases())
          .orElseGet(() -> loadBundled().aliases());
    } catch (UncheckedIOException uiox) {
      TableConstants.logWarning(
          "failed to load " + ALIAS_FILE + ", continuing without aliases: " +
          uiox.getMessage());
      aliases = List.of();
    }
    return new Definitions(symbols, aliases);
  }
  
  
  
  /**
   * Loads the subset of the definition files bundled on the classpath. Does
   * not consult the file system.
   * 
   * @return {@linkplain Definitions#EMPTY} if the resources are missing
   */
  public static Definitions loadBundled() throws UncheckedIOException {
    InputStream table = DefinitionLocator.class.getResourceAsStream(BUNDLED_PATH + TABLE_FILE);
    InputStream aliases = DefinitionLocator.class.getResourceAsStream(BUNDLED_PATH + ALIAS_FILE);
    if (table == null)
      TableConstants.logWarning("bundled " + TABLE_FILE + " not found");
    if (aliases == null)
      TableConstants.logWarning("bundled " + ALIAS_FILE + " not found");
    return new DefinitionReader().read(table, aliases);
  }

}
