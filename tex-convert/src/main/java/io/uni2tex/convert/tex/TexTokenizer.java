/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.convert.tex;


import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A pass-through TeX tokenizer. Concatenating the {@linkplain Token#source()
 * source} of every token reproduces the input exactly.
 * 
 * <h2>Rules</h2>
 * <ul>
 * <li>A backslash followed by one or more ASCII letters is an escape sequence
 * named by the letters; followed by any other character, it's named by that
 * one character. A backslash at end of input has an empty name.</li>
 * <li>{@code '%'} starts a comment running up to, but not including, the
 * next newline.</li>
 * <li><code>'{'</code> and <code>'}'</code> are group delimiters.</li>
 * <li>{@value #ACTIVE_CHARS} are active characters.</li>
 * <li>Runs of anything else are plain text.</li>
 * </ul>
 * <p>
 * I/O errors are rethrown as {@code UncheckedIOException}s.
 * </p>
 */
public class TexTokenizer implements Iterator<Token>, Closeable {
  
  public final static String ACTIVE_CHARS = "$&~^_#";
  
  private final static int UNREAD = -2;
  
  
  private final Reader in;
  private int lookahead = UNREAD;
  private Token next;
  
  
  public TexTokenizer(Reader in) {
    this.in = Objects.requireNonNull(in, "null reader");
  }
  
  public TexTokenizer(String source) {
    this(new StringReader(source));
  }
  
  
  @Override
  public boolean hasNext() {
    if (next == null)
      next = scan();
    return next != null;
  }
  
  
  @Override
  public Token next() {
    if (!hasNext())
      throw new NoSuchElementException();
    var token = next;
    next = null;
    return token;
  }
  
  
  @Override
  public void close() throws IOException {
    in.close();
  }
  
  
  
  private int read() {
    if (lookahead != UNREAD) {
      int c = lookahead;
      lookahead = UNREAD;
      return c;
    }
    try {
      return in.read();
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
  }
  
  private int peek() {
    if (lookahead == UNREAD)
      lookahead = read();
    return lookahead;
  }
  
  
  private static boolean isLetter(int c) {
    return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
  }
  
  
  /** Determines whether the given char ends a plain-text run. */
  public static boolean isSpecial(int c) {
    return c == '\\' || c == '%' || c == '{' || c == '}' || ACTIVE_CHARS.indexOf(c) != -1;
  }
  
  
  private Token scan() {
    int c = read();
    if (c == -1)
      return null;
    
    switch (c) {
    case '\\':
      return escape();
    case '%':
      return comment();
    case '{':
    case '}':
      return Token.group((char) c);
    default:
    }
    
    if (ACTIVE_CHARS.indexOf(c) != -1)
      return Token.active((char) c);
    
    var text = new StringBuilder();
    text.append((char) c);
    for (int p = peek(); p != -1 && !isSpecial(p); p = peek())
      text.append((char) read());
    return Token.plain(text.toString());
  }
  
  
  private Token escape() {
    var name = new StringBuilder();
    while (isLetter(peek()))
      name.append((char) read());
    if (name.length() == 0) {
      int c = read();
      if (c != -1) {
        name.append((char) c);
        if (Character.isHighSurrogate((char) c) && Character.isLowSurrogate((char) peek()))
          name.append((char) read());
      }
    }
    return Token.escape(name.toString());
  }
  
  
  private Token comment() {
    var text = new StringBuilder();
    for (int p = peek(); p != -1 && p != '\n'; p = peek())
      text.append((char) read());
    return Token.comment(text.toString());
  }

}
