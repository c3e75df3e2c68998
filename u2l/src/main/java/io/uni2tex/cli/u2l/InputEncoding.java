/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.cli.u2l;


import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Optional;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Input character encoding: either a named charset, or {@code AUTO}.
 * 
 * <h2>Auto-detection</h2>
 * <p>
 * A byte-order mark (UTF-8, UTF-16 LE/BE, UTF-32 LE/BE) determines the
 * encoding (the mark itself is skipped). Otherwise, the input is read as
 * UTF-8 provided its first bytes decode as strict UTF-8 (a multi-byte
 * sequence cut off at the end of the sniffed prefix is tolerated); if not,
 * detection fails. No input is lost to sniffing.
 * </p>
 * 
 * @param charset the charset; empty means {@code AUTO}
 */
public record InputEncoding(Optional<Charset> charset) {
  
  public final static String AUTO_NAME = "AUTO";
  
  public final static InputEncoding AUTO = new InputEncoding(Optional.empty());
  public final static InputEncoding UTF_8 = new InputEncoding(Optional.of(StandardCharsets.UTF_8));
  
  /** Maximum number of bytes examined by auto-detection. */
  public final static int SNIFF_SIZE = 8192;
  
  
  private final static byte[] BOM_UTF_8 = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF };
  private final static byte[] BOM_UTF_32LE = { (byte) 0xFF, (byte) 0xFE, 0, 0 };
  private final static byte[] BOM_UTF_32BE = { 0, 0, (byte) 0xFE, (byte) 0xFF };
  private final static byte[] BOM_UTF_16LE = { (byte) 0xFF, (byte) 0xFE };
  private final static byte[] BOM_UTF_16BE = { (byte) 0xFE, (byte) 0xFF };
  
  
  public InputEncoding {
    if (charset == null)
      charset = Optional.empty();
  }
  
  
  /**
   * Parses the given encoding name ({@code AUTO} is case-insensitive).
   * 
   * @throws IllegalArgumentException if the name is unknown
   */
  public static InputEncoding parse(String name) throws IllegalArgumentException {
    if (name == null || name.isBlank())
      throw new IllegalArgumentException("unknown encoding: " + name);
    name = name.strip();
    if (name.equalsIgnoreCase(AUTO_NAME))
      return AUTO;
    try {
      return new InputEncoding(Optional.of(Charset.forName(name)));
    } catch (IllegalCharsetNameException | UnsupportedCharsetException x) {
      throw new IllegalArgumentException("unknown encoding: " + name, x);
    }
  }
  
  
  public boolean isAuto() {
    return charset.isEmpty();
  }
  
  
  @Override
  public String toString() {
    return charset.map(Charset::name).orElse(AUTO_NAME);
  }
  
  
  /**
   * Returns a reader over the given stream.
   * 
   * @throws EncodingDetectionException if {@code AUTO} and detection fails
   */
  public Reader open(InputStream in) throws IOException {
    if (charset.isPresent())
      return new InputStreamReader(in, charset.get());
    
    var buffered = new BufferedInputStream(in, SNIFF_SIZE);
    buffered.mark(SNIFF_SIZE);
    byte[] head = new byte[SNIFF_SIZE];
    int len = fill(buffered, head);
    buffered.reset();
    
    Charset detected;
    int bomLength;
    if (startsWith(head, len, BOM_UTF_8)) {
      detected = StandardCharsets.UTF_8;
      bomLength = BOM_UTF_8.length;
    } else if (startsWith(head, len, BOM_UTF_32LE)) {
      detected = Charset.forName("UTF-32LE");
      bomLength = BOM_UTF_32LE.length;
    } else if (startsWith(head, len, BOM_UTF_32BE)) {
      detected = Charset.forName("UTF-32BE");
      bomLength = BOM_UTF_32BE.length;
    } else if (startsWith(head, len, BOM_UTF_16LE)) {
      detected = StandardCharsets.UTF_16LE;
      bomLength = BOM_UTF_16LE.length;
    } else if (startsWith(head, len, BOM_UTF_16BE)) {
      detected = StandardCharsets.UTF_16BE;
      bomLength = BOM_UTF_16BE.length;
    } else {
      checkUtf8(head, len);
      detected = StandardCharsets.UTF_8;
      bomLength = 0;
    }
    buffered.skipNBytes(bomLength);
    return new InputStreamReader(buffered, detected);
  }
  
  
  /**
   * Reads at least the first few bytes (enough for any BOM), and whatever
   * else is immediately available, up to the buffer's length.
   */
  private static int fill(InputStream in, byte[] buffer) throws IOException {
    int len = 0;
    while (len < buffer.length) {
      int n = in.read(buffer, len, buffer.length - len);
      if (n == -1)
        break;
      len += n;
      if (len >= BOM_UTF_32LE.length && in.available() <= 0)
        break;
    }
    return len;
  }
  
  
  private static boolean startsWith(byte[] head, int len, byte[] bom) {
    if (len < bom.length)
      return false;
    for (int index = 0; index < bom.length; ++index)
      if (head[index] != bom[index])
        return false;
    return true;
  }
  
  
  private static void checkUtf8(byte[] head, int len) throws EncodingDetectionException {
    var decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    var bytes = ByteBuffer.wrap(head, 0, len);
    var chars = CharBuffer.allocate(len + 1);
    // endOfInput=false: a sequence cut off at the end of the prefix is underflow, not error
    var result = decoder.decode(bytes, chars, false);
    if (result.isError())
      throw new EncodingDetectionException(
          "could not auto-detect input encoding (not UTF-8, no byte-order mark); " +
          "specify one with --input-encoding",
          new MalformedInputException(result.length()));
  }
  
  
  
  /** Picocli converter. */
  public static class Converter implements ITypeConverter<InputEncoding> {
    @Override
    public InputEncoding convert(String value) {
      try {
        return parse(value);
      } catch (IllegalArgumentException iax) {
        throw new TypeConversionException(iax.getMessage());
      }
    }
  }

}
