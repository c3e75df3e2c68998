/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.cli.u2l;


import java.io.IOException;

/**
 * Thrown when the input encoding cannot be auto-detected.
 */
@SuppressWarnings("serial")
public class EncodingDetectionException extends IOException {

  public EncodingDetectionException(String message) {
    super(message);
  }

  public EncodingDetectionException(String message, Throwable cause) {
    super(message, cause);
  }

}
