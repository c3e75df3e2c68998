/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables.json;

/**
 * Unchecked exception for illegal JSON input.
 */
@SuppressWarnings("serial")
public class JsonParsingException extends RuntimeException {

  public JsonParsingException() {
  }

  public JsonParsingException(String s) {
    super(s);
  }

  public JsonParsingException(Throwable cause) {
    super(cause);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
