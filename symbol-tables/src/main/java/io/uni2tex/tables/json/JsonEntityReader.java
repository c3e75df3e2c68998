/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables.json;


import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JSON read-interface for an entity.
 * 
 * @param <T> the entity type
 */
public interface JsonEntityReader<T> {

  
  /**
   * Returns the given JSON as the typed instance.
   * 
   * @throws JsonParsingException if the given object is malformed, or breaks the entity's grammar
   */
  T toEntity(JSONObject jObj) throws JsonParsingException;
  
  
  /**
   * Returns the given JSON input as a typed entity.
   * Invokes {@linkplain #toEntity(JSONObject)} after constructing a {@code JSONObject}
   * using the {@code json-simple} library.
   * 
   * @throws JsonParsingException if the given object is malformed, or if the given
   * JSON is not a single object
   */
  default T toEntity(String json) throws JsonParsingException {
    try {
      return toEntity((JSONObject) new JSONParser().parse(json));
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + px, px);
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("not a JSON object: " + abbreviate(json), ccx);
    }
  }
  
  
  private static String abbreviate(String json) {
    return json.length() <= 20 ? json : json.substring(0, 20) + "...";
  }
  

  /**
   * Returns the given JSON input as a typed entity.
   * 
   * @throws JsonParsingException if the given object is malformed, or if the given
   * JSON is not a single object
   * @throws UncheckedIOException {@code IOException}s are unchecked
   */
  default T toEntity(Reader reader) throws JsonParsingException, UncheckedIOException {
    try {
      return toEntity((JSONObject) new JSONParser().parse(reader));
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + px, px);
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("not a JSON object", ccx);
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
  }
  
  
  /** Reads the given UTF-8 encoded file. */
  default T toEntity(File file) throws JsonParsingException, UncheckedIOException {
    try (var reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return toEntity(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException("on toEntity(file=" + file + "): " + iox , iox);
    }
  }
  
}
