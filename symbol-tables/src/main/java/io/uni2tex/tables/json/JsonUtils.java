/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables.json;

import java.util.Map;
import java.util.TreeMap;

import org.json.simple.JSONObject;

/**
 * Typed accessors over {@code json-simple} objects.
 */
public class JsonUtils {

  private JsonUtils() {  }
  
  
  public static String getString(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected '" + name + "' missing");
      return null;
    }
    if (!(value instanceof String))
      throw new JsonParsingException("'" + name + "' expects a simple string: " + value);
    return value.toString();
  }
  
  
  public static JSONObject getJsonObject(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON object '" + name + "' missing");
      return null;
    }
    try {
      return (JSONObject) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a JSON object: " + value, ccx);
    }
  }
  
  
  /**
   * Returns the given object's members as a string-to-string map, sorted by
   * key ({@code json-simple} objects are unordered).
   * 
   * @param jObj  {@code null} counts as empty
   * @throws JsonParsingException if a member value is not a string
   */
  public static Map<String, String> toStringMap(JSONObject jObj) throws JsonParsingException {
    var map = new TreeMap<String, String>();
    if (jObj == null)
      return map;
    for (Object key : jObj.keySet()) {
      String name = key.toString();
      map.put(name, getString(jObj, name, true));
    }
    return map;
  }

}
