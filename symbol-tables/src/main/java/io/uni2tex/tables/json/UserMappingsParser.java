/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables.json;


import java.util.LinkedHashMap;
import java.util.Map;

import org.json.simple.JSONObject;

import io.uni2tex.tables.CodepointMapping;

/**
 * Parses {@linkplain UserMappings} from JSON. Example:
 * <pre>
 * {
 *   "overrides": {
 *     "☺": "\\smiley",
 *     "U+2665": "\\heart"
 *   },
 *   "replacements": {
 *     "\\R": "ℝ"
 *   }
 * }
 * </pre>
 * <p>
 * Both members are optional. Override keys are either a single character
 * or a <code>U+<em>hex</em></code> code point label. Replacement keys must
 * be macros (start with a backslash).
 * </p>
 */
public class UserMappingsParser implements JsonEntityReader<UserMappings> {
  
  public final static UserMappingsParser INSTANCE = new UserMappingsParser();
  
  public final static String OVERRIDES = "overrides";
  public final static String REPLACEMENTS = "replacements";
  

  @Override
  public UserMappings toEntity(JSONObject jObj) throws JsonParsingException {
    var overrides = new LinkedHashMap<Integer, String>();
    for (var e : JsonUtils.toStringMap(
        JsonUtils.getJsonObject(jObj, OVERRIDES, false)).entrySet()) {
      
      int cp = toCodepoint(e.getKey());
      String macro = e.getValue().strip();
      if (macro.isEmpty())
        throw new JsonParsingException(
            "empty override for '" + e.getKey() + "'");
      overrides.put(cp, macro);
    }
    
    Map<String, String> replacements =
        JsonUtils.toStringMap(JsonUtils.getJsonObject(jObj, REPLACEMENTS, false));
    for (var macro : replacements.keySet()) {
      if (macro.length() < 2 || macro.charAt(0) != '\\')
        throw new JsonParsingException(
            "replacement key must be a macro (e.g. \"\\\\R\"): " + macro);
    }
    return new UserMappings(CodepointMapping.of(overrides), replacements);
  }
  
  
  /**
   * Parses an override key: either a single code point, or a label of the form
   * <code>U+<em>hex</em></code>.
   */
  public static int toCodepoint(String key) throws JsonParsingException {
    if (key.codePointCount(0, key.length()) == 1)
      return key.codePointAt(0);
    
    if (key.length() > 2 && (key.startsWith("U+") || key.startsWith("u+"))) {
      try {
        int cp = Integer.parseInt(key.substring(2), 16);
        if (Character.isValidCodePoint(cp))
          return cp;
      } catch (NumberFormatException nfx) {
        throw new JsonParsingException("malformed code point label: " + key, nfx);
      }
    }
    throw new JsonParsingException(
        "override key must be a single character or U+hhhh: " + key);
  }

}
