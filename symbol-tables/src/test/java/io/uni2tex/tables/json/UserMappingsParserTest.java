/*
 * Copyright 2025 Babak Farhang
 */
package io.uni2tex.tables.json;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * 
 */
public class UserMappingsParserTest {
  
  final static String JSON =
      "{\n" +
      "  \"overrides\": {\n" +
      "    \"☺\": \"\\\\smiley\",\n" +
      "    \"U+2665\": \"\\\\heart\"\n" +
      "  },\n" +
      "  \"replacements\": {\n" +
      "    \"\\\\R\": \"ℝ\"\n" +
      "  }\n" +
      "}";
  
  
  @Test
  public void testParse() {
    var mappings = UserMappingsParser.INSTANCE.toEntity(JSON);
    assertEquals("\\smiley", mappings.overrides().macro(0x263A));
    assertEquals("\\heart", mappings.overrides().macro(0x2665));
    assertEquals(2, mappings.overrides().size());
    assertEquals("ℝ", mappings.replacements().get("\\R"));
    assertFalse(mappings.isEmpty());
  }
  
  
  @Test
  public void testEmptyObject() {
    var mappings = UserMappingsParser.INSTANCE.toEntity("{}");
    assertTrue(mappings.isEmpty());
  }
  
  
  @Test
  public void testSupplementaryKey() {
    var mappings = UserMappingsParser.INSTANCE.toEntity(
        "{\"overrides\": {\"𝛼\": \"\\\\mitalpha\"}}");
    assertEquals("\\mitalpha", mappings.overrides().macro(0x1D6FC));
  }
  
  
  @Test
  public void testBadKeys() {
    assertThrows(
        JsonParsingException.class,
        () -> UserMappingsParser.INSTANCE.toEntity("{\"overrides\": {\"ab\": \"\\\\x\"}}"));
    assertThrows(
        JsonParsingException.class,
        () -> UserMappingsParser.INSTANCE.toEntity("{\"overrides\": {\"U+ZZ\": \"\\\\x\"}}"));
    assertThrows(
        JsonParsingException.class,
        () -> UserMappingsParser.INSTANCE.toEntity("{\"replacements\": {\"R\": \"x\"}}"));
    assertThrows(
        JsonParsingException.class,
        () -> UserMappingsParser.INSTANCE.toEntity("{\"overrides\": {\"x\": 5}}"));
    assertThrows(
        JsonParsingException.class,
        () -> UserMappingsParser.INSTANCE.toEntity("{\"overrides\": [1, 2]}"));
  }
  
  
  @Test
  public void testMalformed() {
    assertThrows(
        JsonParsingException.class,
        () -> UserMappingsParser.INSTANCE.toEntity("{\"overrides\": "));
    assertThrows(
        JsonParsingException.class,
        () -> UserMappingsParser.INSTANCE.toEntity("[]"));
  }
  
  
  @Test
  public void testFile(@TempDir File dir) throws IOException {
    var file = new File(dir, "mappings.json");
    Files.writeString(file.toPath(), JSON, StandardCharsets.UTF_8);
    var mappings = UserMappingsParser.INSTANCE.toEntity(file);
    assertEquals("\\heart", mappings.overrides().macro(0x2665));
  }

}
