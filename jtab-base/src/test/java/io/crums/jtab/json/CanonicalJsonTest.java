/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.json;


import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.junit.jupiter.api.Test;

import io.crums.jtab.UnsupportedValueException;

/**
 * 
 */
public class CanonicalJsonTest {

  @Test
  public void testSortedKeys() {
    var map = new LinkedHashMap<String, Object>();
    map.put("b", 2);
    map.put("a", List.of(true, "x", Map.of("z", 1, "y", 0)));
    assertEquals("{\"a\":[true,\"x\",{\"y\":0,\"z\":1}],\"b\":2}", CanonicalJson.toJson(map));
  }
  
  
  @Test
  public void testHashInputSkipsHash() {
    var map = Map.of("_hash", "abc", "a", 1, "n", Map.of("_hash", "def", "b", 2));
    assertEquals("{\"a\":1,\"n\":{\"b\":2}}", CanonicalJson.toHashInput(map));
    assertTrue(CanonicalJson.toJson(map).contains("\"_hash\":\"abc\""));
  }
  
  
  @Test
  public void testNumbers() {
    assertEquals("1", CanonicalJson.toJson(1));
    assertEquals("1", CanonicalJson.toJson(1.0));
    assertEquals("1", CanonicalJson.toJson(new BigDecimal("1.000")));
    assertEquals("1.5", CanonicalJson.toJson(1.5f));
    assertEquals("-20", CanonicalJson.toJson(-2e1));
    
    assertEquals(7L, CanonicalJson.normalize(7));
    assertEquals(7L, CanonicalJson.normalize(new BigDecimal("7.00")));
    assertEquals(0.25, CanonicalJson.normalize(new BigDecimal("0.25")));
    
    assertThrows(UnsupportedValueException.class, () -> CanonicalJson.toJson(Double.NaN));
    assertThrows(
        UnsupportedValueException.class,
        () -> CanonicalJson.toBigDecimal(Double.POSITIVE_INFINITY));
  }
  
  
  @Test
  public void testNumbersBeyondLong() {
    assertEquals("1E+20", CanonicalJson.toJson(1e20));
    assertEquals("1E+20", CanonicalJson.toJson(new BigDecimal("100000000000000000000")));
    var big = new BigInteger("123456789012345678901234");
    String json = CanonicalJson.toJson(List.of(big));
    assertEquals("[1.2345678901234568E+23]", json);
    assertEquals(List.of(1.2345678901234568E23), CanonicalJson.parse(json));
    assertEquals(1e20, CanonicalJson.parse(CanonicalJson.toJson(1e20)));
    assertEquals(
        CanonicalJson.toJson(Long.MAX_VALUE),
        String.valueOf(Long.MAX_VALUE));
    
    // integer literals json.simple can't hold in a long
    assertThrows(
        JsonParsingException.class,
        () -> CanonicalJson.parse("{\"x\":100000000000000000000}"));
  }
  
  
  @Test
  public void testEscapes() {
    String json = CanonicalJson.toJson(Map.of("s", "say \"hi\"\n"));
    assertEquals("{\"s\":\"say \\\"hi\\\"\\n\"}", json);
    assertEquals(Map.of("s", "say \"hi\"\n"), CanonicalJson.parse(json));
  }
  
  
  @Test
  public void testNotJson() {
    assertFalse(CanonicalJson.isJsonValue(new Object()));
    assertFalse(CanonicalJson.isJsonValue(Map.of(1, "one")));
    assertFalse(CanonicalJson.isJsonValue(List.of(new StringBuilder("x"))));
    assertTrue(CanonicalJson.isJsonValue(List.of(Map.of("k", List.of()))));
    assertThrows(UnsupportedValueException.class, () -> CanonicalJson.copy(new Object()));
  }
  
  
  @Test
  public void testCopy() {
    Object copy = CanonicalJson.copy(Map.of("a", List.of(1, Map.of("b", 2.0))));
    assertTrue(copy instanceof JSONObject);
    var a = ((JSONObject) copy).get("a");
    assertTrue(a instanceof JSONArray);
    assertEquals(1L, ((JSONArray) a).get(0));
    assertEquals(2L, ((JSONObject) ((JSONArray) a).get(1)).get("b"));
  }
  
  
  @Test
  public void testParseMalformed() {
    assertThrows(JsonParsingException.class, () -> CanonicalJson.parse("{\"a\":"));
  }

}
