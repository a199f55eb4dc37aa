/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import static io.crums.jtab.ColumnType.*;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.junit.jupiter.api.Test;

import io.crums.jtab.ColumnConfig;
import io.crums.jtab.ColumnType;
import io.crums.jtab.TableConfig;
import io.crums.jtab.UnsupportedColumnTypeException;
import io.crums.jtab.UnsupportedValueException;

/**
 * 
 */
public class ColumnCodecTest {
  
  private final ColumnCodec codec = ColumnCodec.INSTANCE;

  @Test
  public void testBoolean() {
    assertEquals(1, codec.encode(true, BOOLEAN));
    assertEquals(0, codec.encode(false, BOOLEAN));
    assertEquals(true, codec.decode(1, BOOLEAN));
    assertEquals(false, codec.decode(0, BOOLEAN));
    assertEquals(true, codec.decode(7L, BOOLEAN));
    assertThrows(UnsupportedValueException.class, () -> codec.decode("yes", BOOLEAN));
  }
  
  
  @Test
  public void testNumber() {
    assertEquals(new BigDecimal("42"), codec.encode(42, NUMBER));
    assertEquals(42L, codec.decode(new BigDecimal("42"), NUMBER));
    assertEquals(42L, codec.decode(new BigDecimal("42.000"), NUMBER));
    assertEquals(-0.5, codec.decode(new BigDecimal("-0.5"), NUMBER));
    assertEquals(3L, codec.decode("3", NUMBER));
    assertThrows(UnsupportedValueException.class, () -> codec.encode(Double.NaN, NUMBER));
    assertThrows(UnsupportedValueException.class, () -> codec.decode("three", NUMBER));
  }
  
  
  @Test
  public void testJson() {
    var value = Map.of("b", List.of(1, 2), "a", "x");
    Object text = codec.encode(value, JSON);
    assertEquals("{\"a\":\"x\",\"b\":[1,2]}", text);
    
    Object decoded = codec.decode(text, JSON);
    assertTrue(decoded instanceof JSONObject);
    assertEquals(List.of(1L, 2L), ((JSONObject) decoded).get("b"));
    
    assertEquals("[true,null]", codec.encode(Arrays.asList(true, null), JSON_ARRAY));
    assertTrue(codec.decode("[]", JSON_ARRAY) instanceof JSONArray);
    
    assertThrows(UnsupportedValueException.class, () -> codec.decode("[1]", JSON));
    assertThrows(UnsupportedValueException.class, () -> codec.decode("{}", JSON_ARRAY));
    assertThrows(UnsupportedValueException.class, () -> codec.decode("{oops", JSON));
    assertThrows(
        UnsupportedValueException.class,
        () -> codec.encode(Map.of("when", new Object()), JSON));
  }
  
  
  @Test
  public void testKindMismatch() {
    assertThrows(UnsupportedValueException.class, () -> codec.encode("1", NUMBER));
    assertThrows(UnsupportedValueException.class, () -> codec.encode(1, STRING));
    assertThrows(UnsupportedValueException.class, () -> codec.encode(List.of(), JSON));
    assertThrows(UnsupportedValueException.class, () -> codec.encode(Map.of(), JSON_ARRAY));
    assertThrows(UnsupportedValueException.class, () -> codec.encode(0, BOOLEAN));
  }
  
  
  @Test
  public void testNulls() {
    for (var type : ColumnType.values()) {
      assertNull(codec.encode(null, type));
      assertNull(codec.decode(null, type));
    }
  }
  
  
  @Test
  public void testUnknownTypeName() {
    assertEquals("x", codec.encode("x", "string"));
    assertThrows(UnsupportedColumnTypeException.class, () -> codec.encode("x", "varchar"));
    assertThrows(UnsupportedColumnTypeException.class, () -> codec.encode("x", (ColumnType) null));
  }
  
  
  @Test
  public void testRows() {
    var config = TableConfig.of(
        "users", "components",
        new ColumnConfig("id", NUMBER),
        new ColumnConfig("name", STRING),
        new ColumnConfig("active", BOOLEAN));
    
    var row = new HashMap<String, Object>();
    row.put("_hash", "h");
    row.put("id", 7);
    row.put("active", false);
    
    List<Object> values = codec.encodeRow(row, config);
    assertEquals(4, values.size());
    assertEquals("h", values.get(0));
    assertEquals(new BigDecimal(7), values.get(1));
    assertNull(values.get(2));
    assertEquals(0, values.get(3));
    
    var names = NameMapper.DEFAULT;
    var physical = new HashMap<String, Object>();
    var keys = config.columnKeys();
    var encoded = new ArrayList<>(values);
    for (int index = 0; index < keys.size(); ++index)
      physical.put(names.toPhysicalColumn(keys.get(index)), encoded.get(index));
    
    JSONObject decoded = codec.decodeRow(physical, config, names);
    assertEquals(Map.of("_hash", "h", "id", 7L, "active", false), decoded);
    assertFalse(decoded.containsKey("name"));
    
    row.put("name", 5);
    var x = assertThrows(UnsupportedValueException.class, () -> codec.encodeRow(row, config));
    assertTrue(x.getMessage().contains("name"));
  }

}
