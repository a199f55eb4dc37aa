/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.crums.jtab.json.JsonParsingException;

/**
 * 
 */
public class TableTest {

  @Test
  public void testSparseRows() {
    var row = new HashMap<String, Object>();
    row.put("id", 1);
    row.put("email", null);
    var table = Table.of("components", List.of(row));
    
    assertEquals(1, table.size());
    var copy = table.data().get(0);
    assertFalse(copy.containsKey("email"));
    assertEquals(1L, copy.get("id"));
  }
  
  
  @Test
  public void testRowsCopied() {
    var row = new HashMap<String, Object>();
    row.put("id", 1);
    var table = Table.of("components", List.of(row));
    row.put("id", 2);
    assertEquals(1L, table.data().get(0).get("id"));
  }
  
  
  @Test
  public void testNonJsonValue() {
    var row = Map.<String, Object>of("when", new java.util.Date());
    assertThrows(UnsupportedValueException.class, () -> Table.of("components", List.of(row)));
  }
  
  
  @Test
  public void testJson() {
    var table = Table.of("components", List.of(Map.of("id", 1, "name", "Alice")))
        .withTableConfigHash("cfg")
        .withHash("h");
    var jObj = Table.PARSER.toJsonObject(table);
    assertEquals("components", jObj.get("_type"));
    assertEquals("cfg", jObj.get("_tableCfg"));
    assertEquals(table, Table.PARSER.toEntity(jObj.toJSONString()));
    
    assertThrows(
        JsonParsingException.class,
        () -> Table.PARSER.toEntity("{\"_type\":\"components\",\"_data\":[1]}"));
  }
  
  
  @Test
  public void testBundle() {
    var table = Table.of("components", List.of(Map.of("id", 1)));
    var bundle = new TableBundle(Map.of("b", table, "a", Table.empty("components")));
    assertEquals(List.of("a", "b"), List.copyOf(bundle.tables().keySet()));
    assertTrue(bundle.hash().isEmpty());
    
    var json = TableBundle.PARSER.toJsonObject(bundle.withHash("h")).toJSONString();
    var parsed = TableBundle.PARSER.toEntity(json);
    assertEquals("h", parsed.hash().get());
    assertEquals(bundle.tables(), parsed.tables());
    
    assertThrows(IllegalArgumentException.class, () -> TableBundle.of("_hash", table));
  }

}
