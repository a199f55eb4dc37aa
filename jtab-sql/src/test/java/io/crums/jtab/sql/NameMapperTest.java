/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class NameMapperTest {
  
  private final NameMapper names = NameMapper.DEFAULT;

  @Test
  public void testRoundTrip() {
    assertEquals("users_tbl", names.toPhysicalTable("users"));
    assertEquals("users", names.toLogicalTable("users_tbl"));
    assertEquals("select_col", names.toPhysicalColumn("select"));
    assertEquals("select", names.toLogicalColumn("select_col"));
    assertEquals("_hash_col", names.toPhysicalColumn("_hash"));
    assertEquals("\"order_tbl\"", names.quotedTable("order"));
    assertEquals("\"id_col\"", names.quotedColumn("id"));
  }
  
  
  @Test
  public void testBadKeys() {
    assertThrows(IllegalArgumentException.class, () -> names.toPhysicalTable("drop table"));
    assertThrows(IllegalArgumentException.class, () -> names.toPhysicalTable("a\"b"));
    assertThrows(IllegalArgumentException.class, () -> names.toPhysicalColumn("1st"));
    assertThrows(IllegalArgumentException.class, () -> names.toPhysicalColumn(""));
    assertThrows(IllegalArgumentException.class, () -> names.toPhysicalColumn("x".repeat(65)));
    names.toPhysicalColumn("x".repeat(64));
  }
  
  
  @Test
  public void testInverseRequiresSuffix() {
    assertThrows(IllegalArgumentException.class, () -> names.toLogicalTable("users"));
    assertThrows(IllegalArgumentException.class, () -> names.toLogicalTable("users_col"));
    assertThrows(IllegalArgumentException.class, () -> names.toLogicalColumn("_col"));
  }
  
  
  @Test
  public void testCustomSuffixes() {
    var custom = new NameMapper("_t", "_c");
    assertEquals("users_t", custom.toPhysicalTable("users"));
    assertEquals("id", custom.toLogicalColumn("id_c"));
    assertThrows(IllegalArgumentException.class, () -> new NameMapper("_x", "_x"));
    assertThrows(IllegalArgumentException.class, () -> new NameMapper("", "_c"));
  }

}
