/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


import static io.crums.jtab.ColumnType.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class TableConfigTest {
  
  private final static ColumnConfig ID = new ColumnConfig("id", NUMBER);
  private final static ColumnConfig NAME = new ColumnConfig("name", STRING);
  private final static ColumnConfig EMAIL = new ColumnConfig("email", STRING);
  
  
  @Test
  public void testOfPrependsHashColumn() {
    var config = TableConfig.of("users", "components", ID, NAME);
    assertEquals(List.of("_hash", "id", "name"), config.columnKeys());
    assertTrue(config.hash().isEmpty());
    
    var again = TableConfig.of("users", "components", config.columns());
    assertEquals(config, again);
  }
  
  
  @Test
  public void testConstructorValidation() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new TableConfig("users", "components", List.of(ID, NAME), Optional.empty()));
    assertThrows(
        IllegalArgumentException.class,
        () -> TableConfig.of("users", "components", ID, new ColumnConfig("id", STRING)));
    assertThrows(IllegalArgumentException.class, () -> TableConfig.of(" ", "components", ID));
    assertThrows(IllegalArgumentException.class, () -> TableConfig.of("users", "", ID));
  }
  
  
  @Test
  public void testAddedColumns() {
    var v1 = TableConfig.of("users", "components", ID, NAME);
    var v2 = TableConfig.of("users", "components", ID, NAME, EMAIL);
    
    assertEquals(List.of(EMAIL), v1.addedColumns(v2));
    assertTrue(v1.addedColumns(v1).isEmpty());
    assertTrue(v2.addedColumns(v2.withHash("abc")).isEmpty());
  }
  
  
  @Test
  public void testRemovedColumn() {
    var v1 = TableConfig.of("users", "components", ID, NAME);
    var bad = TableConfig.of("users", "components", ID);
    var x = assertThrows(SchemaIncompatibleException.class, () -> v1.addedColumns(bad));
    assertTrue(x.getMessage().contains("removed"));
    
    var swapped = TableConfig.of("users", "components", ID, EMAIL);
    x = assertThrows(SchemaIncompatibleException.class, () -> v1.addedColumns(swapped));
    assertTrue(x.getMessage().contains("removed"));
  }
  
  
  @Test
  public void testReorderedColumn() {
    var v1 = TableConfig.of("users", "components", ID, NAME);
    var bad = TableConfig.of("users", "components", NAME, ID);
    var x = assertThrows(SchemaIncompatibleException.class, () -> v1.addedColumns(bad));
    assertTrue(x.getMessage().contains("reordered"));
  }
  
  
  @Test
  public void testRetypedColumn() {
    var v1 = TableConfig.of("users", "components", ID, NAME);
    var bad = TableConfig.of("users", "components", ID, new ColumnConfig("name", JSON));
    var x = assertThrows(SchemaIncompatibleException.class, () -> v1.addedColumns(bad));
    assertTrue(x.getMessage().contains("retyped"));
  }
  
  
  @Test
  public void testTypeChange() {
    var v1 = TableConfig.of("users", "components", ID, NAME);
    var bad = TableConfig.of("users", "layers", ID, NAME);
    assertThrows(SchemaIncompatibleException.class, () -> v1.addedColumns(bad));
  }
  
  
  @Test
  public void testJsonRoundTrip() {
    var config = TableConfig.of("users", "components", ID, NAME).withHash("h");
    var jObj = TableConfig.PARSER.toJsonObject(config);
    assertEquals("users", jObj.get("key"));
    assertEquals("h", jObj.get("_hash"));
    assertEquals(config, TableConfig.PARSER.toEntity(jObj.toJSONString()));
  }
  
  
  @Test
  public void testParseUnknownColumnType() {
    String json =
        "{\"key\":\"t\",\"type\":\"components\",\"columns\":" +
        "[{\"key\":\"_hash\",\"type\":\"string\"},{\"key\":\"d\",\"type\":\"date\"}]}";
    assertThrows(UnsupportedColumnTypeException.class, () -> TableConfig.PARSER.toEntity(json));
  }

}
