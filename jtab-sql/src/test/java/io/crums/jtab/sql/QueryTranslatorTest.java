/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import static io.crums.jtab.ColumnType.*;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.crums.jtab.ColumnConfig;
import io.crums.jtab.TableConfig;

/**
 * 
 */
public class QueryTranslatorTest {
  
  private final static TableConfig USERS = TableConfig.of(
      "users", "components",
      new ColumnConfig("id", NUMBER),
      new ColumnConfig("name", STRING),
      new ColumnConfig("admin", BOOLEAN),
      new ColumnConfig("prefs", JSON),
      new ColumnConfig("tags", JSON_ARRAY));
  
  private final QueryTranslator sql = new QueryTranslator();

  @Test
  public void testCreateTable() {
    String ddl = sql.createTable(USERS);
    assertTrue(ddl.startsWith("CREATE TABLE IF NOT EXISTS \"users_tbl\" ("), ddl);
    assertTrue(ddl.contains("\"_hash_col\" VARCHAR NOT NULL PRIMARY KEY"), ddl);
    assertTrue(ddl.contains("\"id_col\" DECFLOAT"), ddl);
    assertTrue(ddl.contains("\"name_col\" VARCHAR"), ddl);
    assertTrue(ddl.contains("\"admin_col\" INT"), ddl);
    assertTrue(ddl.contains("\"prefs_col\" VARCHAR"), ddl);
    assertTrue(ddl.contains("\"tags_col\" VARCHAR"), ddl);
    assertTrue(ddl.indexOf("id_col") < ddl.indexOf("name_col"));
    assertTrue(ddl.indexOf("prefs_col") < ddl.indexOf("tags_col"));
  }
  
  
  @Test
  public void testAlterTable() {
    var added = List.of(new ColumnConfig("email", STRING), new ColumnConfig("age", NUMBER));
    assertEquals(
        List.of(
            "ALTER TABLE \"users_tbl\" ADD COLUMN IF NOT EXISTS \"email_col\" VARCHAR",
            "ALTER TABLE \"users_tbl\" ADD COLUMN IF NOT EXISTS \"age_col\" DECFLOAT"),
        sql.alterTable("users", added));
    assertTrue(sql.alterTable("users", List.of()).isEmpty());
  }
  
  
  @Test
  public void testInsert() {
    assertEquals(
        "INSERT INTO \"users_tbl\" (\"_hash_col\", \"id_col\") VALUES (?, ?)",
        sql.insertRow("users", List.of("_hash", "id")));
  }
  
  
  @Test
  public void testSelectAll() {
    var query = sql.selectWhere(USERS, Map.of());
    assertEquals(
        "SELECT \"_hash_col\", \"id_col\", \"name_col\", \"admin_col\", \"prefs_col\", \"tags_col\" " +
        "FROM \"users_tbl\"",
        query.sql());
    assertTrue(query.params().isEmpty());
    assertEquals(query, sql.selectAll(USERS));
  }
  
  
  @Test
  public void testSelectWhere() {
    var where = new HashMap<String, Object>();
    where.put("name", "O'Brien");
    where.put("id", 3);
    where.put("admin", true);
    where.put("prefs", null);
    where.put("tags", List.of("a"));
    
    var query = sql.selectWhere(USERS, where);
    assertTrue(
        query.sql().endsWith(
            " WHERE \"admin_col\" = ? AND \"id_col\" = ? AND \"name_col\" = ?" +
            " AND \"prefs_col\" IS NULL AND \"tags_col\" = ?"),
        query.sql());
    assertEquals(List.of(1, new BigDecimal(3), "O'Brien", "[\"a\"]"), query.params());
  }
  
  
  @Test
  public void testSelectWhereKindMismatch() {
    var query = sql.selectWhere(USERS, Map.of("name", 5));
    assertTrue(query.sql().endsWith(" WHERE 1 = 0"), query.sql());
    assertTrue(query.params().isEmpty());
  }
  
  
  @Test
  public void testSelectWhereNumberOnBoolean() {
    var query = sql.selectWhere(USERS, Map.of("admin", 1));
    assertTrue(query.sql().endsWith(" WHERE \"admin_col\" = ?"), query.sql());
    assertEquals(List.of(BigDecimal.ONE), query.params());
  }
  
  
  @Test
  public void testSelectWhereErrors() {
    var x = assertThrows(
        ColumnNotFoundException.class,
        () -> sql.selectWhere(USERS, Map.of("nonexistent", "x")));
    assertEquals("users", x.tableKey());
    assertEquals("nonexistent", x.columnKey());
    
    assertThrows(
        UnsupportedPredicateTypeException.class,
        () -> sql.selectWhere(USERS, Map.of("name", new Object())));
    assertThrows(
        UnsupportedPredicateTypeException.class,
        () -> sql.selectWhere(USERS, Map.of("id", Double.NaN)));
    assertThrows(
        UnsupportedPredicateTypeException.class,
        () -> sql.selectWhere(USERS, Map.of("prefs", Map.of("k", new Object()))));
  }
  
  
  @Test
  public void testCatalogQueries() {
    assertEquals("SELECT COUNT(*) FROM \"users_tbl\"", sql.countRows("users"));
    assertEquals(List.of("users_tbl"), sql.tableExists("users").params());
    assertEquals("SELECT * FROM \"users_tbl\" WHERE 1 = 0", sql.probeColumns("users"));
  }

}
