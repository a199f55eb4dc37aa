/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import static io.crums.jtab.sql.SqlStoreConstants.BOOLEAN_TYPE;
import static io.crums.jtab.sql.SqlStoreConstants.NUMBER_TYPE;
import static io.crums.jtab.sql.SqlStoreConstants.TEXT_TYPE;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.crums.jtab.ColumnConfig;
import io.crums.jtab.ColumnType;
import io.crums.jtab.TableConfig;
import io.crums.jtab.UnsupportedColumnTypeException;
import io.crums.jtab.UnsupportedValueException;
import io.crums.jtab.json.CanonicalJson;

/**
 * Generates the SQL the store executes. Instances are stateless; every
 * identifier is mapped and quoted via the {@linkplain NameMapper}, and every
 * value is bound as a parameter.
 */
public class QueryTranslator {
  
  private final NameMapper names;
  private final ColumnCodec codec;
  
  
  public QueryTranslator() {
    this(NameMapper.DEFAULT, ColumnCodec.INSTANCE);
  }
  
  public QueryTranslator(NameMapper names, ColumnCodec codec) {
    this.names = names;
    this.codec = codec;
  }
  
  
  public NameMapper names() {
    return names;
  }
  
  
  /** Returns the SQL column type for the given column type. */
  public String sqlType(ColumnType type) throws UnsupportedColumnTypeException {
    if (type == null)
      throw new UnsupportedColumnTypeException("null column type");
    switch (type) {
    case STRING:
    case JSON:
    case JSON_ARRAY:  return TEXT_TYPE;
    case NUMBER:      return NUMBER_TYPE;
    case BOOLEAN:     return BOOLEAN_TYPE;
    default:
      throw new UnsupportedColumnTypeException("unsupported column type: " + type);
    }
  }
  
  
  /**
   * Returns the {@code CREATE TABLE IF NOT EXISTS} statement for the given
   * configuration. The hash column is the primary key.
   */
  public String createTable(TableConfig config) {
    var sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
        .append(names.quotedTable(config.key())).append(" (");
    
    boolean first = true;
    for (var col : config.columns()) {
      if (first)
        first = false;
      else
        sql.append(',');
      sql.append("\n  ").append(columnDef(col));
      if (col.equals(TableConfig.HASH_COLUMN))
        sql.append(" NOT NULL PRIMARY KEY");
    }
    return sql.append("\n)").toString();
  }
  
  
  private String columnDef(ColumnConfig col) {
    return names.quotedColumn(col.key()) + " " + sqlType(col.type());
  }
  
  
  /**
   * Returns one {@code ALTER TABLE .. ADD COLUMN IF NOT EXISTS} statement per
   * added column, in order.
   */
  public List<String> alterTable(String tableKey, List<ColumnConfig> added) {
    String table = names.quotedTable(tableKey);
    return added.stream()
        .map(col -> "ALTER TABLE " + table + " ADD COLUMN IF NOT EXISTS " + columnDef(col))
        .toList();
  }
  
  
  /**
   * Returns the {@code INSERT} statement for a row with the given
   * column values (as parameters, in order).
   */
  public String insertRow(String tableKey, List<String> columnKeys) {
    var cols = new StringBuilder();
    var params = new StringBuilder();
    for (var key : columnKeys) {
      if (!cols.isEmpty()) {
        cols.append(", ");
        params.append(", ");
      }
      cols.append(names.quotedColumn(key));
      params.append('?');
    }
    return "INSERT INTO %s (%s) VALUES (%s)"
        .formatted(names.quotedTable(tableKey), cols, params);
  }
  
  
  /** Returns the query selecting every row (and column) of the given table. */
  public Query selectAll(TableConfig config) {
    return new Query(selectClause(config));
  }
  
  
  /**
   * Returns the query selecting every row of the given table whose columns
   * equal the given values. Predicates are ANDed (in key order); an empty
   * {@code where} selects all rows.
   * 
   * <h4>Predicate Values</h4>
   * <p>
   * {@code null} translates to {@code IS NULL}. Strings, numbers, booleans,
   * objects and arrays are encoded like cell values and bound. A value whose
   * JSON kind differs from the column's type matches no row.
   * </p>
   * 
   * @throws ColumnNotFoundException
   *         if a key in {@code where} is not a column
   * @throws UnsupportedPredicateTypeException
   *         if a value is not a JSON value
   */
  public Query selectWhere(TableConfig config, Map<String, ?> where)
      throws ColumnNotFoundException, UnsupportedPredicateTypeException {
    
    if (where.isEmpty())
      return selectAll(config);
    
    var sql = new StringBuilder(selectClause(config)).append(" WHERE ");
    var params = new ArrayList<Object>();
    boolean first = true;
    for (var e : new TreeMap<String, Object>(where).entrySet()) {
      ColumnConfig col = config.findColumn(e.getKey()).orElseThrow(
          () -> new ColumnNotFoundException(config.key(), e.getKey()));
      
      if (first)
        first = false;
      else
        sql.append(" AND ");
      
      Object value = e.getValue();
      String column = names.quotedColumn(col.key());
      if (value == null) {
        sql.append(column).append(" IS NULL");
        continue;
      }
      checkPredicateType(col, value);
      // booleans are stored as 0/1
      if (col.type() == ColumnType.BOOLEAN && value instanceof Number num) {
        params.add(toBigDecimal(num, col));
        sql.append(column).append(" = ?");
        continue;
      }
      if (!col.type().accepts(value)) {
        sql.append("1 = 0");
        continue;
      }
      try {
        params.add(codec.encode(value, col.type()));
      } catch (UnsupportedValueException uvx) {
        throw new UnsupportedPredicateTypeException(
            "filter on column '%s': %s".formatted(col.key(), uvx.getMessage()));
      }
      sql.append(column).append(" = ?");
    }
    return new Query(sql.toString(), params);
  }
  
  
  private BigDecimal toBigDecimal(Number num, ColumnConfig col) {
    try {
      return CanonicalJson.toBigDecimal(num);
    } catch (UnsupportedValueException uvx) {
      throw new UnsupportedPredicateTypeException(
          "filter on column '%s': %s".formatted(col.key(), uvx.getMessage()));
    }
  }
  
  
  private void checkPredicateType(ColumnConfig col, Object value) {
    if (value instanceof String || value instanceof Number || value instanceof Boolean ||
        value instanceof Map || value instanceof List)
      return;
    throw new UnsupportedPredicateTypeException(
        "unsupported filter value type on column '%s': %s (%s)"
        .formatted(col.key(), value, value.getClass().getName()));
  }
  
  
  private String selectClause(TableConfig config) {
    var sql = new StringBuilder("SELECT ");
    boolean first = true;
    for (var key : config.columnKeys()) {
      if (first)
        first = false;
      else
        sql.append(", ");
      sql.append(names.quotedColumn(key));
    }
    return sql.append(" FROM ").append(names.quotedTable(config.key())).toString();
  }
  
  
  /** Returns the {@code SELECT COUNT(*)} statement for the given table. */
  public String countRows(String tableKey) {
    return "SELECT COUNT(*) FROM " + names.quotedTable(tableKey);
  }
  
  
  /**
   * Returns the catalog query counting physical tables with the given
   * table's physical name. (0 or 1.)
   */
  public Query tableExists(String tableKey) {
    return new Query(
        "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME = ?",
        List.of(names.toPhysicalTable(tableKey)));
  }
  
  
  /**
   * Returns a statement that selects no rows, but whose result set metadata
   * lists the table's physical columns.
   */
  public String probeColumns(String tableKey) {
    return "SELECT * FROM " + names.quotedTable(tableKey) + " WHERE 1 = 0";
  }

}
