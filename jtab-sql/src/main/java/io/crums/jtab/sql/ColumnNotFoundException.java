/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import io.crums.jtab.JtabException;

/**
 * Thrown when a column is not in a table's active configuration.
 */
@SuppressWarnings("serial")
public class ColumnNotFoundException extends JtabException {
  
  private final String tableKey;
  private final String columnKey;

  public ColumnNotFoundException(String tableKey, String columnKey) {
    super("column '%s' not found in table '%s'".formatted(columnKey, tableKey));
    this.tableKey = tableKey;
    this.columnKey = columnKey;
  }
  
  public String tableKey() {
    return tableKey;
  }
  
  public String columnKey() {
    return columnKey;
  }

}
