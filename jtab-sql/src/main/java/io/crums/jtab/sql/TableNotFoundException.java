/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import io.crums.jtab.JtabException;

/**
 * Thrown when a table is not registered.
 */
@SuppressWarnings("serial")
public class TableNotFoundException extends JtabException {
  
  private final String tableKey;

  public TableNotFoundException(String tableKey) {
    super("table not found: " + tableKey);
    this.tableKey = tableKey;
  }
  
  /** Returns the (logical) key of the missing table. */
  public String tableKey() {
    return tableKey;
  }

}
