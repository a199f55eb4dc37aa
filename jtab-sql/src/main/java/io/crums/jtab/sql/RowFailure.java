/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


/**
 * A row that failed to insert.
 * 
 * @param tableKey  logical table key
 * @param rowHash   the row's hash (its primary key)
 * @param message   error message
 */
public record RowFailure(String tableKey, String rowHash, String message) {

  @Override
  public String toString() {
    return message;
  }
}
