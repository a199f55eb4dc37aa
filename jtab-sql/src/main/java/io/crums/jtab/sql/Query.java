/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parameterized SQL statement.
 * 
 * @param sql     SQL text with {@code ?} placeholders
 * @param params  parameter values, in placeholder order (may contain nulls)
 */
public record Query(String sql, List<Object> params) {
  
  public Query {
    if (sql.isBlank())
      throw new IllegalArgumentException("blank sql");
    params = Collections.unmodifiableList(new ArrayList<>(params));
  }
  
  /** Creates an instance with no parameters. */
  public Query(String sql) {
    this(sql, List.of());
  }

}
