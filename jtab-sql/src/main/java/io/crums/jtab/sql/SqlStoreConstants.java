/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import java.lang.System.Logger;

/**
 * Module constants.
 */
public class SqlStoreConstants {

  // no one calls
  private SqlStoreConstants() {  }
  
  
  public final static String LOG_NAME = "io.crums.jtab.sql";
  
  
  static Logger getLogger() {
    return System.getLogger(LOG_NAME);
  }
  
  
  /** SQL type for {@code string}, {@code json}, and {@code jsonArray} columns. */
  public final static String TEXT_TYPE = "VARCHAR";
  /** SQL type for {@code number} columns. */
  public final static String NUMBER_TYPE = "DECFLOAT";
  /** SQL type for {@code boolean} columns (0 or 1). */
  public final static String BOOLEAN_TYPE = "INT";
  
  
  /** Standard SQLState for a unique (primary key) constraint violation. */
  public final static String DUPLICATE_KEY_STATE = "23505";

}
