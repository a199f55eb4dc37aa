/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import static io.crums.jtab.sql.SqlStoreConstants.DUPLICATE_KEY_STATE;

import java.sql.SQLException;

import io.crums.jtab.JtabException;

/**
 * Unchecked wrapper exception around checked (ugh) {@code SQLException}s.
 */
@SuppressWarnings("serial")
public class SqlStoreException extends JtabException {

  public SqlStoreException(String message) {
    super(message);
  }

  public SqlStoreException(Throwable cause) {
    this("internal error caused by: " + cause, cause);
  }

  public SqlStoreException(String message, Throwable cause) {
    super(message, cause);
  }
  
  
  /**
   * Returns the cause as an {@code SQLException}, if castable; {@code null}, o.w.
   */
  public SQLException sqlCause() {
    Throwable cause = getCause();
    return cause instanceof SQLException ? (SQLException) cause : null;
  }
  
  
  /**
   * Tests whether the cause was a primary key (or other unique constraint)
   * collision. Besides the standard SQLState, MySQL's and SQLite's vendor
   * codes are recognized.
   */
  public boolean isDuplicateKey() {
    for (SQLException sx = sqlCause(); sx != null; sx = sx.getNextException()) {
      if (DUPLICATE_KEY_STATE.equals(sx.getSQLState()))
        return true;
      int code = sx.getErrorCode();
      if (code == 1062    // MySQL ER_DUP_ENTRY
          || code == 1555 // SQLITE_CONSTRAINT_PRIMARYKEY
          || code == 2067)// SQLITE_CONSTRAINT_UNIQUE
        return true;
    }
    return false;
  }

}
