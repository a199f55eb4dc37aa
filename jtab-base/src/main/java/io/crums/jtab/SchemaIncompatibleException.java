/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


/**
 * Thrown when a table configuration does not extend the existing one:
 * a column was removed, reordered, or retyped.
 */
@SuppressWarnings("serial")
public class SchemaIncompatibleException extends JtabException {

  public SchemaIncompatibleException(String message) {
    super(message);
  }

  public SchemaIncompatibleException(String message, Throwable cause) {
    super(message, cause);
  }

}
