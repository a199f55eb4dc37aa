/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


/**
 * Thrown on encountering a column type tag outside {@linkplain ColumnType}.
 * Usually this means the stored schema is corrupted, or was written by a
 * newer version.
 */
@SuppressWarnings("serial")
public class UnsupportedColumnTypeException extends JtabException {

  public UnsupportedColumnTypeException(String message) {
    super(message);
  }

  public UnsupportedColumnTypeException(String message, Throwable cause) {
    super(message, cause);
  }

}
