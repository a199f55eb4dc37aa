/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


/**
 * Thrown when a value cannot be represented as JSON, or does not
 * match its column's declared type.
 */
@SuppressWarnings("serial")
public class UnsupportedValueException extends JtabException {

  public UnsupportedValueException(String message) {
    super(message);
  }

  public UnsupportedValueException(String message, Throwable cause) {
    super(message, cause);
  }

}
