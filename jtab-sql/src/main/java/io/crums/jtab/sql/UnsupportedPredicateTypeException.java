/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import io.crums.jtab.JtabException;

/**
 * Thrown when an equality filter value is not a JSON value.
 */
@SuppressWarnings("serial")
public class UnsupportedPredicateTypeException extends JtabException {

  public UnsupportedPredicateTypeException(String message) {
    super(message);
  }

}
