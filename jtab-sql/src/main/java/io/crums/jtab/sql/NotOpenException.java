/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import io.crums.jtab.JtabException;

/**
 * Thrown on using (or closing) a database session that isn't open.
 */
@SuppressWarnings("serial")
public class NotOpenException extends JtabException {

  public NotOpenException(String message) {
    super(message);
  }

}
