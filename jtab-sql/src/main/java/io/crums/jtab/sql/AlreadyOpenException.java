/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import io.crums.jtab.JtabException;

/**
 * Thrown on opening (or initializing) something that's already open.
 */
@SuppressWarnings("serial")
public class AlreadyOpenException extends JtabException {

  public AlreadyOpenException(String message) {
    super(message);
  }

}
