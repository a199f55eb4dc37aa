/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import io.crums.jtab.JtabException;

/**
 * Thrown when a data operation is attempted before the store is
 * initialized.
 */
@SuppressWarnings("serial")
public class NotReadyException extends JtabException {

  public NotReadyException(String message) {
    super(message);
  }

}
