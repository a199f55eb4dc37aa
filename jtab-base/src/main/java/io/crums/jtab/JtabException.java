/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


/**
 * Base exception in the <code>jtab</code> modules.
 */
@SuppressWarnings("serial")
public class JtabException extends RuntimeException {

  public JtabException(String message) {
    super(message);
  }

  public JtabException(Throwable cause) {
    super(cause);
  }

  public JtabException(String message, Throwable cause) {
    super(message, cause);
  }

}
