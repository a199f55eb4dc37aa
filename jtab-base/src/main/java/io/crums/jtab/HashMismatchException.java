/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


/**
 * Thrown in strict mode when a stamped hash does not match the
 * recomputed one.
 */
@SuppressWarnings("serial")
public class HashMismatchException extends JtabException {
  
  private final String stamped;
  private final String computed;

  public HashMismatchException(String stamped, String computed) {
    super("hash mismatch: stamped '%s', computed '%s'".formatted(stamped, computed));
    this.stamped = stamped;
    this.computed = computed;
  }
  
  /** Returns the hash found on the value. */
  public String stamped() {
    return stamped;
  }
  
  /** Returns the hash the value's contents actually hash to. */
  public String computed() {
    return computed;
  }

}
