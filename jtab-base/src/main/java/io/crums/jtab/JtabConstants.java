/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


/**
 * Library constants.
 */
public class JtabConstants {
  
  // no one calls
  private JtabConstants() {  }
  
  
  /**
   * Reserved member name for content hashes. Rows, tables, table configurations
   * and table bundles all carry their hash under this name. The member is
   * excluded from its own hash computation.
   */
  public final static String HASH = "_hash";
  
  /**
   * Number of characters in an encoded hash (22 base64url chars, 132 bits
   * of SHA-256).
   */
  public final static int HASH_LENGTH = 22;

}
