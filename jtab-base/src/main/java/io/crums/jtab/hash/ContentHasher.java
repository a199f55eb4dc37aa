/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.hash;


import static io.crums.jtab.JtabConstants.HASH_LENGTH;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

import io.crums.jtab.UnsupportedValueException;
import io.crums.jtab.json.CanonicalJson;

/**
 * Canonical content hash of a JSON value. The value's
 * {@linkplain CanonicalJson#toHashInput(Object) hash input} text is
 * SHA-256'ed, base64url-encoded (no padding), and truncated to
 * {@linkplain io.crums.jtab.JtabConstants#HASH_LENGTH HASH_LENGTH} characters.
 * 
 * <p>
 * Since the hash input excludes {@code _hash} members at every level and
 * writes object members in key order, the hash is stable under key
 * reordering and does not depend on any hash already stamped on the value.
 * </p>
 */
public class ContentHasher {
  
  /** Stateless. */
  public final static ContentHasher INSTANCE = new ContentHasher();
  
  /** Digest algorithm. */
  public final static String HASH_ALGO = "SHA-256";
  
  
  /**
   * Returns the content hash of the given JSON value.
   * 
   * @throws UnsupportedValueException if {@code value} is not a JSON value
   */
  public String hash(Object value) throws UnsupportedValueException {
    byte[] input = CanonicalJson.toHashInput(value).getBytes(StandardCharsets.UTF_8);
    byte[] digest = newDigest().digest(input);
    return
        Base64.getUrlEncoder().withoutPadding().encodeToString(digest)
        .substring(0, HASH_LENGTH);
  }
  
  
  /** Creates and returns a new {@code MessageDigest}. */
  protected MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(HASH_ALGO);
    } catch (NoSuchAlgorithmException nsax) {
      throw new RuntimeException("on creating digest with algo " + HASH_ALGO, nsax);
    }
  }

}
