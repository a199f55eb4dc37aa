/*
 * Copyright 2026 Babak Farhang
 */
/**
 * JSON entity parsers and canonical JSON.
 * 
 * <p>
 * Entities here are read and written using the {@code json.simple}
 * library, same as everywhere else. {@linkplain CanonicalJson} defines the
 * one textual form used both for hashing and for JSON-typed columns in
 * storage; the two must never diverge, else equality filters on JSON
 * columns stop matching.
 * </p>
 */
package io.crums.jtab.json;
