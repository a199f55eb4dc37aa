/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.hash;


import static io.crums.jtab.JtabConstants.HASH;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

import org.json.simple.JSONObject;

import io.crums.jtab.HashMismatchException;
import io.crums.jtab.Table;
import io.crums.jtab.TableBundle;
import io.crums.jtab.TableConfig;
import io.crums.jtab.UnsupportedValueException;

/**
 * Stamps and verifies content hashes.
 * 
 * <h2>Modes</h2>
 * <p>
 * In the default, <em>lenient</em> mode, existing hashes are never overwritten
 * and a wrong hash is not an error: only <em>missing</em> hashes are filled in.
 * In <em>strict</em> mode, every existing hash encountered while stamping is
 * verified, and a mismatch raises {@linkplain HashMismatchException}.
 * </p><p>
 * Either way, stamping is idempotent: stamping an already stamped value leaves
 * it unchanged.
 * </p>
 */
public class IntegrityEngine {
  
  /** Lenient instance. */
  public final static IntegrityEngine LENIENT = new IntegrityEngine(false);
  
  /** Strict instance. */
  public final static IntegrityEngine STRICT = new IntegrityEngine(true);
  
  
  private final ContentHasher hasher;
  private final boolean strict;
  
  
  public IntegrityEngine(boolean strict) {
    this(ContentHasher.INSTANCE, strict);
  }

  public IntegrityEngine(ContentHasher hasher, boolean strict) {
    this.hasher = Objects.requireNonNull(hasher, "null hasher");
    this.strict = strict;
  }
  
  
  /** Returns {@code true} if existing hashes are verified. */
  public boolean isStrict() {
    return strict;
  }
  
  
  /** Returns the content hash of the given JSON value. */
  public String hash(Object value) throws UnsupportedValueException {
    return hasher.hash(value);
  }
  
  
  /**
   * Stamps the given object's {@code _hash} member, if absent. If present,
   * it's left as-is (and verified, in strict mode).
   * 
   * @return {@code value}
   * 
   * @throws HashMismatchException in strict mode only
   */
  @SuppressWarnings("unchecked")
  public JSONObject stampMissing(JSONObject value) throws HashMismatchException {
    if (value.get(HASH) == null)
      value.put(HASH, hash(value));
    else if (strict)
      verify(value);
    return value;
  }
  
  
  /**
   * Verifies the given object's {@code _hash} member matches its contents.
   * 
   * @throws HashMismatchException if it doesn't, or if there is no hash
   */
  public void verify(JSONObject value) throws HashMismatchException {
    Object stamped = value.get(HASH);
    String computed = hash(value);
    if (!computed.equals(stamped))
      throw new HashMismatchException(String.valueOf(stamped), computed);
  }
  
  
  /**
   * Returns the given configuration with its hash stamped, if missing.
   * 
   * @throws HashMismatchException in strict mode only
   */
  public TableConfig stamp(TableConfig config) throws HashMismatchException {
    var jObj = TableConfig.PARSER.toJsonObject(config);
    if (config.hash().isPresent()) {
      if (strict)
        verify(jObj);
      return config;
    }
    return config.withHash(hash(jObj));
  }
  
  
  /**
   * Stamps the table's rows (each, if missing), then the table itself
   * (if missing). Row order is preserved.
   * 
   * @throws HashMismatchException in strict mode only
   */
  public Table stampRows(Table table) throws HashMismatchException {
    Table stamped = table.withData(stampedRows(table));
    if (stamped.hash().isPresent()) {
      if (strict)
        verify(Table.PARSER.toJsonObject(stamped));
      return stamped;
    }
    return stamped.withHash(hash(Table.PARSER.toJsonObject(stamped)));
  }
  
  
  /**
   * Stamps missing row hashes, sorts the rows by hash, and (re)computes the
   * table hash. Unlike {@linkplain #stampRows(Table)}, any existing table
   * hash is replaced. This is for tables reconstructed from storage, whose
   * hash depends only on the rows' content.
   */
  public Table rehash(Table table) {
    var rows = stampedRows(table);
    rows.sort(Comparator.comparing(row -> row.get(HASH).toString()));
    Table sorted = table.withData(rows);
    return sorted.withHash(hash(Table.PARSER.toJsonObject(sorted)));
  }
  
  
  /**
   * Stamps each table per {@linkplain #stampRows(Table)}, then the bundle's
   * own hash, if missing.
   * 
   * @throws HashMismatchException in strict mode only
   */
  public TableBundle stamp(TableBundle bundle) throws HashMismatchException {
    var tables = new TreeMap<String, Table>();
    for (var e : bundle.tables().entrySet())
      tables.put(e.getKey(), stampRows(e.getValue()));
    
    var stamped = new TableBundle(tables, bundle.hash());
    if (stamped.hash().isPresent()) {
      if (strict)
        verify(TableBundle.PARSER.toJsonObject(stamped));
      return stamped;
    }
    return stamped.withHash(hash(TableBundle.PARSER.toJsonObject(stamped)));
  }
  
  
  @SuppressWarnings("unchecked")
  private List<JSONObject> stampedRows(Table table) {
    var rows = new ArrayList<JSONObject>(table.size());
    for (var row : table.data()) {
      var copy = new JSONObject();
      copy.putAll(row);
      rows.add(stampMissing(copy));
    }
    return rows;
  }

}
