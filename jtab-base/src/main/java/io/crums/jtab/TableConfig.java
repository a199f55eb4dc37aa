/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


import static io.crums.jtab.JtabConstants.HASH;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import org.json.simple.JSONObject;

import io.crums.jtab.json.JsonEntityParser;
import io.crums.jtab.json.JsonParsingException;
import io.crums.jtab.json.JsonUtils;

/**
 * A table's identity, kind, and ordered columns. Column order is append-only
 * history: a later configuration for the same table must have the earlier one's
 * columns as a prefix of its own.
 * 
 * <h2>Hash Column</h2>
 * <p>
 * The first column is always {@linkplain #HASH_COLUMN}. Rows are keyed by their
 * content hash, which doubles as the table's primary key in storage. The
 * {@linkplain #of(String, String, ColumnConfig...) of(..)} factory methods
 * prepend it, if missing.
 * </p>
 * 
 * @param key     table key (identity)
 * @param type    semantic table kind
 * @param columns ordered columns; first is {@linkplain #HASH_COLUMN}
 * @param hash    content hash of the other 3 fields, if stamped
 * 
 * @see #PARSER
 */
public record TableConfig(
    String key, String type, List<ColumnConfig> columns, Optional<String> hash) {
  
  /** The row-hash column. Always first. */
  public final static ColumnConfig HASH_COLUMN = new ColumnConfig(HASH, ColumnType.STRING);
  
  /** JSON parser. */
  public final static JsonEntityParser<TableConfig> PARSER = new Parser();
  
  
  /**
   * Returns a new unhashed instance, prepending the {@linkplain #HASH_COLUMN},
   * if not already the first of the given {@code columns}.
   */
  public static TableConfig of(String key, String type, ColumnConfig... columns) {
    return of(key, type, List.of(columns));
  }
  
  /**
   * Returns a new unhashed instance, prepending the {@linkplain #HASH_COLUMN},
   * if not already the first of the given {@code columns}.
   */
  public static TableConfig of(String key, String type, List<ColumnConfig> columns) {
    if (columns.isEmpty() || !columns.get(0).equals(HASH_COLUMN)) {
      var withHash = new ArrayList<ColumnConfig>(columns.size() + 1);
      withHash.add(HASH_COLUMN);
      withHash.addAll(columns);
      columns = withHash;
    }
    return new TableConfig(key, type, columns, Optional.empty());
  }
  
  
  /**
   * Full constructor.
   * 
   * @throws IllegalArgumentException
   *         if the key or type is blank, if a column key is duplicated, or
   *         if the first column is not the {@linkplain #HASH_COLUMN}
   */
  public TableConfig {
    if (key.isBlank())
      throw new IllegalArgumentException("blank table key");
    if (type.isBlank())
      throw new IllegalArgumentException("blank table type (table '" + key + "')");
    columns = List.copyOf(columns);
    if (columns.isEmpty() || !columns.get(0).equals(HASH_COLUMN))
      throw new IllegalArgumentException(
          "first column of table '%s' must be %s: %s".formatted(key, HASH_COLUMN, columns));
    
    var keys = new HashSet<String>();
    for (var col : columns)
      if (!keys.add(col.key()))
        throw new IllegalArgumentException(
            "duplicate column key '%s' in table '%s'".formatted(col.key(), key));
    
    if (hash == null)
      hash = Optional.empty();
  }
  
  
  /** Returns the column keys, in order. */
  public List<String> columnKeys() {
    return columns.stream().map(ColumnConfig::key).toList();
  }
  
  
  /** Finds and returns the column with the given key. */
  public Optional<ColumnConfig> findColumn(String columnKey) {
    return columns.stream().filter(c -> c.key().equals(columnKey)).findFirst();
  }
  
  
  public boolean hasColumn(String columnKey) {
    return findColumn(columnKey).isPresent();
  }
  
  
  /** Returns a copy of this instance with the given hash. */
  public TableConfig withHash(String hash) {
    return new TableConfig(key, type, columns, Optional.of(hash));
  }
  
  
  /** Returns this instance sans hash. */
  public TableConfig sansHash() {
    return hash.isEmpty() ? this : new TableConfig(key, type, columns, Optional.empty());
  }
  
  
  /**
   * Tests whether the columns of this instance are the same as the given
   * instance's. Hashes are ignored.
   */
  public boolean sameSchema(TableConfig other) {
    return key.equals(other.key) && type.equals(other.type) && columns.equals(other.columns);
  }
  
  
  /**
   * Checks that the given {@code newer} configuration extends this one
   * (or is the same), and returns the columns it adds.
   * 
   * @param newer a configuration for the same table
   * 
   * @return the added columns, in order; empty, if none
   * 
   * @throws SchemaIncompatibleException
   *         if {@code newer} is for a different table, has a different
   *         type, or if a column was removed, reordered, or retyped
   */
  public List<ColumnConfig> addedColumns(TableConfig newer)
      throws SchemaIncompatibleException {
    
    if (!key.equals(newer.key))
      throw new SchemaIncompatibleException(
          "table key mismatch: '%s' vs '%s'".formatted(key, newer.key));
    if (!type.equals(newer.type))
      throw new SchemaIncompatibleException(
          "table '%s' type changed from '%s' to '%s'".formatted(key, type, newer.type));
    
    final int count = columns.size();
    if (newer.columns.size() < count)
      throw new SchemaIncompatibleException(
          "table '%s': columns removed; existing %s, new %s"
          .formatted(key, columns, newer.columns));
    
    for (int index = 0; index < count; ++index) {
      var existing = columns.get(index);
      var proposed = newer.columns.get(index);
      if (existing.equals(proposed))
        continue;
      
      String problem;
      if (existing.key().equals(proposed.key()))
        problem = "retyped";
      else if (newer.hasColumn(existing.key()))
        problem = "reordered";
      else
        problem = "removed";
      throw new SchemaIncompatibleException(
          "table '%s': column %s %s (at index %d, found %s)"
          .formatted(key, existing, problem, index, proposed));
    }
    return newer.columns.subList(count, newer.columns.size());
  }
  
  
  
  public static class Parser implements JsonEntityParser<TableConfig> {
    
    public final static String KEY = "key";
    public final static String TYPE = "type";
    public final static String COLUMNS = "columns";

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(TableConfig config, JSONObject jObj) {
      jObj.put(KEY, config.key());
      jObj.put(TYPE, config.type());
      jObj.put(COLUMNS, ColumnConfig.PARSER.toJsonArray(config.columns()));
      config.hash().ifPresent(h -> jObj.put(HASH, h));
      return jObj;
    }

    @Override
    public TableConfig toEntity(JSONObject jObj)
        throws JsonParsingException, UnsupportedColumnTypeException {
      String key = JsonUtils.getString(jObj, KEY, true);
      String type = JsonUtils.getString(jObj, TYPE, true);
      var columns = ColumnConfig.PARSER.toEntityList(
          JsonUtils.getJsonArray(jObj, COLUMNS, true));
      var hash = Optional.ofNullable(JsonUtils.getString(jObj, HASH, false));
      try {
        return new TableConfig(key, type, columns, hash);
      } catch (IllegalArgumentException iax) {
        throw new JsonParsingException(iax);
      }
    }
  }

}
