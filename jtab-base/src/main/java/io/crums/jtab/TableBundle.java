/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


import static io.crums.jtab.JtabConstants.HASH;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import org.json.simple.JSONObject;

import io.crums.jtab.json.JsonEntityParser;
import io.crums.jtab.json.JsonParsingException;
import io.crums.jtab.json.JsonUtils;

/**
 * A set of {@linkplain Table}s keyed by table key, with an optional hash
 * over the whole. This is the unit of exchange for writes and dumps.
 * In JSON, each table is a member named by its key, next to the
 * bundle's {@code _hash}.
 * 
 * @see #PARSER
 */
public record TableBundle(SortedMap<String, Table> tables, Optional<String> hash) {
  
  /** JSON parser. */
  public final static JsonEntityParser<TableBundle> PARSER = new Parser();
  
  
  /** Returns an unhashed bundle with a single table. */
  public static TableBundle of(String tableKey, Table table) {
    return new TableBundle(Map.of(tableKey, table));
  }
  
  /** Returns an unhashed bundle. */
  public TableBundle(Map<String, Table> tables) {
    this(new TreeMap<>(tables), Optional.empty());
  }
  
  
  public TableBundle {
    var copy = new TreeMap<String, Table>(tables);
    if (copy.containsKey(HASH))
      throw new IllegalArgumentException("reserved table key: " + HASH);
    if (copy.containsValue(null))
      throw new IllegalArgumentException("null table: " + tables);
    tables = Collections.unmodifiableSortedMap(copy);
    if (hash == null)
      hash = Optional.empty();
  }
  
  
  /** Returns the table with the given key, if present. */
  public Optional<Table> table(String tableKey) {
    return Optional.ofNullable(tables.get(tableKey));
  }
  
  
  public boolean isEmpty() {
    return tables.isEmpty();
  }
  
  
  public TableBundle withHash(String hash) {
    return new TableBundle(tables, Optional.of(hash));
  }
  
  
  
  public static class Parser implements JsonEntityParser<TableBundle> {

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(TableBundle bundle, JSONObject jObj) {
      for (var e : bundle.tables().entrySet())
        jObj.put(e.getKey(), Table.PARSER.toJsonObject(e.getValue()));
      bundle.hash().ifPresent(h -> jObj.put(HASH, h));
      return jObj;
    }

    @Override
    public TableBundle toEntity(JSONObject jObj) throws JsonParsingException {
      var tables = new TreeMap<String, Table>();
      for (var key : jObj.keySet()) {
        if (HASH.equals(key))
          continue;
        String tableKey = key.toString();
        tables.put(tableKey, Table.PARSER.toEntity(JsonUtils.getJsonObject(jObj, tableKey, true)));
      }
      var hash = Optional.ofNullable(JsonUtils.getString(jObj, HASH, false));
      return new TableBundle(tables, hash);
    }
  }

}
