/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


import static io.crums.jtab.JtabConstants.HASH;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.jtab.json.CanonicalJson;
import io.crums.jtab.json.JsonEntityParser;
import io.crums.jtab.json.JsonParsingException;
import io.crums.jtab.json.JsonUtils;

/**
 * Typed table data. Rows are JSON objects keyed by column key. Rows are
 * <em>sparse</em>: a member with a {@code null} value is dropped on
 * construction, so "no value" is always represented by an absent key.
 * 
 * <p>
 * Instances hold defensive copies of their rows, but the row objects
 * returned by {@linkplain #data()} are themselves mutable; don't.
 * </p>
 * 
 * @param type            semantic table kind (same as its configuration's)
 * @param data            the rows
 * @param tableConfigHash hash of the {@linkplain TableConfig} the rows conform to
 *                        (a reference, not ownership)
 * @param hash            content hash, if stamped
 * 
 * @see #PARSER
 */
public record Table(
    String type,
    List<JSONObject> data,
    Optional<String> tableConfigHash,
    Optional<String> hash) {
  
  /** JSON parser. */
  public final static JsonEntityParser<Table> PARSER = new Parser();
  
  
  /** Returns an unhashed instance with no table-config reference. */
  public static Table of(String type, List<?> rows) {
    return new Table(type, copyRows(rows), Optional.empty(), Optional.empty());
  }
  
  /** Returns an unhashed, empty instance. */
  public static Table empty(String type) {
    return new Table(type, List.of(), Optional.empty(), Optional.empty());
  }
  
  
  public Table {
    if (type.isBlank())
      throw new IllegalArgumentException("blank table type");
    data = copyRows(data);
    if (tableConfigHash == null)
      tableConfigHash = Optional.empty();
    if (hash == null)
      hash = Optional.empty();
  }
  
  
  private static List<JSONObject> copyRows(List<?> rows) {
    if (rows.isEmpty())
      return List.of();
    var copy = new ArrayList<JSONObject>(rows.size());
    for (var row : rows) {
      if (!(row instanceof Map))
        throw new IllegalArgumentException("row is not a map: " + row);
      copy.add(sparseCopy((Map<?, ?>) row));
    }
    return Collections.unmodifiableList(copy);
  }
  
  
  @SuppressWarnings("unchecked")
  private static JSONObject sparseCopy(Map<?, ?> row) {
    var copy = new JSONObject();
    for (var e : row.entrySet()) {
      if (e.getValue() == null)
        continue;
      if (!(e.getKey() instanceof String))
        throw new UnsupportedValueException("non-string column key: " + e.getKey());
      copy.put(e.getKey(), CanonicalJson.copy(e.getValue()));
    }
    return copy;
  }
  
  
  /** Returns the number of rows. */
  public int size() {
    return data.size();
  }
  
  public boolean isEmpty() {
    return data.isEmpty();
  }
  
  
  public Table withHash(String hash) {
    return new Table(type, data, tableConfigHash, Optional.of(hash));
  }
  
  
  public Table withData(List<?> rows) {
    return new Table(type, copyRows(rows), tableConfigHash, hash);
  }
  
  
  public Table withTableConfigHash(String tableConfigHash) {
    return new Table(type, data, Optional.of(tableConfigHash), hash);
  }
  
  
  
  public static class Parser implements JsonEntityParser<Table> {
    
    public final static String TYPE = "_type";
    public final static String DATA = "_data";
    public final static String TABLE_CFG = "_tableCfg";

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(Table table, JSONObject jObj) {
      jObj.put(TYPE, table.type());
      var jRows = new JSONArray();
      for (var row : table.data())
        jRows.add(CanonicalJson.copy(row));
      jObj.put(DATA, jRows);
      table.tableConfigHash().ifPresent(h -> jObj.put(TABLE_CFG, h));
      table.hash().ifPresent(h -> jObj.put(HASH, h));
      return jObj;
    }

    @Override
    public Table toEntity(JSONObject jObj) throws JsonParsingException {
      String type = JsonUtils.getString(jObj, TYPE, true);
      JSONArray jRows = JsonUtils.getJsonArray(jObj, DATA, true);
      var rows = new ArrayList<JSONObject>(jRows.size());
      for (var jRow : jRows) {
        if (!(jRow instanceof JSONObject))
          throw new JsonParsingException("table row is not a JSON object: " + jRow);
        rows.add((JSONObject) jRow);
      }
      var configHash = Optional.ofNullable(JsonUtils.getString(jObj, TABLE_CFG, false));
      var hash = Optional.ofNullable(JsonUtils.getString(jObj, HASH, false));
      try {
        return new Table(type, rows, configHash, hash);
      } catch (IllegalArgumentException | UnsupportedValueException x) {
        throw new JsonParsingException(x);
      }
    }
  }

}
