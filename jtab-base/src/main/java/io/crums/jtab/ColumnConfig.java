/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


import java.util.Objects;

import org.json.simple.JSONObject;

import io.crums.jtab.json.JsonEntityParser;
import io.crums.jtab.json.JsonParsingException;
import io.crums.jtab.json.JsonUtils;

/**
 * A column's key and type. Immutable once persisted.
 * 
 * @param key   unique within its table
 * @param type  not {@code null}
 * 
 * @see #PARSER
 */
public record ColumnConfig(String key, ColumnType type) {
  
  /** JSON parser. */
  public final static JsonEntityParser<ColumnConfig> PARSER = new Parser();
  
  
  public ColumnConfig {
    if (key.isBlank())
      throw new IllegalArgumentException("blank column key");
    Objects.requireNonNull(type, "null type");
  }
  
  
  @Override
  public String toString() {
    return key + ":" + type;
  }
  
  
  public static class Parser implements JsonEntityParser<ColumnConfig> {
    
    public final static String KEY = "key";
    public final static String TYPE = "type";

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(ColumnConfig column, JSONObject jObj) {
      jObj.put(KEY, column.key());
      jObj.put(TYPE, column.type().typeName());
      return jObj;
    }

    /**
     * {@inheritDoc}
     * 
     * @throws UnsupportedColumnTypeException if the type tag is unknown
     */
    @Override
    public ColumnConfig toEntity(JSONObject jObj)
        throws JsonParsingException, UnsupportedColumnTypeException {
      String key = JsonUtils.getString(jObj, KEY, true);
      ColumnType type = ColumnType.forName(JsonUtils.getString(jObj, TYPE, true));
      try {
        return new ColumnConfig(key, type);
      } catch (IllegalArgumentException iax) {
        throw new JsonParsingException(iax);
      }
    }
  }

}
