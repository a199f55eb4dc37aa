/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.json;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Typed getters over {@code JSONObject}s.
 */
public class JsonUtils {

  private JsonUtils() {  }
  
  
  public static String getString(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected '" + name + "' missing");
      return null;
    }
    if (!(value instanceof String))
      throw new JsonParsingException("'" + name + "' expects a simple string: " + value);
    return value.toString();
  }
  
  
  public static Boolean getBoolean(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected boolean '" + name + "' missing");
      return null;
    }
    if (value instanceof Boolean)
      return (Boolean) value;
    if (value instanceof String) {
      String s = value.toString().trim();
      if (s.equalsIgnoreCase("true"))
        return Boolean.TRUE;
      if (s.equalsIgnoreCase("false"))
        return Boolean.FALSE;
    }
    throw new JsonParsingException("'" + name + "' expects a boolean: " + value);
  }
  
  
  public static JSONArray getJsonArray(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON array '" + name + "' missing");
      return null;
    }
    try {
      return (JSONArray) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a JSON array: " + value, ccx);
    }
  }
  
  
  public static JSONObject getJsonObject(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON object '" + name + "' missing");
      return null;
    }
    try {
      return (JSONObject) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a JSON object: " + value, ccx);
    }
  }

}
