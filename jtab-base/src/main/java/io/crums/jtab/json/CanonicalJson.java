/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.json;


import static io.crums.jtab.JtabConstants.HASH;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import io.crums.jtab.UnsupportedValueException;

/**
 * Deterministic JSON text. Object members are written in key order,
 * there's no whitespace, and numbers are written in a normalized form
 * so that {@code 1}, {@code 1.0} and {@code 1.00} all write as {@code 1}.
 * 
 * <h2>Accepted Values</h2>
 * <p>
 * {@code null}, {@code String}, {@code Boolean}, finite {@code Number}s,
 * {@code Map}s with {@code String} keys, and {@code List}s, nested to any
 * depth. Anything else is an {@linkplain UnsupportedValueException}.
 * </p>
 */
public class CanonicalJson {
  
  // no one calls
  private CanonicalJson() {  }
  
  
  /**
   * Returns the canonical JSON text of the given value.
   * 
   * @throws UnsupportedValueException if {@code value} is not a JSON value
   */
  public static String toJson(Object value) throws UnsupportedValueException {
    var out = new StringBuilder();
    append(value, false, out);
    return out.toString();
  }
  
  
  /**
   * Returns the canonical JSON text of the given value, less any
   * {@linkplain io.crums.jtab.JtabConstants#HASH _hash} member at any
   * object level. This is what gets hashed.
   * 
   * @throws UnsupportedValueException if {@code value} is not a JSON value
   */
  public static String toHashInput(Object value) throws UnsupportedValueException {
    var out = new StringBuilder();
    append(value, true, out);
    return out.toString();
  }
  
  
  /**
   * Parses and returns the given JSON text.
   * 
   * @return a {@code JSONObject}, {@code JSONArray}, {@code String},
   *         {@code Long}, {@code Double}, {@code Boolean}, or {@code null}
   */
  public static Object parse(String json) throws JsonParsingException {
    try {
      return new JSONParser().parse(json);
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + json, px);
    } catch (RuntimeException rx) {
      throw new JsonParsingException(
          "unreadable json (" + rx.getMessage() + "): " + json, rx);
    }
  }
  
  
  /**
   * Tests whether the given value is a (possibly nested) JSON value.
   */
  public static boolean isJsonValue(Object value) {
    try {
      append(value, false, new StringBuilder());
      return true;
    } catch (UnsupportedValueException x) {
      return false;
    }
  }
  
  
  /**
   * Returns a deep copy of the given JSON value using {@code json.simple}
   * collection types. Scalars are returned as-is (numbers normalized).
   * 
   * @throws UnsupportedValueException if {@code value} is not a JSON value
   */
  @SuppressWarnings("unchecked")
  public static Object copy(Object value) throws UnsupportedValueException {
    if (value instanceof Map) {
      var map = (Map<?, ?>) value;
      JSONObject copy = new JSONObject();
      for (var e : map.entrySet())
        copy.put(checkKey(e.getKey()), copy(e.getValue()));
      return copy;
    }
    if (value instanceof List) {
      JSONArray copy = new JSONArray();
      for (var element : (List<?>) value)
        copy.add(copy(element));
      return copy;
    }
    if (value instanceof Number)
      return normalize((Number) value);
    if (value == null || value instanceof String || value instanceof Boolean)
      return value;
    throw new UnsupportedValueException(
        "not a JSON value: " + value + " (" + value.getClass().getName() + ")");
  }
  
  
  /**
   * Normalizes the representation of the given number. Integral values
   * that fit in a {@code long} are returned as {@code Long}s; otherwise, a
   * {@code Double} is returned.
   * 
   * @throws UnsupportedValueException if not finite
   */
  public static Number normalize(Number n) throws UnsupportedValueException {
    if (n instanceof Long)
      return n;
    if (n instanceof Integer || n instanceof Short || n instanceof Byte)
      return n.longValue();
    
    BigDecimal dec = toBigDecimal(n).stripTrailingZeros();
    if (dec.scale() <= 0) {
      try {
        return dec.longValueExact();
      } catch (ArithmeticException overflow) {
        return dec.doubleValue();
      }
    }
    return dec.doubleValue();
  }
  
  
  /**
   * Returns the given number as a {@code BigDecimal}.
   * 
   * @throws UnsupportedValueException if not finite
   */
  public static BigDecimal toBigDecimal(Number n) throws UnsupportedValueException {
    if (n instanceof BigDecimal)
      return (BigDecimal) n;
    if (n instanceof BigInteger)
      return new BigDecimal((BigInteger) n);
    if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte)
      return BigDecimal.valueOf(n.longValue());
    
    double d = n.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d))
      throw new UnsupportedValueException("not a JSON number: " + n);
    return BigDecimal.valueOf(d);
  }
  
  
  
  private static String checkKey(Object key) {
    if (key instanceof String)
      return (String) key;
    throw new UnsupportedValueException("non-string JSON member name: " + key);
  }
  
  
  private static void append(Object value, boolean skipHash, StringBuilder out) {
    if (value == null) {
      out.append("null");
    
    } else if (value instanceof String) {
      out.append('"').append(JSONValue.escape((String) value)).append('"');
    
    } else if (value instanceof Boolean) {
      out.append(value.toString());
    
    } else if (value instanceof Number) {
      out.append(numberText((Number) value));
    
    } else if (value instanceof Map) {
      var sorted = new TreeMap<String, Object>();
      for (var e : ((Map<?, ?>) value).entrySet())
        sorted.put(checkKey(e.getKey()), e.getValue());
      if (skipHash)
        sorted.remove(HASH);
      
      out.append('{');
      boolean first = true;
      for (var e : sorted.entrySet()) {
        if (!first)
          out.append(',');
        first = false;
        out.append('"').append(JSONValue.escape(e.getKey())).append("\":");
        append(e.getValue(), skipHash, out);
      }
      out.append('}');
    
    } else if (value instanceof List) {
      out.append('[');
      boolean first = true;
      for (var element : (List<?>) value) {
        if (!first)
          out.append(',');
        first = false;
        append(element, skipHash, out);
      }
      out.append(']');
    
    } else
      throw new UnsupportedValueException(
          "not a JSON value: " + value + " (" + value.getClass().getName() + ")");
  }
  
  
  
  /**
   * Integral values that fit in a {@code long} are written as integer
   * literals; all others in {@code BigDecimal} notation (e.g. {@code 1E+20}),
   * so that they parse back as {@code Double}s.
   */
  private static String numberText(Number n) {
    Number normalized = normalize(n);
    if (normalized instanceof Long)
      return normalized.toString();
    return toBigDecimal(normalized).stripTrailingZeros().toString();
  }

}
