/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import java.math.BigDecimal;
import java.sql.Clob;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.jtab.ColumnConfig;
import io.crums.jtab.ColumnType;
import io.crums.jtab.TableConfig;
import io.crums.jtab.UnsupportedColumnTypeException;
import io.crums.jtab.UnsupportedValueException;
import io.crums.jtab.json.CanonicalJson;
import io.crums.jtab.json.JsonParsingException;

/**
 * Converts JSON cell values to storage primitives, and back.
 * 
 * <h2>Mapping</h2>
 * <ul>
 * <li>{@code string} &harr; {@code String}</li>
 * <li>{@code number} &harr; {@code BigDecimal} (decoded to {@code Long},
 *     if integral and in range; {@code Double}, o.w.)</li>
 * <li>{@code boolean} &harr; {@code Integer} 0 or 1 (decoding, any non-zero
 *     number is {@code true})</li>
 * <li>{@code json}, {@code jsonArray} &harr; canonical JSON text</li>
 * <li>{@code null} (or absent) &harr; SQL {@code NULL}</li>
 * </ul>
 */
public class ColumnCodec {
  
  public final static ColumnCodec INSTANCE = new ColumnCodec();
  
  
  /**
   * Encodes the given cell value.
   * 
   * @param value JSON value, or {@code null}
   * @param type  the column type
   * 
   * @return storage primitive; {@code null} if {@code value} is
   * 
   * @throws UnsupportedValueException
   *         if {@code value} is not of the column's JSON kind, or is
   *         not serializable
   */
  public Object encode(Object value, ColumnType type) throws UnsupportedValueException {
    if (value == null)
      return null;
    checkType(type);
    if (!type.accepts(value))
      throw new UnsupportedValueException(
          "%s column does not accept %s value: %s"
          .formatted(type, value.getClass().getSimpleName(), value));
    
    switch (type) {
    case STRING:      return value;
    case NUMBER:      return CanonicalJson.toBigDecimal((Number) value);
    case BOOLEAN:     return ((Boolean) value) ? 1 : 0;
    case JSON:
    case JSON_ARRAY:  return CanonicalJson.toJson(value);
    default:
      throw new UnsupportedColumnTypeException("unsupported column type: " + type);
    }
  }
  
  
  /**
   * Encodes the given cell value using the column type's wire name.
   * 
   * @throws UnsupportedColumnTypeException if {@code typeName} is unknown
   * @see #encode(Object, ColumnType)
   */
  public Object encode(Object value, String typeName)
      throws UnsupportedColumnTypeException, UnsupportedValueException {
    return encode(value, ColumnType.forName(typeName));
  }
  
  
  /**
   * Decodes the given storage primitive.
   * 
   * @param primitive as read from storage, or {@code null}
   * @param type      the column type
   * 
   * @return JSON value; {@code null}, if {@code primitive} is
   * 
   * @throws UnsupportedValueException
   *         if {@code primitive} cannot be decoded to the column's type
   */
  public Object decode(Object primitive, ColumnType type) throws UnsupportedValueException {
    if (primitive == null)
      return null;
    checkType(type);
    
    switch (type) {
    case STRING:
      return text(primitive);
      
    case NUMBER:
      if (primitive instanceof Number num)
        return CanonicalJson.normalize(num);
      try {
        return CanonicalJson.normalize(new BigDecimal(text(primitive).trim()));
      } catch (NumberFormatException nfx) {
        throw new UnsupportedValueException("not a number: " + primitive, nfx);
      }
      
    case BOOLEAN:
      if (primitive instanceof Boolean)
        return primitive;
      if (primitive instanceof Number num)
        return CanonicalJson.toBigDecimal(num).signum() != 0;
      throw new UnsupportedValueException("not a boolean: " + primitive);
      
    case JSON:
      return parse(primitive, JSONObject.class);
    case JSON_ARRAY:
      return parse(primitive, JSONArray.class);
    default:
      throw new UnsupportedColumnTypeException("unsupported column type: " + type);
    }
  }
  
  
  /**
   * Encodes the given row's values in the order of the configuration's
   * columns. Absent members encode to {@code null}.
   * 
   * @throws UnsupportedValueException on the first bad value
   */
  public List<Object> encodeRow(Map<?, ?> row, TableConfig config)
      throws UnsupportedValueException {
    var values = new ArrayList<Object>(config.columns().size());
    for (var col : config.columns()) {
      try {
        values.add(encode(row.get(col.key()), col.type()));
      } catch (UnsupportedValueException uvx) {
        throw new UnsupportedValueException(
            "table '%s', column '%s': %s".formatted(config.key(), col.key(), uvx.getMessage()),
            uvx);
      }
    }
    return values;
  }
  
  
  /**
   * Decodes the given physical row (keyed by physical column name). Columns
   * whose value is SQL {@code NULL}, or that are absent, are omitted from the
   * returned row.
   * 
   * @param physicalRow values keyed by physical column name
   * @param config      the table configuration
   * @param names       physical name mapper
   */
  @SuppressWarnings("unchecked")
  public JSONObject decodeRow(
      Map<String, ?> physicalRow, TableConfig config, NameMapper names)
          throws UnsupportedValueException {
    var row = new JSONObject();
    for (ColumnConfig col : config.columns()) {
      Object primitive = physicalRow.get(names.toPhysicalColumn(col.key()));
      Object value;
      try {
        value = decode(primitive, col.type());
      } catch (UnsupportedValueException uvx) {
        throw new UnsupportedValueException(
            "table '%s', column '%s': %s".formatted(config.key(), col.key(), uvx.getMessage()),
            uvx);
      }
      if (value != null)
        row.put(col.key(), value);
    }
    return row;
  }
  
  
  
  private void checkType(ColumnType type) {
    if (type == null)
      throw new UnsupportedColumnTypeException("null column type");
  }
  
  
  private String text(Object primitive) {
    if (primitive instanceof String)
      return (String) primitive;
    if (primitive instanceof Clob clob) {
      try {
        return clob.getSubString(1, (int) clob.length());
      } catch (SQLException sx) {
        throw new UnsupportedValueException("on reading CLOB: " + sx.getMessage(), sx);
      }
    }
    return primitive.toString();
  }
  
  
  private <T> T parse(Object primitive, Class<T> kind) {
    Object value;
    try {
      value = CanonicalJson.parse(text(primitive));
    } catch (JsonParsingException jpx) {
      throw new UnsupportedValueException(jpx.getMessage(), jpx);
    }
    if (!kind.isInstance(value))
      throw new UnsupportedValueException(
          "expected %s; actual: %s".formatted(kind.getSimpleName(), primitive));
    return kind.cast(value);
  }

}
