/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab;


import java.util.List;
import java.util.Map;

/**
 * The closed set of column types. Each type has a wire name, used in
 * table configurations.
 */
public enum ColumnType {
  
  /** JSON string. */
  STRING("string"),
  /** JSON number. */
  NUMBER("number"),
  /** JSON {@code true} / {@code false}. */
  BOOLEAN("boolean"),
  /** JSON object. */
  JSON("json"),
  /** JSON array. */
  JSON_ARRAY("jsonArray");
  
  
  private final String typeName;
  
  private ColumnType(String typeName) {
    this.typeName = typeName;
  }
  
  
  /** Returns the wire name (e.g. {@code "jsonArray"}). */
  public String typeName() {
    return typeName;
  }
  
  
  /**
   * Tests whether the given (non-null) value is of this type's JSON kind.
   * Elements of JSON values are not inspected.
   */
  public boolean accepts(Object value) {
    switch (this) {
    case STRING:      return value instanceof String;
    case NUMBER:      return value instanceof Number;
    case BOOLEAN:     return value instanceof Boolean;
    case JSON:        return value instanceof Map;
    case JSON_ARRAY:  return value instanceof List;
    default:
      throw new AssertionError("unaccounted type " + this);
    }
  }
  
  
  /**
   * Returns the instance with the given wire name.
   * 
   * @throws UnsupportedColumnTypeException if there is no such type
   */
  public static ColumnType forName(String typeName) throws UnsupportedColumnTypeException {
    for (var type : values())
      if (type.typeName.equals(typeName))
        return type;
    throw new UnsupportedColumnTypeException("unsupported column type: " + typeName);
  }

  
  @Override
  public String toString() {
    return typeName;
  }
  
}
