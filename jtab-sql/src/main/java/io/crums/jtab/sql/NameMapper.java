/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Maps logical table and column keys to physical SQL identifiers, and back.
 * A physical name is the logical key plus a suffix ({@code _tbl} for tables,
 * {@code _col} for columns), so no logical key can collide with an SQL
 * reserved word. Physical names are always double-quoted in generated SQL.
 * 
 * <h2>Keys</h2>
 * <p>
 * Logical keys must be plain identifiers ({@code [A-Za-z_][A-Za-z0-9_]*}, at
 * most {@linkplain #MAX_KEY_LENGTH} characters).
 * </p>
 */
public class NameMapper {
  
  public final static String TABLE_SUFFIX = "_tbl";
  public final static String COLUMN_SUFFIX = "_col";
  
  public final static int MAX_KEY_LENGTH = 64;
  
  private final static Pattern KEY_REGEX = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  
  /** Instance using the standard suffixes. */
  public final static NameMapper DEFAULT = new NameMapper(TABLE_SUFFIX, COLUMN_SUFFIX);
  
  
  private final String tableSuffix;
  private final String columnSuffix;
  
  
  /**
   * @param tableSuffix   appended to table keys
   * @param columnSuffix  appended to column keys
   */
  public NameMapper(String tableSuffix, String columnSuffix) {
    this.tableSuffix = checkSuffix(tableSuffix);
    this.columnSuffix = checkSuffix(columnSuffix);
    if (tableSuffix.equals(columnSuffix))
      throw new IllegalArgumentException(
          "table and column suffixes must differ: " + tableSuffix);
  }
  
  private static String checkSuffix(String suffix) {
    if (suffix.isEmpty() || !suffix.matches("[A-Za-z0-9_]+"))
      throw new IllegalArgumentException("illegal suffix: '" + suffix + "'");
    return suffix;
  }
  
  
  public String tableSuffix() {
    return tableSuffix;
  }
  
  public String columnSuffix() {
    return columnSuffix;
  }
  
  
  /**
   * Checks and returns the given logical key.
   * 
   * @throws IllegalArgumentException if not a legal key
   */
  public static String checkKey(String key) throws IllegalArgumentException {
    Objects.requireNonNull(key, "null key");
    if (key.length() > MAX_KEY_LENGTH)
      throw new IllegalArgumentException(
          "key too long (%d > %d): %s".formatted(key.length(), MAX_KEY_LENGTH, key));
    if (!KEY_REGEX.matcher(key).matches())
      throw new IllegalArgumentException("illegal key: '" + key + "'");
    return key;
  }
  
  
  public String toPhysicalTable(String tableKey) {
    return checkKey(tableKey) + tableSuffix;
  }
  
  public String toPhysicalColumn(String columnKey) {
    return checkKey(columnKey) + columnSuffix;
  }
  
  
  /**
   * Returns the logical table key of the given physical name.
   * 
   * @throws IllegalArgumentException if the name doesn't end with the table suffix
   */
  public String toLogicalTable(String physicalName) {
    return strip(physicalName, tableSuffix);
  }
  
  /**
   * Returns the logical column key of the given physical name.
   * 
   * @throws IllegalArgumentException if the name doesn't end with the column suffix
   */
  public String toLogicalColumn(String physicalName) {
    return strip(physicalName, columnSuffix);
  }
  
  
  private String strip(String physicalName, String suffix) {
    if (!physicalName.endsWith(suffix) || physicalName.length() == suffix.length())
      throw new IllegalArgumentException(
          "'%s' does not end with '%s'".formatted(physicalName, suffix));
    return checkKey(physicalName.substring(0, physicalName.length() - suffix.length()));
  }
  
  
  /** Returns the given identifier double-quoted. */
  public static String quote(String identifier) {
    if (identifier.indexOf('"') != -1)
      throw new IllegalArgumentException("quote char in identifier: " + identifier);
    return '"' + identifier + '"';
  }
  
  
  /** Returns the quoted physical name of the given table. */
  public String quotedTable(String tableKey) {
    return quote(toPhysicalTable(tableKey));
  }
  
  /** Returns the quoted physical name of the given column. */
  public String quotedColumn(String columnKey) {
    return quote(toPhysicalColumn(columnKey));
  }

}
