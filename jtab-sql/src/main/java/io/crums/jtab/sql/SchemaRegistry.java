/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import static io.crums.jtab.sql.SqlStoreConstants.getLogger;

import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.json.simple.JSONObject;

import io.crums.jtab.ColumnConfig;
import io.crums.jtab.ColumnType;
import io.crums.jtab.SchemaIncompatibleException;
import io.crums.jtab.TableConfig;
import io.crums.jtab.UnsupportedColumnTypeException;
import io.crums.jtab.hash.IntegrityEngine;
import io.crums.jtab.json.JsonParsingException;

/**
 * Append-only log of table configurations, itself stored as a table.
 * 
 * <h2>Versions</h2>
 * <p>
 * Each configuration a table key was registered (or extended) with is a row
 * in the {@linkplain #REGISTRY_KEY tableCfgs} table, keyed by its content hash.
 * A table's versions form a prefix chain (each version's columns start with
 * the previous version's columns), so the active version is simply the one
 * with the most columns.
 * </p>
 * <h2>Migration Order</h2>
 * <p>
 * On extension the new version is recorded <em>before</em> the physical table
 * is altered. If altering fails midway, the next registration of the same
 * configuration finds the missing physical columns and adds them.
 * </p>
 * <p>
 * Nothing is cached: every lookup reads the registry table.
 * </p>
 */
public class SchemaRegistry {
  
  /** Logical key of the registry table. Reserved. */
  public final static String REGISTRY_KEY = "tableCfgs";
  
  /** Configuration of the registry table (unhashed). */
  public final static TableConfig REGISTRY_CONFIG =
      TableConfig.of(
          REGISTRY_KEY,
          REGISTRY_KEY,
          new ColumnConfig(TableConfig.Parser.KEY, ColumnType.STRING),
          new ColumnConfig(TableConfig.Parser.TYPE, ColumnType.STRING),
          new ColumnConfig(TableConfig.Parser.COLUMNS, ColumnType.JSON_ARRAY));
  
  
  private final DbSession session;
  private final QueryTranslator sql;
  private final ColumnCodec codec;
  private final IntegrityEngine integrity;
  private final TableConfig registryConfig;
  
  
  /**
   * 
   * @param session     open database session
   * @param sql         SQL generator
   * @param codec       cell codec
   * @param integrity   used to stamp configuration hashes
   */
  public SchemaRegistry(
      DbSession session, QueryTranslator sql, ColumnCodec codec, IntegrityEngine integrity) {
    this.session = session;
    this.sql = sql;
    this.codec = codec;
    this.integrity = integrity;
    this.registryConfig = integrity.stamp(REGISTRY_CONFIG);
  }
  
  
  /**
   * Creates the registry table, if it doesn't exist, and records the
   * registry's own configuration in it.
   * 
   * @return the registry's (hashed) configuration
   */
  public synchronized TableConfig bootstrap() throws SqlStoreException {
    session.executeDdl(sql.createTable(registryConfig));
    if (history(REGISTRY_KEY).isEmpty())
      insertConfig(registryConfig);
    return registryConfig;
  }
  
  
  /**
   * Registers the given configuration, or extends an existing table with it.
   * 
   * <ul>
   * <li>Unregistered key: the configuration is recorded and its table created.</li>
   * <li>Same columns as active: nothing is recorded. Physical columns missing
   *     (from an interrupted migration) are added.</li>
   * <li>Strict extension of active: the new version is recorded, then the
   *     new columns are added to the table.</li>
   * </ul>
   * 
   * @param config the proposed configuration (hash, if any, is ignored in
   *               lenient mode)
   * 
   * @return the active (hashed) configuration
   * 
   * @throws SchemaIncompatibleException
   *         if an active column is removed, reordered, or retyped (or the
   *         table type changed)
   * @throws IllegalArgumentException
   *         if the table or a column key is illegal, or if the table key is
   *         {@linkplain #REGISTRY_KEY reserved}
   */
  public synchronized TableConfig registerOrExtend(TableConfig config)
      throws SchemaIncompatibleException, SqlStoreException {
    
    if (REGISTRY_KEY.equals(config.key()))
      throw new IllegalArgumentException("reserved table key: " + REGISTRY_KEY);
    var names = sql.names();
    NameMapper.checkKey(config.key());
    config.columnKeys().forEach(NameMapper::checkKey);
    
    TableConfig proposed =
        integrity.stamp(integrity.isStrict() ? config : config.sansHash());
    Optional<TableConfig> active = findActiveConfig(config.key());
    
    if (active.isEmpty()) {
      insertConfig(proposed);
      session.executeDdl(sql.createTable(proposed));
      getLogger().log(Level.INFO,
          "registered table '%s' (%s)".formatted(config.key(), names.toPhysicalTable(config.key())));
      return proposed;
    }
    
    TableConfig current = active.get();
    List<ColumnConfig> added = current.addedColumns(proposed);
    if (added.isEmpty()) {
      repairTable(current);
      return current;
    }
    
    insertConfig(proposed);
    for (var ddl : sql.alterTable(config.key(), added))
      session.executeDdl(ddl);
    getLogger().log(Level.INFO,
        "extended table '%s' with %s".formatted(config.key(), added));
    return proposed;
  }
  
  
  /**
   * Re-creates the physical table, or adds its missing columns, if the
   * physical schema lags the given active configuration.
   */
  private void repairTable(TableConfig active) {
    if (!physicalTableExists(active.key())) {
      getLogger().log(Level.WARNING,
          "table '%s' registered but missing; creating".formatted(active.key()));
      session.executeDdl(sql.createTable(active));
      return;
    }
    var names = sql.names();
    var present = new HashSet<String>();
    for (var label : session.columnLabels(sql.probeColumns(active.key())))
      present.add(label);
    
    var missing = active.columns().stream()
        .filter(col -> !present.contains(names.toPhysicalColumn(col.key())))
        .toList();
    if (missing.isEmpty())
      return;
    
    getLogger().log(Level.WARNING,
        "table '%s' missing columns %s (interrupted migration?); adding"
        .formatted(active.key(), missing));
    for (var ddl : sql.alterTable(active.key(), missing))
      session.executeDdl(ddl);
  }
  
  
  /** Tests whether the given table's physical table exists. */
  public boolean physicalTableExists(String tableKey) {
    var query = sql.tableExists(tableKey);
    return session.queryLong(query.sql(), query.params()) > 0;
  }
  
  
  private void insertConfig(TableConfig hashed) {
    var row = TableConfig.PARSER.toJsonObject(hashed);
    session.execute(
        sql.insertRow(REGISTRY_KEY, registryConfig.columnKeys()),
        codec.encodeRow(row, registryConfig));
  }
  
  
  /**
   * Returns the active configuration of the given table.
   * 
   * @throws TableNotFoundException if not registered
   */
  public TableConfig activeConfig(String tableKey) throws TableNotFoundException {
    return findActiveConfig(tableKey).orElseThrow(
        () -> new TableNotFoundException(tableKey));
  }
  
  
  /** Finds and returns the active configuration of the given table. */
  public Optional<TableConfig> findActiveConfig(String tableKey) {
    var versions = history(tableKey);
    return versions.isEmpty() ?
        Optional.empty() : Optional.of(versions.get(versions.size() - 1));
  }
  
  
  public boolean isRegistered(String tableKey) {
    return !history(tableKey).isEmpty();
  }
  
  
  /**
   * Returns the given table's configuration versions, oldest first.
   * 
   * @return possibly empty list
   * @throws SchemaIncompatibleException
   *         if the stored versions do not form a prefix chain
   */
  public synchronized List<TableConfig> history(String tableKey)
      throws SchemaIncompatibleException {
    var query = sql.selectWhere(
        registryConfig, Map.of(TableConfig.Parser.KEY, tableKey));
    return chain(tableKey, readConfigs(query));
  }
  
  
  /**
   * Returns every stored configuration (every version of every table,
   * including the registry's own), ordered by table key, then version.
   */
  public synchronized List<TableConfig> allConfigs() {
    var byKey = new TreeMap<String, List<TableConfig>>();
    for (var config : readConfigs(sql.selectAll(registryConfig)))
      byKey.computeIfAbsent(config.key(), k -> new ArrayList<>()).add(config);
    
    var all = new ArrayList<TableConfig>();
    for (var e : byKey.entrySet())
      all.addAll(chain(e.getKey(), e.getValue()));
    return all;
  }
  
  
  /** Returns the keys of every registered table (including the registry's). */
  public synchronized SortedSet<String> tableKeys() {
    var keys = new TreeSet<String>();
    for (var config : readConfigs(sql.selectAll(registryConfig)))
      keys.add(config.key());
    return keys;
  }
  
  
  /** Returns the registry's own (hashed) configuration. */
  public TableConfig registryConfig() {
    return registryConfig;
  }
  
  
  private List<TableConfig> readConfigs(Query query) {
    var configs = new ArrayList<TableConfig>();
    for (var physicalRow : session.query(query)) {
      JSONObject row = codec.decodeRow(physicalRow, registryConfig, sql.names());
      try {
        configs.add(TableConfig.PARSER.toEntity(row));
      } catch (JsonParsingException | UnsupportedColumnTypeException | IllegalArgumentException x) {
        throw new SchemaIncompatibleException(
            "corrupt table config in registry: " + row, x);
      }
    }
    return configs;
  }
  
  
  /** Orders the given versions and checks they form a prefix chain. */
  private List<TableConfig> chain(String tableKey, List<TableConfig> versions) {
    if (versions.size() < 2)
      return versions;
    
    var sorted = new ArrayList<>(versions);
    sorted.sort(Comparator.comparingInt(c -> c.columns().size()));
    for (int index = 1; index < sorted.size(); ++index) {
      var prev = sorted.get(index - 1);
      var next = sorted.get(index);
      if (prev.addedColumns(next).isEmpty())
        throw new SchemaIncompatibleException(
            "table '%s': duplicate versions in registry: %s, %s"
            .formatted(tableKey, prev.hash().orElse("?"), next.hash().orElse("?")));
    }
    return sorted;
  }

}
