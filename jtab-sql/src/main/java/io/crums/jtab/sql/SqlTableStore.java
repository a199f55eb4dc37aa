/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import static io.crums.jtab.JtabConstants.HASH;
import static io.crums.jtab.sql.SqlStoreConstants.getLogger;

import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

import org.json.simple.JSONObject;

import io.crums.jtab.HashMismatchException;
import io.crums.jtab.SchemaIncompatibleException;
import io.crums.jtab.Table;
import io.crums.jtab.TableBundle;
import io.crums.jtab.TableConfig;
import io.crums.jtab.UnsupportedValueException;
import io.crums.jtab.hash.IntegrityEngine;
import io.crums.jtab.sql.config.StoreConfig;

/**
 * JSON table store over a relational database. This is the public face of
 * the module: it owns the {@linkplain DbSession}, and combines the
 * {@linkplain SchemaRegistry}, {@linkplain QueryTranslator},
 * {@linkplain ColumnCodec} and {@linkplain IntegrityEngine} into
 * table-level operations.
 * 
 * <h2>Lifecycle</h2>
 * <p>
 * {@linkplain #init()} opens the connection and bootstraps the registry. Data
 * operations invoked before then fail fast with {@linkplain NotReadyException};
 * callers that would rather wait can chain on {@linkplain #isReady()}.
 * </p>
 * <h2>Writes</h2>
 * <p>
 * Rows are keyed by their content hash, so writing the same row twice is
 * harmless: the second insert is ignored. A write validates and encodes every
 * row before inserting any; rows that then fail to insert are collected and
 * reported together once the write completes. Rows already inserted stay
 * inserted.
 * </p>
 * <p>
 * All public methods are synchronized: a store is meant to be used by one
 * writer.
 * </p>
 */
public class SqlTableStore implements AutoCloseable {
  
  private final StoreConfig config;
  private final DbSession session;
  private final NameMapper names;
  private final ColumnCodec codec;
  private final QueryTranslator sql;
  private final IntegrityEngine integrity;
  private final CompletableFuture<Void> ready = new CompletableFuture<>();
  
  private SchemaRegistry registry;
  
  
  /** Creates an uninitialized instance using a private, in-memory H2 database. */
  public SqlTableStore() {
    this(StoreConfig.DEFAULT);
  }
  
  /**
   * Creates an uninitialized instance.
   * 
   * @see #init()
   */
  public SqlTableStore(StoreConfig config) {
    this.config = config;
    this.session = new DbSession();
    this.names = NameMapper.DEFAULT;
    this.codec = ColumnCodec.INSTANCE;
    this.sql = new QueryTranslator(names, codec);
    this.integrity = config.integrityEngine();
  }
  
  
  public StoreConfig config() {
    return config;
  }
  
  
  /**
   * Opens the database connection and bootstraps the table registry.
   * May only be called once.
   * 
   * @throws AlreadyOpenException if already called
   * @throws SqlStoreException on connection or DDL failure
   */
  public synchronized void init() throws AlreadyOpenException, SqlStoreException {
    if (ready.isDone() || session.isOpen())
      throw new AlreadyOpenException("store already initialized");
    
    session.open(config.dbConnection());
    try {
      var reg = new SchemaRegistry(session, sql, codec, integrity);
      reg.bootstrap();
      this.registry = reg;
    } catch (RuntimeException rx) {
      session.close();
      throw rx;
    }
    ready.complete(null);
    getLogger().log(Level.INFO, "table store ready: " + config.dbConnection().url());
  }
  
  
  /**
   * Returns a future that completes once {@linkplain #init()} has. The
   * returned future is a copy; completing it has no effect on this store.
   */
  public CompletableFuture<Void> isReady() {
    return ready.copy();
  }
  
  
  public synchronized boolean isOpen() {
    return session.isOpen();
  }
  
  
  /**
   * Closes the underlying connection. Further operations fail with
   * {@linkplain NotOpenException}.
   */
  @Override
  public synchronized void close() throws NotOpenException {
    session.close();
  }
  
  
  private SchemaRegistry registry() throws NotReadyException {
    if (!ready.isDone())
      throw new NotReadyException("table store not initialized (init() not invoked)");
    return registry;
  }
  
  
  /**
   * Creates the table described by the given configuration, or extends the
   * existing table with its added columns.
   * 
   * @return the active (hashed) configuration
   * 
   * @throws SchemaIncompatibleException
   *         if an existing column is removed, reordered, or retyped
   * @see SchemaRegistry#registerOrExtend(TableConfig)
   */
  public synchronized TableConfig createOrExtendTable(TableConfig tableConfig)
      throws NotReadyException, SchemaIncompatibleException, SqlStoreException {
    return registry().registerOrExtend(tableConfig);
  }
  
  
  /**
   * Writes the rows of a single table.
   * 
   * @see #write(TableBundle)
   */
  public WriteReport write(String tableKey, Table table)
      throws NotReadyException, AggregateWriteException {
    return write(TableBundle.of(tableKey, table));
  }
  
  
  /**
   * Writes the rows of every table in the given bundle. Missing row hashes
   * are computed; rows whose hash already exists are ignored.
   * 
   * <ol>
   * <li>Every table must be registered, and every row member must be a column
   *     of its table's active configuration.</li>
   * <li>Every row is encoded before any is inserted.</li>
   * <li>Rows are inserted one at a time. Failures don't stop the write.</li>
   * </ol>
   * 
   * @return the write's report (no failures)
   * 
   * @throws TableNotFoundException
   *         if a table is not registered (nothing written)
   * @throws ColumnNotFoundException
   *         if a row has a member that is not a column (nothing written)
   * @throws UnsupportedValueException
   *         if a cell value cannot be encoded (nothing written)
   * @throws HashMismatchException
   *         strict mode only, if a stamped hash is wrong (nothing written)
   * @throws AggregateWriteException
   *         if any row failed to insert, after every row is attempted
   */
  public synchronized WriteReport write(TableBundle data)
      throws NotReadyException, TableNotFoundException, ColumnNotFoundException,
      UnsupportedValueException, AggregateWriteException {
    
    var reg = registry();
    
    var configs = new TreeMap<String, TableConfig>();
    for (var e : data.tables().entrySet()) {
      String tableKey = e.getKey();
      TableConfig tableConfig = reg.activeConfig(tableKey);
      for (var row : e.getValue().data())
        for (Object member : row.keySet())
          if (!tableConfig.hasColumn(member.toString()))
            throw new ColumnNotFoundException(tableKey, member.toString());
      configs.put(tableKey, tableConfig);
    }
    
    TableBundle stamped = integrity.stamp(data);
    
    var inserts = new ArrayList<PendingRow>();
    for (var e : stamped.tables().entrySet()) {
      TableConfig tableConfig = configs.get(e.getKey());
      String insertSql = sql.insertRow(e.getKey(), tableConfig.columnKeys());
      for (JSONObject row : e.getValue().data())
        inserts.add(new PendingRow(
            e.getKey(),
            row.get(HASH).toString(),
            insertSql,
            codec.encodeRow(row, tableConfig)));
    }
    
    var report = new WriteReport();
    for (var pending : inserts) {
      try {
        if (session.execute(pending.sql(), pending.values()) > 0)
          report.recordInserted();
        else
          report.recordIgnored();
        
      } catch (SqlStoreException sx) {
        if (sx.isDuplicateKey()) {
          getLogger().log(Level.DEBUG,
              "row %s already in table '%s'".formatted(pending.rowHash(), pending.tableKey()));
          report.recordIgnored();
        } else {
          var msg = "Error inserting row %s into table '%s': %s"
              .formatted(pending.rowHash(), pending.tableKey(), sx.getMessage());
          getLogger().log(Level.WARNING, msg);
          report.recordFailure(new RowFailure(pending.tableKey(), pending.rowHash(), msg));
        }
      }
    }
    return report.throwIfFailed();
  }
  
  
  private record PendingRow(String tableKey, String rowHash, String sql, List<Object> values) {  }
  
  
  /**
   * Reads the rows of the given table whose columns equal the given values.
   * The returned table's rows are sorted by hash, and the table is stamped
   * with its (recomputed) hash.
   * 
   * @param where column key / value pairs (ANDed); empty for all rows
   * 
   * @return possibly empty table
   * 
   * @throws TableNotFoundException if not registered
   * @throws ColumnNotFoundException if a filter key is not a column
   * @throws UnsupportedPredicateTypeException if a filter value is not a JSON value
   */
  public synchronized Table readRows(String tableKey, Map<String, ?> where)
      throws NotReadyException, TableNotFoundException, ColumnNotFoundException,
      UnsupportedPredicateTypeException {
    
    TableConfig tableConfig = registry().activeConfig(tableKey);
    return readTable(tableConfig, sql.selectWhere(tableConfig, where));
  }
  
  
  private Table readTable(TableConfig tableConfig, Query query) {
    var rows = new ArrayList<JSONObject>();
    for (var physicalRow : session.query(query))
      rows.add(codec.decodeRow(physicalRow, tableConfig, names));
    
    var table = new Table(
        tableConfig.type(), rows, tableConfig.hash(), Optional.empty());
    return integrity.rehash(table);
  }
  
  
  /**
   * Returns a bundle containing all the rows of the given table.
   * 
   * @throws TableNotFoundException if not registered
   */
  public synchronized TableBundle dumpTable(String tableKey)
      throws NotReadyException, TableNotFoundException {
    TableConfig tableConfig = registry().activeConfig(tableKey);
    return TableBundle.of(tableKey, readTable(tableConfig, sql.selectAll(tableConfig)));
  }
  
  
  /**
   * Returns every registered table (the registry table included) in a single,
   * hashed bundle.
   */
  public synchronized TableBundle dumpAll() throws NotReadyException {
    var reg = registry();
    var tables = new TreeMap<String, Table>();
    for (var tableKey : reg.tableKeys()) {
      TableConfig tableConfig = reg.activeConfig(tableKey);
      tables.put(tableKey, readTable(tableConfig, sql.selectAll(tableConfig)));
    }
    return integrity.stamp(new TableBundle(tables));
  }
  
  
  /**
   * Returns the number of rows in the given table.
   * 
   * @throws TableNotFoundException if not registered
   */
  public synchronized long rowCount(String tableKey)
      throws NotReadyException, TableNotFoundException {
    registry().activeConfig(tableKey);
    return session.queryLong(sql.countRows(tableKey), List.of());
  }
  
  
  /**
   * Tests whether the given table is registered and exists.
   */
  public synchronized boolean tableExists(String tableKey) throws NotReadyException {
    var reg = registry();
    return reg.isRegistered(tableKey) && reg.physicalTableExists(tableKey);
  }
  
  
  /**
   * Returns the table's content type (its configuration's {@code type}).
   * 
   * @throws TableNotFoundException if not registered
   */
  public synchronized String contentType(String tableKey)
      throws NotReadyException, TableNotFoundException {
    return registry().activeConfig(tableKey).type();
  }
  
  
  /**
   * Returns the active configuration of the given table.
   * 
   * @throws TableNotFoundException if not registered
   */
  public synchronized TableConfig tableConfig(String tableKey)
      throws NotReadyException, TableNotFoundException {
    return registry().activeConfig(tableKey);
  }
  
  
  /**
   * Returns every stored configuration version of every table, ordered by
   * table key, then version.
   */
  public synchronized List<TableConfig> tableConfigs() throws NotReadyException {
    return registry().allConfigs();
  }
  
  
  /** Returns the versions of the given table's configuration, oldest first. */
  public synchronized List<TableConfig> tableConfigHistory(String tableKey)
      throws NotReadyException {
    return registry().history(tableKey);
  }

}
