/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import static io.crums.jtab.sql.SqlStoreConstants.getLogger;

import java.lang.System.Logger.Level;
import java.nio.channels.Channel;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import io.crums.jtab.sql.config.DbConnection;

/**
 * A single JDBC connection, opened and closed explicitly. This is the only
 * class that touches JDBC statements; everything above it passes SQL text
 * and parameter lists.
 * 
 * <h2>State</h2>
 * <p>
 * An instance starts out closed. {@linkplain #open(DbConnection) Opening} it
 * twice fails with {@linkplain AlreadyOpenException}; using (or closing) it
 * while closed fails with {@linkplain NotOpenException}. The connection is in
 * auto-commit mode, except inside {@linkplain #transaction(Supplier)}.
 * </p>
 * <p>
 * Methods are synchronized, so statements never interleave.
 * </p>
 */
public class DbSession implements Channel {
  
  /**
   * Returns a new, open instance.
   * 
   * @see #open(DbConnection)
   */
  public static DbSession newInstance(DbConnection dbConn)
      throws SqlStoreException {
    return new DbSession().open(dbConn);
  }
  
  
  private Connection connection;
  private String url;
  
  
  /** Creates a closed instance. */
  public DbSession() {  }
  
  
  /**
   * Opens a connection to the given database.
   * 
   * @return {@code this}
   * 
   * @throws AlreadyOpenException if already open
   * @throws SqlStoreException if the driver is not found, or on connection failure
   */
  public synchronized DbSession open(DbConnection dbConn)
      throws AlreadyOpenException, SqlStoreException {
    
    checkNotOpen();
    
    if (dbConn.driverClass().isPresent()) {
      String driver = dbConn.driverClass().get();
      try {
        Class.forName(driver);
      } catch (ClassNotFoundException cnfx) {
        throw new SqlStoreException(
            "Driver class %s not found".formatted(driver), cnfx);
      }
    }
    
    Connection con;
    try {
      if (dbConn.creds().isPresent()) {
        var creds = dbConn.creds().get();
        con = DriverManager.getConnection(
            dbConn.url(), creds.username(), creds.password());
      } else
        con = DriverManager.getConnection(dbConn.url());
      
    } catch (SQLException sx) {
      throw new SqlStoreException(
          "on connecting to %s: %s".formatted(dbConn.url(), sx.getMessage()), sx);
    }
    return adopt(con, dbConn.url());
  }
  
  
  private DbSession adopt(Connection con, String url) {
    try {
      con.setAutoCommit(true);
    } catch (SQLException sx) {
      closeQuietly(con);
      throw new SqlStoreException(sx);
    }
    this.connection = con;
    this.url = url;
    getLogger().log(Level.DEBUG, "opened database session: " + url);
    return this;
  }
  
  
  private void checkNotOpen() {
    if (connection != null)
      throw new AlreadyOpenException("Database is already open: " + url);
  }
  
  
  private Connection connection() throws NotOpenException {
    if (connection == null)
      throw new NotOpenException("Database is not open");
    return connection;
  }
  

  /**
   * Closes the connection. Errors on closing are logged and otherwise ignored.
   * 
   * @throws NotOpenException if not open
   */
  @Override
  public synchronized void close() throws NotOpenException {
    Connection con = connection();
    connection = null;
    closeQuietly(con);
    getLogger().log(Level.DEBUG, "closed database session: " + url);
  }
  
  
  private void closeQuietly(Connection con) {
    try {
      con.close();
    } catch (SQLException sx) {
      getLogger().log(Level.WARNING,
          "ignoring error on closing database connection (%s): %s"
          .formatted(con, sx));
    }
  }
  

  @Override
  public synchronized boolean isOpen() throws SqlStoreException {
    try {
      return connection != null && !connection.isClosed();
    } catch (SQLException sx) {
      throw new SqlStoreException(sx);
    }
  }
  
  
  /** Returns the connection URL, if open. */
  public synchronized Optional<String> url() {
    return connection == null ? Optional.empty() : Optional.ofNullable(url);
  }
  
  
  /**
   * Executes the given DDL statement. The statement is logged at {@code INFO}
   * level.
   */
  public synchronized void executeDdl(String sql) throws NotOpenException, SqlStoreException {
    getLogger().log(Level.INFO, "Executing SQL DDL:%n%s".formatted(sql));
    try (var stmt = connection().createStatement()) {
      stmt.execute(sql);
    } catch (SQLException sx) {
      throw new SqlStoreException(
          "on executing DDL: %s%n%s".formatted(sx.getMessage(), sql), sx);
    }
  }
  
  
  /**
   * Executes the given (non-query) statement.
   * 
   * @return number of rows affected
   */
  public synchronized int execute(String sql, List<?> params)
      throws NotOpenException, SqlStoreException {
    try (var stmt = prepare(sql, params)) {
      return stmt.executeUpdate();
    } catch (SQLException sx) {
      throw new SqlStoreException(
          "on executing [%s]: %s".formatted(sql, sx.getMessage()), sx);
    }
  }
  
  /** @see #execute(String, List) */
  public int execute(Query query) throws NotOpenException, SqlStoreException {
    return execute(query.sql(), query.params());
  }
  
  
  /**
   * Runs the given query and returns its rows. Each row maps column label
   * to value, in select order.
   */
  public synchronized List<Map<String, Object>> query(String sql, List<?> params)
      throws NotOpenException, SqlStoreException {
    try (var stmt = prepare(sql, params);
         var rs = stmt.executeQuery()) {
      
      var meta = rs.getMetaData();
      final int cc = meta.getColumnCount();
      var labels = new String[cc];
      for (int index = 0; index < cc; ++index)
        labels[index] = meta.getColumnLabel(index + 1);
      
      var rows = new ArrayList<Map<String, Object>>();
      while (rs.next()) {
        var row = new LinkedHashMap<String, Object>();
        for (int index = 0; index < cc; ++index)
          row.put(labels[index], rs.getObject(index + 1));
        rows.add(row);
      }
      return rows;
      
    } catch (SQLException sx) {
      throw new SqlStoreException(
          "on query [%s]: %s".formatted(sql, sx.getMessage()), sx);
    }
  }
  
  /** @see #query(String, List) */
  public List<Map<String, Object>> query(Query query)
      throws NotOpenException, SqlStoreException {
    return query(query.sql(), query.params());
  }
  
  
  /** Returns the first row of the given query, if any. */
  public Optional<Map<String, Object>> queryOne(String sql, List<?> params)
      throws NotOpenException, SqlStoreException {
    var rows = query(sql, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
  
  
  /**
   * Returns the first column of the first row of the given query as a
   * {@code long}. For {@code COUNT(*)} queries.
   */
  public long queryLong(String sql, List<?> params)
      throws NotOpenException, SqlStoreException {
    var row = queryOne(sql, params).orElseThrow(
        () -> new SqlStoreException("no rows returned: " + sql));
    Object value = row.values().iterator().next();
    if (value instanceof Number num)
      return num.longValue();
    throw new SqlStoreException("expected a number from [%s]: %s".formatted(sql, value));
  }
  
  
  /**
   * Returns the column labels of the given query's result set.
   */
  public synchronized List<String> columnLabels(String sql)
      throws NotOpenException, SqlStoreException {
    try (var stmt = connection().prepareStatement(sql);
         var rs = stmt.executeQuery()) {
      var meta = rs.getMetaData();
      var labels = new ArrayList<String>(meta.getColumnCount());
      for (int index = 1; index <= meta.getColumnCount(); ++index)
        labels.add(meta.getColumnLabel(index));
      return labels;
    } catch (SQLException sx) {
      throw new SqlStoreException(
          "on query [%s]: %s".formatted(sql, sx.getMessage()), sx);
    }
  }
  
  
  /**
   * Runs the given work in a single transaction. If {@code work} throws, the
   * transaction is rolled back and the exception is rethrown. Auto-commit
   * is restored on return.
   */
  public synchronized <T> T transaction(Supplier<T> work)
      throws NotOpenException, SqlStoreException {
    Connection con = connection();
    try {
      con.setAutoCommit(false);
    } catch (SQLException sx) {
      throw new SqlStoreException(sx);
    }
    try {
      T result = work.get();
      con.commit();
      return result;
    
    } catch (SQLException sx) {
      rollback(con, sx);
      throw new SqlStoreException("on commit: " + sx.getMessage(), sx);
    } catch (RuntimeException rx) {
      rollback(con, rx);
      throw rx;
    } finally {
      try {
        con.setAutoCommit(true);
      } catch (SQLException sx) {
        getLogger().log(Level.WARNING, "failed to restore auto-commit: " + sx);
      }
    }
  }
  
  
  private void rollback(Connection con, Exception cause) {
    try {
      con.rollback();
    } catch (SQLException sx) {
      cause.addSuppressed(sx);
    }
  }
  
  
  private PreparedStatement prepare(String sql, List<?> params) throws SQLException {
    PreparedStatement stmt = connection().prepareStatement(sql);
    try {
      for (int index = 0; index < params.size(); ++index)
        stmt.setObject(index + 1, params.get(index));
    } catch (SQLException sx) {
      stmt.close();
      throw sx;
    }
    return stmt;
  }
  
  
  @Override
  public String toString() {
    return "DbSession[" + (connection == null ? "closed" : url) + "]";
  }

}
