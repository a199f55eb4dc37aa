/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql.config;


import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

import org.json.simple.JSONObject;

import io.crums.jtab.hash.IntegrityEngine;
import io.crums.jtab.json.JsonEntityParser;
import io.crums.jtab.json.JsonParsingException;
import io.crums.jtab.json.JsonUtils;

/**
 * Table store configuration.
 * 
 * <h2>Properties File</h2>
 * <p>
 * Every property is prefixed with {@linkplain #ROOT}. Only
 * {@linkplain #JDBC_URL} is required. The same settings may also be
 * expressed in JSON (see {@linkplain #PARSER}).
 * </p>
 * 
 * @param dbConnection  database connection parameters
 * @param strictHashes  if {@code true}, existing content hashes are verified
 *                      (and mismatches fail the operation)
 */
public record StoreConfig(DbConnection dbConnection, boolean strictHashes) {
  
  /**
   * Every property known to this configuration is prefixed with this value.
   */
  public final static String ROOT = "jtab.";
  
  /** JDBC connection URL. Required. */
  public final static String JDBC_URL = ROOT + "jdbc.url";
  /**
   * Fully qualified JDBC driver class name. If not set, a suitable driver is
   * assumed to be already registered for the URL.
   */
  public final static String JDBC_DRIVER = ROOT + "jdbc.driver";
  public final static String JDBC_USERNAME = ROOT + "jdbc.username";
  public final static String JDBC_PASSWORD = ROOT + "jdbc.password";
  /** {@code true} or {@code false} (default). */
  public final static String STRICT_HASHES = ROOT + "hash.strict";
  
  public final static List<String> PROP_NAMES =
      List.of(JDBC_URL, JDBC_DRIVER, JDBC_USERNAME, JDBC_PASSWORD, STRICT_HASHES);
  
  /** URL of a private, in-memory H2 database. */
  public final static String H2_MEM_URL = "jdbc:h2:mem:";
  
  /** Private in-memory H2 database; lenient hashing. */
  public final static StoreConfig DEFAULT = new StoreConfig(new DbConnection(H2_MEM_URL), false);
  
  /** JSON parser. */
  public final static JsonEntityParser<StoreConfig> PARSER = new Parser();
  
  
  public StoreConfig {
    Objects.requireNonNull(dbConnection, "null dbConnection");
  }
  
  
  /**
   * Returns a lenient configuration for a named in-memory H2 database. The
   * database lives as long as its connection.
   */
  public static StoreConfig inMemory(String dbName) {
    return new StoreConfig(new DbConnection(H2_MEM_URL + dbName), false);
  }
  
  
  /** Returns a copy of this instance with the given hash checking mode. */
  public StoreConfig strictHashes(boolean strict) {
    return strict == strictHashes ? this : new StoreConfig(dbConnection, strict);
  }
  
  
  /** Returns the integrity engine for this configuration's hashing mode. */
  public IntegrityEngine integrityEngine() {
    return strictHashes ? IntegrityEngine.STRICT : IntegrityEngine.LENIENT;
  }
  
  
  /**
   * Loads and returns the configuration from the given properties.
   * 
   * @throws IllegalArgumentException if a property is missing or malformed
   */
  public static StoreConfig fromProperties(Properties props) throws IllegalArgumentException {
    String url = props.getProperty(JDBC_URL);
    if (url == null || url.isBlank())
      throw new IllegalArgumentException("missing required property " + JDBC_URL);
    
    String driver = props.getProperty(JDBC_DRIVER);
    String username = props.getProperty(JDBC_USERNAME);
    String password = props.getProperty(JDBC_PASSWORD);
    if (username == null && password != null)
      throw new IllegalArgumentException(
          JDBC_PASSWORD + " set without " + JDBC_USERNAME);
    DbCredentials creds =
        username == null ? null : new DbCredentials(username, password == null ? "" : password);
    
    boolean strict;
    String strictValue = props.getProperty(STRICT_HASHES, "false").trim();
    if (strictValue.equalsIgnoreCase("true"))
      strict = true;
    else if (strictValue.equalsIgnoreCase("false"))
      strict = false;
    else
      throw new IllegalArgumentException(
          "%s must be 'true' or 'false': '%s'".formatted(STRICT_HASHES, strictValue));
    
    return new StoreConfig(new DbConnection(url.trim(), driver, creds), strict);
  }
  
  
  /**
   * Loads and returns the configuration from the given file. Files ending in
   * {@code .json} are parsed as JSON; all others, as properties files.
   * 
   * @throws UncheckedIOException on I/O error
   * @throws JsonParsingException if a {@code .json} file is malformed
   */
  public static StoreConfig load(File file)
      throws IllegalArgumentException, UncheckedIOException {
    if (file.getName().toLowerCase().endsWith(".json"))
      return PARSER.toEntity(file);
    
    var props = new Properties();
    try (var reader = new FileReader(file, StandardCharsets.UTF_8)) {
      props.load(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException("on loading " + file + ": " + iox.getMessage(), iox);
    }
    return fromProperties(props);
  }
  
  
  /** Returns this configuration as properties. */
  public Properties toProperties() {
    var props = new Properties();
    props.setProperty(JDBC_URL, dbConnection.url());
    dbConnection.driverClass().ifPresent(d -> props.setProperty(JDBC_DRIVER, d));
    dbConnection.creds().ifPresent(c -> {
      props.setProperty(JDBC_USERNAME, c.username());
      props.setProperty(JDBC_PASSWORD, c.password());
    });
    props.setProperty(STRICT_HASHES, Boolean.toString(strictHashes));
    return props;
  }
  
  
  
  public static class Parser implements JsonEntityParser<StoreConfig> {
    
    public final static String DB = "db";
    public final static String STRICT_HASHES = "strict_hashes";

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(StoreConfig config, JSONObject jObj) {
      jObj.put(DB, DbConnection.PARSER.toJsonObject(config.dbConnection()));
      jObj.put(STRICT_HASHES, config.strictHashes());
      return jObj;
    }

    @Override
    public StoreConfig toEntity(JSONObject jObj) throws JsonParsingException {
      var db = DbConnection.PARSER.toEntity(JsonUtils.getJsonObject(jObj, DB, true));
      Boolean strict = JsonUtils.getBoolean(jObj, STRICT_HASHES, false);
      return new StoreConfig(db, strict != null && strict);
    }
    
  }

}
