/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql.config;

import org.json.simple.JSONObject;

import io.crums.jtab.json.JsonEntityParser;
import io.crums.jtab.json.JsonParsingException;
import io.crums.jtab.json.JsonUtils;

/**
 * Database credentials.
 * 
 * @see DbCredentials#PARSER
 */
public record DbCredentials(String username, String password) {
  

  /** JSON parser. */
  public final static JsonEntityParser<DbCredentials> PARSER = new Parser();
  
  /**
   * Full constructor.
   * 
   * @param username    not empty
   * @param password    not {@code null}; may be empty (H2's default {@code sa}
   *                    user has an empty password)
   */
  public DbCredentials {
    if (username.isEmpty())
      throw new IllegalArgumentException("empty username");
    if (password == null)
      throw new NullPointerException("null password");
  }
  
  
  @Override
  public String toString() {
    return "DbCredentials[username=" + username + ", password=***]";
  }
  
  
  public static class Parser implements JsonEntityParser<DbCredentials> {

    public final static String USERNAME = "username";
    public final static String PASSWORD = "password";
    

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(DbCredentials creds, JSONObject jObj) {
      jObj.put(USERNAME, creds.username());
      jObj.put(PASSWORD, creds.password());
      return jObj;
    }

    @Override
    public DbCredentials toEntity(JSONObject jObj) throws JsonParsingException {
      var username = JsonUtils.getString(jObj, USERNAME, true);
      var password = JsonUtils.getString(jObj, PASSWORD, false);
      try {
        return new DbCredentials(username, password == null ? "" : password);
      } catch (Exception x) {
        throw new JsonParsingException(x);
      }
    }
    
  }

}
