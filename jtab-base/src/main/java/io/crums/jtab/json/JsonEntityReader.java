/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.json;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * JSON read-interface for an entity. Text is parsed with
 * {@linkplain CanonicalJson#parse(String)}, so numbers read the same way
 * whether they come from a stored cell or a config file.
 * 
 * @param <T> the entity type
 */
public interface JsonEntityReader<T> {

  
  /**
   * Returns the given JSON as the typed instance.
   * 
   * @throws JsonParsingException if the given object is malformed, or breaks the entity's grammar
   */
  T toEntity(JSONObject jObj) throws JsonParsingException;
  
  
  /**
   * Parses the given JSON text and returns it as a typed entity.
   * 
   * @throws JsonParsingException if malformed, or if not a single JSON object
   */
  default T toEntity(String json) throws JsonParsingException {
    Object parsed = CanonicalJson.parse(json);
    if (parsed instanceof JSONObject jObj)
      return toEntity(jObj);
    throw new JsonParsingException(
        "not a JSON object: " + json.substring(0, Math.min(20, json.length())) + "...");
  }
  
  
  /**
   * Reads the given UTF-8 file and returns its contents as a typed entity.
   * 
   * @throws UncheckedIOException on I/O error
   * @see #toEntity(String)
   */
  default T toEntity(File file) throws JsonParsingException, UncheckedIOException {
    String json;
    try {
      json = Files.readString(file.toPath());
    } catch (IOException iox) {
      throw new UncheckedIOException("on toEntity(file=" + file + "): " + iox , iox);
    }
    return toEntity(json);
  }
  
  
  /**
   * Returns the given JSON array as a typed list.
   * 
   * @param jArray null counts as empty
   * 
   * @return read-only, possibly empty list
   */
  default List<T> toEntityList(JSONArray jArray) throws JsonParsingException {
    if (jArray == null || jArray.isEmpty())
      return Collections.emptyList();
    
    var list = new ArrayList<T>(jArray.size());
    for (var element : jArray) {
      if (!(element instanceof JSONObject jObj))
        throw new JsonParsingException(
            "expected JSON object at index [" + list.size() + "]: " + element);
      list.add(toEntity(jObj));
    }
    return Collections.unmodifiableList(list);
  }
  
}
