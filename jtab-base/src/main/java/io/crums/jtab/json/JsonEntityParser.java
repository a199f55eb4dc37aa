/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.json;


/**
 * Two-way JSON mapping for an entity. The model's records
 * ({@code ColumnConfig}, {@code TableConfig}, {@code Table},
 * {@code TableBundle}) and the store's configuration records each expose
 * one of these as a {@code PARSER} constant.
 * 
 * @param <T> the entity type
 */
public interface JsonEntityParser<T> extends JsonEntityWriter<T>, JsonEntityReader<T> {

}
