/*
 * Copyright 2026 Babak Farhang
 */
/**
 * JSON tables stored in a relational database.
 * 
 * <h2>Overview</h2>
 * <p>
 * {@linkplain io.crums.jtab.sql.SqlTableStore} is the entry point. Each
 * logical table is one physical table whose name is the table key plus a
 * suffix (see {@linkplain io.crums.jtab.sql.NameMapper}); its columns
 * likewise. Rows are keyed by content hash. Table configurations, and their
 * append-only versions, are themselves rows in a reserved registry table
 * (see {@linkplain io.crums.jtab.sql.SchemaRegistry}).
 * </p>
 * <p>
 * The SQL emitted targets H2 (2.x) but sticks mostly to standard forms:
 * quoted identifiers, {@code CREATE TABLE IF NOT EXISTS},
 * {@code ALTER TABLE .. ADD COLUMN IF NOT EXISTS}, and
 * {@code INFORMATION_SCHEMA.TABLES}.
 * </p>
 */
package io.crums.jtab.sql;
