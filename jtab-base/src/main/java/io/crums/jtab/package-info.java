/*
 * Copyright 2026 Babak Farhang
 */
/**
 * The table model: {@linkplain io.crums.jtab.ColumnConfig column} and
 * {@linkplain io.crums.jtab.TableConfig table configurations},
 * {@linkplain io.crums.jtab.Table tables}, and
 * {@linkplain io.crums.jtab.TableBundle bundles} of them.
 * 
 * <h2>Schema Evolution</h2>
 * <p>
 * A table's schema may only grow. New columns are appended; existing columns
 * are never removed, reordered, or retyped. Each version of a table's
 * configuration is an immutable snapshot, and the earlier versions' columns
 * are always a prefix of the later ones'.
 * </p>
 * <h2>Hashes</h2>
 * <p>
 * Every entity here carries an optional content hash under the reserved
 * {@code _hash} member. See the {@linkplain io.crums.jtab.hash hash} package.
 * </p>
 */
package io.crums.jtab;
