/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Store configuration: JDBC connection parameters and hashing mode,
 * loadable from properties files or JSON.
 */
package io.crums.jtab.sql.config;
