/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Content hashing. The hashing primitive is {@linkplain ContentHasher};
 * {@linkplain IntegrityEngine} decides when hashes get stamped and whether
 * existing ones are trusted.
 */
package io.crums.jtab.hash;
