/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a write: rows inserted, rows ignored (already present), and rows
 * that failed. Failures are collected as the write proceeds; the write does
 * not stop at the first.
 */
public class WriteReport {
  
  private int inserted;
  private int ignored;
  private final List<RowFailure> failures = new ArrayList<>();
  
  
  WriteReport() {  }
  
  
  void recordInserted() {
    ++inserted;
  }
  
  void recordIgnored() {
    ++ignored;
  }
  
  void recordFailure(RowFailure failure) {
    failures.add(failure);
  }
  
  
  /** Number of new rows written. */
  public int insertedCount() {
    return inserted;
  }
  
  /** Number of rows whose primary key (hash) already existed. */
  public int ignoredCount() {
    return ignored;
  }
  
  /** Returns the failed rows. */
  public List<RowFailure> failures() {
    return List.copyOf(failures);
  }
  
  public boolean hasFailures() {
    return !failures.isEmpty();
  }
  
  
  /**
   * Returns this instance, if there are no failures.
   * 
   * @throws AggregateWriteException if there are
   */
  public WriteReport throwIfFailed() throws AggregateWriteException {
    if (hasFailures())
      throw new AggregateWriteException(this);
    return this;
  }
  
  
  @Override
  public String toString() {
    return "[inserted=%d, ignored=%d, failed=%d]".formatted(inserted, ignored, failures.size());
  }

}
