/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.jtab.sql;


import java.util.List;
import java.util.stream.Collectors;

import io.crums.jtab.JtabException;

/**
 * Thrown after a write, if any of its rows failed to insert. Rows
 * inserted before (or after) a failed row are <em>not</em> rolled back.
 * 
 * @see WriteReport
 */
@SuppressWarnings("serial")
public class AggregateWriteException extends JtabException {
  
  private final List<RowFailure> failures;
  private final WriteReport report;

  AggregateWriteException(WriteReport report) {
    super("Errors occurred: " +
        report.failures().stream().map(RowFailure::message).collect(Collectors.joining(", ")));
    this.failures = report.failures();
    this.report = report;
  }
  
  
  /** Returns the failed rows, in the order attempted. Never empty. */
  public List<RowFailure> failures() {
    return failures;
  }
  
  /** Returns the error messages, in the order attempted. */
  public List<String> messages() {
    return failures.stream().map(RowFailure::message).toList();
  }
  
  /** Returns the report of the whole write (including its successes). */
  public WriteReport report() {
    return report;
  }

}
