package dev.sqljudge.execution;

import dev.sqljudge.normalize.RawValue;
import java.util.List;
import java.util.Objects;

/** Outcome of running one statement through a {@link QueryExecutor}. */
public sealed interface QueryExecution permits QueryExecution.Success, QueryExecution.Failure {

  /** True when the statement produced data that can be compared. */
  boolean hasData();

  /**
   * Rows produced by a successful statement.
   *
   * @param columns column labels in select-list order
   * @param rows the rows, each in column order
   * @param rowCount number of rows returned
   */
  record Success(List<String> columns, List<List<RawValue>> rows, int rowCount)
      implements QueryExecution {

    public Success {
      columns = List.copyOf(columns);
      rows = rows.stream().<List<RawValue>>map(List::copyOf).toList();
      if (rowCount != rows.size()) {
        throw new IllegalArgumentException(
            "rowCount " + rowCount + " does not match " + rows.size() + " rows");
      }
    }

    public Success(List<String> columns, List<List<RawValue>> rows) {
      this(columns, rows, rows.size());
    }

    @Override
    public boolean hasData() {
      return true;
    }
  }

  /**
   * The statement could not produce data.
   *
   * @param error human-readable reason
   */
  record Failure(String error) implements QueryExecution {

    public Failure {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public boolean hasData() {
      return false;
    }
  }
}
