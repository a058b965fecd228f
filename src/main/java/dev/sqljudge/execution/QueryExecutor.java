package dev.sqljudge.execution;

/**
 * Runs SQL text and returns either the produced data or an error.
 *
 * <p>Implementations restrict execution to read-only statements and bound execution time.
 * Per-query problems (syntax errors, timeouts, rejected statements) are reported as {@link
 * QueryExecution.Failure}, never thrown.
 */
public interface QueryExecutor {

  /**
   * Executes a single statement.
   *
   * @param sql the SQL text
   * @return the result rows or the error that prevented producing them
   */
  QueryExecution execute(String sql);
}
