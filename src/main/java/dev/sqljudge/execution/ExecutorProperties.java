package dev.sqljudge.execution;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for query execution.
 *
 * <p>Properties are bound from {@code sqljudge.executor.*} in application.yml.
 *
 * <ul>
 *   <li>{@code query-timeout-seconds} - per-statement execution limit (default 10, bounded [1,
 *       600])
 *   <li>{@code max-rows} - cap on fetched rows per statement (default 0 = unlimited)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "sqljudge.executor")
public class ExecutorProperties {

  private int queryTimeoutSeconds = 10;
  private int maxRows = 0;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (queryTimeoutSeconds < 1 || queryTimeoutSeconds > 600) {
      throw new IllegalStateException(
          "sqljudge.executor.query-timeout-seconds must be in [1, 600], got: "
              + queryTimeoutSeconds);
    }
    if (maxRows < 0) {
      throw new IllegalStateException(
          "sqljudge.executor.max-rows must not be negative, got: " + maxRows);
    }
  }

  public int getQueryTimeoutSeconds() {
    return queryTimeoutSeconds;
  }

  public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  public int getMaxRows() {
    return maxRows;
  }

  public void setMaxRows(int maxRows) {
    this.maxRows = maxRows;
  }
}
