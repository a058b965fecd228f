package dev.sqljudge.execution;

import dev.sqljudge.normalize.RawValue;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link QueryExecutor} backed by the application's JDBC data source.
 *
 * <p>Statements rejected by {@link ReadOnlySqlGuard} never reach the database. Accepted statements
 * run inside a read-only transaction with the configured timeout. Driver and transaction errors are
 * turned into {@link QueryExecution.Failure} so one bad query never aborts a benchmark run.
 */
@Service
public class JdbcQueryExecutor implements QueryExecutor {

  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  static final String UNSUPPORTED_QUERY = "Query not supported.";

  private static final int LOGGED_SQL_LENGTH = 200;

  private static final ResultSetExtractor<QueryExecution.Success> EXTRACTOR =
      JdbcQueryExecutor::extract;

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;

  public JdbcQueryExecutor(
      @Qualifier("evaluationJdbcTemplate") JdbcTemplate jdbcTemplate,
      @Qualifier("readOnlyTransactionTemplate") TransactionTemplate transactionTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
  }

  @Override
  public QueryExecution execute(String sql) {
    if (!ReadOnlySqlGuard.isReadOnly(sql)) {
      log.debug("Rejected statement that is not a single read-only query: {}", abbreviate(sql));
      return new QueryExecution.Failure(UNSUPPORTED_QUERY);
    }

    try {
      QueryExecution.Success result =
          transactionTemplate.execute(status -> jdbcTemplate.query(sql, EXTRACTOR));
      if (result == null) {
        return new QueryExecution.Failure("Query returned no result set");
      }
      return result;
    } catch (DataAccessException | TransactionException e) {
      String message = rootMessage(e);
      log.warn("Query failed: {} ({})", abbreviate(sql), message);
      return new QueryExecution.Failure(message);
    }
  }

  private static QueryExecution.Success extract(ResultSet rs) throws SQLException {
    ResultSetMetaData metaData = rs.getMetaData();
    int columnCount = metaData.getColumnCount();

    List<String> columns = new ArrayList<>(columnCount);
    for (int i = 1; i <= columnCount; i++) {
      columns.add(metaData.getColumnLabel(i));
    }

    List<List<RawValue>> rows = new ArrayList<>();
    while (rs.next()) {
      List<RawValue> row = new ArrayList<>(columnCount);
      for (int i = 1; i <= columnCount; i++) {
        row.add(toRawValue(rs.getObject(i)));
      }
      rows.add(row);
    }
    return new QueryExecution.Success(columns, rows);
  }

  /** SQL arrays are materialised into lists so they compare by content, not identity. */
  private static RawValue toRawValue(@Nullable Object value) throws SQLException {
    if (value instanceof Array array) {
      try {
        Object elements = array.getArray();
        if (elements instanceof Object[] objects) {
          return new RawValue.Other(Collections.unmodifiableList(Arrays.asList(objects)));
        }
        return new RawValue.Other(elements);
      } finally {
        array.free();
      }
    }
    return RawValue.of(value);
  }

  private static String rootMessage(Exception e) {
    Throwable cause = e;
    while (cause.getCause() != null && cause.getCause() != cause) {
      cause = cause.getCause();
    }
    String message = cause.getMessage();
    return message == null ? cause.getClass().getSimpleName() : message.strip();
  }

  private static String abbreviate(@Nullable String sql) {
    if (sql == null) {
      return "<null>";
    }
    String flat = sql.strip().replaceAll("\\s+", " ");
    return flat.length() <= LOGGED_SQL_LENGTH ? flat : flat.substring(0, LOGGED_SQL_LENGTH) + "...";
  }
}
