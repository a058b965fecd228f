package dev.sqljudge.execution;

import static org.assertj.core.api.Assertions.assertThat;

import dev.sqljudge.BaseIntegrationTest;
import dev.sqljudge.normalize.RawValue;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.TestPropertySource;

@TestPropertySource(properties = "sqljudge.executor.query-timeout-seconds=2")
class JdbcQueryExecutorIT extends BaseIntegrationTest {

  @Autowired private QueryExecutor queryExecutor;

  @Test
  void selectReturnsColumnsAndRowsInOrder() {
    QueryExecution result =
        queryExecutor.execute("SELECT id, name, active FROM customers ORDER BY id");

    assertThat(result).isInstanceOf(QueryExecution.Success.class);
    QueryExecution.Success success = (QueryExecution.Success) result;
    assertThat(success.columns()).containsExactly("id", "name", "active");
    assertThat(success.rowCount()).isEqualTo(3);
    assertThat(success.rows().get(0))
        .containsExactly(new RawValue.Int(1), new RawValue.Text("Alice"), new RawValue.Bool(true));
  }

  @Test
  void numericAndNullColumnsAreLifted() {
    QueryExecution.Success success =
        (QueryExecution.Success)
            queryExecutor.execute("SELECT balance FROM customers WHERE id IN (1, 2) ORDER BY id");

    assertThat(success.rows())
        .containsExactly(
            List.of(new RawValue.Decimal(new BigDecimal("10.50"))), List.of(RawValue.NULL));
  }

  @Test
  void arraysAreMaterialised() {
    QueryExecution.Success success =
        (QueryExecution.Success) queryExecutor.execute("SELECT ARRAY[1, 2, 3]");

    assertThat(success.rows().get(0).get(0)).isEqualTo(new RawValue.Other(List.of(1, 2, 3)));
  }

  @Test
  void emptyResultStillCountsAsData() {
    QueryExecution result = queryExecutor.execute("SELECT name FROM customers WHERE false");

    assertThat(result.hasData()).isTrue();
    assertThat(((QueryExecution.Success) result).rows()).isEmpty();
  }

  @Test
  void writeStatementIsRejectedWithoutReachingDatabase() {
    QueryExecution result = queryExecutor.execute("DELETE FROM orders");

    assertThat(result).isEqualTo(new QueryExecution.Failure(JdbcQueryExecutor.UNSUPPORTED_QUERY));
    assertThat(orderCount()).isEqualTo(3);
  }

  @Test
  void writeHiddenInCommonTableExpressionNeverModifiesData() {
    QueryExecution result =
        queryExecutor.execute("WITH d AS (DELETE FROM orders RETURNING id) SELECT count(*) FROM d");

    assertThat(result).isInstanceOf(QueryExecution.Failure.class);
    assertThat(orderCount()).isEqualTo(3);
  }

  @Test
  void unparseableStatementIsRejected() {
    QueryExecution result = queryExecutor.execute("SELECT * FORM customers");

    assertThat(result).isEqualTo(new QueryExecution.Failure(JdbcQueryExecutor.UNSUPPORTED_QUERY));
  }

  @Test
  void unknownColumnBecomesFailureWithDriverMessage() {
    QueryExecution result = queryExecutor.execute("SELECT nosuchcolumn FROM customers");

    assertThat(result).isInstanceOf(QueryExecution.Failure.class);
    assertThat(((QueryExecution.Failure) result).error()).contains("nosuchcolumn");
  }

  @Test
  void dollarQuotedLiteralReachesDatabase() {
    QueryExecution result = queryExecutor.execute("SELECT $$a;b$$ AS s");

    assertThat(result)
        .isEqualTo(
            new QueryExecution.Success(List.of("s"), List.of(List.of(new RawValue.Text("a;b")))));
  }

  @Test
  void byteaCellsCompareByContent() {
    QueryExecution first = queryExecutor.execute("SELECT '\\x0102'::bytea AS b");
    QueryExecution second = queryExecutor.execute("SELECT decode('0102', 'hex') AS b");

    assertThat(first).isEqualTo(second);
  }

  @Test
  void unknownTableBecomesFailure() {
    QueryExecution result = queryExecutor.execute("SELECT * FROM order_lines");

    assertThat(result).isInstanceOf(QueryExecution.Failure.class);
    assertThat(((QueryExecution.Failure) result).error()).contains("order_lines");
  }

  @Test
  void slowQueryIsCancelledAfterTimeout() {
    long start = System.nanoTime();

    QueryExecution result = queryExecutor.execute("SELECT pg_sleep(10)");

    assertThat(result).isInstanceOf(QueryExecution.Failure.class);
    assertThat((System.nanoTime() - start) / 1_000_000_000L).isLessThan(8);
  }

  @Test
  void connectionIsReusableAfterFailure() {
    queryExecutor.execute("SELECT * FROM order_lines");

    QueryExecution result = queryExecutor.execute("SELECT count(*) FROM customers");

    assertThat(result)
        .isEqualTo(
            new QueryExecution.Success(List.of("count"), List.of(List.of(new RawValue.Int(3)))));
  }

  private int orderCount() {
    Integer count =
        new JdbcTemplate(dataSource).queryForObject("SELECT count(*) FROM orders", Integer.class);
    return count == null ? 0 : count;
  }
}
