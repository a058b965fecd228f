package dev.sqljudge.eval;

import static org.assertj.core.api.Assertions.assertThat;

import dev.sqljudge.BaseIntegrationTest;
import dev.sqljudge.dataset.DatasetLoader;
import dev.sqljudge.dataset.QueryRecord;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class AccuracyHarnessIT extends BaseIntegrationTest {

  @Autowired private AccuracyHarness harness;
  @Autowired private DatasetLoader datasetLoader;

  @Test
  void evaluatesClasspathDatasetsAgainstRealDatabase() throws IOException {
    List<QueryRecord> references = datasetLoader.load("classpath:datasets/references.json");
    List<QueryRecord> predictions = datasetLoader.load("classpath:datasets/predictions.json");

    EvaluationRun run = harness.evaluate("it", references, predictions);

    assertThat(run.report().statusLine()).isEqualTo("2/3 = 0.667");
    assertThat(run.outcomes()).extracting(PairOutcome::correct).containsExactly(true, true, false);
    assertThat(run.outcomes().get(2).predictedError()).contains("order_lines");
  }

  @Test
  void reorderedAndRecasedResultsAreEquivalent() {
    EvaluationRun run =
        harness.evaluate(
            List.of(QueryRecord.ofSql("SELECT id, name FROM customers ORDER BY id")),
            List.of(QueryRecord.ofSql("SELECT id, lower(name) FROM customers ORDER BY id DESC")));

    assertThat(run.report()).isEqualTo(new AccuracyReport(1, 1));
  }

  @Test
  void numericResultsMatchAfterRounding() {
    EvaluationRun run =
        harness.evaluate(
            List.of(QueryRecord.ofSql("SELECT AVG(total) FROM orders")),
            List.of(QueryRecord.ofSql("SELECT SUM(total)::float8 / COUNT(*) FROM orders")));

    assertThat(run.report()).isEqualTo(new AccuracyReport(1, 1));
  }

  @Test
  void booleanColumnMatchesTextualTruthValues() {
    EvaluationRun run =
        harness.evaluate(
            List.of(QueryRecord.ofSql("SELECT name, active FROM customers")),
            List.of(
                QueryRecord.ofSql(
                    "SELECT name, CASE WHEN active THEN 'yes' ELSE 'no' END FROM customers")));

    assertThat(run.report()).isEqualTo(new AccuracyReport(1, 1));
  }

  @Test
  void rejectedPredictionCountsAsIncorrect() {
    EvaluationRun run =
        harness.evaluate(
            List.of(QueryRecord.ofSql("SELECT count(*) FROM orders")),
            List.of(QueryRecord.ofSql("DELETE FROM orders")));

    assertThat(run.report().statusLine()).isEqualTo("0/1 = 0.0");
    assertThat(run.outcomes().get(0).predictedError()).isEqualTo("Query not supported.");
  }
}
