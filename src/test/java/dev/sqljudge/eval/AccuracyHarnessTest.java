package dev.sqljudge.eval;

import static dev.sqljudge.fixture.Rows.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.sqljudge.dataset.QueryRecord;
import dev.sqljudge.execution.QueryExecution;
import dev.sqljudge.execution.QueryExecutor;
import dev.sqljudge.normalize.RawValue;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccuracyHarnessTest {

  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneId.of("UTC"));

  @Mock private QueryExecutor queryExecutor;

  private EvaluationProgressTracker tracker;
  private AccuracyHarness harness;

  @BeforeEach
  void setUp() {
    tracker = new EvaluationProgressTracker(FIXED_CLOCK);
    harness = new AccuracyHarness(queryExecutor, tracker);
  }

  private static QueryExecution.Success data(List<List<RawValue>> rows) {
    return new QueryExecution.Success(List.of("c"), rows);
  }

  @Test
  void equivalent_results_count_as_correct() {
    when(queryExecutor.execute("ref-1")).thenReturn(data(List.of(row(1, "Alice"))));
    when(queryExecutor.execute("pred-1")).thenReturn(data(List.of(row(1, "ALICE"))));
    when(queryExecutor.execute("ref-2")).thenReturn(data(List.of(row(1, 2))));
    when(queryExecutor.execute("pred-2")).thenReturn(data(List.of(row(3, 4))));

    EvaluationRun run =
        harness.evaluate(
            List.of(QueryRecord.ofSql("ref-1"), QueryRecord.ofSql("ref-2")),
            List.of(QueryRecord.ofSql("pred-1"), QueryRecord.ofSql("pred-2")));

    assertThat(run.report()).isEqualTo(new AccuracyReport(1, 2));
    assertThat(run.report().statusLine()).isEqualTo("1/2 = 0.5");
    assertThat(run.outcomes()).extracting(PairOutcome::correct).containsExactly(true, false);
    assertThat(run.outcomes()).allMatch(PairOutcome::executed);
    assertThat(run.cancelled()).isFalse();
  }

  @Test
  void executes_reference_before_prediction_for_each_pair() {
    when(queryExecutor.execute(anyString())).thenReturn(data(List.of(row(1))));

    harness.evaluate(
        List.of(QueryRecord.ofSql("ref-1"), QueryRecord.ofSql("ref-2")),
        List.of(QueryRecord.ofSql("pred-1"), QueryRecord.ofSql("pred-2")));

    InOrder order = inOrder(queryExecutor);
    order.verify(queryExecutor).execute("ref-1");
    order.verify(queryExecutor).execute("pred-1");
    order.verify(queryExecutor).execute("ref-2");
    order.verify(queryExecutor).execute("pred-2");
  }

  @Test
  void failed_prediction_counts_in_total_but_not_correct_and_run_continues() {
    when(queryExecutor.execute("ref-1")).thenReturn(data(List.of(row(1))));
    when(queryExecutor.execute("bad")).thenReturn(new QueryExecution.Failure("syntax error"));
    when(queryExecutor.execute("ref-2")).thenReturn(data(List.of(row(2))));
    when(queryExecutor.execute("pred-2")).thenReturn(data(List.of(row(2))));

    EvaluationRun run =
        harness.evaluate(
            List.of(QueryRecord.ofSql("ref-1"), QueryRecord.ofSql("ref-2")),
            List.of(QueryRecord.ofSql("bad"), QueryRecord.ofSql("pred-2")));

    assertThat(run.report()).isEqualTo(new AccuracyReport(1, 2));
    PairOutcome failed = run.outcomes().get(0);
    assertThat(failed.correct()).isFalse();
    assertThat(failed.executed()).isFalse();
    assertThat(failed.predictedError()).isEqualTo("syntax error");
    assertThat(failed.referenceError()).isNull();
  }

  @Test
  void failed_reference_is_never_correct_even_if_prediction_also_fails() {
    when(queryExecutor.execute(anyString())).thenReturn(new QueryExecution.Failure("timeout"));

    EvaluationRun run =
        harness.evaluate(List.of(QueryRecord.ofSql("ref")), List.of(QueryRecord.ofSql("pred")));

    assertThat(run.report()).isEqualTo(new AccuracyReport(0, 1));
    assertThat(run.outcomes().get(0).referenceError()).isEqualTo("timeout");
  }

  @Test
  void exception_from_executor_is_absorbed_as_failure() {
    when(queryExecutor.execute("ref-1")).thenThrow(new IllegalStateException("pool closed"));
    when(queryExecutor.execute("pred-1")).thenReturn(data(List.of(row(1))));
    when(queryExecutor.execute("ref-2")).thenReturn(data(List.of(row(1))));
    when(queryExecutor.execute("pred-2")).thenReturn(data(List.of(row(1))));

    EvaluationRun run =
        harness.evaluate(
            List.of(QueryRecord.ofSql("ref-1"), QueryRecord.ofSql("ref-2")),
            List.of(QueryRecord.ofSql("pred-1"), QueryRecord.ofSql("pred-2")));

    assertThat(run.report()).isEqualTo(new AccuracyReport(1, 2));
    assertThat(run.outcomes().get(0).referenceError()).isEqualTo("pool closed");
  }

  @Test
  void all_pairs_failing_still_reports_zero_accuracy() {
    when(queryExecutor.execute(anyString())).thenReturn(new QueryExecution.Failure("down"));

    EvaluationRun run =
        harness.evaluate(
            List.of(QueryRecord.ofSql("a"), QueryRecord.ofSql("b"), QueryRecord.ofSql("c")),
            List.of(QueryRecord.ofSql("d"), QueryRecord.ofSql("e"), QueryRecord.ofSql("f")));

    assertThat(run.report().statusLine()).isEqualTo("0/3 = 0.0");
  }

  @Test
  void empty_datasets_report_zero_of_zero() {
    EvaluationRun run = harness.evaluate(List.of(), List.of());

    assertThat(run.report()).isEqualTo(new AccuracyReport(0, 0));
    assertThat(run.outcomes()).isEmpty();
  }

  @Test
  void mismatched_lengths_evaluate_only_the_common_prefix() {
    when(queryExecutor.execute(anyString())).thenReturn(data(List.of(row(1))));

    EvaluationRun run =
        harness.evaluate(
            List.of(QueryRecord.ofSql("ref-1"), QueryRecord.ofSql("ref-2")),
            List.of(QueryRecord.ofSql("pred-1")));

    assertThat(run.report()).isEqualTo(new AccuracyReport(1, 1));
    verify(queryExecutor, never()).execute("ref-2");
  }

  @Test
  void progress_is_tracked_and_completed() {
    when(queryExecutor.execute(anyString())).thenReturn(data(List.of(row(1))));

    harness.evaluate(
        "nightly", List.of(QueryRecord.ofSql("r")), List.of(QueryRecord.ofSql("p")));

    EvaluationProgress progress = tracker.getProgress("nightly").orElseThrow();
    assertThat(progress.status()).isEqualTo(EvaluationProgress.Status.COMPLETED);
    assertThat(progress.report()).isEqualTo(new AccuracyReport(1, 1));
    assertThat(progress.expectedPairs()).isEqualTo(1);
    assertThat(progress.startedAt()).isEqualTo(FIXED_CLOCK.instant());
  }

  @Test
  void cancellation_stops_between_pairs() {
    when(queryExecutor.execute("ref-1")).thenReturn(data(List.of(row(1))));
    when(queryExecutor.execute("pred-1"))
        .thenAnswer(
            invocation -> {
              tracker.requestCancellation("cancel-me");
              return data(List.of(row(1)));
            });

    EvaluationRun run =
        harness.evaluate(
            "cancel-me",
            List.of(QueryRecord.ofSql("ref-1"), QueryRecord.ofSql("ref-2")),
            List.of(QueryRecord.ofSql("pred-1"), QueryRecord.ofSql("pred-2")));

    assertThat(run.cancelled()).isTrue();
    assertThat(run.report()).isEqualTo(new AccuracyReport(1, 1));
    verify(queryExecutor, never()).execute("ref-2");
    assertThat(tracker.getProgress("cancel-me").orElseThrow().status())
        .isEqualTo(EvaluationProgress.Status.CANCELLED);
  }
}
