package dev.sqljudge.eval;

import dev.sqljudge.compare.ResultSetComparator;
import dev.sqljudge.dataset.QueryRecord;
import dev.sqljudge.execution.QueryExecution;
import dev.sqljudge.execution.QueryExecutor;
import dev.sqljudge.normalize.NormalizedResultSet;
import dev.sqljudge.normalize.ResultSetNormalizer;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives a benchmark run: executes each (reference, predicted) pair, compares the results and
 * accumulates accuracy.
 *
 * <p>Pairs are processed sequentially in dataset order. A pair whose reference or predicted query
 * fails to produce data counts towards the total but never as correct; the run always completes
 * and always reports a final accuracy. The running status line is logged after every pair.
 */
@Service
public class AccuracyHarness {

  private static final Logger log = LoggerFactory.getLogger(AccuracyHarness.class);

  static final String DEFAULT_LABEL = "run";

  private final QueryExecutor queryExecutor;
  private final EvaluationProgressTracker progressTracker;

  public AccuracyHarness(QueryExecutor queryExecutor, EvaluationProgressTracker progressTracker) {
    this.queryExecutor = queryExecutor;
    this.progressTracker = progressTracker;
  }

  /** Evaluates the datasets under the default label. */
  public EvaluationRun evaluate(List<QueryRecord> references, List<QueryRecord> predictions) {
    return evaluate(DEFAULT_LABEL, references, predictions);
  }

  /**
   * Evaluates index-aligned reference and predicted queries.
   *
   * <p>If the lists differ in length only the common prefix is evaluated.
   *
   * @param label descriptive label for progress tracking and logs
   * @param references reference query descriptors
   * @param predictions predicted query descriptors, aligned by index with {@code references}
   * @return final accuracy and per-pair outcomes
   */
  public EvaluationRun evaluate(
      String label, List<QueryRecord> references, List<QueryRecord> predictions) {
    int pairCount = Math.min(references.size(), predictions.size());
    if (references.size() != predictions.size()) {
      log.warn(
          "Reference ({}) and prediction ({}) counts differ; evaluating the first {} pairs",
          references.size(),
          predictions.size(),
          pairCount);
    }

    AccuracyState state = new AccuracyState();
    List<PairOutcome> outcomes = new ArrayList<>(pairCount);
    boolean cancelled = false;
    progressTracker.startRun(label, pairCount);

    for (int i = 0; i < pairCount; i++) {
      if (progressTracker.isCancelled(label)) {
        log.info("Evaluation '{}' cancelled after {} of {} pairs", label, i, pairCount);
        cancelled = true;
        break;
      }
      PairOutcome outcome = evaluatePair(i, references.get(i), predictions.get(i));
      outcomes.add(outcome);
      state.record(outcome.correct());

      AccuracyReport running = state.snapshot();
      progressTracker.recordPair(label, running);
      log.info("ACCURACY: {}", running.statusLine());
    }

    if (cancelled) {
      progressTracker.markCancelled(label);
    } else {
      progressTracker.completeRun(label);
    }

    AccuracyReport report = state.snapshot();
    log.info("FINAL ACCURACY: {}", report.statusLine());
    return new EvaluationRun(label, report, outcomes, cancelled);
  }

  private PairOutcome evaluatePair(int index, QueryRecord reference, QueryRecord predicted) {
    QueryExecution referenceExecution = executeSafely(reference.sql());
    QueryExecution predictedExecution = executeSafely(predicted.sql());

    boolean correct = false;
    if (referenceExecution instanceof QueryExecution.Success actual
        && predictedExecution instanceof QueryExecution.Success guess) {
      NormalizedResultSet actualRows = ResultSetNormalizer.normalizeResultSet(actual.rows());
      NormalizedResultSet predictedRows = ResultSetNormalizer.normalizeResultSet(guess.rows());
      correct = ResultSetComparator.isEquivalent(actualRows, predictedRows);
    } else {
      log.debug("Pair {} skipped comparison: a query produced no data", index);
    }

    return new PairOutcome(
        index,
        reference,
        predicted,
        correct,
        errorOf(referenceExecution),
        errorOf(predictedExecution));
  }

  /** Turns anything the executor throws into a failure for this pair. */
  private QueryExecution executeSafely(String sql) {
    try {
      return queryExecutor.execute(sql);
    } catch (RuntimeException e) {
      log.warn("Query executor threw instead of reporting a failure: {}", e.getMessage(), e);
      String message = e.getMessage();
      return new QueryExecution.Failure(message == null ? e.getClass().getSimpleName() : message);
    }
  }

  private static @Nullable String errorOf(QueryExecution execution) {
    return execution instanceof QueryExecution.Failure failure ? failure.error() : null;
  }
}
