package dev.sqljudge.eval;

import java.time.Instant;

/**
 * Immutable snapshot of an active evaluation run's progress.
 *
 * <p>Created and updated by {@link EvaluationProgressTracker}; each update produces a new record.
 *
 * @param label the run label
 * @param status current run status
 * @param report accuracy counters so far
 * @param expectedPairs number of pairs the run will evaluate if not cancelled
 * @param startedAt when the run started
 */
public record EvaluationProgress(
    String label, Status status, AccuracyReport report, int expectedPairs, Instant startedAt) {

  /** Evaluation run status. */
  public enum Status {
    RUNNING,
    COMPLETED,
    CANCELLED
  }
}
