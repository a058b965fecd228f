package dev.sqljudge.eval;

import java.util.List;

/**
 * Result of one harness run.
 *
 * @param label descriptive label of the run
 * @param report final accuracy counters
 * @param outcomes per-pair verdicts in dataset order
 * @param cancelled true if the run stopped early on a cancellation request
 */
public record EvaluationRun(
    String label, AccuracyReport report, List<PairOutcome> outcomes, boolean cancelled) {
  public EvaluationRun {
    outcomes = List.copyOf(outcomes);
  }
}
