package dev.sqljudge.eval;

/**
 * Mutable accuracy counters owned by a single harness run. Counters only grow; {@code total}
 * advances exactly once per evaluated pair.
 */
final class AccuracyState {

  private int correct;
  private int total;

  void record(boolean pairCorrect) {
    total++;
    if (pairCorrect) {
      correct++;
    }
  }

  AccuracyReport snapshot() {
    return new AccuracyReport(correct, total);
  }
}
