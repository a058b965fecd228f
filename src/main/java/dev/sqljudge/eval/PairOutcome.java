package dev.sqljudge.eval;

import dev.sqljudge.dataset.QueryRecord;
import org.jspecify.annotations.Nullable;

/**
 * Verdict for one (reference, predicted) pair.
 *
 * @param index 0-based position of the pair in the dataset
 * @param reference the reference query descriptor
 * @param predicted the predicted query descriptor
 * @param correct true if both queries ran and the results were judged equivalent
 * @param referenceError executor error for the reference query, null if it produced data
 * @param predictedError executor error for the predicted query, null if it produced data
 */
public record PairOutcome(
    int index,
    QueryRecord reference,
    QueryRecord predicted,
    boolean correct,
    @Nullable String referenceError,
    @Nullable String predictedError) {

  /** True when both sides produced data and the comparator was consulted. */
  public boolean executed() {
    return referenceError == null && predictedError == null;
  }
}
