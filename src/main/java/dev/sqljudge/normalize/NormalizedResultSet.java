package dev.sqljudge.normalize;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deduplicated, order-independent set of normalized rows for one query's output.
 *
 * <p>Iteration follows first-seen order of the source rows, but equality only considers
 * membership.
 *
 * @param rows the distinct normalized rows
 */
public record NormalizedResultSet(Set<NormalizedRow> rows) {

  public static final NormalizedResultSet EMPTY = new NormalizedResultSet(Set.of());

  public NormalizedResultSet {
    rows = Collections.unmodifiableSet(new LinkedHashSet<>(rows));
  }

  /** Convenience factory for tests and fixtures. */
  public static NormalizedResultSet of(NormalizedRow... rows) {
    return new NormalizedResultSet(new LinkedHashSet<>(List.of(rows)));
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public boolean contains(NormalizedRow row) {
    return rows.contains(row);
  }
}
