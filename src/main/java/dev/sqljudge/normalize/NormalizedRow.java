package dev.sqljudge.normalize;

import java.util.List;
import java.util.Set;

/**
 * Ordered tuple of normalized values for one result row. Same length and column order as the
 * source row; equality and hashing are structural over the whole tuple.
 *
 * @param values the normalized values in column order
 */
public record NormalizedRow(List<NormalizedValue> values) {

  public NormalizedRow {
    values = List.copyOf(values);
  }

  /** Convenience factory for tests and fixtures. */
  public static NormalizedRow of(NormalizedValue... values) {
    return new NormalizedRow(List.of(values));
  }

  public int width() {
    return values.size();
  }

  /**
   * Returns the row's values as an unordered set. Column positions and repeated values are
   * discarded: {@code (5, "a")} and {@code ("a", 5)} give the same set, {@code (5, 5)} gives
   * {@code {5}}.
   */
  public Set<NormalizedValue> valueSet() {
    return Set.copyOf(values);
  }

  /** Lifts every value back into a raw row. */
  public List<RawValue> toRawRow() {
    return values.stream().map(NormalizedValue::toRawValue).toList();
  }
}
