package dev.sqljudge.normalize;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Applies {@link ValueNormalizer} across rows and whole result sets. */
public final class ResultSetNormalizer {

  private ResultSetNormalizer() {
    // utility class
  }

  /**
   * Normalizes every value of a row, preserving column count and order.
   *
   * @param row the raw row
   * @return the hashable normalized tuple
   */
  public static NormalizedRow normalizeRow(List<RawValue> row) {
    return new NormalizedRow(row.stream().map(ValueNormalizer::normalize).toList());
  }

  /**
   * Normalizes every row and collapses rows that are equal after normalization. Source row order
   * is not significant for the result.
   *
   * @param rows the raw rows as returned by the executor
   * @return the distinct normalized rows
   */
  public static NormalizedResultSet normalizeResultSet(List<? extends List<RawValue>> rows) {
    Set<NormalizedRow> distinct = new LinkedHashSet<>();
    for (List<RawValue> row : rows) {
      distinct.add(normalizeRow(row));
    }
    return new NormalizedResultSet(distinct);
  }

  /**
   * Re-applies normalization to an already normalized set. Always returns an equal set.
   *
   * @param resultSet a normalized result set
   * @return the same membership, re-normalized
   */
  public static NormalizedResultSet normalizeResultSet(NormalizedResultSet resultSet) {
    return normalizeResultSet(resultSet.rows().stream().map(NormalizedRow::toRawRow).toList());
  }
}
