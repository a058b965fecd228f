package dev.sqljudge.compare;

import dev.sqljudge.normalize.NormalizedResultSet;
import dev.sqljudge.normalize.NormalizedRow;
import dev.sqljudge.normalize.NormalizedValue;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a predicted query produced the same data as the reference query.
 *
 * <p>The decision runs in two steps:
 *
 * <ol>
 *   <li>Exact match: both normalized sets have the same membership.
 *   <li>Subset-tolerant fallback: every predicted row, taken as an unordered value set, must be a
 *       subset or superset of the value set of some reference row. The first predicted row without
 *       such a partner rejects the whole result. After the scan the number of matched predicted
 *       rows must equal the number of <em>reference</em> rows.
 * </ol>
 *
 * <p>The fallback accepts extra or missing columns, but it also drops column correspondence and
 * repeated values inside a row, so distinct rows that share a value set are indistinguishable.
 * The final count is compared against the reference size, not the predicted size: a predicted set
 * with more rows than the reference fails even if each row matches, and a predicted set whose rows
 * all hit the same reference row can pass when the counts coincide.
 */
public final class ResultSetComparator {

  private static final Logger log = LoggerFactory.getLogger(ResultSetComparator.class);

  private ResultSetComparator() {
    // utility class
  }

  /**
   * Compares two normalized result sets.
   *
   * @param actual the reference query's normalized output
   * @param predicted the predicted query's normalized output
   * @return true if the predicted output is accepted as equivalent
   */
  public static boolean isEquivalent(NormalizedResultSet actual, NormalizedResultSet predicted) {
    if (actual.equals(predicted)) {
      return true;
    }

    List<Set<NormalizedValue>> actualValueSets =
        actual.rows().stream().map(NormalizedRow::valueSet).toList();

    int matches = 0;
    for (NormalizedRow row : predicted.rows()) {
      Set<NormalizedValue> predictedValues = row.valueSet();
      if (!hasContainmentPartner(predictedValues, actualValueSets)) {
        log.debug("No reference row contains or is contained in predicted row {}", row);
        return false;
      }
      matches++;
    }

    if (matches != actual.size()) {
      log.debug(
          "All {} predicted rows matched but reference has {} rows", matches, actual.size());
      return false;
    }
    return true;
  }

  private static boolean hasContainmentPartner(
      Set<NormalizedValue> predictedValues, List<Set<NormalizedValue>> actualValueSets) {
    for (Set<NormalizedValue> actualValues : actualValueSets) {
      if (predictedValues.containsAll(actualValues) || actualValues.containsAll(predictedValues)) {
        return true;
      }
    }
    return false;
  }
}
