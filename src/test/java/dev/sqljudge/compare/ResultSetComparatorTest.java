package dev.sqljudge.compare;

import static dev.sqljudge.fixture.Rows.normalized;
import static dev.sqljudge.fixture.Rows.row;
import static org.assertj.core.api.Assertions.assertThat;

import dev.sqljudge.normalize.NormalizedResultSet;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResultSetComparatorTest {

  @Nested
  class ExactMatch {

    @Test
    void same_rows_with_different_case_are_equivalent() {
      NormalizedResultSet actual = normalized(row(1, "Alice"));
      NormalizedResultSet predicted = normalized(row(1, "ALICE"));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isTrue();
    }

    @Test
    void equal_binary_cells_are_equivalent() {
      NormalizedResultSet actual = normalized(row(1, new byte[] {1, 2}));
      NormalizedResultSet predicted = normalized(row(1, new byte[] {1, 2}));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isTrue();
    }

    @Test
    void row_order_and_duplicates_do_not_matter() {
      NormalizedResultSet actual = normalized(row(1, "a"), row(2, "b"));
      NormalizedResultSet predicted = normalized(row(2, "B"), row(1, "a"), row(1, "A"));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isTrue();
    }

    @Test
    void empty_against_empty_is_equivalent() {
      NormalizedResultSet empty = NormalizedResultSet.EMPTY;

      assertThat(ResultSetComparator.isEquivalent(empty, empty)).isTrue();
    }

    @Test
    void boolean_and_numeric_spellings_are_equivalent() {
      NormalizedResultSet actual = normalized(row(true, 3.0));
      NormalizedResultSet predicted = normalized(row("yes", 3));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isTrue();
    }
  }

  @Nested
  class SubsetTolerance {

    @Test
    void extra_predicted_column_is_tolerated() {
      NormalizedResultSet actual = normalized(row(1));
      NormalizedResultSet predicted = normalized(row(1, 2));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isTrue();
    }

    @Test
    void missing_predicted_column_is_tolerated() {
      NormalizedResultSet actual = normalized(row(1, "a"), row(2, "b"));
      NormalizedResultSet predicted = normalized(row("a"), row("b"));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isTrue();
    }

    @Test
    void reordered_columns_are_tolerated() {
      NormalizedResultSet actual = normalized(row(5, "a"));
      NormalizedResultSet predicted = normalized(row("a", 5));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isTrue();
    }

    @Test
    void repeated_values_inside_a_row_collapse() {
      NormalizedResultSet actual = normalized(row(5));
      NormalizedResultSet predicted = normalized(row(5, 5));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isTrue();
    }
  }

  @Nested
  class Mismatch {

    @Test
    void disjoint_values_are_not_equivalent() {
      NormalizedResultSet actual = normalized(row(1, 2));
      NormalizedResultSet predicted = normalized(row(3, 4));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isFalse();
    }

    @Test
    void partially_overlapping_rows_are_not_equivalent() {
      NormalizedResultSet actual = normalized(row(1, "a"));
      NormalizedResultSet predicted = normalized(row(1, "b"));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isFalse();
    }

    @Test
    void one_unmatched_predicted_row_rejects_the_result() {
      NormalizedResultSet actual = normalized(row(1), row(2));
      NormalizedResultSet predicted = normalized(row(1, "x"), row(9, "y"));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isFalse();
    }

    @Test
    void empty_reference_with_rows_predicted_is_not_equivalent() {
      NormalizedResultSet predicted = normalized(row(1));

      assertThat(ResultSetComparator.isEquivalent(NormalizedResultSet.EMPTY, predicted)).isFalse();
    }

    @Test
    void rows_expected_but_nothing_predicted_is_not_equivalent() {
      NormalizedResultSet actual = normalized(row(1));

      assertThat(ResultSetComparator.isEquivalent(actual, NormalizedResultSet.EMPTY)).isFalse();
    }

    @Test
    void precision_beyond_five_digits_is_ignored_but_fifth_digit_is_not() {
      assertThat(
              ResultSetComparator.isEquivalent(
                  normalized(row(1.0)), normalized(row(1.000001))))
          .isTrue();
      assertThat(
              ResultSetComparator.isEquivalent(normalized(row(1.0)), normalized(row(1.00001))))
          .isFalse();
    }
  }

  /**
   * The fallback counts matched predicted rows but compares the count with the reference size.
   * These tests pin that behaviour.
   */
  @Nested
  class MatchCountAgainstReferenceSize {

    @Test
    void more_predicted_rows_than_reference_rows_fails_even_when_every_row_matches() {
      NormalizedResultSet actual = normalized(row(1, "a"), row(2, "b"));
      NormalizedResultSet predicted =
          normalized(row(1, "a", "x"), row(2, "b", "y"), row(1, "a", "z"));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isFalse();
    }

    @Test
    void fewer_predicted_rows_than_reference_rows_fails_even_when_every_row_matches() {
      NormalizedResultSet actual = normalized(row(1), row(2));
      NormalizedResultSet predicted = normalized(row(1, 2));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isFalse();
    }

    @Test
    void predicted_rows_all_hitting_one_reference_row_pass_when_counts_coincide() {
      NormalizedResultSet actual = normalized(row(1, "a"), row(2, "b"));
      NormalizedResultSet predicted = normalized(row(1, "a", "x"), row(1, "a", "y"));

      assertThat(ResultSetComparator.isEquivalent(actual, predicted)).isTrue();
    }
  }
}
