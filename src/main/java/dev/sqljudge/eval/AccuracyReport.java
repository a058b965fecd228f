package dev.sqljudge.eval;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Immutable snapshot of the accuracy counters.
 *
 * @param correct pairs whose predicted result was accepted as equivalent
 * @param total pairs evaluated so far
 */
public record AccuracyReport(int correct, int total) {

  /** Fractional digits of the reported accuracy. */
  public static final int REPORT_PRECISION = 3;

  public AccuracyReport {
    if (total < 0 || correct < 0 || correct > total) {
      throw new IllegalArgumentException(
          "Invalid accuracy counters: correct=" + correct + ", total=" + total);
    }
  }

  /** {@code correct / total}, or 0 when nothing has been evaluated. */
  public double accuracy() {
    return total == 0 ? 0.0 : (double) correct / total;
  }

  /** Accuracy rounded half-even to {@value #REPORT_PRECISION} fractional digits. */
  public double roundedAccuracy() {
    return new BigDecimal(accuracy())
        .setScale(REPORT_PRECISION, RoundingMode.HALF_EVEN)
        .doubleValue();
  }

  /**
   * Formats the counters as {@code "<correct>/<total> = <accuracy>"}, e.g. {@code "1/3 = 0.333"}
   * or {@code "2/2 = 1.0"}.
   */
  public String statusLine() {
    return correct + "/" + total + " = " + roundedAccuracy();
  }
}
