package dev.sqljudge.normalize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;

/**
 * Canonicalizes single cell values so that superficially different query outputs compare equal.
 *
 * <ul>
 *   <li>Text is trimmed and lower-cased; the tokens {@code true/yes/1} and {@code false/no/0}
 *       become the numbers 1 and 0
 *   <li>Booleans become the numbers 1 and 0
 *   <li>Integers, floats and decimals become a double rounded half-even to {@value #PRECISION}
 *       fractional digits
 *   <li>Null and any other type are kept unchanged
 * </ul>
 *
 * <p>The function is pure and idempotent: normalizing {@link NormalizedValue#toRawValue()} of a
 * result returns the same result.
 */
public final class ValueNormalizer {

  /** Number of fractional digits numbers are rounded to. */
  public static final int PRECISION = 5;

  private static final Set<String> TRUE_TOKENS = Set.of("true", "yes", "1");
  private static final Set<String> FALSE_TOKENS = Set.of("false", "no", "0");

  private ValueNormalizer() {
    // utility class
  }

  /**
   * Normalizes a raw cell value.
   *
   * @param value the raw value
   * @return its canonical comparable form
   */
  public static NormalizedValue normalize(RawValue value) {
    return switch (value.kind()) {
      case TEXT -> normalizeText(((RawValue.Text) value).value());
      case BOOLEAN -> normalize(new RawValue.Int(((RawValue.Bool) value).value() ? 1 : 0));
      case INTEGER -> round(((RawValue.Int) value).value());
      case FLOAT -> round(((RawValue.Real) value).value());
      case DECIMAL -> round(((RawValue.Decimal) value).value().doubleValue());
      case NULL -> NormalizedValue.Opaque.NULL;
      case OTHER -> new NormalizedValue.Opaque(((RawValue.Other) value).value());
    };
  }

  /** Re-normalizes an already canonical value; always returns an equal value. */
  public static NormalizedValue normalize(NormalizedValue value) {
    return normalize(value.toRawValue());
  }

  private static NormalizedValue normalizeText(String text) {
    String folded = text.strip().toLowerCase(Locale.ROOT);
    if (TRUE_TOKENS.contains(folded)) {
      return normalize(new RawValue.Int(1));
    }
    if (FALSE_TOKENS.contains(folded)) {
      return normalize(new RawValue.Int(0));
    }
    return new NormalizedValue.Text(folded);
  }

  /**
   * Rounds on the exact binary value of the double, so ties are resolved the same way no matter
   * whether the input arrived as an integer, a float or a decimal.
   */
  private static NormalizedValue round(double value) {
    if (!Double.isFinite(value)) {
      return new NormalizedValue.Number(value);
    }
    double rounded =
        new BigDecimal(value).setScale(PRECISION, RoundingMode.HALF_EVEN).doubleValue();
    return new NormalizedValue.Number(rounded);
  }
}
