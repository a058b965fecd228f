package dev.sqljudge.normalize;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Canonical, comparable form of a cell produced by {@link ValueNormalizer}.
 *
 * <p>All variants have structural equality and a stable hash, so they can be used as set members
 * and inside {@link NormalizedRow} keys.
 */
public sealed interface NormalizedValue
    permits NormalizedValue.Text, NormalizedValue.Number, NormalizedValue.Opaque {

  /**
   * Lifts this value back into a {@link RawValue}. Normalizing the result yields this value again.
   */
  RawValue toRawValue();

  /** Trimmed, lower-cased text that is not a boolean token. */
  record Text(String value) implements NormalizedValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public RawValue toRawValue() {
      return new RawValue.Text(value);
    }
  }

  /** A number already rounded to {@link ValueNormalizer#PRECISION} fractional digits. */
  record Number(double value) implements NormalizedValue {
    public Number {
      // -0.0 and 0.0 must collide in sets
      if (value == 0.0) {
        value = 0.0;
      }
    }

    @Override
    public RawValue toRawValue() {
      return new RawValue.Real(value);
    }
  }

  /** A value kept unchanged: SQL null or a type without a dedicated normalization. */
  record Opaque(@Nullable Object value) implements NormalizedValue {

    public static final Opaque NULL = new Opaque(null);

    @Override
    public RawValue toRawValue() {
      return value == null ? RawValue.NULL : new RawValue.Other(value);
    }
  }
}
