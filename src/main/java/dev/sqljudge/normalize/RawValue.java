package dev.sqljudge.normalize;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A single cell value as returned by a query executor.
 *
 * <p>Every variant reports its {@link Kind} tag so callers can dispatch with an exhaustive {@code
 * switch} instead of inspecting runtime types. Use {@link #of(Object)} to lift a value coming out
 * of JDBC or Jackson.
 */
public sealed interface RawValue
    permits RawValue.Text,
        RawValue.Int,
        RawValue.Real,
        RawValue.Decimal,
        RawValue.Bool,
        RawValue.Null,
        RawValue.Other {

  /** Shared null cell. */
  RawValue NULL = new Null();

  Kind kind();

  /** Type tag of a raw cell value. */
  enum Kind {
    TEXT,
    INTEGER,
    FLOAT,
    DECIMAL,
    BOOLEAN,
    NULL,
    OTHER
  }

  /**
   * Lifts an arbitrary driver value into its variant.
   *
   * <p>Integral types up to {@code long} become {@link Int}; {@link BigInteger} becomes {@link
   * Decimal} so no digits are lost before normalization.
   *
   * @param value the value as produced by the driver, possibly null
   * @return the matching variant, {@link #NULL} for null
   */
  static RawValue of(@Nullable Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof RawValue raw) {
      return raw;
    }
    if (value instanceof String s) {
      return new Text(s);
    }
    if (value instanceof Character c) {
      return new Text(String.valueOf(c));
    }
    if (value instanceof Boolean b) {
      return new Bool(b);
    }
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return new Int(((Number) value).longValue());
    }
    if (value instanceof Double || value instanceof Float) {
      return new Real(((Number) value).doubleValue());
    }
    if (value instanceof BigDecimal d) {
      return new Decimal(d);
    }
    if (value instanceof BigInteger i) {
      return new Decimal(new BigDecimal(i));
    }
    return new Other(value);
  }

  record Text(String value) implements RawValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
      return Kind.TEXT;
    }
  }

  record Int(long value) implements RawValue {
    @Override
    public Kind kind() {
      return Kind.INTEGER;
    }
  }

  record Real(double value) implements RawValue {
    @Override
    public Kind kind() {
      return Kind.FLOAT;
    }
  }

  record Decimal(BigDecimal value) implements RawValue {
    public Decimal {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
      return Kind.DECIMAL;
    }
  }

  record Bool(boolean value) implements RawValue {
    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }
  }

  record Null() implements RawValue {
    @Override
    public Kind kind() {
      return Kind.NULL;
    }
  }

  /**
   * Any value without a dedicated variant (dates, arrays, driver objects). A {@code byte[]} is
   * stored as an unmodifiable {@code List<Byte>} so that equal binary cells are equal values.
   */
  record Other(Object value) implements RawValue {
    public Other {
      Objects.requireNonNull(value, "value");
      if (value instanceof byte[] bytes) {
        value = byteList(bytes);
      }
    }

    private static List<Byte> byteList(byte[] bytes) {
      List<Byte> list = new ArrayList<>(bytes.length);
      for (byte b : bytes) {
        list.add(b);
      }
      return Collections.unmodifiableList(list);
    }

    @Override
    public Kind kind() {
      return Kind.OTHER;
    }
  }
}
