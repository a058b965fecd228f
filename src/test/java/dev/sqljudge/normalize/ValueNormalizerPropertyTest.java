package dev.sqljudge.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link ValueNormalizer} invariants: idempotence over every raw value
 * kind and the precision bound of numeric rounding.
 */
class ValueNormalizerPropertyTest {

  @Provide
  Arbitrary<RawValue> rawValues() {
    return Arbitraries.oneOf(
        texts().map(RawValue.Text::new),
        Arbitraries.longs().map(RawValue.Int::new),
        Arbitraries.doubles().map(RawValue.Real::new),
        Arbitraries.bigDecimals()
            .between(new BigDecimal("-1e12"), new BigDecimal("1e12"))
            .ofScale(8)
            .map(RawValue.Decimal::new),
        Arbitraries.of(true, false).map(RawValue.Bool::new),
        Arbitraries.just(RawValue.NULL),
        Arbitraries.integers()
            .between(0, 20_000)
            .map(days -> new RawValue.Other(LocalDate.ofEpochDay(days))));
  }

  private Arbitrary<String> texts() {
    return Arbitraries.oneOf(
        Arbitraries.of("true", " Yes", "NO ", "0", "1", "False", "maybe"),
        Arbitraries.strings().withCharRange('A', 'z').withChars(' ', '\t').ofMaxLength(12));
  }

  @Property
  void normalizing_twice_equals_normalizing_once(@ForAll("rawValues") RawValue value) {
    NormalizedValue once = ValueNormalizer.normalize(value);
    NormalizedValue twice = ValueNormalizer.normalize(once);

    assertThat(twice).isEqualTo(once);
  }

  @Property
  void normalization_is_deterministic(@ForAll("rawValues") RawValue value) {
    assertThat(ValueNormalizer.normalize(value)).isEqualTo(ValueNormalizer.normalize(value));
  }

  @Property
  void rounded_numbers_stay_within_half_a_unit_of_the_fifth_digit(
      @ForAll("moderateDoubles") double value) {
    NormalizedValue.Number normalized =
        (NormalizedValue.Number) ValueNormalizer.normalize(new RawValue.Real(value));

    assertThat(Math.abs(normalized.value() - value)).isLessThanOrEqualTo(0.5e-5 + 1e-9);
  }

  @Provide
  Arbitrary<Double> moderateDoubles() {
    return Arbitraries.doubles().between(-1e6, 1e6);
  }

  @Property
  void normalized_text_is_never_a_boolean_token(@ForAll("rawValues") RawValue value) {
    NormalizedValue normalized = ValueNormalizer.normalize(value);

    if (normalized instanceof NormalizedValue.Text text) {
      assertThat(text.value()).isNotIn("true", "yes", "1", "false", "no", "0");
      assertThat(text.value()).isEqualTo(text.value().strip());
    }
  }
}
