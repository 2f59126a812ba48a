package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;

import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A fixed-point amount such as {@code 10Gi}, {@code 500m} or {@code 1e3}. The number may carry a binary suffix
 * ({@code Ki Mi Gi Ti Pi Ei}), a decimal suffix ({@code n u m k M G T P E}) or a decimal exponent ({@code e3},
 * {@code E-2}). Quantities are compared by their numeric value; the original text is kept for serialization.
 */
public final class Quantity implements Comparable<Quantity> {

  private static final Pattern QUANTITY_PATTERN = Pattern.compile(
      "([+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+))([eE][+-]?[0-9]+|Ki|Mi|Gi|Ti|Pi|Ei|[numkMGTPE])?");

  private static final BigDecimal KIBI = BigDecimal.valueOf(1024);

  private static final Map<String, BigDecimal> SUFFIX_MULTIPLIERS = ImmutableMap.<String, BigDecimal>builder()
      .put("", BigDecimal.ONE)
      .put("n", BigDecimal.ONE.scaleByPowerOfTen(-9))
      .put("u", BigDecimal.ONE.scaleByPowerOfTen(-6))
      .put("m", BigDecimal.ONE.scaleByPowerOfTen(-3))
      .put("k", BigDecimal.ONE.scaleByPowerOfTen(3))
      .put("M", BigDecimal.ONE.scaleByPowerOfTen(6))
      .put("G", BigDecimal.ONE.scaleByPowerOfTen(9))
      .put("T", BigDecimal.ONE.scaleByPowerOfTen(12))
      .put("P", BigDecimal.ONE.scaleByPowerOfTen(15))
      .put("E", BigDecimal.ONE.scaleByPowerOfTen(18))
      .put("Ki", KIBI)
      .put("Mi", KIBI.pow(2))
      .put("Gi", KIBI.pow(3))
      .put("Ti", KIBI.pow(4))
      .put("Pi", KIBI.pow(5))
      .put("Ei", KIBI.pow(6))
      .build();

  private final String text;

  private final BigDecimal value;

  private Quantity(String text, BigDecimal value) {
    this.text = text;
    this.value = value;
  }

  /**
   * Parses the provided quantity string.
   *
   * @throws IllegalArgumentException if the string is not a well-formed quantity
   */
  public static Quantity parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("Quantity cannot be null");
    }
    String trimmed = text.trim();
    Matcher matcher = QUANTITY_PATTERN.matcher(trimmed);
    if (!matcher.matches()) {
      throw malformed(text);
    }
    BigDecimal number = new BigDecimal(matcher.group(1));
    String suffix = matcher.group(2) == null ? "" : matcher.group(2);
    BigDecimal amount;
    if (suffix.length() > 1 && (suffix.charAt(0) == 'e' || suffix.charAt(0) == 'E')) {
      try {
        amount = number.scaleByPowerOfTen(Integer.parseInt(suffix.substring(1)));
      } catch (NumberFormatException | ArithmeticException e) {
        IllegalArgumentException error = malformed(text);
        error.initCause(e);
        throw error;
      }
    } else {
      amount = number.multiply(SUFFIX_MULTIPLIERS.get(suffix));
    }
    return new Quantity(trimmed, amount);
  }

  private static IllegalArgumentException malformed(String text) {
    return new IllegalArgumentException(String.format("Quantity '%s' must match the regular expression '%s'",
        text, QUANTITY_PATTERN.pattern()));
  }

  /**
   * Accepts both quoted strings and bare YAML/JSON numbers.
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  static Quantity fromJson(Object value) {
    return parse(String.valueOf(value));
  }

  public BigDecimal getValue() {
    return value;
  }

  public boolean isNegative() {
    return value.signum() < 0;
  }

  @Override
  public int compareTo(Quantity other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Quantity)) {
      return false;
    }
    return value.compareTo(((Quantity) o).value) == 0;
  }

  @Override
  public int hashCode() {
    return value.stripTrailingZeros().hashCode();
  }

  @JsonValue
  @Override
  public String toString() {
    return text;
  }
}
