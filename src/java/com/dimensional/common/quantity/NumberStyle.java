// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.dimensional.common.quantity;

import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import com.dimensional.common.base.MorePreconditions;

/**
 * The number format of a culture: its decimal separator, optional group (thousands) separator
 * and negative sign.  A style both contributes the number part of parse patterns and converts
 * matched literals and values to and from text, so parsing never depends on the JVM default
 * locale.
 */
public final class NumberStyle {

  /**
   * The style of the invariant culture: {@code 1,234.5} and {@code -1}.
   */
  public static final NumberStyle INVARIANT = new NumberStyle('.', ',', '-');

  private final char decimalSeparator;
  @Nullable private final Character groupSeparator;
  private final char negativeSign;

  /**
   * Creates a number style.  A group separator equal to the decimal separator would make literals
   * ambiguous, so grouping is disabled in that case.
   *
   * @param decimalSeparator separates the integral and fractional digits
   * @param groupSeparator separates groups of three integral digits, or {@code null} for none
   * @param negativeSign the culture's minus sign; the ASCII '-' is always accepted as well
   */
  public NumberStyle(char decimalSeparator, @Nullable Character groupSeparator,
      char negativeSign) {
    this.decimalSeparator = MorePreconditions.checkSeparator(decimalSeparator, "decimal separator");
    if (groupSeparator != null) {
      MorePreconditions.checkSeparator(groupSeparator, "group separator");
    }
    this.groupSeparator = Objects.equal(groupSeparator, decimalSeparator) ? null : groupSeparator;
    Preconditions.checkArgument(negativeSign != decimalSeparator,
        "negative sign may not equal the decimal separator");
    this.negativeSign = negativeSign;
  }

  public char getDecimalSeparator() {
    return decimalSeparator;
  }

  @Nullable
  public Character getGroupSeparator() {
    return groupSeparator;
  }

  public char getNegativeSign() {
    return negativeSign;
  }

  /**
   * Returns a regular expression matching a number literal in this style.  The expression contains
   * no capturing groups, so it can be embedded any number of times in a larger pattern.
   */
  public String numberPattern() {
    String sign = "[+\\-" + quoteInClass(negativeSign) + "]?";
    String integral = groupSeparator == null
        ? "\\d+"
        : "(?:\\d{1,3}(?:" + Pattern.quote(String.valueOf(groupSeparator)) + "\\d{3})+|\\d+)";
    String decimal = Pattern.quote(String.valueOf(decimalSeparator));
    return sign
        + "(?:" + integral + "(?:" + decimal + "\\d*)?|" + decimal + "\\d+)"
        + "(?:[eE][+\\-]?\\d+)?";
  }

  /**
   * Converts a literal matched by {@link #numberPattern()} to a double.
   *
   * @param literal the number text
   * @return the parsed value
   * @throws NumberFormatException if the literal is not a number in this style
   */
  public double parse(String literal) {
    Preconditions.checkNotNull(literal);
    String normalized = literal.trim();
    if (groupSeparator != null) {
      normalized = CharMatcher.is(groupSeparator).removeFrom(normalized);
    }
    normalized = normalized.replace(negativeSign, '-').replace(decimalSeparator, '.');
    if (!normalized.matches("[+\\-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+\\-]?\\d+)?")) {
      throw new NumberFormatException("Not a number: '" + literal + "'");
    }
    return Double.parseDouble(normalized);
  }

  /**
   * Formats a value with this style's decimal separator and negative sign.  Grouping is never
   * applied, and large or small magnitudes use an exponent, so the output always round-trips
   * through {@link #parse(String)}.
   *
   * @param value the value to format
   * @return the formatted value
   */
  public String format(double value) {
    Preconditions.checkArgument(!Double.isNaN(value) && !Double.isInfinite(value),
        "Only finite values can be formatted: %s", value);
    String magnitude = Double.toString(Math.abs(value)).replace('.', decimalSeparator);
    return value < 0 ? negativeSign + magnitude : magnitude;
  }

  /**
   * Formats a whole number with this style's negative sign and no grouping.
   */
  public String format(long value) {
    String magnitude = Long.toString(Math.abs(value));
    return value < 0 ? negativeSign + magnitude : magnitude;
  }

  private static String quoteInClass(char c) {
    return "\\x{" + Integer.toHexString(c) + "}";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof NumberStyle)) {
      return false;
    }
    NumberStyle other = (NumberStyle) obj;
    return decimalSeparator == other.decimalSeparator
        && Objects.equal(groupSeparator, other.groupSeparator)
        && negativeSign == other.negativeSign;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(decimalSeparator, groupSeparator, negativeSign);
  }

  @Override
  public String toString() {
    return String.format("NumberStyle[decimal='%s', group='%s', negative='%s']",
        decimalSeparator, groupSeparator, negativeSign);
  }
}
