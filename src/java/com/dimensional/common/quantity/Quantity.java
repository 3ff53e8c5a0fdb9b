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

import com.google.common.base.Preconditions;

import com.dimensional.common.base.MorePreconditions;

/**
 * Represents a value in a unit of some quantity type and facilitates unambiguous communication of
 * physical amounts.  Instances are created via the static factory {@code of(...)} methods and are
 * immutable.
 *
 * <p>Arithmetic and comparisons operate on the value converted to the base unit of the quantity
 * type, so {@code 1 km} equals {@code 1000 m}.  Sums and differences are expressed in the unit of
 * the left operand.
 *
 * @param <U> the type of unit that this quantity is expressed in
 */
public final class Quantity<U extends Unit<U>> implements Comparable<Quantity<U>> {

  private final double value;
  private final U unit;

  private Quantity(double value, U unit) {
    this.value = MorePreconditions.checkNotNaN(value, "Quantity value may not be NaN: %s");
    this.unit = Preconditions.checkNotNull(unit);
  }

  /**
   * Creates a quantity of {@code value} {@code unit}s.
   *
   * @param value the number of units the returned quantity should quantify
   * @param unit the unit the returned quantity is expressed in terms of
   * @param <U> the type of unit that the returned quantity quantifies
   * @return a quantity of the given {@code value} of {@code unit}s
   * @throws IllegalArgumentException if the value is {@code NaN}
   */
  public static <U extends Unit<U>> Quantity<U> of(double value, U unit) {
    return new Quantity<U>(value, unit);
  }

  /**
   * Creates a quantity expressed in the base unit of {@code type}.
   *
   * @param baseValue the value in the base unit
   * @param type the quantity type of the result
   * @param <U> the unit type of {@code type}
   * @return a quantity in the base unit of {@code type}
   */
  public static <U extends Unit<U>> Quantity<U> ofBase(double baseValue, QuantityType<U> type) {
    return new Quantity<U>(baseValue, type.getBaseUnit());
  }

  public double getValue() {
    return value;
  }

  public U getUnit() {
    return unit;
  }

  public QuantityType<U> getType() {
    return unit.type();
  }

  /**
   * Returns the value of this quantity in the base unit of its type.
   */
  public double baseValue() {
    return unit.toBase(value);
  }

  public double as(U targetUnit) {
    return targetUnit.equals(unit) ? value : targetUnit.fromBase(baseValue());
  }

  /**
   * Returns an equal quantity expressed in {@code targetUnit}.
   */
  public Quantity<U> to(U targetUnit) {
    return targetUnit.equals(unit) ? this : of(as(targetUnit), targetUnit);
  }

  public Quantity<U> plus(Quantity<U> other) {
    return of(value + other.as(unit), unit);
  }

  public Quantity<U> minus(Quantity<U> other) {
    return of(value - other.as(unit), unit);
  }

  public Quantity<U> negate() {
    return of(-value, unit);
  }

  public Quantity<U> times(double factor) {
    return of(value * factor, unit);
  }

  public Quantity<U> dividedBy(double divisor) {
    return of(value / divisor, unit);
  }

  /**
   * Returns the dimensionless ratio of this quantity to {@code other}.
   */
  public double ratio(Quantity<U> other) {
    return baseValue() / other.baseValue();
  }

  /**
   * Tests whether this quantity and {@code other} differ by at most {@code tolerance}, measured in
   * the unit of this quantity.
   */
  public boolean isWithin(Quantity<U> other, double tolerance) {
    Preconditions.checkArgument(tolerance >= 0, "Tolerance must be non-negative: %s", tolerance);
    return Math.abs(value - other.as(unit)) <= tolerance;
  }

  @Override
  public int hashCode() {
    return 31 * getType().hashCode() + Double.valueOf(baseValue()).hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Quantity)) {
      return false;
    }

    Quantity<?> other = (Quantity<?>) obj;
    return getType() == other.getType()
        && Double.compare(baseValue(), other.baseValue()) == 0;
  }

  @Override
  public int compareTo(Quantity<U> other) {
    return Double.compare(baseValue(), other.baseValue());
  }

  @Override
  public String toString() {
    return value + " " + unit;
  }
}
