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

import java.util.Locale;

import com.google.common.base.Preconditions;

/**
 * A length split into whole feet and remaining inches, the customary way of stating heights and
 * room dimensions in the US.
 */
public final class FeetInches {

  private static final double INCHES_PER_FOOT = 12;

  private final double feet;
  private final double inches;

  public FeetInches(double feet, double inches) {
    this.feet = feet;
    this.inches = inches;
  }

  /**
   * Splits a length into whole feet and the remaining inches.  The feet are rounded towards
   * negative infinity, so the inches are never negative for a negative length whose magnitude
   * spans whole feet.  This is not a truncating split: -20 in is -2 ft 4 in, not -1 ft -8 in.
   *
   * @param length the length to split
   * @return the feet and inches of the length
   */
  public static FeetInches of(Quantity<LengthUnit> length) {
    Preconditions.checkNotNull(length);
    double totalInches = length.as(LengthUnit.INCH);
    double wholeFeet = Math.floor(totalInches / INCHES_PER_FOOT);
    return new FeetInches(wholeFeet, totalInches - wholeFeet * INCHES_PER_FOOT);
  }

  /**
   * Creates a length from a number of feet and inches.
   */
  public static Quantity<LengthUnit> toLength(double feet, double inches) {
    return Quantity.of(INCHES_PER_FOOT * feet + inches, LengthUnit.INCH);
  }

  public double getFeet() {
    return feet;
  }

  public double getInches() {
    return inches;
  }

  public Quantity<LengthUnit> toLength() {
    return toLength(feet, inches);
  }

  /**
   * Formats as {@code 5 ft 4 in}.  Fractional inches are not customary, so inches are rounded.
   */
  @Override
  public String toString() {
    return String.format(Locale.ROOT, "%.0f ft %d in", feet, Math.round(inches));
  }
}
