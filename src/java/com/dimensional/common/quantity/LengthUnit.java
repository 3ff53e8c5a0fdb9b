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

/**
 * Units of length.  The base unit is the meter; feet, inches, yards and miles use their exact
 * international definitions.
 */
public enum LengthUnit implements Unit<LengthUnit> {
  METER(1),
  KILOMETER(1000, METER),
  DECIMETER(0.1, METER),
  CENTIMETER(0.01, METER),
  MILLIMETER(0.001, METER),
  MICROMETER(0.001, MILLIMETER),
  NANOMETER(0.001, MICROMETER),
  INCH(0.0254),
  FOOT(0.3048),
  YARD(0.9144),
  MILE(1609.344);

  private final double multiplier;

  private LengthUnit(double multiplier) {
    this.multiplier = multiplier;
  }

  private LengthUnit(double multiplier, LengthUnit base) {
    this(multiplier * base.multiplier);
  }

  /**
   * Returns the number of meters in one of this unit.
   */
  public double multiplier() {
    return multiplier;
  }

  @Override
  public QuantityType<LengthUnit> type() {
    return QuantityType.LENGTH;
  }

  @Override
  public double toBase(double value) {
    return value * multiplier;
  }

  @Override
  public double fromBase(double baseValue) {
    return baseValue / multiplier;
  }
}
