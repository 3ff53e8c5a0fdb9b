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
 * Units of mass.  The base unit is the kilogram even though the gram is the unit that metric
 * prefixes are applied to.
 */
public enum MassUnit implements Unit<MassUnit> {
  KILOGRAM(1),
  GRAM(0.001, KILOGRAM),
  MILLIGRAM(0.001, GRAM),
  MICROGRAM(0.001, MILLIGRAM),
  TONNE(1000, KILOGRAM),
  POUND(0.45359237),
  OUNCE(1.0 / 16, POUND);

  private final double multiplier;

  private MassUnit(double multiplier) {
    this.multiplier = multiplier;
  }

  private MassUnit(double multiplier, MassUnit base) {
    this(multiplier * base.multiplier);
  }

  public double multiplier() {
    return multiplier;
  }

  @Override
  public QuantityType<MassUnit> type() {
    return QuantityType.MASS;
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
