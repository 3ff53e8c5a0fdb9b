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
 * Units of volume, based on the cubic meter.  Both the US liquid gallon and the imperial gallon are
 * present since they share the customary "gal" abbreviation.
 */
public enum VolumeUnit implements Unit<VolumeUnit> {
  CUBIC_METER(1),
  LITER(0.001, CUBIC_METER),
  DECILITER(0.1, LITER),
  CENTILITER(0.01, LITER),
  MILLILITER(0.001, LITER),
  US_GALLON(3.785411784, LITER),
  IMPERIAL_GALLON(4.54609, LITER),
  CUBIC_FOOT(0.028316846592);

  private final double multiplier;

  private VolumeUnit(double multiplier) {
    this.multiplier = multiplier;
  }

  private VolumeUnit(double multiplier, VolumeUnit base) {
    this(multiplier * base.multiplier);
  }

  public double multiplier() {
    return multiplier;
  }

  @Override
  public QuantityType<VolumeUnit> type() {
    return QuantityType.VOLUME;
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
