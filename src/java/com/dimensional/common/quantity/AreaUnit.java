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
 * Units of area, based on the square meter.
 */
public enum AreaUnit implements Unit<AreaUnit> {
  SQUARE_METER(1),
  SQUARE_KILOMETER(1e6, SQUARE_METER),
  SQUARE_CENTIMETER(1e-4, SQUARE_METER),
  HECTARE(1e4, SQUARE_METER),
  SQUARE_FOOT(0.09290304),
  ACRE(43560, SQUARE_FOOT);

  private final double multiplier;

  private AreaUnit(double multiplier) {
    this.multiplier = multiplier;
  }

  private AreaUnit(double multiplier, AreaUnit base) {
    this(multiplier * base.multiplier);
  }

  public double multiplier() {
    return multiplier;
  }

  @Override
  public QuantityType<AreaUnit> type() {
    return QuantityType.AREA;
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
