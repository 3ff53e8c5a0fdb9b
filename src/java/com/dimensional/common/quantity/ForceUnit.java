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
 * Units of force, based on the newton.
 */
public enum ForceUnit implements Unit<ForceUnit> {
  NEWTON(1),
  KILONEWTON(1000, NEWTON),
  MEGANEWTON(1000, KILONEWTON),
  MILLINEWTON(0.001, NEWTON),
  POUND_FORCE(4.4482216152605),
  KILOGRAM_FORCE(9.80665);

  private final double multiplier;

  private ForceUnit(double multiplier) {
    this.multiplier = multiplier;
  }

  private ForceUnit(double multiplier, ForceUnit base) {
    this(multiplier * base.multiplier);
  }

  public double multiplier() {
    return multiplier;
  }

  @Override
  public QuantityType<ForceUnit> type() {
    return QuantityType.FORCE;
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
