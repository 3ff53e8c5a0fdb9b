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
 * Units of acceleration, based on meters per second squared.
 */
public enum AccelerationUnit implements Unit<AccelerationUnit> {
  METER_PER_SECOND_SQUARED(1),
  STANDARD_GRAVITY(9.80665),
  FOOT_PER_SECOND_SQUARED(0.3048);

  private final double multiplier;

  private AccelerationUnit(double multiplier) {
    this.multiplier = multiplier;
  }

  private AccelerationUnit(double multiplier, AccelerationUnit base) {
    this(multiplier * base.multiplier);
  }

  public double multiplier() {
    return multiplier;
  }

  @Override
  public QuantityType<AccelerationUnit> type() {
    return QuantityType.ACCELERATION;
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
