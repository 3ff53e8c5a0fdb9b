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

public enum SpeedUnit implements Unit<SpeedUnit> {
  METER_PER_SECOND(1),
  KILOMETER_PER_SECOND(1000, METER_PER_SECOND),
  MILLIMETER_PER_SECOND(0.001, METER_PER_SECOND),
  KILOMETER_PER_HOUR(1 / 3.6),
  MILE_PER_HOUR(0.44704),
  KNOT(1852.0 / 3600),
  FOOT_PER_SECOND(0.3048);

  private final double multiplier;

  private SpeedUnit(double multiplier) {
    this.multiplier = multiplier;
  }

  private SpeedUnit(double multiplier, SpeedUnit base) {
    this(multiplier * base.multiplier);
  }

  public double multiplier() {
    return multiplier;
  }

  @Override
  public QuantityType<SpeedUnit> type() {
    return QuantityType.SPEED;
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
