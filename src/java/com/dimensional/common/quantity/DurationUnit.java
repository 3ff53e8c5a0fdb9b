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
 * Units of elapsed time, based on the second.
 */
public enum DurationUnit implements Unit<DurationUnit> {
  SECOND(1),
  MILLISECOND(0.001, SECOND),
  MICROSECOND(0.001, MILLISECOND),
  NANOSECOND(0.001, MICROSECOND),
  MINUTE(60, SECOND),
  HOUR(60, MINUTE),
  DAY(24, HOUR);

  private final double multiplier;

  private DurationUnit(double multiplier) {
    this.multiplier = multiplier;
  }

  private DurationUnit(double multiplier, DurationUnit base) {
    this(multiplier * base.multiplier);
  }

  public double multiplier() {
    return multiplier;
  }

  @Override
  public QuantityType<DurationUnit> type() {
    return QuantityType.DURATION;
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
