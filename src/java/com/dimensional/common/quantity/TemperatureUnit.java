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
 * Units of thermodynamic temperature.  Unlike the other unit enumerations these are affine: each
 * unit converts to kelvins with a scale and an offset, so {@code toBase(0)} is not zero.
 */
public enum TemperatureUnit implements Unit<TemperatureUnit> {
  KELVIN(1, 0),
  DEGREE_CELSIUS(1, 273.15),
  DEGREE_FAHRENHEIT(5.0 / 9, 459.67 * 5.0 / 9);

  private final double scale;
  private final double offset;

  private TemperatureUnit(double scale, double offset) {
    this.scale = scale;
    this.offset = offset;
  }

  @Override
  public QuantityType<TemperatureUnit> type() {
    return QuantityType.TEMPERATURE;
  }

  @Override
  public double toBase(double value) {
    return value * scale + offset;
  }

  @Override
  public double fromBase(double baseValue) {
    return (baseValue - offset) / scale;
  }
}
