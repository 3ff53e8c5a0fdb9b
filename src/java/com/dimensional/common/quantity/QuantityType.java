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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import com.dimensional.common.base.MorePreconditions;

/**
 * Identifies a physical dimension family, such as length or mass, and serves as the type tag used
 * to select parsers and operator rules.  Each quantity type has exactly one base unit that all of
 * its other units convert through.
 *
 * @param <U> the unit enumeration of this quantity type
 */
public final class QuantityType<U extends Unit<U>> {

  public static final QuantityType<LengthUnit> LENGTH =
      new QuantityType<LengthUnit>("Length", LengthUnit.class, LengthUnit.METER);
  public static final QuantityType<AreaUnit> AREA =
      new QuantityType<AreaUnit>("Area", AreaUnit.class, AreaUnit.SQUARE_METER);
  public static final QuantityType<VolumeUnit> VOLUME =
      new QuantityType<VolumeUnit>("Volume", VolumeUnit.class, VolumeUnit.CUBIC_METER);
  public static final QuantityType<SpeedUnit> SPEED =
      new QuantityType<SpeedUnit>("Speed", SpeedUnit.class, SpeedUnit.METER_PER_SECOND);
  public static final QuantityType<AccelerationUnit> ACCELERATION =
      new QuantityType<AccelerationUnit>("Acceleration", AccelerationUnit.class,
          AccelerationUnit.METER_PER_SECOND_SQUARED);
  public static final QuantityType<ForceUnit> FORCE =
      new QuantityType<ForceUnit>("Force", ForceUnit.class, ForceUnit.NEWTON);
  public static final QuantityType<TorqueUnit> TORQUE =
      new QuantityType<TorqueUnit>("Torque", TorqueUnit.class, TorqueUnit.NEWTON_METER);
  public static final QuantityType<MassUnit> MASS =
      new QuantityType<MassUnit>("Mass", MassUnit.class, MassUnit.KILOGRAM);
  public static final QuantityType<DurationUnit> DURATION =
      new QuantityType<DurationUnit>("Duration", DurationUnit.class, DurationUnit.SECOND);
  public static final QuantityType<TemperatureUnit> TEMPERATURE =
      new QuantityType<TemperatureUnit>("Temperature", TemperatureUnit.class,
          TemperatureUnit.KELVIN);

  private static final ImmutableList<QuantityType<?>> VALUES = ImmutableList.<QuantityType<?>>of(
      LENGTH, AREA, VOLUME, SPEED, ACCELERATION, FORCE, TORQUE, MASS, DURATION, TEMPERATURE);

  private final String name;
  private final Class<U> unitClass;
  private final U baseUnit;

  private QuantityType(String name, Class<U> unitClass, U baseUnit) {
    this.name = MorePreconditions.checkNotBlank(name);
    this.unitClass = Preconditions.checkNotNull(unitClass);
    this.baseUnit = Preconditions.checkNotNull(baseUnit);
  }

  /**
   * Returns every quantity type known to this library in declaration order.
   */
  public static ImmutableList<QuantityType<?>> values() {
    return VALUES;
  }

  public String getName() {
    return name;
  }

  public Class<U> getUnitClass() {
    return unitClass;
  }

  public U getBaseUnit() {
    return baseUnit;
  }

  /**
   * Returns all units of this type in their enumeration order.  Note that a unit definition table
   * may define only a subset of these.
   */
  public ImmutableList<U> getUnits() {
    return ImmutableList.copyOf(unitClass.getEnumConstants());
  }

  /**
   * Casts {@code unit} to this type's unit class.
   *
   * @param unit a unit of any type
   * @return the unit, typed to this quantity type
   * @throws IllegalArgumentException if the unit belongs to another quantity type
   */
  public U cast(Unit<?> unit) {
    Preconditions.checkArgument(unitClass.isInstance(unit),
        "Unit %s is not a unit of %s", unit, name);
    return unitClass.cast(unit);
  }

  @Override
  public String toString() {
    return name;
  }
}
