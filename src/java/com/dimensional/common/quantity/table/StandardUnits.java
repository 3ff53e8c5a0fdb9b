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

package com.dimensional.common.quantity.table;

import com.dimensional.common.quantity.AccelerationUnit;
import com.dimensional.common.quantity.AreaUnit;
import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.DurationUnit;
import com.dimensional.common.quantity.ForceUnit;
import com.dimensional.common.quantity.LengthUnit;
import com.dimensional.common.quantity.MassUnit;
import com.dimensional.common.quantity.Prefix;
import com.dimensional.common.quantity.SpeedUnit;
import com.dimensional.common.quantity.TemperatureUnit;
import com.dimensional.common.quantity.TorqueUnit;
import com.dimensional.common.quantity.VolumeUnit;

import static com.dimensional.common.quantity.Culture.EN_US;
import static com.dimensional.common.quantity.Culture.RU_RU;

/**
 * The unit definition table shipped with the library.  It covers English (the fallback culture)
 * for every unit and Russian for most; other cultures, such as {@link Culture#NB_NO}, resolve
 * through the fallback.
 */
public final class StandardUnits {

  private static final UnitDefinitionTable TABLE = createTable();

  private StandardUnits() {
    // utility
  }

  public static UnitDefinitionTable table() {
    return TABLE;
  }

  private static UnitDefinitionTable createTable() {
    UnitDefinitionTable.Builder builder = UnitDefinitionTable.builder();
    prefixSymbols(builder);
    length(builder);
    area(builder);
    volume(builder);
    speed(builder);
    acceleration(builder);
    force(builder);
    torque(builder);
    mass(builder);
    duration(builder);
    temperature(builder);
    return builder.build();
  }

  private static void prefixSymbols(UnitDefinitionTable.Builder builder) {
    builder
        .prefixSymbol(RU_RU, Prefix.NANO, "н")
        .prefixSymbol(RU_RU, Prefix.MICRO, "мк")
        .prefixSymbol(RU_RU, Prefix.MILLI, "м")
        .prefixSymbol(RU_RU, Prefix.CENTI, "с")
        .prefixSymbol(RU_RU, Prefix.DECI, "д")
        .prefixSymbol(RU_RU, Prefix.HECTO, "г")
        .prefixSymbol(RU_RU, Prefix.KILO, "к")
        .prefixSymbol(RU_RU, Prefix.MEGA, "М");
  }

  private static void length(UnitDefinitionTable.Builder builder) {
    builder
        .define(LengthUnit.METER, EN_US, "m")
        .define(LengthUnit.METER, RU_RU, "м")
        .prefixed(LengthUnit.METER, Prefix.KILO, LengthUnit.KILOMETER)
        .prefixed(LengthUnit.METER, Prefix.DECI, LengthUnit.DECIMETER)
        .prefixed(LengthUnit.METER, Prefix.CENTI, LengthUnit.CENTIMETER)
        .prefixed(LengthUnit.METER, Prefix.MILLI, LengthUnit.MILLIMETER)
        .prefixed(LengthUnit.METER, Prefix.MICRO, LengthUnit.MICROMETER)
        .prefixed(LengthUnit.METER, Prefix.NANO, LengthUnit.NANOMETER)
        .define(LengthUnit.FOOT, EN_US, "ft", "'", "′")
        .define(LengthUnit.FOOT, RU_RU, "фут")
        .define(LengthUnit.INCH, EN_US, "in", "\"", "″")
        .define(LengthUnit.INCH, RU_RU, "дюйм")
        .define(LengthUnit.YARD, EN_US, "yd")
        .define(LengthUnit.YARD, RU_RU, "ярд")
        .define(LengthUnit.MILE, EN_US, "mi")
        .define(LengthUnit.MILE, RU_RU, "миля");
  }

  private static void area(UnitDefinitionTable.Builder builder) {
    builder
        .define(AreaUnit.SQUARE_METER, EN_US, "m²")
        .define(AreaUnit.SQUARE_METER, RU_RU, "м²")
        .define(AreaUnit.SQUARE_KILOMETER, EN_US, "km²")
        .define(AreaUnit.SQUARE_KILOMETER, RU_RU, "км²")
        .define(AreaUnit.SQUARE_CENTIMETER, EN_US, "cm²")
        .define(AreaUnit.SQUARE_CENTIMETER, RU_RU, "см²")
        .define(AreaUnit.HECTARE, EN_US, "ha")
        .define(AreaUnit.HECTARE, RU_RU, "га")
        .define(AreaUnit.SQUARE_FOOT, EN_US, "ft²")
        .define(AreaUnit.ACRE, EN_US, "ac");
  }

  private static void volume(UnitDefinitionTable.Builder builder) {
    builder
        .define(VolumeUnit.CUBIC_METER, EN_US, "m³")
        .define(VolumeUnit.CUBIC_METER, RU_RU, "м³")
        .define(VolumeUnit.LITER, EN_US, "l", "L")
        .define(VolumeUnit.LITER, RU_RU, "л")
        .prefixed(VolumeUnit.LITER, Prefix.DECI, VolumeUnit.DECILITER)
        .prefixed(VolumeUnit.LITER, Prefix.CENTI, VolumeUnit.CENTILITER)
        .prefixed(VolumeUnit.LITER, Prefix.MILLI, VolumeUnit.MILLILITER)
        // Both gallons answer to a bare "gal"; the US gallon is declared first and wins.
        .define(VolumeUnit.US_GALLON, EN_US, "gal (U.S.)", "gal")
        .define(VolumeUnit.IMPERIAL_GALLON, EN_US, "gal (imp.)", "gal")
        .define(VolumeUnit.CUBIC_FOOT, EN_US, "ft³");
  }

  private static void speed(UnitDefinitionTable.Builder builder) {
    builder
        .define(SpeedUnit.METER_PER_SECOND, EN_US, "m/s")
        .define(SpeedUnit.METER_PER_SECOND, RU_RU, "м/с")
        .prefixed(SpeedUnit.METER_PER_SECOND, Prefix.KILO, SpeedUnit.KILOMETER_PER_SECOND)
        .prefixed(SpeedUnit.METER_PER_SECOND, Prefix.MILLI, SpeedUnit.MILLIMETER_PER_SECOND)
        .define(SpeedUnit.KILOMETER_PER_HOUR, EN_US, "km/h")
        .define(SpeedUnit.KILOMETER_PER_HOUR, RU_RU, "км/ч")
        .define(SpeedUnit.MILE_PER_HOUR, EN_US, "mph")
        .define(SpeedUnit.KNOT, EN_US, "kn", "kt", "knot")
        .define(SpeedUnit.KNOT, RU_RU, "уз.")
        .define(SpeedUnit.FOOT_PER_SECOND, EN_US, "ft/s");
  }

  private static void acceleration(UnitDefinitionTable.Builder builder) {
    builder
        .define(AccelerationUnit.METER_PER_SECOND_SQUARED, EN_US, "m/s²")
        .define(AccelerationUnit.METER_PER_SECOND_SQUARED, RU_RU, "м/с²")
        .define(AccelerationUnit.STANDARD_GRAVITY, EN_US, "g")
        .define(AccelerationUnit.STANDARD_GRAVITY, RU_RU, "g")
        .define(AccelerationUnit.FOOT_PER_SECOND_SQUARED, EN_US, "ft/s²");
  }

  private static void force(UnitDefinitionTable.Builder builder) {
    builder
        .define(ForceUnit.NEWTON, EN_US, "N")
        .define(ForceUnit.NEWTON, RU_RU, "Н")
        .prefixed(ForceUnit.NEWTON, Prefix.KILO, ForceUnit.KILONEWTON)
        .prefixed(ForceUnit.NEWTON, Prefix.MEGA, ForceUnit.MEGANEWTON)
        .prefixed(ForceUnit.NEWTON, Prefix.MILLI, ForceUnit.MILLINEWTON)
        .define(ForceUnit.POUND_FORCE, EN_US, "lbf")
        .define(ForceUnit.KILOGRAM_FORCE, EN_US, "kgf")
        .define(ForceUnit.KILOGRAM_FORCE, RU_RU, "кгс");
  }

  private static void torque(UnitDefinitionTable.Builder builder) {
    builder
        .define(TorqueUnit.NEWTON_METER, EN_US, "N·m", "Nm")
        .define(TorqueUnit.NEWTON_METER, RU_RU, "Н·м")
        .prefixed(TorqueUnit.NEWTON_METER, Prefix.KILO, TorqueUnit.KILONEWTON_METER)
        .define(TorqueUnit.POUND_FORCE_FOOT, EN_US, "lbf·ft");
  }

  private static void mass(UnitDefinitionTable.Builder builder) {
    builder
        .define(MassUnit.GRAM, EN_US, "g")
        .define(MassUnit.GRAM, RU_RU, "г")
        .prefixed(MassUnit.GRAM, Prefix.KILO, MassUnit.KILOGRAM)
        .prefixed(MassUnit.GRAM, Prefix.MILLI, MassUnit.MILLIGRAM)
        .prefixed(MassUnit.GRAM, Prefix.MICRO, MassUnit.MICROGRAM)
        .define(MassUnit.TONNE, EN_US, "t")
        .define(MassUnit.TONNE, RU_RU, "т")
        .define(MassUnit.POUND, EN_US, "lb", "lbs")
        .define(MassUnit.POUND, RU_RU, "фунт")
        .define(MassUnit.OUNCE, EN_US, "oz");
  }

  private static void duration(UnitDefinitionTable.Builder builder) {
    builder
        .define(DurationUnit.SECOND, EN_US, "s", "sec")
        .define(DurationUnit.SECOND, RU_RU, "с", "сек")
        .prefixed(DurationUnit.SECOND, Prefix.MILLI, DurationUnit.MILLISECOND)
        .prefixed(DurationUnit.SECOND, Prefix.MICRO, DurationUnit.MICROSECOND)
        .prefixed(DurationUnit.SECOND, Prefix.NANO, DurationUnit.NANOSECOND)
        .define(DurationUnit.MINUTE, EN_US, "min", "m")
        .define(DurationUnit.MINUTE, RU_RU, "мин")
        .define(DurationUnit.HOUR, EN_US, "h", "hr")
        .define(DurationUnit.HOUR, RU_RU, "ч")
        .define(DurationUnit.DAY, EN_US, "d", "day", "days")
        .define(DurationUnit.DAY, RU_RU, "сут", "д");
  }

  private static void temperature(UnitDefinitionTable.Builder builder) {
    builder
        .define(TemperatureUnit.KELVIN, EN_US, "K")
        .define(TemperatureUnit.DEGREE_CELSIUS, EN_US, "°C")
        .define(TemperatureUnit.DEGREE_FAHRENHEIT, EN_US, "°F");
  }
}
