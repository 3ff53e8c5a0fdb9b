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

import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.testing.EqualsTester;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class QuantityTest {

  private static final double EPSILON = 1e-9;

  @Test
  public void testEquals() {
    new EqualsTester()
        .addEqualityGroup(Quantity.of(1, DurationUnit.DAY), Quantity.of(24, DurationUnit.HOUR),
            Quantity.of(86400, DurationUnit.SECOND))
        .addEqualityGroup(Quantity.of(25, DurationUnit.HOUR))
        .addEqualityGroup(Quantity.of(1, LengthUnit.KILOMETER),
            Quantity.of(1000, LengthUnit.METER))
        .addEqualityGroup(Quantity.of(1, MassUnit.KILOGRAM), Quantity.of(1000, MassUnit.GRAM))
        .testEquals();

    assertFalse("quantities of different types should never be equal even if their values are",
        Quantity.of(1, LengthUnit.METER).equals(Quantity.of(1, DurationUnit.SECOND)));
  }

  @Test
  public void testComparisonMixedUnits() {
    assertTrue(Quantity.of(1, DurationUnit.MINUTE)
        .compareTo(Quantity.of(59, DurationUnit.SECOND)) > 0);
    assertTrue(Quantity.of(1, DurationUnit.MINUTE)
        .compareTo(Quantity.of(60, DurationUnit.SECOND)) == 0);
    assertTrue(Quantity.of(1, DurationUnit.MINUTE)
        .compareTo(Quantity.of(61, DurationUnit.SECOND)) < 0);
  }

  @Test
  @SuppressWarnings("unchecked") // Needed because type information lost in vargs.
  public void testOrderingMixedUnits() {
    assertEquals(
        Lists.newArrayList(
            Quantity.of(1, LengthUnit.MILLIMETER),
            Quantity.of(1, LengthUnit.INCH),
            Quantity.of(1, LengthUnit.METER),
            Quantity.of(1, LengthUnit.MILE)),
        Ordering.natural().sortedCopy(Lists.newArrayList(
            Quantity.of(1, LengthUnit.METER),
            Quantity.of(1, LengthUnit.MILE),
            Quantity.of(1, LengthUnit.MILLIMETER),
            Quantity.of(1, LengthUnit.INCH))));
  }

  @Test
  public void testConversion() {
    Quantity<MassUnit> pounds = Quantity.of(2, MassUnit.POUND);
    assertEquals(0.90718474, pounds.as(MassUnit.KILOGRAM), EPSILON);
    assertEquals(32, pounds.as(MassUnit.OUNCE), EPSILON);
    assertEquals(0.90718474, pounds.baseValue(), EPSILON);

    Quantity<MassUnit> kilograms = pounds.to(MassUnit.KILOGRAM);
    assertSame(MassUnit.KILOGRAM, kilograms.getUnit());
    assertSame(QuantityType.MASS, kilograms.getType());
    assertSame(pounds, pounds.to(MassUnit.POUND));
  }

  @Test
  public void testSameTypeArithmeticUsesLeftUnit() {
    Quantity<LengthUnit> sum =
        Quantity.of(2, LengthUnit.FOOT).plus(Quantity.of(6, LengthUnit.INCH));
    assertSame(LengthUnit.FOOT, sum.getUnit());
    assertEquals(2.5, sum.getValue(), EPSILON);

    Quantity<LengthUnit> difference =
        Quantity.of(1, LengthUnit.METER).minus(Quantity.of(25, LengthUnit.CENTIMETER));
    assertSame(LengthUnit.METER, difference.getUnit());
    assertEquals(0.75, difference.getValue(), EPSILON);

    assertEquals(-3, Quantity.of(3, LengthUnit.YARD).negate().getValue(), 0);
    assertEquals(7.5, Quantity.of(2.5, LengthUnit.YARD).times(3).getValue(), EPSILON);
    assertEquals(1.25, Quantity.of(2.5, LengthUnit.YARD).dividedBy(2).getValue(), EPSILON);
    assertEquals(1000,
        Quantity.of(1, LengthUnit.KILOMETER).ratio(Quantity.of(1, LengthUnit.METER)), EPSILON);
  }

  @Test
  public void testIsWithin() {
    Quantity<LengthUnit> foot = Quantity.of(1, LengthUnit.FOOT);
    assertTrue(foot.isWithin(Quantity.of(12, LengthUnit.INCH), EPSILON));
    assertFalse(foot.isWithin(Quantity.of(13, LengthUnit.INCH), 0.01));
  }

  @Test
  public void testTemperatureIsAffine() {
    Quantity<TemperatureUnit> boiling = Quantity.of(100, TemperatureUnit.DEGREE_CELSIUS);
    assertEquals(373.15, boiling.baseValue(), EPSILON);
    assertEquals(212, boiling.as(TemperatureUnit.DEGREE_FAHRENHEIT), EPSILON);
    assertEquals(-40, Quantity.of(-40, TemperatureUnit.DEGREE_FAHRENHEIT)
        .as(TemperatureUnit.DEGREE_CELSIUS), EPSILON);
    assertEquals(0, Quantity.of(-273.15, TemperatureUnit.DEGREE_CELSIUS).baseValue(), EPSILON);
  }

  @Test
  public void testInfinityAllowedNaNRejected() {
    assertTrue(Double.isInfinite(
        Quantity.of(Double.POSITIVE_INFINITY, LengthUnit.METER).baseValue()));
    try {
      Quantity.of(Double.NaN, LengthUnit.METER);
      fail("NaN should be rejected");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testOfBase() {
    Quantity<SpeedUnit> speed = Quantity.ofBase(5, QuantityType.SPEED);
    assertSame(SpeedUnit.METER_PER_SECOND, speed.getUnit());
    assertEquals(18, speed.as(SpeedUnit.KILOMETER_PER_HOUR), EPSILON);
  }

  @Test
  public void testUnitsRoundTripThroughBase() {
    for (QuantityType<?> type : QuantityType.values()) {
      assertSame(type, type.getBaseUnit().type());
      assertEquals(1, type.getBaseUnit().toBase(1), 0);
      for (Unit<?> unit : type.getUnits()) {
        assertSame(type, unit.type());
        assertEquals(unit + " should round trip", 42.5, unit.fromBase(unit.toBase(42.5)), 1e-9);
      }
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCastRejectsForeignUnit() {
    QuantityType.LENGTH.cast(MassUnit.GRAM);
  }
}
