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

package com.dimensional.common.quantity.algebra;

import java.util.Random;

import org.junit.Test;

import com.dimensional.common.quantity.AccelerationUnit;
import com.dimensional.common.quantity.AreaUnit;
import com.dimensional.common.quantity.DurationUnit;
import com.dimensional.common.quantity.ForceUnit;
import com.dimensional.common.quantity.LengthUnit;
import com.dimensional.common.quantity.MassUnit;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.QuantityType;
import com.dimensional.common.quantity.SpeedUnit;
import com.dimensional.common.quantity.TemperatureUnit;
import com.dimensional.common.quantity.TorqueUnit;
import com.dimensional.common.quantity.VolumeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class OperatorNetworkTest {

  private static final double EPSILON = 1e-9;

  private final OperatorNetwork network = OperatorNetwork.standard();

  @Test
  public void testDerivedRules() {
    assertEquals(6, network.getProducts().size());
    // Length × Length = Area derives only two distinct rules.
    assertEquals(22, network.getRules().size());

    assertSame(QuantityType.SPEED,
        network.getRule(QuantityType.LENGTH, Operator.DIVIDE, QuantityType.DURATION).get()
            .getResult());
    assertSame(QuantityType.DURATION,
        network.getRule(QuantityType.LENGTH, Operator.DIVIDE, QuantityType.SPEED).get()
            .getResult());
    assertSame(QuantityType.LENGTH,
        network.getRule(QuantityType.DURATION, Operator.MULTIPLY, QuantityType.SPEED).get()
            .getResult());
    assertSame(QuantityType.MASS,
        network.getRule(QuantityType.FORCE, Operator.DIVIDE, QuantityType.ACCELERATION).get()
            .getResult());
    assertFalse(
        network.getRule(QuantityType.LENGTH, Operator.DIVIDE, QuantityType.MASS).isPresent());
    assertFalse(
        network.getRule(QuantityType.DURATION, Operator.DIVIDE, QuantityType.LENGTH).isPresent());

    assertEquals("Length ÷ Duration = Speed",
        network.getRule(QuantityType.LENGTH, Operator.DIVIDE, QuantityType.DURATION).get()
            .toString());
  }

  @Test
  public void testTypedOperations() {
    Quantity<SpeedUnit> speed = network.divide(Quantity.of(10, LengthUnit.METER),
        Quantity.of(2, DurationUnit.SECOND), QuantityType.SPEED);
    assertSame(SpeedUnit.METER_PER_SECOND, speed.getUnit());
    assertEquals(5, speed.getValue(), EPSILON);

    assertEquals(90, network.divide(Quantity.of(90, LengthUnit.KILOMETER),
        Quantity.of(1, DurationUnit.HOUR), QuantityType.SPEED)
        .as(SpeedUnit.KILOMETER_PER_HOUR), EPSILON);

    Quantity<AreaUnit> area = network.multiply(Quantity.of(3, LengthUnit.METER),
        Quantity.of(400, LengthUnit.CENTIMETER), QuantityType.AREA);
    assertEquals(12, area.as(AreaUnit.SQUARE_METER), EPSILON);

    assertEquals(3, network.divide(area, Quantity.of(4, LengthUnit.METER), QuantityType.LENGTH)
        .as(LengthUnit.METER), EPSILON);

    assertEquals(19.6133, network.multiply(Quantity.of(2, MassUnit.KILOGRAM),
        Quantity.of(1, AccelerationUnit.STANDARD_GRAVITY), QuantityType.FORCE)
        .as(ForceUnit.NEWTON), EPSILON);

    assertEquals(1, network.multiply(Quantity.of(1, ForceUnit.KILONEWTON),
        Quantity.of(1, LengthUnit.METER), QuantityType.TORQUE)
        .as(TorqueUnit.KILONEWTON_METER), EPSILON);

    assertEquals(1000, network.multiply(area.to(AreaUnit.SQUARE_METER),
        Quantity.of(1, LengthUnit.METER), QuantityType.VOLUME)
        .as(VolumeUnit.LITER) / 12, EPSILON);
  }

  @Test
  public void testUntypedOperationsDispatchOnRuntimeType() {
    Quantity<?> area =
        network.multiply(Quantity.of(2, LengthUnit.METER), Quantity.of(3, LengthUnit.METER));
    assertSame(QuantityType.AREA, area.getType());
    assertEquals(6, area.baseValue(), EPSILON);

    Quantity<?> duration = network.divide(Quantity.of(100, LengthUnit.METER),
        Quantity.of(20, SpeedUnit.METER_PER_SECOND));
    assertSame(QuantityType.DURATION, duration.getType());
    assertEquals(5, duration.baseValue(), EPSILON);
  }

  @Test
  public void testMultiplicationCommutes() {
    Random random = new Random(7);
    for (OperatorRule product : network.getProducts()) {
      for (int i = 0; i < 100; i++) {
        Quantity<?> a = Quantity.ofBase(random.nextDouble() * 1000 + 0.001, product.getLeft());
        Quantity<?> b = Quantity.ofBase(random.nextDouble() * 1000 + 0.001, product.getRight());
        assertEquals(network.multiply(a, b), network.multiply(b, a));
      }
    }
  }

  @Test
  public void testDivisionUndoesProduct() {
    Random random = new Random(11);
    for (OperatorRule product : network.getProducts()) {
      for (int i = 0; i < 100; i++) {
        Quantity<?> a = Quantity.ofBase(random.nextDouble() * 1000 + 0.001, product.getLeft());
        Quantity<?> b = Quantity.ofBase(random.nextDouble() * 1000 + 0.001, product.getRight());
        Quantity<?> c = network.multiply(a, b);
        assertSame(product.getResult(), c.getType());

        Quantity<?> b2 = network.divide(c, a);
        Quantity<?> a2 = network.divide(c, b);
        assertSame(product.getRight(), b2.getType());
        assertSame(product.getLeft(), a2.getType());
        assertEquals(product.toString(), b.baseValue(), b2.baseValue(), b.baseValue() * EPSILON);
        assertEquals(product.toString(), a.baseValue(), a2.baseValue(), a.baseValue() * EPSILON);
      }
    }
  }

  @Test
  public void testContradictoryDeclarationsFail() {
    try {
      OperatorNetwork.builder()
          .product(QuantityType.LENGTH, QuantityType.LENGTH, QuantityType.AREA)
          .product(QuantityType.LENGTH, QuantityType.LENGTH, QuantityType.VOLUME)
          .build();
      fail("Length × Length can not be both Area and Volume");
    } catch (IllegalStateException e) {
      // expected
    }

    try {
      OperatorNetwork.builder()
          .product(QuantityType.SPEED, QuantityType.DURATION, QuantityType.LENGTH)
          .product(QuantityType.MASS, QuantityType.DURATION, QuantityType.LENGTH)
          .build();
      fail("Length ÷ Duration can not be both Speed and Mass");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test
  public void testRepeatedDeclarationIsHarmless() {
    OperatorNetwork twice = OperatorNetwork.builder()
        .product(QuantityType.SPEED, QuantityType.DURATION, QuantityType.LENGTH)
        .product(QuantityType.DURATION, QuantityType.SPEED, QuantityType.LENGTH)
        .build();
    assertEquals(4, twice.getRules().size());
  }

  @Test
  public void testDivisionByZeroThrowsByDefault() {
    assertSame(ZeroDivisorPolicy.THROW, network.getZeroDivisorPolicy());
    try {
      network.divide(Quantity.of(10, LengthUnit.METER), Quantity.of(0, DurationUnit.HOUR));
      fail("division by zero duration");
    } catch (DivisionByZeroException e) {
      assertEquals(network.getRule(QuantityType.LENGTH, Operator.DIVIDE, QuantityType.DURATION)
          .get(), e.getRule());
    }
  }

  @Test
  public void testIeeeDivisionByZero() {
    OperatorNetwork ieee = OperatorNetwork.standard(ZeroDivisorPolicy.IEEE);
    Quantity<SpeedUnit> forward = ieee.divide(Quantity.of(10, LengthUnit.METER),
        Quantity.of(0, DurationUnit.SECOND), QuantityType.SPEED);
    assertEquals(Double.POSITIVE_INFINITY, forward.getValue(), 0);

    Quantity<SpeedUnit> backward = ieee.divide(Quantity.of(-10, LengthUnit.METER),
        Quantity.of(0, DurationUnit.SECOND), QuantityType.SPEED);
    assertEquals(Double.NEGATIVE_INFINITY, backward.getValue(), 0);

    try {
      ieee.divide(Quantity.of(0, LengthUnit.METER), Quantity.of(0, DurationUnit.SECOND));
      fail("zero by zero has no value");
    } catch (DivisionByZeroException e) {
      // expected
    }
  }

  @Test
  public void testInfiniteTimesZeroIsUndefined() {
    try {
      network.multiply(Quantity.of(Double.POSITIVE_INFINITY, LengthUnit.METER),
          Quantity.of(0, LengthUnit.METER));
      fail("infinity times zero has no value");
    } catch (UndefinedResultException e) {
      assertEquals(network.getRule(QuantityType.LENGTH, Operator.MULTIPLY, QuantityType.LENGTH)
          .get(), e.getRule());
    }
  }

  @Test
  public void testInfiniteOverInfiniteIsUndefinedUnderEitherPolicy() {
    for (ZeroDivisorPolicy policy : ZeroDivisorPolicy.values()) {
      try {
        OperatorNetwork.standard(policy).divide(
            Quantity.of(Double.POSITIVE_INFINITY, LengthUnit.METER),
            Quantity.of(Double.POSITIVE_INFINITY, DurationUnit.SECOND), QuantityType.SPEED);
        fail("infinity over infinity has no value under " + policy);
      } catch (UndefinedResultException e) {
        // expected
      }
    }
  }

  @Test
  public void testInfiniteOperandWithDefinedResult() {
    Quantity<?> area = network.multiply(Quantity.of(Double.POSITIVE_INFINITY, LengthUnit.METER),
        Quantity.of(-2, LengthUnit.METER));
    assertEquals(Double.NEGATIVE_INFINITY, area.baseValue(), 0);
  }

  @Test
  public void testUndefinedOperations() {
    try {
      network.multiply(Quantity.of(1, MassUnit.KILOGRAM), Quantity.of(1, MassUnit.GRAM));
      fail("Mass × Mass is not defined");
    } catch (UndefinedOperationException e) {
      // expected
    }

    try {
      network.divide(Quantity.of(1, TemperatureUnit.KELVIN), Quantity.of(1, DurationUnit.SECOND));
      fail("Temperature ÷ Duration is not defined");
    } catch (UndefinedOperationException e) {
      // expected
    }
  }

  @Test(expected = UndefinedOperationException.class)
  public void testTypedResultMustMatchRule() {
    network.divide(Quantity.of(10, LengthUnit.METER), Quantity.of(2, DurationUnit.SECOND),
        QuantityType.AREA);
  }

  @Test
  public void testUndefinedOperationIsIllegalArgument() {
    assertTrue(IllegalArgumentException.class.isAssignableFrom(UndefinedOperationException.class));
    assertTrue(ArithmeticException.class.isAssignableFrom(DivisionByZeroException.class));
    assertTrue(ArithmeticException.class.isAssignableFrom(UndefinedResultException.class));
  }
}
