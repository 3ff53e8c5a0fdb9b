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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.LengthUnit;
import com.dimensional.common.quantity.MassUnit;
import com.dimensional.common.quantity.Prefix;
import com.dimensional.common.quantity.QuantityType;
import com.dimensional.common.quantity.TemperatureUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class UnitDefinitionTableTest {

  @Test
  public void testDeclarationOrder() {
    UnitDefinitionTable table = UnitDefinitionTable.builder()
        .define(MassUnit.POUND, Culture.EN_US, "lb")
        .define(MassUnit.GRAM, Culture.EN_US, "g")
        .prefixed(MassUnit.GRAM, Prefix.KILO, MassUnit.KILOGRAM)
        .define(LengthUnit.METER, Culture.EN_US, "m")
        .build();

    assertEquals(ImmutableList.of(MassUnit.POUND, MassUnit.GRAM, MassUnit.KILOGRAM),
        table.getUnits(QuantityType.MASS));
    assertEquals(ImmutableList.of(QuantityType.MASS, QuantityType.LENGTH),
        table.getQuantityTypes());
    assertTrue(table.getUnits(QuantityType.DURATION).isEmpty());
    assertFalse(table.isDefined(MassUnit.TONNE));
  }

  @Test
  public void testDefinitions() {
    UnitDefinitionTable table = UnitDefinitionTable.builder()
        .define(MassUnit.GRAM, Culture.EN_US, "g", "gr")
        .define(MassUnit.GRAM, Culture.RU_RU, "г")
        .prefixed(MassUnit.GRAM, Prefix.KILO, MassUnit.KILOGRAM)
        .define(MassUnit.KILOGRAM, Culture.EN_US, "kilo")
        .build();

    UnitDefinition gram = table.getDefinition(MassUnit.GRAM).get();
    assertEquals(ImmutableList.of("g", "gr"), gram.getAbbreviations(Culture.EN_US));
    assertEquals(ImmutableList.of("г"), gram.getAbbreviations(Culture.RU_RU));
    assertTrue(gram.getAbbreviations(Culture.DE_DE).isEmpty());
    assertEquals(ImmutableMap.of(Prefix.KILO, MassUnit.KILOGRAM), gram.getPrefixedUnits());
    assertFalse(gram.isPrefixed());

    UnitDefinition kilogram = table.getDefinition(MassUnit.KILOGRAM).get();
    assertTrue(kilogram.isPrefixed());
    assertSame(MassUnit.GRAM, kilogram.getPrefixBase());
    assertSame(Prefix.KILO, kilogram.getPrefix());
    assertEquals(ImmutableList.of("kilo"), kilogram.getAbbreviations(Culture.EN_US));

    assertFalse(table.getDefinition(MassUnit.OUNCE).isPresent());
  }

  @Test
  public void testPrefixSymbols() {
    UnitDefinitionTable table = StandardUnits.table();
    assertEquals("k", table.getPrefixSymbol(Prefix.KILO, Culture.EN_US));
    assertEquals("к", table.getPrefixSymbol(Prefix.KILO, Culture.RU_RU));
    assertEquals("µ", table.getPrefixSymbol(Prefix.MICRO, Culture.NB_NO));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDefineNeedsAbbreviations() {
    UnitDefinitionTable.builder().define(LengthUnit.METER, Culture.EN_US);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDefineRejectsBlankAbbreviation() {
    UnitDefinitionTable.builder().define(LengthUnit.METER, Culture.EN_US, "m", " ");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPrefixFactorMustMatch() {
    UnitDefinitionTable.builder().prefixed(MassUnit.GRAM, Prefix.KILO, MassUnit.MILLIGRAM);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPrefixesDoNotNest() {
    UnitDefinitionTable.builder()
        .prefixed(MassUnit.GRAM, Prefix.MILLI, MassUnit.MILLIGRAM)
        .prefixed(MassUnit.MILLIGRAM, Prefix.MILLI, MassUnit.MICROGRAM);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPrefixedUnitHasOneBase() {
    UnitDefinitionTable.builder()
        .prefixed(LengthUnit.METER, Prefix.MILLI, LengthUnit.MILLIMETER)
        .prefixed(LengthUnit.CENTIMETER, Prefix.DECI, LengthUnit.MILLIMETER);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPrefixKeepsQuantityType() {
    UnitDefinitionTable.builder().prefixed(LengthUnit.METER, Prefix.KILO, MassUnit.KILOGRAM);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAffineUnitsTakeNoPrefix() {
    UnitDefinitionTable.builder()
        .prefixed(TemperatureUnit.DEGREE_CELSIUS, Prefix.MILLI, TemperatureUnit.KELVIN);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBlankAbbreviationRejected() {
    UnitDefinitionTable.builder().define(LengthUnit.METER, Culture.EN_US, "m", " ");
  }

  @Test
  public void testStandardTableDefinesEveryUnit() {
    UnitDefinitionTable table = StandardUnits.table();
    for (QuantityType<?> type : QuantityType.values()) {
      assertEquals(type.getName(), ImmutableSet.copyOf(type.getUnits()),
          ImmutableSet.copyOf(table.getUnits(type)));
    }
    assertEquals(ImmutableList.of(LengthUnit.METER, LengthUnit.KILOMETER, LengthUnit.DECIMETER),
        table.getUnits(QuantityType.LENGTH).subList(0, 3));
  }
}
