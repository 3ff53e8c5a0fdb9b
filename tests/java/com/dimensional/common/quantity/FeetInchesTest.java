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

import java.util.Locale;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class FeetInchesTest {

  private static final double EPSILON = 1e-9;

  @Test
  public void testSplit() {
    FeetInches feetInches = FeetInches.of(Quantity.of(68, LengthUnit.INCH));
    assertEquals(5, feetInches.getFeet(), 0);
    assertEquals(8, feetInches.getInches(), EPSILON);
    assertEquals("5 ft 8 in", feetInches.toString());
  }

  @Test
  public void testSplitConvertsUnits() {
    FeetInches feetInches = FeetInches.of(Quantity.of(1, LengthUnit.METER));
    assertEquals(3, feetInches.getFeet(), 0);
    assertEquals(3.370078740, feetInches.getInches(), 1e-6);
  }

  @Test
  public void testNegativeLengthKeepsInchesNonNegative() {
    FeetInches feetInches = FeetInches.of(Quantity.of(-20, LengthUnit.INCH));
    assertEquals(-2, feetInches.getFeet(), 0);
    assertEquals(4, feetInches.getInches(), EPSILON);
    assertEquals(-20, feetInches.toLength().as(LengthUnit.INCH), EPSILON);
  }

  @Test
  public void testToStringIgnoresDefaultLocale() {
    Locale saved = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("ar-EG-u-nu-arab"));
    try {
      assertEquals("5 ft 8 in", FeetInches.of(Quantity.of(68, LengthUnit.INCH)).toString());
      assertEquals("-2 ft 4 in", FeetInches.of(Quantity.of(-20, LengthUnit.INCH)).toString());
    } finally {
      Locale.setDefault(saved);
    }
  }

  @Test
  public void testToLength() {
    Quantity<LengthUnit> length = FeetInches.toLength(2, 4);
    assertEquals(28, length.as(LengthUnit.INCH), EPSILON);
    assertEquals(0.7112, length.as(LengthUnit.METER), EPSILON);
  }
}
