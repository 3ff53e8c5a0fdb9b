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

import java.util.regex.Pattern;

import com.google.common.testing.EqualsTester;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class NumberStyleTest {

  private static final NumberStyle GERMAN = Culture.DE_DE.getNumberStyle();
  private static final NumberStyle NORWEGIAN = Culture.NB_NO.getNumberStyle();

  @Test
  public void testInvariantParse() {
    assertEquals(2.5, NumberStyle.INVARIANT.parse("2.5"), 0);
    assertEquals(1000.5, NumberStyle.INVARIANT.parse("1,000.5"), 0);
    assertEquals(-0.5, NumberStyle.INVARIANT.parse("-.5"), 0);
    assertEquals(3, NumberStyle.INVARIANT.parse("+3."), 0);
    assertEquals(1.5e-3, NumberStyle.INVARIANT.parse("1.5E-3"), 0);
  }

  @Test
  public void testCultureParse() {
    assertEquals(1500, GERMAN.parse("1.500"), 0);
    assertEquals(1.5, GERMAN.parse("1,5"), 0);
    assertEquals(-1234567.25, NORWEGIAN.parse("\u22121\u00a0234\u00a0567,25"), 0);
    assertEquals(-2, NORWEGIAN.parse("-2"), 0);
  }

  @Test(expected = NumberFormatException.class)
  public void testParseRejectsGarbage() {
    NumberStyle.INVARIANT.parse("1.2.3");
  }

  @Test
  public void testNumberPattern() {
    Pattern invariant = Pattern.compile(NumberStyle.INVARIANT.numberPattern());
    assertTrue(invariant.matcher("1,234,567.89").matches());
    assertTrue(invariant.matcher("-1e10").matches());
    assertTrue(invariant.matcher(".5").matches());
    assertFalse(invariant.matcher("1,23").matches());
    assertFalse(invariant.matcher("").matches());
    assertFalse(invariant.matcher(".").matches());
    assertEquals(0, invariant.matcher("").groupCount());

    Pattern norwegian = Pattern.compile(NORWEGIAN.numberPattern());
    assertTrue(norwegian.matcher("\u22125,5").matches());
    assertTrue(norwegian.matcher("1\u00a0000").matches());
    assertFalse(norwegian.matcher("1.5").matches());
  }

  @Test
  public void testCoincidingSeparatorsDisableGrouping() {
    NumberStyle style = new NumberStyle(',', ',', '-');
    assertNull(style.getGroupSeparator());
    assertEquals(1.5, style.parse("1,5"), 0);
    assertFalse(Pattern.compile(style.numberPattern()).matcher("1,000,000").matches());
  }

  @Test
  public void testFormat() {
    assertEquals("2.5", NumberStyle.INVARIANT.format(2.5));
    assertEquals("-2,5", GERMAN.format(-2.5));
    assertEquals("\u22122,5", NORWEGIAN.format(-2.5));
    assertEquals("1,0E-10", GERMAN.format(1e-10));
    assertEquals("\u221212", NORWEGIAN.format(-12L));
  }

  @Test
  public void testFormatParses() {
    for (double value : new double[] {0, -0.25, 1234567.891, 1e-12, -6.02e23}) {
      assertEquals(value, GERMAN.parse(GERMAN.format(value)), 0);
      assertEquals(value, NORWEGIAN.parse(NORWEGIAN.format(value)), 0);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFormatRejectsInfinity() {
    NumberStyle.INVARIANT.format(Double.POSITIVE_INFINITY);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDigitSeparatorRejected() {
    new NumberStyle('1', null, '-');
  }

  @Test
  public void testEquals() {
    new EqualsTester()
        .addEqualityGroup(NumberStyle.INVARIANT, new NumberStyle('.', ',', '-'))
        .addEqualityGroup(GERMAN, new NumberStyle(',', '.', '-'))
        .addEqualityGroup(NORWEGIAN)
        .testEquals();
  }
}
