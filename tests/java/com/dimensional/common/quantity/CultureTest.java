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

import com.google.common.testing.EqualsTester;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class CultureTest {

  @Test
  public void testForId() {
    assertEquals(Culture.RU_RU, Culture.forId("ru-RU").get());
    assertEquals(Culture.NB_NO, Culture.forId(" nb-no ").get());
    assertFalse(Culture.forId("fr-FR").isPresent());
  }

  @Test
  public void testEqualityByIdentifier() {
    new EqualsTester()
        .addEqualityGroup(Culture.EN_US, Culture.of("en-US", new NumberStyle(',', null, '-')))
        .addEqualityGroup(Culture.DE_DE)
        .testEquals();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBlankIdRejected() {
    Culture.of(" ", NumberStyle.INVARIANT);
  }
}
