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

package com.dimensional.common.quantity.parse;

import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.Unit;

/**
 * Thrown when a unit has no abbreviation in the requested culture nor in the fallback culture.
 * This signals a gap in the unit definition table rather than bad input.
 */
public class AbbreviationNotFoundException extends RuntimeException {

  private final Unit<?> unit;
  private final Culture culture;

  public AbbreviationNotFoundException(Unit<?> unit, Culture culture, Culture fallbackCulture) {
    super(String.format("No abbreviation defined for %s %s in %s or fallback %s",
        unit.type(), unit, culture, fallbackCulture));
    this.unit = unit;
    this.culture = culture;
  }

  public Unit<?> getUnit() {
    return unit;
  }

  public Culture getCulture() {
    return culture;
  }
}
