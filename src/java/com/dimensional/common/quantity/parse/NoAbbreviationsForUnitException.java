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
 * Thrown when a parse pattern can not be built because its unit has no resolvable abbreviation.
 * Parsers treat the unit as not parseable.
 */
public class NoAbbreviationsForUnitException extends RuntimeException {

  private final Unit<?> unit;
  private final Culture culture;

  public NoAbbreviationsForUnitException(Unit<?> unit, Culture culture,
      AbbreviationNotFoundException cause) {
    super(String.format("Can not build a pattern for %s %s in %s", unit.type(), unit, culture),
        cause);
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
