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

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.FeetInches;
import com.dimensional.common.quantity.LengthUnit;
import com.dimensional.common.quantity.NumberStyle;
import com.dimensional.common.quantity.Quantity;

/**
 * Writes quantities as text that {@link QuantityParser} reads back: the value in the culture's
 * number style, a space and the unit's default abbreviation.
 */
public class QuantityFormatter {

  private final AbbreviationResolver resolver;
  private final Culture defaultCulture;

  public QuantityFormatter(AbbreviationResolver resolver, Culture defaultCulture) {
    this.resolver = Preconditions.checkNotNull(resolver);
    this.defaultCulture = Preconditions.checkNotNull(defaultCulture);
  }

  /**
   * Formats {@code quantity} in its own unit, eg: {@code 2.5 kg} or {@code 2,5 кг}.
   *
   * @param quantity a quantity with a finite value
   * @param culture the culture to format in, or {@code null} for the default culture
   * @return the formatted quantity
   * @throws AbbreviationNotFoundException if the unit has no abbreviation in the culture
   */
  public String format(Quantity<?> quantity, @Nullable Culture culture) {
    Culture effectiveCulture = culture == null ? defaultCulture : culture;
    return effectiveCulture.getNumberStyle().format(quantity.getValue()) + " "
        + resolver.defaultAbbreviation(quantity.getUnit(), effectiveCulture);
  }

  /**
   * Formats a length as whole feet and rounded inches, eg: {@code 5 ft 4 in}.
   */
  public String formatFeetInches(Quantity<LengthUnit> length, @Nullable Culture culture) {
    Culture effectiveCulture = culture == null ? defaultCulture : culture;
    NumberStyle style = effectiveCulture.getNumberStyle();
    FeetInches feetInches = FeetInches.of(length);
    long feet = (long) feetInches.getFeet();
    long inches = Math.round(feetInches.getInches());
    if (inches == 12) {
      feet++;
      inches = 0;
    }
    return style.format(feet) + " "
        + resolver.defaultAbbreviation(LengthUnit.FOOT, effectiveCulture) + " "
        + style.format(inches) + " "
        + resolver.defaultAbbreviation(LengthUnit.INCH, effectiveCulture);
  }
}
