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

import java.util.List;
import java.util.regex.Pattern;

import com.google.common.base.Function;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.Unit;

/**
 * Builds the regular expressions that recognize a number followed by one of a unit's
 * abbreviations, eg: {@code 2.5 kg} or {@code 2,5кг}.
 *
 * <p>Anchored patterns expose the number and the abbreviation through the named groups
 * {@link #VALUE_GROUP} and {@link #UNIT_GROUP}.  Unanchored fragments contain no capturing groups
 * at all so that several of them can be embedded in one composite pattern.
 */
public class PatternBuilder {

  public static final String VALUE_GROUP = "value";
  public static final String UNIT_GROUP = "unit";

  private static final String UNIT_SEPARATOR = "\\s?";

  private static final Function<String, String> QUOTE = new Function<String, String>() {
    @Override public String apply(String abbreviation) {
      return Pattern.quote(abbreviation);
    }
  };

  private final AbbreviationResolver resolver;

  public PatternBuilder(AbbreviationResolver resolver) {
    this.resolver = Preconditions.checkNotNull(resolver);
  }

  /**
   * Builds a pattern for quantities of {@code unit} written in {@code culture}.
   *
   * @param unit the unit whose abbreviations the pattern accepts
   * @param culture the culture providing the number style and abbreviations
   * @param matchEntireString whether to anchor the pattern and name its groups
   * @return the pattern source
   * @throws NoAbbreviationsForUnitException if the unit has no abbreviation in the culture or its
   *     fallback
   */
  public String buildUnitPattern(Unit<?> unit, Culture culture, boolean matchEntireString) {
    String number = culture.getNumberStyle().numberPattern();
    String units = Joiner.on('|').join(Lists.transform(abbreviations(unit, culture), QUOTE));
    if (matchEntireString) {
      return "^(?<" + VALUE_GROUP + ">" + number + ")" + UNIT_SEPARATOR
          + "(?<" + UNIT_GROUP + ">" + units + ")$";
    }
    return "(?:" + number + ")" + UNIT_SEPARATOR + "(?:" + units + ")";
  }

  private List<String> abbreviations(Unit<?> unit, Culture culture) {
    try {
      return resolver.abbreviationsFor(unit, culture);
    } catch (AbbreviationNotFoundException e) {
      throw new NoAbbreviationsForUnitException(unit, culture, e);
    }
  }
}
