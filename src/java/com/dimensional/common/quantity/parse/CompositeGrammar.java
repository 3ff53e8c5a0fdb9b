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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import com.dimensional.common.base.MorePreconditions;
import com.dimensional.common.quantity.LengthUnit;
import com.dimensional.common.quantity.QuantityType;
import com.dimensional.common.quantity.Unit;

/**
 * Describes a quantity written as several parts in different units of one type, such as
 * {@code 2 ft 4 in}.  Each part is a number and an abbreviation of its unit; consecutive parts are
 * joined by a separator expression.  The value of a composite is the sum of its parts.
 *
 * <p>A leading sign belongs to the first part only: {@code -2 ft 4 in} is {@code -(2 ft) + 4 in}.
 *
 * @param <U> the unit type of the quantity type this grammar parses
 */
public final class CompositeGrammar<U extends Unit<U>> {

  private static final String DEFAULT_SEPARATOR = "\\s?";

  /**
   * Feet and inches, as in {@code 2' 4"}, {@code 2′4″} or {@code 2 ft 4 in}.
   */
  public static final CompositeGrammar<LengthUnit> FEET_INCHES =
      builder("feet-inches", QuantityType.LENGTH)
          .unit(LengthUnit.FOOT)
          .unit(LengthUnit.INCH)
          .build();

  private final String name;
  private final QuantityType<U> type;
  private final ImmutableList<U> units;
  private final ImmutableList<String> separators;

  private CompositeGrammar(String name, QuantityType<U> type, ImmutableList<U> units,
      ImmutableList<String> separators) {
    this.name = name;
    this.type = type;
    this.units = units;
    this.separators = separators;
  }

  /**
   * Creates a builder for a grammar of quantities of {@code type}.
   *
   * @param name a name for the grammar, used in diagnostics
   * @param type the quantity type parsed
   */
  public static <U extends Unit<U>> Builder<U> builder(String name, QuantityType<U> type) {
    return new Builder<U>(name, type);
  }

  public String getName() {
    return name;
  }

  public QuantityType<U> getType() {
    return type;
  }

  /**
   * Returns the units of the parts, in the order they are written.
   */
  public ImmutableList<U> getUnits() {
    return units;
  }

  /**
   * Returns the separator expression following each part except the last.
   */
  public ImmutableList<String> getSeparators() {
    return separators;
  }

  @Override
  public String toString() {
    return name + units;
  }

  public static final class Builder<U extends Unit<U>> {
    private final String name;
    private final QuantityType<U> type;
    private final List<U> units = Lists.newArrayList();
    private final List<String> separators = Lists.newArrayList();

    private Builder(String name, QuantityType<U> type) {
      this.name = MorePreconditions.checkNotBlank(name);
      this.type = Preconditions.checkNotNull(type);
    }

    /**
     * Appends a part in {@code unit}, joined to the previous part by optional whitespace.
     */
    public Builder<U> unit(U unit) {
      return unit(DEFAULT_SEPARATOR, unit);
    }

    /**
     * Appends a part in {@code unit}, joined to the previous part by {@code separator}.
     *
     * @param separator a regular expression without capturing groups; ignored for the first part
     * @param unit the unit of the part
     * @return this builder
     */
    public Builder<U> unit(String separator, U unit) {
      Preconditions.checkNotNull(separator);
      Preconditions.checkNotNull(unit);
      Preconditions.checkArgument(Pattern.compile(separator).matcher("").groupCount() == 0,
          "Separator may not contain capturing groups: %s", separator);
      if (!units.isEmpty()) {
        separators.add(separator);
      }
      units.add(unit);
      return this;
    }

    public CompositeGrammar<U> build() {
      Preconditions.checkState(units.size() >= 2, "A composite needs at least two parts: %s",
          units);
      return new CompositeGrammar<U>(name, type, ImmutableList.copyOf(units),
          ImmutableList.copyOf(separators));
    }
  }
}
