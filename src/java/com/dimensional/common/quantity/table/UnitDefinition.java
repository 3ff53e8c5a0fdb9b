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

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.Prefix;
import com.dimensional.common.quantity.Unit;

/**
 * The table entry of a single unit: its abbreviations per culture, the prefixed units derived
 * from it and, for a prefixed unit, the unit and prefix it is derived from.
 */
public final class UnitDefinition {

  private final Unit<?> unit;
  private final ImmutableListMultimap<Culture, String> abbreviations;
  private final ImmutableMap<Prefix, Unit<?>> prefixedUnits;
  @Nullable private final Unit<?> prefixBase;
  @Nullable private final Prefix prefix;

  UnitDefinition(Unit<?> unit, ImmutableListMultimap<Culture, String> abbreviations,
      ImmutableMap<Prefix, Unit<?>> prefixedUnits, @Nullable Unit<?> prefixBase,
      @Nullable Prefix prefix) {
    this.unit = Preconditions.checkNotNull(unit);
    this.abbreviations = Preconditions.checkNotNull(abbreviations);
    this.prefixedUnits = Preconditions.checkNotNull(prefixedUnits);
    Preconditions.checkArgument((prefixBase == null) == (prefix == null));
    this.prefixBase = prefixBase;
    this.prefix = prefix;
  }

  public Unit<?> getUnit() {
    return unit;
  }

  /**
   * Returns the abbreviations declared directly for this unit in {@code culture}, in declaration
   * order.  Abbreviations synthesized from a prefix are not included.
   */
  public ImmutableList<String> getAbbreviations(Culture culture) {
    return abbreviations.get(culture);
  }

  public ImmutableListMultimap<Culture, String> getAbbreviations() {
    return abbreviations;
  }

  /**
   * Returns the units derived from this one by applying a prefix, eg: kilogram for gram.
   */
  public ImmutableMap<Prefix, Unit<?>> getPrefixedUnits() {
    return prefixedUnits;
  }

  public boolean isPrefixed() {
    return prefixBase != null;
  }

  @Nullable
  public Unit<?> getPrefixBase() {
    return prefixBase;
  }

  @Nullable
  public Prefix getPrefix() {
    return prefix;
  }

  @Override
  public String toString() {
    return isPrefixed()
        ? String.format("%s (%s %s) %s", unit, prefix, prefixBase, abbreviations)
        : String.format("%s %s", unit, abbreviations);
  }
}
