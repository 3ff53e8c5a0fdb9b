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

import java.util.Set;
import java.util.logging.Logger;

import com.google.common.base.Function;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;

import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.QuantityType;
import com.dimensional.common.quantity.Unit;
import com.dimensional.common.quantity.table.UnitDefinition;
import com.dimensional.common.quantity.table.UnitDefinitionTable;
import com.dimensional.common.util.caching.Cache;
import com.dimensional.common.util.caching.ConcurrentCache;

/**
 * Resolves the localized abbreviations of units, and abbreviations back to units.
 *
 * <p>A prefixed unit answers to its own declared abbreviations plus every abbreviation of its
 * prefix base with the prefix symbol prepended, eg: "kg" for kilogram from "g" and "k".  When a
 * unit has no abbreviation in the requested culture, the fallback culture is consulted instead.
 */
public class AbbreviationResolver {

  private static final Logger LOG = Logger.getLogger(AbbreviationResolver.class.getName());

  private static final Ordering<String> LONGEST_FIRST =
      Ordering.<Integer>natural().reverse().onResultOf(new Function<String, Integer>() {
        @Override public Integer apply(String abbreviation) {
          return abbreviation.length();
        }
      });

  private final UnitDefinitionTable table;
  private final Culture fallbackCulture;
  private final Cache<Culture, ImmutableSetMultimap<String, Unit<?>>> unitsByAbbreviation =
      new ConcurrentCache<Culture, ImmutableSetMultimap<String, Unit<?>>>("units_by_abbreviation");

  /**
   * Creates a resolver over {@code table}.
   *
   * @param table the unit definitions to resolve against
   * @param fallbackCulture the culture consulted when a unit has no abbreviation in the requested
   *     one
   */
  public AbbreviationResolver(UnitDefinitionTable table, Culture fallbackCulture) {
    this.table = Preconditions.checkNotNull(table);
    this.fallbackCulture = Preconditions.checkNotNull(fallbackCulture);
  }

  public UnitDefinitionTable getTable() {
    return table;
  }

  public Culture getFallbackCulture() {
    return fallbackCulture;
  }

  /**
   * Returns all abbreviations of {@code unit}, longest first.  Abbreviations of equal length keep
   * their declaration order.
   *
   * @param unit the unit to look up
   * @param culture the culture to look up abbreviations in
   * @return the unit's abbreviations, never empty
   * @throws AbbreviationNotFoundException if neither {@code culture} nor the fallback culture
   *     has an abbreviation for the unit
   */
  public ImmutableList<String> abbreviationsFor(Unit<?> unit, Culture culture) {
    return ImmutableList.copyOf(LONGEST_FIRST.sortedCopy(resolve(unit, culture)));
  }

  /**
   * Returns the abbreviation used when formatting {@code unit}: the first one declared.
   *
   * @throws AbbreviationNotFoundException if the unit has no abbreviation
   */
  public String defaultAbbreviation(Unit<?> unit, Culture culture) {
    return resolve(unit, culture).iterator().next();
  }

  /**
   * Finds every unit, of any quantity type, that {@code abbreviation} denotes in {@code culture}.
   *
   * @param abbreviation the exact abbreviation text
   * @param culture the culture to resolve in
   * @return the matching units in table order; empty if the abbreviation is unknown
   */
  public ImmutableSet<Unit<?>> unitsFor(String abbreviation, Culture culture) {
    Preconditions.checkNotNull(abbreviation);
    return index(culture).get(abbreviation.trim());
  }

  /**
   * Finds the units of {@code type} that {@code abbreviation} denotes in {@code culture}.
   */
  public <U extends Unit<U>> ImmutableList<U> unitsFor(String abbreviation, QuantityType<U> type,
      Culture culture) {
    ImmutableList.Builder<U> units = ImmutableList.builder();
    for (Unit<?> unit : unitsFor(abbreviation, culture)) {
      if (unit.type() == type) {
        units.add(type.cast(unit));
      }
    }
    return units.build();
  }

  private ImmutableSetMultimap<String, Unit<?>> index(final Culture culture) {
    Preconditions.checkNotNull(culture);
    return unitsByAbbreviation.fetch(culture,
        new Supplier<ImmutableSetMultimap<String, Unit<?>>>() {
          @Override public ImmutableSetMultimap<String, Unit<?>> get() {
            return buildIndex(culture);
          }
        });
  }

  private ImmutableSetMultimap<String, Unit<?>> buildIndex(Culture culture) {
    ImmutableSetMultimap.Builder<String, Unit<?>> index = ImmutableSetMultimap.builder();
    for (QuantityType<?> type : table.getQuantityTypes()) {
      for (Unit<?> unit : table.getUnits(type)) {
        try {
          for (String abbreviation : resolve(unit, culture)) {
            index.put(abbreviation, unit);
          }
        } catch (AbbreviationNotFoundException e) {
          LOG.fine("Unit " + unit + " is not abbreviated in " + culture + ", skipping");
        }
      }
    }
    LOG.fine("Built abbreviation index for " + culture);
    return index.build();
  }

  private Set<String> resolve(Unit<?> unit, Culture culture) {
    Preconditions.checkNotNull(unit);
    Preconditions.checkNotNull(culture);
    Set<String> abbreviations = collect(unit, culture);
    if (abbreviations.isEmpty() && !culture.equals(fallbackCulture)) {
      abbreviations = collect(unit, fallbackCulture);
    }
    if (abbreviations.isEmpty()) {
      throw new AbbreviationNotFoundException(unit, culture, fallbackCulture);
    }
    return abbreviations;
  }

  private Set<String> collect(Unit<?> unit, Culture culture) {
    Set<String> abbreviations = Sets.newLinkedHashSet();
    Optional<UnitDefinition> definition = table.getDefinition(unit);
    if (!definition.isPresent()) {
      return abbreviations;
    }

    abbreviations.addAll(definition.get().getAbbreviations(culture));
    if (definition.get().isPrefixed()) {
      Optional<UnitDefinition> base = table.getDefinition(definition.get().getPrefixBase());
      String symbol = table.getPrefixSymbol(definition.get().getPrefix(), culture);
      for (String baseAbbreviation : base.get().getAbbreviations(culture)) {
        abbreviations.add(symbol + baseAbbreviation);
      }
    }
    return abbreviations;
  }
}
