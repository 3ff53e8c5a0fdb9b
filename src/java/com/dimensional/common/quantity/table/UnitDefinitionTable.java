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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Maps;
import com.google.common.collect.Table;

import com.dimensional.common.base.MorePreconditions;
import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.Prefix;
import com.dimensional.common.quantity.QuantityType;
import com.dimensional.common.quantity.Unit;

/**
 * The read-only catalog of units the parser knows about: for each quantity type the units that
 * are defined, in declaration order, with their per-culture abbreviations and prefix
 * relationships.
 *
 * <p>Declaration order matters.  When an abbreviation is shared by several units of the same
 * quantity type, the parser picks the unit declared first.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class UnitDefinitionTable {

  private static final double PREFIX_TOLERANCE = 1e-9;

  private final ImmutableListMultimap<QuantityType<?>, Unit<?>> unitsByType;
  private final ImmutableMap<Unit<?>, UnitDefinition> definitions;
  private final ImmutableTable<Culture, Prefix, String> prefixSymbols;

  private UnitDefinitionTable(ImmutableListMultimap<QuantityType<?>, Unit<?>> unitsByType,
      ImmutableMap<Unit<?>, UnitDefinition> definitions,
      ImmutableTable<Culture, Prefix, String> prefixSymbols) {
    this.unitsByType = unitsByType;
    this.definitions = definitions;
    this.prefixSymbols = prefixSymbols;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the quantity types that have at least one defined unit.
   */
  public ImmutableList<QuantityType<?>> getQuantityTypes() {
    return unitsByType.keySet().asList();
  }

  /**
   * Returns the defined units of {@code type} in declaration order.
   */
  public <U extends Unit<U>> ImmutableList<U> getUnits(QuantityType<U> type) {
    ImmutableList.Builder<U> units = ImmutableList.builder();
    for (Unit<?> unit : unitsByType.get(type)) {
      units.add(type.cast(unit));
    }
    return units.build();
  }

  public Optional<UnitDefinition> getDefinition(Unit<?> unit) {
    return Optional.fromNullable(definitions.get(unit));
  }

  public boolean isDefined(Unit<?> unit) {
    return definitions.containsKey(unit);
  }

  /**
   * Returns the symbol of {@code prefix} in {@code culture}, which is the prefix's invariant
   * symbol unless the table overrides it for that culture.
   */
  public String getPrefixSymbol(Prefix prefix, Culture culture) {
    String symbol = prefixSymbols.get(culture, prefix);
    return symbol != null ? symbol : prefix.symbol();
  }

  /**
   * Builds a {@link UnitDefinitionTable}.  Units are ordered by the first call that mentions them.
   */
  public static final class Builder {
    private final Map<Unit<?>, ListMultimap<Culture, String>> abbreviations =
        Maps.newLinkedHashMap();
    private final Map<Unit<?>, Map<Prefix, Unit<?>>> prefixedUnits = Maps.newHashMap();
    private final Map<Unit<?>, Unit<?>> prefixBases = Maps.newHashMap();
    private final Map<Unit<?>, Prefix> prefixes = Maps.newHashMap();
    private final Table<Culture, Prefix, String> prefixSymbols = HashBasedTable.create();

    private Builder() {
    }

    /**
     * Adds abbreviations for {@code unit} in {@code culture}.  May be called repeatedly for the
     * same unit, once per culture or to append further abbreviations.
     *
     * @param unit the unit to define
     * @param culture the culture the abbreviations belong to
     * @param unitAbbreviations the abbreviations, the first being the culture's default
     * @return this builder
     * @throws IllegalArgumentException if no abbreviation is given or one is blank
     */
    public Builder define(Unit<?> unit, Culture culture, String... unitAbbreviations) {
      Preconditions.checkNotNull(culture);
      ListMultimap<Culture, String> byCulture = entry(unit);
      for (String abbreviation : MorePreconditions.checkNotBlank(Arrays.asList(unitAbbreviations),
          "No abbreviations given for %s in %s", unit, culture)) {
        byCulture.put(culture, MorePreconditions.checkNotBlank(abbreviation,
            "Blank abbreviation for %s in %s", unit, culture));
      }
      return this;
    }

    /**
     * Declares that {@code prefixedUnit} is {@code base} combined with {@code prefix}, so its
     * abbreviations can be synthesized from those of {@code base}.  Prefixes do not nest: a
     * prefixed unit can not serve as the base of another prefix.
     *
     * @param base the unit the prefix is applied to
     * @param prefix the prefix
     * @param prefixedUnit the resulting unit
     * @return this builder
     * @throws IllegalArgumentException if the units differ in type, if {@code base} is itself
     *     prefixed, or if the conversion of {@code prefixedUnit} does not match the prefix factor
     */
    public Builder prefixed(Unit<?> base, Prefix prefix, Unit<?> prefixedUnit) {
      Preconditions.checkNotNull(prefix);
      Preconditions.checkArgument(base.type() == prefixedUnit.type(),
          "%s and %s measure different quantities", base, prefixedUnit);
      Preconditions.checkArgument(!prefixBases.containsKey(base),
          "%s is itself prefixed and can not take prefix %s", base, prefix);
      Preconditions.checkArgument(!prefixBases.containsKey(prefixedUnit),
          "%s is already derived from %s", prefixedUnit, prefixBases.get(prefixedUnit));
      checkPrefixFactor(base, prefix, prefixedUnit);

      entry(base);
      entry(prefixedUnit);
      Map<Prefix, Unit<?>> derived = prefixedUnits.get(base);
      if (derived == null) {
        derived = new LinkedHashMap<Prefix, Unit<?>>();
        prefixedUnits.put(base, derived);
      }
      Preconditions.checkArgument(!derived.containsKey(prefix),
          "%s already has prefix %s", base, prefix);
      derived.put(prefix, prefixedUnit);
      prefixBases.put(prefixedUnit, base);
      prefixes.put(prefixedUnit, prefix);
      return this;
    }

    /**
     * Overrides the symbol of {@code prefix} in {@code culture}.
     */
    public Builder prefixSymbol(Culture culture, Prefix prefix, String symbol) {
      prefixSymbols.put(Preconditions.checkNotNull(culture), Preconditions.checkNotNull(prefix),
          MorePreconditions.checkNotBlank(symbol));
      return this;
    }

    public UnitDefinitionTable build() {
      ImmutableListMultimap.Builder<QuantityType<?>, Unit<?>> unitsByType =
          ImmutableListMultimap.builder();
      ImmutableMap.Builder<Unit<?>, UnitDefinition> definitions = ImmutableMap.builder();
      for (Map.Entry<Unit<?>, ListMultimap<Culture, String>> entry : abbreviations.entrySet()) {
        Unit<?> unit = entry.getKey();
        Map<Prefix, Unit<?>> derived = prefixedUnits.get(unit);
        unitsByType.put(unit.type(), unit);
        definitions.put(unit, new UnitDefinition(
            unit,
            ImmutableListMultimap.copyOf(entry.getValue()),
            derived == null ? ImmutableMap.<Prefix, Unit<?>>of() : ImmutableMap.copyOf(derived),
            prefixBases.get(unit),
            prefixes.get(unit)));
      }
      return new UnitDefinitionTable(unitsByType.build(), definitions.build(),
          ImmutableTable.copyOf(prefixSymbols));
    }

    private ListMultimap<Culture, String> entry(Unit<?> unit) {
      Preconditions.checkNotNull(unit);
      ListMultimap<Culture, String> byCulture = abbreviations.get(unit);
      if (byCulture == null) {
        byCulture = LinkedListMultimap.create();
        abbreviations.put(unit, byCulture);
      }
      return byCulture;
    }

    private static void checkPrefixFactor(Unit<?> base, Prefix prefix, Unit<?> prefixedUnit) {
      Preconditions.checkArgument(base.toBase(0) == 0 && prefixedUnit.toBase(0) == 0,
          "Prefixes only apply to multiplicative units, not %s", base);
      double expected = prefix.factor() * base.toBase(1);
      double actual = prefixedUnit.toBase(1);
      Preconditions.checkArgument(
          Math.abs(expected - actual) <= PREFIX_TOLERANCE * Math.abs(expected),
          "%s is not %s %s: expected %s base units but was %s",
          prefixedUnit, prefix, base, expected, actual);
    }
  }
}
