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

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;

import javax.annotation.Nullable;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

import org.apache.commons.lang.StringUtils;

import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.QuantityType;
import com.dimensional.common.quantity.Unit;
import com.dimensional.common.quantity.table.StandardUnits;
import com.dimensional.common.quantity.table.UnitDefinitionTable;
import com.dimensional.common.util.caching.Cache;
import com.dimensional.common.util.caching.ConcurrentCache;

/**
 * Parses free-form text such as {@code 2.5 kg}, {@code 5 m/s} or {@code 2' 4"} into quantities.
 *
 * <p>Parsing trims the text and first tries, in table declaration order, every defined unit of
 * the requested quantity type with a pattern matching the whole text.  The first unit that matches
 * wins, so when two units of a type share an abbreviation (eg: "gal") the one declared first in
 * the {@link UnitDefinitionTable} is chosen, deterministically.  If no single unit matches, the
 * {@link CompositeGrammar composite grammars} registered for the type are tried and the parts of a
 * match are summed.
 *
 * <p>Compiled patterns are cached per unit or grammar and culture for the life of the parser.
 * Parsers are thread-safe.
 */
public class QuantityParser {

  private static final Logger LOG = Logger.getLogger(QuantityParser.class.getName());

  private static final String PART_GROUP_PREFIX = "part";

  private final AbbreviationResolver resolver;
  private final PatternBuilder patternBuilder;
  private final Culture defaultCulture;
  private final ImmutableListMultimap<QuantityType<?>, CompositeGrammar<?>> grammars;
  private final Cache<PatternKey, ParsePattern> patterns;

  private QuantityParser(AbbreviationResolver resolver, Culture defaultCulture,
      ImmutableListMultimap<QuantityType<?>, CompositeGrammar<?>> grammars,
      Cache<PatternKey, ParsePattern> patterns) {
    this.resolver = resolver;
    this.patternBuilder = new PatternBuilder(resolver);
    this.defaultCulture = defaultCulture;
    this.grammars = grammars;
    this.patterns = patterns;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a parser over the standard unit table, using en-US both as the default and the
   * fallback culture, with the feet/inches grammar registered.
   */
  public static QuantityParser standard() {
    return builder().build();
  }

  public AbbreviationResolver getResolver() {
    return resolver;
  }

  public Culture getDefaultCulture() {
    return defaultCulture;
  }

  /**
   * Returns the composite grammars registered for {@code type}, in registration order.
   */
  public ImmutableList<CompositeGrammar<?>> getCompositeGrammars(QuantityType<?> type) {
    return grammars.get(type);
  }

  public <U extends Unit<U>> ParseResult<U> tryParse(@Nullable String text, QuantityType<U> type) {
    return tryParse(text, type, null);
  }

  /**
   * Attempts to parse {@code text} as a quantity of {@code type}.  Never throws for bad input.
   *
   * @param text the text to parse; blank or {@code null} text always fails
   * @param type the quantity type to parse
   * @param culture the culture of the text, or {@code null} for the parser's default culture
   * @return the parsed quantity, or a failure listing every pattern attempted
   */
  public <U extends Unit<U>> ParseResult<U> tryParse(@Nullable String text, QuantityType<U> type,
      @Nullable Culture culture) {
    Preconditions.checkNotNull(type);
    Culture effectiveCulture = culture == null ? defaultCulture : culture;
    ParseFailure.Collector diagnostics = new ParseFailure.Collector();
    if (StringUtils.isBlank(text)) {
      return ParseResult.failure(diagnostics.toFailure(text, type, effectiveCulture));
    }

    String trimmed = text.trim();
    Optional<Quantity<U>> single = parseSingleUnit(trimmed, type, effectiveCulture, diagnostics);
    if (single.isPresent()) {
      return ParseResult.success(single.get(), ParseResult.Path.SINGLE_UNIT);
    }

    Optional<Quantity<U>> composite = parseComposites(trimmed, type, effectiveCulture, diagnostics);
    if (composite.isPresent()) {
      return ParseResult.success(composite.get(), ParseResult.Path.COMPOSITE);
    }

    ParseFailure failure = diagnostics.toFailure(text, type, effectiveCulture);
    if (LOG.isLoggable(Level.FINER)) {
      LOG.finer(failure.describe());
    }
    return ParseResult.failure(failure);
  }

  public <U extends Unit<U>> Quantity<U> parse(@Nullable String text, QuantityType<U> type) {
    return parse(text, type, null);
  }

  /**
   * Parses {@code text} as a quantity of {@code type}.
   *
   * @param text the text to parse
   * @param type the quantity type to parse
   * @param culture the culture of the text, or {@code null} for the parser's default culture
   * @return the parsed quantity
   * @throws QuantityFormatException if the text is not a quantity of the type
   */
  public <U extends Unit<U>> Quantity<U> parse(@Nullable String text, QuantityType<U> type,
      @Nullable Culture culture) {
    return orThrow(tryParse(text, type, culture));
  }

  /**
   * Like {@link #tryParse(String, QuantityType, Culture)}, but for quantity types that are
   * commonly written in a composite format, such as lengths in feet and inches.  A text holding
   * just one of the parts, eg: {@code 2 ft}, is accepted too.
   *
   * @throws IllegalArgumentException if no composite grammar is registered for {@code type}
   */
  public <U extends Unit<U>> ParseResult<U> tryParseComposite(@Nullable String text,
      QuantityType<U> type, @Nullable Culture culture) {
    Preconditions.checkArgument(grammars.containsKey(type),
        "No composite grammar is registered for %s", type);
    return tryParse(text, type, culture);
  }

  /**
   * Parses a composite quantity such as {@code 2' 4"}.
   *
   * @throws QuantityFormatException if the text is not a quantity of the type
   * @throws IllegalArgumentException if no composite grammar is registered for {@code type}
   */
  public <U extends Unit<U>> Quantity<U> parseComposite(@Nullable String text,
      QuantityType<U> type, @Nullable Culture culture) {
    return orThrow(tryParseComposite(text, type, culture));
  }

  /**
   * Parses a bare unit abbreviation, eg: {@code kg}, into a unit of {@code type}.  When the
   * abbreviation denotes several units of the type, the first declared is returned.
   *
   * @param abbreviation the abbreviation
   * @param type the quantity type the unit must belong to
   * @param culture the culture of the abbreviation, or {@code null} for the default culture
   * @return the unit, or absent if the abbreviation is unknown for the type
   */
  public <U extends Unit<U>> Optional<U> tryParseUnit(@Nullable String abbreviation,
      QuantityType<U> type, @Nullable Culture culture) {
    Preconditions.checkNotNull(type);
    if (StringUtils.isBlank(abbreviation)) {
      return Optional.absent();
    }
    ImmutableList<U> units = resolver.unitsFor(abbreviation, type,
        culture == null ? defaultCulture : culture);
    return units.isEmpty() ? Optional.<U>absent() : Optional.of(units.get(0));
  }

  /**
   * Parses a bare unit abbreviation into a unit of {@code type}.
   *
   * @throws IllegalArgumentException if the abbreviation is unknown for the type
   */
  public <U extends Unit<U>> U parseUnit(@Nullable String abbreviation, QuantityType<U> type,
      @Nullable Culture culture) {
    Optional<U> unit = tryParseUnit(abbreviation, type, culture);
    Preconditions.checkArgument(unit.isPresent(), "'%s' is not an abbreviation of a %s unit",
        abbreviation, type);
    return unit.get();
  }

  private static <U extends Unit<U>> Quantity<U> orThrow(ParseResult<U> result) {
    if (!result.isSuccess()) {
      throw new QuantityFormatException(result.getFailure());
    }
    return result.getQuantity();
  }

  private <U extends Unit<U>> Optional<Quantity<U>> parseSingleUnit(String text,
      QuantityType<U> type, Culture culture, ParseFailure.Collector diagnostics) {
    for (U unit : resolver.getTable().getUnits(type)) {
      Optional<Quantity<U>> quantity = parseInUnit(text, unit, culture, diagnostics);
      if (quantity.isPresent()) {
        return quantity;
      }
    }
    return Optional.absent();
  }

  private <U extends Unit<U>> Optional<Quantity<U>> parseInUnit(String text, U unit,
      Culture culture, ParseFailure.Collector diagnostics) {
    ParsePattern pattern;
    try {
      pattern = unitPattern(unit, culture);
    } catch (NoAbbreviationsForUnitException e) {
      LOG.fine(e.getMessage());
      diagnostics.skipped(e.getMessage());
      return Optional.absent();
    }

    diagnostics.attempted(pattern);
    Matcher matcher = pattern.matcher(text);
    if (!matcher.matches()) {
      return Optional.absent();
    }
    String literal = matcher.group(PatternBuilder.VALUE_GROUP);
    double value = culture.getNumberStyle().parse(literal);
    if (Double.isInfinite(value)) {
      String message = String.format("'%s' overflows a double in %s", literal, unit);
      LOG.fine(message);
      diagnostics.skipped(message);
      return Optional.absent();
    }
    return Optional.of(Quantity.of(value, unit));
  }

  private <U extends Unit<U>> Optional<Quantity<U>> parseComposites(String text,
      QuantityType<U> type, Culture culture, ParseFailure.Collector diagnostics) {
    for (CompositeGrammar<?> grammar : grammars.get(type)) {
      ParsePattern pattern;
      try {
        pattern = compositePattern(grammar, culture);
      } catch (NoAbbreviationsForUnitException e) {
        LOG.fine("Composite " + grammar + " is not parseable: " + e.getMessage());
        diagnostics.skipped(e.getMessage());
        continue;
      }

      diagnostics.attempted(pattern);
      Matcher matcher = pattern.matcher(text);
      if (!matcher.matches()) {
        continue;
      }
      Optional<Quantity<U>> sum = sumParts(matcher, pattern, type, culture, diagnostics);
      if (sum.isPresent()) {
        return sum;
      }
    }
    return Optional.absent();
  }

  // Each part carries its own sign, so "-2 ft 4 in" is -(2 ft) + 4 in.
  private <U extends Unit<U>> Optional<Quantity<U>> sumParts(Matcher matcher, ParsePattern pattern,
      QuantityType<U> type, Culture culture, ParseFailure.Collector diagnostics) {
    Quantity<U> sum = null;
    for (Map.Entry<String, Unit<?>> part : pattern.getGroupUnits().entrySet()) {
      String partText = matcher.group(part.getKey()).trim();
      Optional<Quantity<U>> quantity =
          parseInUnit(partText, type.cast(part.getValue()), culture, diagnostics);
      if (!quantity.isPresent()) {
        return Optional.absent();
      }
      sum = sum == null ? quantity.get() : sum.plus(quantity.get());
      if (Double.isInfinite(sum.getValue())) {
        diagnostics.skipped("Sum of '" + matcher.group() + "' overflows a double");
        return Optional.absent();
      }
    }
    return Optional.fromNullable(sum);
  }

  private ParsePattern unitPattern(final Unit<?> unit, final Culture culture) {
    return patterns.fetch(new PatternKey(unit, culture), new Supplier<ParsePattern>() {
      @Override public ParsePattern get() {
        String regex = patternBuilder.buildUnitPattern(unit, culture, true);
        LOG.fine("Compiled pattern for " + unit + " in " + culture + ": " + regex);
        return new ParsePattern(regex, ImmutableMap.<String, Unit<?>>of(
            PatternBuilder.UNIT_GROUP, unit));
      }
    });
  }

  private ParsePattern compositePattern(final CompositeGrammar<?> grammar, final Culture culture) {
    return patterns.fetch(new PatternKey(grammar, culture), new Supplier<ParsePattern>() {
      @Override public ParsePattern get() {
        StringBuilder regex = new StringBuilder("^");
        ImmutableMap.Builder<String, Unit<?>> groupUnits = ImmutableMap.builder();
        ImmutableList<? extends Unit<?>> units = grammar.getUnits();
        for (int i = 0; i < units.size(); i++) {
          if (i > 0) {
            regex.append(grammar.getSeparators().get(i - 1));
          }
          String group = PART_GROUP_PREFIX + i;
          regex.append("(?<").append(group).append('>')
              .append(patternBuilder.buildUnitPattern(units.get(i), culture, false))
              .append(')');
          groupUnits.put(group, units.get(i));
        }
        regex.append('$');
        LOG.fine("Compiled pattern for " + grammar + " in " + culture + ": " + regex);
        return new ParsePattern(regex.toString(), groupUnits.build());
      }
    });
  }

  /**
   * Builds a {@link QuantityParser}.  The feet/inches grammar is registered by default.
   */
  public static final class Builder {
    private UnitDefinitionTable table = StandardUnits.table();
    private Culture defaultCulture = Culture.EN_US;
    private Culture fallbackCulture = Culture.EN_US;
    private final ImmutableListMultimap.Builder<QuantityType<?>, CompositeGrammar<?>> grammars =
        ImmutableListMultimap.builder();
    private Cache<PatternKey, ParsePattern> patterns;

    private Builder() {
      compositeGrammar(CompositeGrammar.FEET_INCHES);
    }

    public Builder table(UnitDefinitionTable table) {
      this.table = Preconditions.checkNotNull(table);
      return this;
    }

    /**
     * Sets the culture used when a parse call passes no culture.
     */
    public Builder defaultCulture(Culture defaultCulture) {
      this.defaultCulture = Preconditions.checkNotNull(defaultCulture);
      return this;
    }

    /**
     * Sets the culture whose abbreviations are used for units that have none in the requested
     * culture.
     */
    public Builder fallbackCulture(Culture fallbackCulture) {
      this.fallbackCulture = Preconditions.checkNotNull(fallbackCulture);
      return this;
    }

    /**
     * Registers an additional composite grammar, tried after those registered before it.
     */
    public Builder compositeGrammar(CompositeGrammar<?> grammar) {
      grammars.put(grammar.getType(), grammar);
      return this;
    }

    Builder patternCache(Cache<PatternKey, ParsePattern> patterns) {
      this.patterns = Preconditions.checkNotNull(patterns);
      return this;
    }

    public QuantityParser build() {
      return new QuantityParser(
          new AbbreviationResolver(table, fallbackCulture),
          defaultCulture,
          grammars.build(),
          patterns != null
              ? patterns
              : new ConcurrentCache<PatternKey, ParsePattern>("parse_patterns"));
    }
  }
}
