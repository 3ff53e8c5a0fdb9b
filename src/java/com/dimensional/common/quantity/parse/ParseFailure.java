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

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import com.dimensional.common.quantity.Culture;
import com.dimensional.common.quantity.QuantityType;

/**
 * Describes why a text could not be parsed as a quantity: the input, what it was parsed as and
 * every pattern that was tried against it.
 */
public final class ParseFailure {

  @Nullable private final String text;
  private final QuantityType<?> type;
  private final Culture culture;
  private final ImmutableList<String> attemptedPatterns;
  private final ImmutableList<String> skippedUnits;

  private ParseFailure(@Nullable String text, QuantityType<?> type, Culture culture,
      ImmutableList<String> attemptedPatterns, ImmutableList<String> skippedUnits) {
    this.text = text;
    this.type = Preconditions.checkNotNull(type);
    this.culture = Preconditions.checkNotNull(culture);
    this.attemptedPatterns = attemptedPatterns;
    this.skippedUnits = skippedUnits;
  }

  /**
   * Returns the text as given to the parser, possibly {@code null}.
   */
  @Nullable
  public String getText() {
    return text;
  }

  public QuantityType<?> getQuantityType() {
    return type;
  }

  public Culture getCulture() {
    return culture;
  }

  /**
   * Returns a description of each pattern matched against the text, in the order they were tried.
   */
  public ImmutableList<String> getAttemptedPatterns() {
    return attemptedPatterns;
  }

  /**
   * Returns the reasons units of the quantity type could not be tried at all.
   */
  public ImmutableList<String> getSkippedUnits() {
    return skippedUnits;
  }

  /**
   * Returns a multi-line description of the failure suitable for logs and exception messages.
   */
  public String describe() {
    StringBuilder description = new StringBuilder(String.format(
        "Unable to parse '%s' as %s in %s.", text, type, culture));
    if (!attemptedPatterns.isEmpty()) {
      description.append(" Attempted:\n  ").append(Joiner.on("\n  ").join(attemptedPatterns));
    }
    if (!skippedUnits.isEmpty()) {
      description.append("\nSkipped:\n  ").append(Joiner.on("\n  ").join(skippedUnits));
    }
    return description.toString();
  }

  @Override
  public String toString() {
    return describe();
  }

  /**
   * Collects the patterns tried during a parse.  Not thread-safe; one is used per parse call.
   */
  static final class Collector {
    private final List<String> attemptedPatterns = Lists.newArrayList();
    private final List<String> skippedUnits = Lists.newArrayList();

    void attempted(Object pattern) {
      attemptedPatterns.add(pattern.toString());
    }

    void skipped(String reason) {
      skippedUnits.add(reason);
    }

    ParseFailure toFailure(@Nullable String text, QuantityType<?> type, Culture culture) {
      return new ParseFailure(text, type, culture, ImmutableList.copyOf(attemptedPatterns),
          ImmutableList.copyOf(skippedUnits));
    }
  }
}
