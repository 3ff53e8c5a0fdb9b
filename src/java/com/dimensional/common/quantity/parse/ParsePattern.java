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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import com.dimensional.common.quantity.Unit;

/**
 * A compiled parse pattern and the unit each of its named groups should be read in.  For a
 * single unit pattern the only entry is {@link PatternBuilder#UNIT_GROUP}; a composite pattern
 * has one entry per part.
 */
final class ParsePattern {

  private final Pattern pattern;
  private final ImmutableMap<String, Unit<?>> groupUnits;

  ParsePattern(String regex, ImmutableMap<String, Unit<?>> groupUnits) {
    this.pattern = Pattern.compile(regex);
    this.groupUnits = Preconditions.checkNotNull(groupUnits);
  }

  Matcher matcher(String text) {
    return pattern.matcher(text);
  }

  ImmutableMap<String, Unit<?>> getGroupUnits() {
    return groupUnits;
  }

  @Override
  public String toString() {
    return groupUnits.values() + ": " + pattern.pattern();
  }
}
