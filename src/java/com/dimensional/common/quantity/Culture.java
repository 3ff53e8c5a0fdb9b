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

package com.dimensional.common.quantity;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import com.dimensional.common.base.MorePreconditions;

/**
 * An explicit culture: an identifier selecting an abbreviation set in a unit definition table,
 * together with the number style used to read and write numbers in that culture.  Cultures are
 * compared by identifier only.
 */
public final class Culture {

  public static final Culture EN_US = new Culture("en-US", NumberStyle.INVARIANT);
  public static final Culture DE_DE = new Culture("de-DE", new NumberStyle(',', '.', '-'));
  public static final Culture RU_RU = new Culture("ru-RU", new NumberStyle(',', '\u00a0', '-'));
  public static final Culture NB_NO =
      new Culture("nb-NO", new NumberStyle(',', '\u00a0', '\u2212'));

  private static final ImmutableList<Culture> KNOWN = ImmutableList.of(EN_US, DE_DE, RU_RU, NB_NO);

  private final String id;
  private final NumberStyle numberStyle;

  private Culture(String id, NumberStyle numberStyle) {
    this.id = MorePreconditions.checkNotBlank(id);
    this.numberStyle = Preconditions.checkNotNull(numberStyle);
  }

  /**
   * Creates a culture that is not one of the predefined constants.
   *
   * @param id the culture identifier, eg: {@code fr-FR}
   * @param numberStyle the number style of the culture
   * @return a new culture
   */
  public static Culture of(String id, NumberStyle numberStyle) {
    return new Culture(id, numberStyle);
  }

  /**
   * Looks up one of the predefined cultures by identifier, ignoring case.
   *
   * @param id the culture identifier
   * @return the culture, or absent if no predefined culture has the identifier
   */
  public static Optional<Culture> forId(String id) {
    MorePreconditions.checkNotBlank(id);
    for (Culture culture : KNOWN) {
      if (culture.id.equalsIgnoreCase(id.trim())) {
        return Optional.of(culture);
      }
    }
    return Optional.absent();
  }

  public String getId() {
    return id;
  }

  public NumberStyle getNumberStyle() {
    return numberStyle;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Culture && ((Culture) obj).id.equals(id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return id;
  }
}
