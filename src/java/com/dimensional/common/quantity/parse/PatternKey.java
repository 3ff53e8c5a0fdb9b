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

import com.google.common.base.Preconditions;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import com.dimensional.common.quantity.Culture;

/**
 * Cache key of a parse pattern: the unit or composite grammar it recognizes and the culture it
 * was built for.
 */
final class PatternKey {

  private final Object subject;
  private final Culture culture;

  PatternKey(Object subject, Culture culture) {
    this.subject = Preconditions.checkNotNull(subject);
    this.culture = Preconditions.checkNotNull(culture);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof PatternKey)) { return false; }

    PatternKey that = (PatternKey) o;
    return new EqualsBuilder()
        .append(this.subject, that.subject)
        .append(this.culture, that.culture)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(subject)
        .append(culture)
        .toHashCode();
  }

  @Override
  public String toString() {
    return String.format("%s [%s]", subject, culture);
  }
}
