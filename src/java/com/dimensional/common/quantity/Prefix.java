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

/**
 * Decimal SI prefixes that may be combined with a unit's abbreviations, as in kilo + gram.  The
 * symbol here is the invariant one; a unit definition table may override it per culture.
 */
public enum Prefix {
  NANO(1e-9, "n"),
  MICRO(1e-6, "µ"),
  MILLI(1e-3, "m"),
  CENTI(1e-2, "c"),
  DECI(1e-1, "d"),
  HECTO(1e2, "h"),
  KILO(1e3, "k"),
  MEGA(1e6, "M");

  private final double factor;
  private final String symbol;

  private Prefix(double factor, String symbol) {
    this.factor = factor;
    this.symbol = symbol;
  }

  public double factor() {
    return factor;
  }

  public String symbol() {
    return symbol;
  }
}
