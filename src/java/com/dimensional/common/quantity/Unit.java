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
 * Represents a unit hierarchy for a given quantity type; eg: length.  Instances represent specific
 * units from the hierarchy; eg: feet.
 *
 * <p>Every unit converts to and from the single base unit of its {@link QuantityType}.  For
 * multiplicative units {@code toBase(fromBase(x)) == x} within floating point tolerance; affine
 * units (temperatures) add an offset as well.
 *
 * @param <U> the type of the concrete unit implementation
 */
public interface Unit<U extends Unit<U>> {

  /**
   * Returns the quantity type this unit measures.
   */
  QuantityType<U> type();

  /**
   * Converts a value expressed in this unit to the base unit of its quantity type.
   *
   * @param value a value in this unit
   * @return the same amount expressed in the base unit
   */
  double toBase(double value);

  /**
   * Converts a value expressed in the base unit of this unit's quantity type to this unit.
   *
   * @param baseValue a value in the base unit
   * @return the same amount expressed in this unit
   */
  double fromBase(double baseValue);
}
