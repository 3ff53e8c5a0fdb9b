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

package com.dimensional.common.quantity.algebra;

/**
 * What a division rule does when its divisor is zero in base units.  One policy applies to every
 * division rule of a network.
 */
public enum ZeroDivisorPolicy {
  /** Throw {@link DivisionByZeroException}. */
  THROW,
  /**
   * Return the IEEE-754 signed infinity.  Zero divided by zero is {@code NaN}, which no quantity
   * can hold, so that case still throws {@link DivisionByZeroException}.  Other undefined
   * results, such as infinity divided by infinity, throw {@link UndefinedResultException} under
   * either policy.
   */
  IEEE
}
